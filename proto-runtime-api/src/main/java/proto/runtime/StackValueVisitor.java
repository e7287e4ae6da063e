package proto.runtime;

/**
 * StackValue 访问者接口，用于替代对 {@link AddressType} 的 switch 分派。
 *
 * <p>每种值标签对应一个方法；新增标签时所有访问者都必须实现，编译器保证不会遗漏。</p>
 */
public interface StackValueVisitor<R> {
    R visitInvalid(StackValue value);
    R visitNull(StackValue value);
    R visitInt(StackValue value);
    R visitDouble(StackValue value);
    R visitBoolean(StackValue value);
    R visitChar(StackValue value);
    R visitString(StackValue value);
    R visitPointer(StackValue value);
    R visitArrayPointer(StackValue value);
    R visitFunctionPointer(StackValue value);
    R visitDefaultArg(StackValue value);

    /** VM 内部寄存器标签（调用约定、块索引、类索引、帧类型） */
    R visitInternal(StackValue value);
}
