package proto.runtime.interpreter;

import proto.runtime.StackValue;

/**
 * 过程体。参数在调用前已写入局部槽位，通过 {@link ExecutionContext} 读取。
 */
@FunctionalInterface
public interface ProcedureBody {

    StackValue invoke(ExecutionContext context);
}
