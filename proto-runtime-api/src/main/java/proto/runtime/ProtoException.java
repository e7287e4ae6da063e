package proto.runtime;

/**
 * Proto VM 基础运行时异常（无执行上下文信息）。
 *
 * <p>{@code proto-runtime} 中的 {@code ProtoRuntimeException} 继承此类，
 * 并添加代码块、图节点等诊断信息。</p>
 */
public class ProtoException extends RuntimeException {

    public ProtoException(String message) {
        super(message);
    }

    public ProtoException(String message, Throwable cause) {
        super(message, cause);
    }
}
