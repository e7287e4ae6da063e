package proto.runtime.interpreter;

import com.protolang.compiler.symbol.Constants;
import proto.runtime.ProtoException;

/**
 * Proto VM 执行期异常
 *
 * 可携带出错的代码块、图节点表达式 uid 以及 VM 调用帧跟踪。
 */
public class ProtoRuntimeException extends ProtoException {

    private final int blockId;
    private final int exprUid;
    private String vmStackTrace;

    public ProtoRuntimeException(String message) {
        this(message, Constants.INVALID_INDEX, Constants.INVALID_INDEX, null);
    }

    public ProtoRuntimeException(String message, Throwable cause) {
        this(message, Constants.INVALID_INDEX, Constants.INVALID_INDEX, cause);
    }

    public ProtoRuntimeException(String message, int blockId, int exprUid, Throwable cause) {
        super(message, cause);
        this.blockId = blockId;
        this.exprUid = exprUid;
    }

    public int getBlockId() {
        return blockId;
    }

    public int getExprUid() {
        return exprUid;
    }

    public String getVmStackTrace() {
        return vmStackTrace;
    }

    void setVmStackTrace(String trace) {
        if (trace != null && this.vmStackTrace == null) {
            this.vmStackTrace = trace;
        }
    }

    /** 不含位置和调用帧的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (blockId != Constants.INVALID_INDEX) {
            sb.append(" [block ").append(blockId);
            if (exprUid != Constants.INVALID_INDEX) {
                sb.append(", expr ").append(exprUid);
            }
            sb.append("]");
        }
        if (vmStackTrace != null) {
            sb.append("\n").append(vmStackTrace);
        }
        return sb.toString();
    }
}
