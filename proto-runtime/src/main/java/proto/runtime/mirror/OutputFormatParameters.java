package proto.runtime.mirror;

/**
 * 一次渲染调用的遍历预算：数组元素上限、嵌套深度上限和当前剩余深度。
 *
 * <p>-1 表示不限。每个获准继续的递归入口都必须在返回前调用
 * {@link #restoreOutputTraceDepth()}，调用前后的剩余深度相同。</p>
 *
 * <p>数组超出上限时首尾各保留 {@code floor(maxArraySize / 2)} 个元素。
 * 因此上限为 1 时保留数为 0，数组不截断，全部元素都会输出；
 * 上限为 0 或 -1 同样不截断。</p>
 */
public final class OutputFormatParameters {

    public static final int DEFAULT_MAX_ARRAY_SIZE = 4;
    public static final int DEFAULT_MAX_OUTPUT_DEPTH = -1;

    private final int maxArraySize;
    private final int maxOutputDepth;
    private int currentOutputDepth;

    public OutputFormatParameters() {
        this(DEFAULT_MAX_ARRAY_SIZE, DEFAULT_MAX_OUTPUT_DEPTH);
    }

    public OutputFormatParameters(int maxArraySize, int maxOutputDepth) {
        this.maxArraySize = maxArraySize;
        this.maxOutputDepth = maxOutputDepth;
        this.currentOutputDepth = maxOutputDepth;
    }

    public void resetOutputDepth() {
        currentOutputDepth = maxOutputDepth;
    }

    /**
     * 申请进入下一层。深度耗尽时拒绝且不再递减。
     */
    public boolean continueOutputTrace() {
        if (maxOutputDepth == -1) {
            return true;
        }
        if (currentOutputDepth == 0) {
            return false;
        }
        currentOutputDepth--;
        return true;
    }

    /** 退出一层，只能在 {@link #continueOutputTrace()} 返回 true 之后调用 */
    public void restoreOutputTraceDepth() {
        if (maxOutputDepth == -1) {
            return;
        }
        currentOutputDepth++;
    }

    public int getMaxArraySize() { return maxArraySize; }
    public int getMaxOutputDepth() { return maxOutputDepth; }
    public int getCurrentOutputDepth() { return currentOutputDepth; }
}
