package proto.runtime.interpreter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 调试属性：与过程调用帧并行的调试帧标志栈。代码块 bounce 不压调试帧。
 */
public final class DebugProperties {

    public enum StackFrameFlag {
        /** 方法 / 函数分派帧 */
        FEP_RUN
    }

    private final List<EnumSet<StackFrameFlag>> debugFrames = new ArrayList<>();

    public void pushDebugFrame(EnumSet<StackFrameFlag> flags) {
        debugFrames.add(EnumSet.copyOf(flags));
    }

    public void popDebugFrame() {
        if (debugFrames.isEmpty()) {
            throw new IllegalStateException("Cannot pop debug frame: stack is empty");
        }
        debugFrames.remove(debugFrames.size() - 1);
    }

    /** 栈顶调试帧是否带有给定标志 */
    public boolean debugStackFrameContains(StackFrameFlag flag) {
        return !debugFrames.isEmpty() && debugFrames.get(debugFrames.size() - 1).contains(flag);
    }

    public int depth() {
        return debugFrames.size();
    }
}
