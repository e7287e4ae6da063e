package proto.runtime.mirror;

import proto.runtime.Heap;
import proto.runtime.StackValue;
import proto.runtime.interpreter.Executable;
import proto.runtime.interpreter.RuntimeCore;
import proto.runtime.interpreter.RuntimeOptions;
import proto.runtime.interpreter.UpdateExpression;

/**
 * 镜像测试共用的小工具
 */
final class MirrorFixtures {

    private MirrorFixtures() {}

    static UpdateExpression constant(final long value) {
        return ctx -> StackValue.buildInt(value);
    }

    static StackValue ints(Heap heap, long... values) {
        StackValue[] elements = new StackValue[values.length];
        for (int i = 0; i < values.length; i++) {
            elements[i] = StackValue.buildInt(values[i]);
        }
        return heap.allocateArray(elements);
    }

    static StackValue range(Heap heap, int count) {
        long[] values = new long[count];
        for (int i = 0; i < count; i++) {
            values[i] = i;
        }
        return ints(heap, values);
    }

    /** 执行全部顶层块并返回绑定的镜像 */
    static ExecutionMirror run(Executable exe) {
        return run(exe, new RuntimeOptions());
    }

    static ExecutionMirror run(Executable exe, RuntimeOptions options) {
        RuntimeCore core = new RuntimeCore(exe, options);
        core.getExecutive().execute();
        return new ExecutionMirror(core.getExecutive(), core);
    }

    static RuntimeCore coreOf(ExecutionMirror mirror) {
        return mirror.getMirrorTarget().getRuntimeCore();
    }
}
