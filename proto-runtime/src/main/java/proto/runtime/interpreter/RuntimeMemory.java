package proto.runtime.interpreter;

import com.protolang.compiler.symbol.SymbolNode;
import proto.runtime.Heap;
import proto.runtime.HeapObject;
import proto.runtime.StackValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 运行时内存：全局栈 + 帧栈 + 堆。
 *
 * <p>栈的前 {@code globOffset} 个槽位是全局区：全局变量、各代码块的块级变量和类静态成员
 * 都按 {@link SymbolNode#getMemoryOffset()} 绝对寻址。函数局部变量和参数相对当前帧的帧指针寻址，
 * 实例成员经当前帧的 this 指针读取对象槽位。</p>
 */
public final class RuntimeMemory {

    private static final int DEFAULT_DISPLAY_LIMIT = 16;

    private final Heap heap;
    private final List<StackValue> stack = new ArrayList<>();
    private final List<StackFrame> frames = new ArrayList<>();
    private int globOffset;

    public RuntimeMemory(Heap heap) {
        this.heap = heap;
    }

    public Heap getHeap() {
        return heap;
    }

    /** 分配全局区，所有槽位初始为未赋值哨兵 */
    public void allocateGlobals(int size) {
        while (stack.size() < size) {
            stack.add(StackValue.INVALID);
        }
        globOffset = size;
    }

    public int getGlobOffset() {
        return globOffset;
    }

    public List<StackValue> getStack() {
        return Collections.unmodifiableList(stack);
    }

    // ========== 帧管理 ==========

    public void pushFrame(StackFrame frame, int localCount) {
        frame.bind(stack.size(), localCount);
        for (int i = 0; i < localCount; i++) {
            stack.add(StackValue.INVALID);
        }
        frames.add(frame);
    }

    public void popFrame() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Cannot pop frame: frame stack is empty");
        }
        StackFrame frame = frames.remove(frames.size() - 1);
        while (stack.size() > frame.getFramePointer()) {
            stack.remove(stack.size() - 1);
        }
    }

    /** 当前帧；不在任何函数内时返回 null */
    public StackFrame getCurrentStackFrame() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public int getFrameDepth() {
        return frames.size();
    }

    // ========== 符号读写 ==========

    public StackValue getSymbolValue(SymbolNode symbol) {
        if (isInstanceMember(symbol)) {
            return getMemberData(symbol);
        }
        return stack.get(resolveSlot(symbol));
    }

    public void setSymbolValue(SymbolNode symbol, StackValue value) {
        if (isInstanceMember(symbol)) {
            HeapObject object = heap.toHeapObject(currentThis(symbol));
            object.setValueAtIndex(symbol.getMemoryOffset(), value);
            return;
        }
        stack.set(resolveSlot(symbol), value);
    }

    /**
     * 读取类成员：静态成员在全局区，实例成员经当前帧的 this 指针读取。
     */
    public StackValue getMemberData(SymbolNode member) {
        if (member.isStatic()) {
            return getGlobal(member.getMemoryOffset());
        }
        HeapObject object = heap.toHeapObject(currentThis(member));
        return object.getValueFromIndex(member.getMemoryOffset());
    }

    public StackValue getGlobal(int offset) {
        checkGlobalOffset(offset);
        return stack.get(offset);
    }

    public void setGlobal(int offset, StackValue value) {
        checkGlobalOffset(offset);
        stack.set(offset, value);
    }

    private boolean isInstanceMember(SymbolNode symbol) {
        return symbol.getClassScope() != com.protolang.compiler.symbol.Constants.INVALID_INDEX
                && symbol.isGlobalFunctionScope()
                && !symbol.isStatic();
    }

    private int resolveSlot(SymbolNode symbol) {
        if (symbol.isGlobalFunctionScope()) {
            checkGlobalOffset(symbol.getMemoryOffset());
            return symbol.getMemoryOffset();
        }
        StackFrame frame = getCurrentStackFrame();
        if (frame == null || frame.getFunctionScope() != symbol.getFunctionScope()) {
            throw new ProtoRuntimeException("Local symbol '" + symbol.getName() + "' is not in the active frame");
        }
        if (symbol.getMemoryOffset() < 0 || symbol.getMemoryOffset() >= frame.getLocalCount()) {
            throw new ProtoRuntimeException("Local slot out of range for '" + symbol.getName() + "': " + symbol.getMemoryOffset());
        }
        return frame.getFramePointer() + symbol.getMemoryOffset();
    }

    private StackValue currentThis(SymbolNode member) {
        StackFrame frame = getCurrentStackFrame();
        if (frame == null || frame.getClassScope() != member.getClassScope() || !frame.getThisPointer().isPointer()) {
            throw new ProtoRuntimeException("No instance of class " + member.getClassScope()
                    + " in the active frame for member '" + member.getName() + "'");
        }
        return frame.getThisPointer();
    }

    private void checkGlobalOffset(int offset) {
        if (offset < 0 || offset >= globOffset) {
            throw new ProtoRuntimeException("Global slot out of range: " + offset + " (globals " + globOffset + ")");
        }
    }

    // ========== 调试辅助 ==========

    /**
     * 格式化帧栈（最近的在前）。超过显示上限时折叠中间部分。
     */
    public String formatFrameTrace(int displayLimit) {
        int size = frames.size();
        if (size == 0) return null;
        if (displayLimit <= 0) displayLimit = DEFAULT_DISPLAY_LIMIT;

        StringBuilder sb = new StringBuilder("VM frames:\n");
        if (size <= displayLimit) {
            for (int i = size - 1; i >= 0; i--) {
                appendFrame(sb, frames.get(i));
            }
        } else {
            int half = displayLimit / 2;
            for (int i = size - 1; i >= size - half; i--) {
                appendFrame(sb, frames.get(i));
            }
            sb.append("  ... ").append(size - displayLimit).append(" frames omitted ...\n");
            for (int i = half - 1; i >= 0; i--) {
                appendFrame(sb, frames.get(i));
            }
        }
        return sb.toString();
    }

    private static void appendFrame(StringBuilder sb, StackFrame frame) {
        sb.append("  at ").append(frame).append("\n");
    }
}
