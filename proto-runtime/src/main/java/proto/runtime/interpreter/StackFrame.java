package proto.runtime.interpreter;

import proto.runtime.StackValue;

/**
 * 栈帧：记录当前执行函数的类 / 函数 / 代码块身份，名称解析时动态查询。
 */
public final class StackFrame {

    private final int classScope;
    private final int functionScope;
    private final int functionBlock;
    private final StackValue thisPointer;
    private final String functionName;
    private int framePointer;
    private int localCount;

    public StackFrame(int classScope, int functionScope, int functionBlock, StackValue thisPointer, String functionName) {
        this.classScope = classScope;
        this.functionScope = functionScope;
        this.functionBlock = functionBlock;
        this.thisPointer = thisPointer != null ? thisPointer : StackValue.NULL;
        this.functionName = functionName;
    }

    public int getClassScope() { return classScope; }
    public int getFunctionScope() { return functionScope; }
    public int getFunctionBlock() { return functionBlock; }
    public StackValue getThisPointer() { return thisPointer; }
    public String getFunctionName() { return functionName; }

    /** 局部变量区在栈中的起点 */
    public int getFramePointer() { return framePointer; }
    public int getLocalCount() { return localCount; }

    void bind(int framePointer, int localCount) {
        this.framePointer = framePointer;
        this.localCount = localCount;
    }

    @Override
    public String toString() {
        return functionName + "(ci=" + classScope + ", fi=" + functionScope + ", block=" + functionBlock + ")";
    }
}
