package com.protolang.compiler.symbol;

/**
 * 函数 / 方法声明
 */
public final class ProcedureNode {

    private final int procedureId;
    private final String name;
    private final int classId;
    private final int codeBlockId;
    private final boolean isStatic;

    public ProcedureNode(int procedureId, String name, int classId, int codeBlockId, boolean isStatic) {
        this.procedureId = procedureId;
        this.name = name;
        this.classId = classId;
        this.codeBlockId = codeBlockId;
        this.isStatic = isStatic;
    }

    public int getProcedureId() { return procedureId; }
    public String getName() { return name; }

    /** 所属类 id；全局函数为 {@link Constants#GLOBAL_SCOPE} */
    public int getClassId() { return classId; }

    /** 函数体所在代码块 */
    public int getCodeBlockId() { return codeBlockId; }
    public boolean isStatic() { return isStatic; }

    public boolean isMethod() {
        return classId != Constants.GLOBAL_SCOPE;
    }

    @Override
    public String toString() {
        return (isMethod() ? "method " : "function ") + name + "#" + procedureId;
    }
}
