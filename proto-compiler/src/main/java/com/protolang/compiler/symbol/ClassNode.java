package com.protolang.compiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类声明：成员符号表（字段、静态字段、成员函数的局部变量）和成员函数
 */
public final class ClassNode {

    private final int classId;
    private final String name;
    private final SymbolTable symbols;
    private final boolean importedClass;
    private final List<ProcedureNode> procedures = new ArrayList<>();

    public ClassNode(int classId, String name, boolean importedClass) {
        this.classId = classId;
        this.name = name;
        this.importedClass = importedClass;
        this.symbols = new SymbolTable(name, classId);
    }

    public int getClassId() { return classId; }
    public String getName() { return name; }
    public SymbolTable getSymbols() { return symbols; }

    /** 外部语言导入的类，字符串形式交由外部编组器 */
    public boolean isImportedClass() { return importedClass; }

    public List<ProcedureNode> getProcedures() {
        return Collections.unmodifiableList(procedures);
    }

    public void addProcedure(ProcedureNode procedure) {
        procedures.add(procedure);
    }

    /** 实例字段个数（类级、非静态），即对象槽位数 */
    public int getInstanceFieldCount() {
        int count = 0;
        for (SymbolNode symbol : symbols.getSymbols()) {
            if (!symbol.isBlank() && symbol.isGlobalFunctionScope() && !symbol.isStatic()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "class " + name + "#" + classId;
    }
}
