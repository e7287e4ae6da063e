package com.protolang.compiler.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 过程表。函数指针的值就是过程在表中的下标。
 */
public final class ProcedureTable {

    private final List<ProcedureNode> procedures = new ArrayList<>();

    /** 声明过程，返回其 id（即函数指针值） */
    public ProcedureNode declare(String name, int classId, int codeBlockId, boolean isStatic) {
        ProcedureNode node = new ProcedureNode(procedures.size(), name, classId, codeBlockId, isStatic);
        procedures.add(node);
        return node;
    }

    /** 按函数指针值查找，未找到返回 null */
    public ProcedureNode tryGetFunction(long pointer) {
        if (pointer < 0 || pointer >= procedures.size()) {
            return null;
        }
        return procedures.get((int) pointer);
    }

    public ProcedureNode get(int procedureId) {
        return procedures.get(procedureId);
    }

    public int size() {
        return procedures.size();
    }

    public List<ProcedureNode> getProcedures() {
        return Collections.unmodifiableList(procedures);
    }
}
