package com.protolang.compiler.symbol;

import com.protolang.compiler.types.PrimitiveType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类表。内置类型各占一个类 id，用户类从 {@link PrimitiveType#MAX_PRIMITIVES} 起编号。
 */
public final class ClassTable {

    private final List<ClassNode> classNodes = new ArrayList<>();

    public ClassTable() {
        for (PrimitiveType type : PrimitiveType.values()) {
            classNodes.add(new ClassNode(type.getUid(), type.getTypeName(), false));
        }
    }

    /** 声明用户类 */
    public ClassNode declareClass(String name) {
        return declareClass(name, false);
    }

    public ClassNode declareClass(String name, boolean imported) {
        if (indexOf(name) != Constants.INVALID_INDEX) {
            throw new IllegalArgumentException("Class already declared: " + name);
        }
        ClassNode node = new ClassNode(classNodes.size(), name, imported);
        classNodes.add(node);
        return node;
    }

    public ClassNode get(int classId) {
        return classNodes.get(classId);
    }

    /** 类 id 是否在表中 */
    public boolean contains(int classId) {
        return classId >= 0 && classId < classNodes.size();
    }

    public int indexOf(String name) {
        for (ClassNode node : classNodes) {
            if (node.getName().equals(name)) {
                return node.getClassId();
            }
        }
        return Constants.INVALID_INDEX;
    }

    public String getTypeName(int classId) {
        return get(classId).getName();
    }

    public int size() {
        return classNodes.size();
    }

    public List<ClassNode> getClassNodes() {
        return Collections.unmodifiableList(classNodes);
    }
}
