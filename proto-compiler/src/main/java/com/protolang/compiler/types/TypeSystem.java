package com.protolang.compiler.types;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.symbol.ClassTable;
import com.protolang.compiler.symbol.Constants;

/**
 * 类型系统：在内置类型和类表之间构造 {@link ProtoType}
 */
public final class TypeSystem {

    private final ClassTable classTable;

    public TypeSystem(ClassTable classTable) {
        this.classTable = classTable;
    }

    public ClassTable getClassTable() {
        return classTable;
    }

    public static ProtoType buildPrimitiveTypeObject(PrimitiveType type, int rank) {
        return new ProtoType(type.getUid(), type.getTypeName(), rank);
    }

    /** 按 uid 构造类型；未知 uid 回退为 var */
    public ProtoType buildTypeObject(int uid, int rank) {
        if (uid >= 0 && uid < classTable.size()) {
            return new ProtoType(uid, classTable.get(uid).getName(), rank);
        }
        return buildPrimitiveTypeObject(PrimitiveType.VAR, rank);
    }

    /** 按名称查 uid，未找到返回 {@link Constants#INVALID_INDEX} */
    public int getType(String name) {
        return classTable.indexOf(name);
    }

    public String getTypeName(int uid) {
        ClassNode node = uid >= 0 && uid < classTable.size() ? classTable.get(uid) : null;
        return node != null ? node.getName() : null;
    }
}
