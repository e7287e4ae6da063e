package com.protolang.compiler.types;

/**
 * 内置类型。序号即类型 uid，也是类表中内置类的 id；用户类从 {@link #MAX_PRIMITIVES} 开始编号。
 */
public enum PrimitiveType {
    NULL("null"),
    VAR("var"),
    DOUBLE("double"),
    INT("int"),
    BOOL("bool"),
    CHAR("char"),
    STRING("string"),
    FUNCTION_POINTER("function"),
    ARRAY("array"),
    POINTER("pointer"),
    VOID("void");

    /** 内置类型个数；类 id 不小于它的是用户定义类 */
    public static final int MAX_PRIMITIVES = values().length;

    private final String typeName;

    PrimitiveType(String typeName) {
        this.typeName = typeName;
    }

    public int getUid() {
        return ordinal();
    }

    public String getTypeName() {
        return typeName;
    }

    public static boolean isPrimitive(int uid) {
        return uid >= 0 && uid < MAX_PRIMITIVES;
    }
}
