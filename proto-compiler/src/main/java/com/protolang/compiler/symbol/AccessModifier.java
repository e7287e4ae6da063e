package com.protolang.compiler.symbol;

/**
 * 成员访问修饰符
 */
public enum AccessModifier {
    PUBLIC,
    PROTECTED,
    PRIVATE
}
