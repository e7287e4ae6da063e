package com.protolang.compiler.symbol;

/**
 * 符号表和调试器共用的常量
 */
public final class Constants {

    /** 全局作用域：无外层类 / 无外层函数 */
    public static final int GLOBAL_SCOPE = -1;

    /** 查找失败哨兵 */
    public static final int INVALID_INDEX = -1;

    /** 临时变量名前缀 */
    public static final String TEMP_PREFIX = "%";

    /** watch 表达式结果变量 */
    public static final String WATCH_RESULT_VAR = "%__watch_result";

    private Constants() {}
}
