package proto.runtime.interpreter;

/**
 * 运行时选项
 */
public final class RuntimeOptions {

    /** 核心转储默认数组元素上限：超出时只显示首尾各一半 */
    public static final int DEFAULT_CORE_DUMP_MAX_ARRAY_SIZE = 4;

    /** 核心转储默认嵌套深度上限，-1 为不限 */
    public static final int DEFAULT_CORE_DUMP_MAX_OUTPUT_DEPTH = -1;

    private String rootCustomPropertyFilterPathName;
    private boolean deltaExecution;
    private int coreDumpMaxArraySize = DEFAULT_CORE_DUMP_MAX_ARRAY_SIZE;
    private int coreDumpMaxOutputDepth = DEFAULT_CORE_DUMP_MAX_OUTPUT_DEPTH;

    /** 可选的属性过滤文件路径（为 null 时不过滤） */
    public String getRootCustomPropertyFilterPathName() {
        return rootCustomPropertyFilterPathName;
    }

    public RuntimeOptions setRootCustomPropertyFilterPathName(String pathName) {
        this.rootCustomPropertyFilterPathName = pathName;
        return this;
    }

    /** 增量执行：只重新执行被标记为脏的图节点 */
    public boolean isDeltaExecution() {
        return deltaExecution;
    }

    public RuntimeOptions setDeltaExecution(boolean deltaExecution) {
        this.deltaExecution = deltaExecution;
        return this;
    }

    public int getCoreDumpMaxArraySize() {
        return coreDumpMaxArraySize;
    }

    public RuntimeOptions setCoreDumpMaxArraySize(int coreDumpMaxArraySize) {
        this.coreDumpMaxArraySize = coreDumpMaxArraySize;
        return this;
    }

    public int getCoreDumpMaxOutputDepth() {
        return coreDumpMaxOutputDepth;
    }

    public RuntimeOptions setCoreDumpMaxOutputDepth(int coreDumpMaxOutputDepth) {
        this.coreDumpMaxOutputDepth = coreDumpMaxOutputDepth;
        return this;
    }
}
