package proto.runtime;

/**
 * Proto VM 栈上的带标签原始值。
 *
 * <p>标量直接存放在 {@code opdata} 中（double 存原始位模式）；
 * 字符串、数组、类实例存放堆句柄，类实例的类 id 记录在 {@code metaType}。</p>
 */
public final class StackValue {

    public static final StackValue NULL = new StackValue(AddressType.NULL, 0L, 0);
    public static final StackValue INVALID = new StackValue(AddressType.INVALID, 0L, 0);

    private final AddressType type;
    private final long opdata;
    private final int metaType;

    private StackValue(AddressType type, long opdata, int metaType) {
        this.type = type;
        this.opdata = opdata;
        this.metaType = metaType;
    }

    // ========== 构造 ==========

    public static StackValue buildInt(long value) {
        return new StackValue(AddressType.INT, value, 0);
    }

    public static StackValue buildDouble(double value) {
        return new StackValue(AddressType.DOUBLE, Double.doubleToRawLongBits(value), 0);
    }

    public static StackValue buildBoolean(boolean value) {
        return new StackValue(AddressType.BOOLEAN, value ? 1L : 0L, 0);
    }

    public static StackValue buildChar(char value) {
        return new StackValue(AddressType.CHAR, value, 0);
    }

    public static StackValue buildString(int handle) {
        return new StackValue(AddressType.STRING, handle, 0);
    }

    public static StackValue buildPointer(int handle, int classId) {
        return new StackValue(AddressType.POINTER, handle, classId);
    }

    public static StackValue buildArrayPointer(int handle) {
        return new StackValue(AddressType.ARRAY_POINTER, handle, 0);
    }

    public static StackValue buildFunctionPointer(int procedureIndex) {
        return new StackValue(AddressType.FUNCTION_POINTER, procedureIndex, 0);
    }

    public static StackValue buildDefaultArg() {
        return new StackValue(AddressType.DEFAULT_ARG, 0L, 0);
    }

    public static StackValue buildCallingConvention(int convention) {
        return new StackValue(AddressType.CALLING_CONVENTION, convention, 0);
    }

    public static StackValue buildBlockIndex(int blockId) {
        return new StackValue(AddressType.BLOCK_INDEX, blockId, 0);
    }

    public static StackValue buildClassIndex(int classId) {
        return new StackValue(AddressType.CLASS_INDEX, classId, 0);
    }

    // ========== 访问 ==========

    public AddressType getType() { return type; }
    public long getOpdata() { return opdata; }
    public int getMetaType() { return metaType; }

    public long getIntValue() { return opdata; }

    public double getDoubleValue() {
        return Double.longBitsToDouble(opdata);
    }

    public boolean getBooleanValue() {
        return opdata != 0;
    }

    public char getCharValue() {
        return (char) opdata;
    }

    /** 堆句柄（字符串/数组/类实例） */
    public int getHandle() {
        return (int) opdata;
    }

    public boolean isInvalid() { return type == AddressType.INVALID; }
    public boolean isNull() { return type == AddressType.NULL; }
    public boolean isInteger() { return type == AddressType.INT; }
    public boolean isDouble() { return type == AddressType.DOUBLE; }
    public boolean isBoolean() { return type == AddressType.BOOLEAN; }
    public boolean isChar() { return type == AddressType.CHAR; }
    public boolean isString() { return type == AddressType.STRING; }
    public boolean isPointer() { return type == AddressType.POINTER; }
    public boolean isArray() { return type == AddressType.ARRAY_POINTER; }
    public boolean isFunctionPointer() { return type == AddressType.FUNCTION_POINTER; }

    /** 是否引用堆上的元素 */
    public boolean isReferenceType() {
        return type == AddressType.STRING || type == AddressType.POINTER || type == AddressType.ARRAY_POINTER;
    }

    /** 接受 StackValueVisitor 进行标签分派 */
    public <R> R accept(StackValueVisitor<R> visitor) {
        return type.dispatch(visitor, this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackValue)) return false;
        StackValue other = (StackValue) o;
        return type == other.type && opdata == other.opdata && metaType == other.metaType;
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + Long.hashCode(opdata);
        result = 31 * result + metaType;
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case DOUBLE:  return "DOUBLE:" + getDoubleValue();
            case POINTER: return "POINTER:" + opdata + "@" + metaType;
            default:      return type + ":" + opdata;
        }
    }
}
