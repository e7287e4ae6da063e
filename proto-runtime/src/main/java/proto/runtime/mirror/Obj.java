package proto.runtime.mirror;

import com.protolang.compiler.types.ProtoType;
import proto.runtime.StackValue;

/**
 * 镜像值：原始栈值 + 语义类型 + 载荷。
 *
 * <p>载荷是标量（Long / Double / Boolean / Character / String）、堆句柄（Long）
 * 或 {@link DsasmArray} 快照；只有 null 和未赋值时为 null。
 * 镜像树每次检查时新建，不引用活动堆。</p>
 */
public final class Obj {

    private final StackValue dsasmValue;
    private final Object payload;
    private final ProtoType type;
    private final boolean cycleReference;

    Obj(StackValue dsasmValue, Object payload, ProtoType type) {
        this(dsasmValue, payload, type, false);
    }

    private Obj(StackValue dsasmValue, Object payload, ProtoType type, boolean cycleReference) {
        if (type == null) {
            throw new IllegalArgumentException("Obj type must not be null");
        }
        this.dsasmValue = dsasmValue;
        this.payload = payload;
        this.type = type;
        this.cycleReference = cycleReference;
    }

    /** 被截断的环回边：载荷是数组句柄，不再展开 */
    static Obj cycleReference(StackValue value, ProtoType type) {
        return new Obj(value, Long.valueOf(value.getHandle()), type, true);
    }

    public StackValue getDsasmValue() { return dsasmValue; }
    public Object getPayload() { return payload; }
    public ProtoType getType() { return type; }

    public boolean isCycleReference() {
        return cycleReference;
    }

    /** 载荷为数组快照时返回，否则 null */
    public DsasmArray getArray() {
        return payload instanceof DsasmArray ? (DsasmArray) payload : null;
    }

    @Override
    public String toString() {
        return "Obj(" + type + ", " + (cycleReference ? "<cycle>" : payload) + ")";
    }
}
