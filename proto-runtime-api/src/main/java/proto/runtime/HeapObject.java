package proto.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 堆上的类实例：按成员槽位排列的字段值
 */
public final class HeapObject extends HeapElement {

    private final int classId;
    private final StackValue[] values;

    HeapObject(int handle, int classId, StackValue[] values) {
        super(handle);
        this.classId = classId;
        this.values = values.clone();
    }

    public int getClassId() {
        return classId;
    }

    public int count() {
        return values.length;
    }

    public StackValue getValueFromIndex(int index) {
        if (index < 0 || index >= values.length) {
            throw new ProtoException("Member slot out of bounds: " + index + " (size " + values.length + ")");
        }
        return values[index];
    }

    public void setValueAtIndex(int index, StackValue value) {
        if (index < 0 || index >= values.length) {
            throw new ProtoException("Member slot out of bounds: " + index + " (size " + values.length + ")");
        }
        values[index] = value;
    }

    public List<StackValue> getValues() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public String getKindName() {
        return "object";
    }
}
