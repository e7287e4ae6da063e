package proto.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 堆上的数组。
 *
 * <p>整数下标元素存放在有序列表中；非整数键（字符串、double 等）存放在
 * 按插入顺序排列的字典部分。数组可原地修改，因此可以构造出自引用的图。</p>
 */
public final class HeapArray extends HeapElement {

    private final List<StackValue> values;
    private final Map<StackValue, StackValue> dictionary = new LinkedHashMap<>();

    HeapArray(int handle, StackValue[] initial) {
        super(handle);
        this.values = new ArrayList<>(initial.length);
        Collections.addAll(values, initial);
    }

    /** 整数下标部分的元素个数 */
    public int count() {
        return values.size();
    }

    public StackValue getValueFromIndex(int index) {
        if (index < 0 || index >= values.size()) {
            throw new ProtoException("Array index out of bounds: " + index + " (size " + values.size() + ")");
        }
        return values.get(index);
    }

    /** 设置元素，越界时用 null 填充到目标下标 */
    public void setValueAtIndex(int index, StackValue value) {
        if (index < 0) {
            throw new ProtoException("Negative array index: " + index);
        }
        while (values.size() <= index) {
            values.add(StackValue.NULL);
        }
        values.set(index, value);
    }

    /** 按键设置：整数键写入下标部分，其余写入字典部分 */
    public void setValueForKey(StackValue key, StackValue value) {
        if (key.isInteger()) {
            setValueAtIndex((int) key.getIntValue(), value);
        } else {
            dictionary.put(key, value);
        }
    }

    public List<StackValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    /** 非整数键部分（插入顺序） */
    public Map<StackValue, StackValue> getDictionary() {
        return Collections.unmodifiableMap(dictionary);
    }

    @Override
    public String getKindName() {
        return "array";
    }
}
