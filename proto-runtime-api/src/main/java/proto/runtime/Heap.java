package proto.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Proto VM 堆：按句柄寻址的字符串、数组和类实例。
 *
 * <p>句柄是分配顺序下标，分配后不再移动。堆由执行引擎独占写入；
 * 调试镜像只读访问（{@code SetValue} 写的是栈槽，不是堆）。</p>
 */
public final class Heap {

    private final List<HeapElement> elements = new ArrayList<>();

    // ========== 分配 ==========

    public StackValue allocateString(String value) {
        int handle = elements.size();
        elements.add(new HeapString(handle, value));
        return StackValue.buildString(handle);
    }

    public StackValue allocateArray(StackValue[] values) {
        int handle = elements.size();
        elements.add(new HeapArray(handle, values));
        return StackValue.buildArrayPointer(handle);
    }

    /** 分配带字典部分的数组 */
    public StackValue allocateArray(StackValue[] values, Map<StackValue, StackValue> dictionary) {
        StackValue ptr = allocateArray(values);
        HeapArray array = toHeapArray(ptr);
        for (Map.Entry<StackValue, StackValue> entry : dictionary.entrySet()) {
            array.setValueForKey(entry.getKey(), entry.getValue());
        }
        return ptr;
    }

    public StackValue allocateObject(int classId, StackValue[] fields) {
        int handle = elements.size();
        elements.add(new HeapObject(handle, classId, fields));
        return StackValue.buildPointer(handle, classId);
    }

    // ========== 解引用 ==========

    public HeapString toHeapString(StackValue value) {
        return resolve(value, HeapString.class);
    }

    public HeapArray toHeapArray(StackValue value) {
        return resolve(value, HeapArray.class);
    }

    public HeapObject toHeapObject(StackValue value) {
        return resolve(value, HeapObject.class);
    }

    /** 字符串值的便捷读取 */
    public String getString(StackValue value) {
        return toHeapString(value).getValue();
    }

    public int size() {
        return elements.size();
    }

    private <T extends HeapElement> T resolve(StackValue value, Class<T> kind) {
        if (!value.isReferenceType()) {
            throw new ProtoException("Not a heap reference: " + value);
        }
        int handle = value.getHandle();
        if (handle < 0 || handle >= elements.size()) {
            throw new ProtoException("Dangling heap handle: " + handle);
        }
        HeapElement element = elements.get(handle);
        if (!kind.isInstance(element)) {
            throw new ProtoException("Heap element " + handle + " is " + element.getKindName()
                    + ", not " + kind.getSimpleName());
        }
        return kind.cast(element);
    }
}
