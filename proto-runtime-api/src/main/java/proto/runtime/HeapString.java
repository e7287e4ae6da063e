package proto.runtime;

/**
 * 堆上的字符串
 */
public final class HeapString extends HeapElement {

    private final String value;

    HeapString(int handle, String value) {
        super(handle);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getKindName() {
        return "string";
    }
}
