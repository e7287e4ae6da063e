package proto.runtime;

/**
 * 堆元素基类
 */
public abstract class HeapElement {

    private final int handle;

    protected HeapElement(int handle) {
        this.handle = handle;
    }

    public int getHandle() {
        return handle;
    }

    /** 元素种类名，用于错误消息 */
    public abstract String getKindName();
}
