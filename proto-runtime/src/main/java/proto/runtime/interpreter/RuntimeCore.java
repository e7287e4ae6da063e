package proto.runtime.interpreter;

import proto.runtime.Heap;
import proto.runtime.StackValue;

import java.util.function.Consumer;

/**
 * 一次运行的全部状态：选项、可执行体、内存、调试属性和当前执行块。
 * 单线程使用；调试器只在 VM 暂停时读取。
 */
public final class RuntimeCore {

    private final RuntimeOptions options;
    private final Executable executable;
    private final RuntimeMemory memory;
    private final DebugProperties debugProperties = new DebugProperties();
    private final Executive executive;
    private int runningBlock;
    private ForeignValueMarshaller marshaller = new ForeignValueMarshaller() {
        @Override
        public String getStringValue(StackValue value) {
            return "<foreign " + value.getMetaType() + "@" + value.getHandle() + ">";
        }
    };
    private Consumer<RuntimeCore> pauseHandler;

    public RuntimeCore(Executable executable, RuntimeOptions options) {
        this.executable = executable;
        this.options = options != null ? options : new RuntimeOptions();
        this.memory = new RuntimeMemory(new Heap());
        this.memory.allocateGlobals(executable.getGlobalStackSize());
        this.executive = new Executive(this);
    }

    public RuntimeCore(Executable executable) {
        this(executable, new RuntimeOptions());
    }

    public RuntimeOptions getOptions() { return options; }
    public Executable getExecutable() { return executable; }
    public RuntimeMemory getRuntimeMemory() { return memory; }
    public Heap getHeap() { return memory.getHeap(); }
    public DebugProperties getDebugProperties() { return debugProperties; }
    public Executive getExecutive() { return executive; }

    /** 当前执行的代码块 id */
    public int getRunningBlock() {
        return runningBlock;
    }

    void setRunningBlock(int runningBlock) {
        this.runningBlock = runningBlock;
    }

    public ForeignValueMarshaller getMarshaller() {
        return marshaller;
    }

    public void setMarshaller(ForeignValueMarshaller marshaller) {
        this.marshaller = marshaller;
    }

    public Consumer<RuntimeCore> getPauseHandler() {
        return pauseHandler;
    }

    /** 设置断点回调，回调期间 VM 处于暂停状态 */
    public void setPauseHandler(Consumer<RuntimeCore> pauseHandler) {
        this.pauseHandler = pauseHandler;
    }
}
