package proto.runtime.interpreter;

import com.protolang.compiler.symbol.SymbolNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import proto.runtime.Heap;
import proto.runtime.StackValue;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RuntimeMemory 测试")
class RuntimeMemoryTest {

    private static final int CLASS_ID = 11;
    private static final int FUNCTION_ID = 3;

    private Heap heap;
    private RuntimeMemory memory;

    @BeforeEach
    void setUp() {
        heap = new Heap();
        memory = new RuntimeMemory(heap);
        memory.allocateGlobals(2);
    }

    @Test
    @DisplayName("全局区初始为未赋值")
    void testGlobalsStartInvalid() {
        assertThat(memory.getGlobal(0).isInvalid()).isTrue();
        memory.setGlobal(1, StackValue.buildInt(7));
        assertThat(memory.getGlobal(1).getIntValue()).isEqualTo(7);
    }

    @Test
    @DisplayName("全局下标越界")
    void testGlobalOutOfRange() {
        assertThatThrownBy(() -> memory.getGlobal(2))
                .isInstanceOf(ProtoRuntimeException.class)
                .hasMessageContaining("Global slot out of range: 2");
    }

    @Test
    @DisplayName("局部变量相对帧指针寻址，出栈后回收")
    void testLocals() {
        SymbolNode local = SymbolNode.builder("t").functionScope(FUNCTION_ID).memoryOffset(1).build();
        memory.pushFrame(new StackFrame(-1, FUNCTION_ID, 0, null, "f"), 2);

        memory.setSymbolValue(local, StackValue.buildInt(9));
        assertThat(memory.getSymbolValue(local).getIntValue()).isEqualTo(9);
        assertThat(memory.getStack()).hasSize(4);

        memory.popFrame();
        assertThat(memory.getStack()).hasSize(2);
        assertThat(memory.getCurrentStackFrame()).isNull();
    }

    @Test
    @DisplayName("其他函数的局部变量不可读")
    void testForeignLocal() {
        SymbolNode local = SymbolNode.builder("t").functionScope(FUNCTION_ID + 1).build();
        memory.pushFrame(new StackFrame(-1, FUNCTION_ID, 0, null, "f"), 1);

        assertThatThrownBy(() -> memory.getSymbolValue(local))
                .isInstanceOf(ProtoRuntimeException.class)
                .hasMessageContaining("not in the active frame");
    }

    @Test
    @DisplayName("实例字段经 this 指针读取对象槽位")
    void testInstanceMember() {
        SymbolNode field = SymbolNode.builder("y").classScope(CLASS_ID).memoryOffset(1).build();
        StackValue point = heap.allocateObject(CLASS_ID, new StackValue[]{StackValue.buildInt(1), StackValue.buildInt(2)});

        assertThatThrownBy(() -> memory.getSymbolValue(field)).isInstanceOf(ProtoRuntimeException.class);

        memory.pushFrame(new StackFrame(CLASS_ID, FUNCTION_ID, 0, point, "Point.m"), 0);
        assertThat(memory.getSymbolValue(field).getIntValue()).isEqualTo(2);
        memory.setSymbolValue(field, StackValue.buildInt(5));
        assertThat(heap.toHeapObject(point).getValueFromIndex(1).getIntValue()).isEqualTo(5);
    }

    @Test
    @DisplayName("帧跟踪最近的在前，超出上限折叠中间")
    void testFormatFrameTrace() {
        assertThat(memory.formatFrameTrace(0)).isNull();

        for (int i = 0; i < 5; i++) {
            memory.pushFrame(new StackFrame(-1, i, 0, null, "f" + i), 0);
        }
        String full = memory.formatFrameTrace(0);
        assertThat(full).startsWith("VM frames:\n  at f4(");
        assertThat(full.indexOf("f4")).isLessThan(full.indexOf("f0"));

        String folded = memory.formatFrameTrace(2);
        assertThat(folded).contains("at f4(", "... 3 frames omitted ...", "at f0(");
        assertThat(folded).doesNotContain("f2(");
    }
}
