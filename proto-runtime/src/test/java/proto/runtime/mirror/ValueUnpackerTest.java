package proto.runtime.mirror;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.types.PrimitiveType;
import com.protolang.compiler.types.ProtoType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import proto.runtime.Heap;
import proto.runtime.HeapArray;
import proto.runtime.StackValue;
import proto.runtime.interpreter.ExecutableBuilder;
import proto.runtime.interpreter.RuntimeCore;

import static org.assertj.core.api.Assertions.*;
import static proto.runtime.mirror.MirrorFixtures.ints;

@DisplayName("解包测试")
class ValueUnpackerTest {

    private ExecutionMirror mirror;
    private Heap heap;
    private ClassNode point;

    @BeforeEach
    void setUp() {
        ExecutableBuilder builder = new ExecutableBuilder();
        point = builder.declareClass("Point");
        RuntimeCore core = new RuntimeCore(builder.build());
        mirror = new ExecutionMirror(core.getExecutive(), core);
        heap = core.getHeap();
    }

    @Test
    @DisplayName("标量载荷使用 Java 包装类型")
    void testScalars() {
        assertThat(mirror.unpack(StackValue.buildInt(3)).getPayload()).isEqualTo(3L);
        assertThat(mirror.unpack(StackValue.buildDouble(2.5)).getPayload()).isEqualTo(2.5);
        assertThat(mirror.unpack(StackValue.buildBoolean(false)).getPayload()).isEqualTo(false);
        assertThat(mirror.unpack(StackValue.buildChar('z')).getPayload()).isEqualTo('z');
        assertThat(mirror.unpack(heap.allocateString("s")).getPayload()).isEqualTo("s");
        assertThat(mirror.unpack(StackValue.NULL).getType().getUid()).isEqualTo(PrimitiveType.NULL.getUid());
        assertThat(mirror.unpack(StackValue.INVALID).getType().getUid()).isEqualTo(PrimitiveType.VOID.getUid());
    }

    @Test
    @DisplayName("类实例载荷为句柄，类型为类")
    void testPointer() {
        StackValue p = heap.allocateObject(point.getClassId(), new StackValue[0]);
        Obj obj = mirror.unpack(p);

        assertThat(obj.getPayload()).isEqualTo((long) p.getHandle());
        assertThat(obj.getType().getName()).isEqualTo("Point");
        assertThat(obj.getArray()).isNull();
    }

    @Test
    @DisplayName("深解包复制数组并推断元素类型")
    void testDeepArray() {
        Obj obj = mirror.unpack(ints(heap, 1, 2, 3));

        DsasmArray array = obj.getArray();
        assertThat(array.size()).isEqualTo(3);
        assertThat(array.get(2).getPayload()).isEqualTo(3L);
        assertThat(obj.getType().getUid()).isEqualTo(PrimitiveType.INT.getUid());
        assertThat(obj.getType().getRank()).isEqualTo(ProtoType.ARBITRARY_RANK);
        assertThat(mirror.unpack(ints(heap)).getType().getUid()).isEqualTo(PrimitiveType.VAR.getUid());
    }

    @Test
    @DisplayName("浅解包只给出句柄")
    void testShallowArray() {
        StackValue array = ints(heap, 1, 2);
        Obj obj = mirror.unpackShallow(array);

        assertThat(obj.getArray()).isNull();
        assertThat(obj.getPayload()).isEqualTo((long) array.getHandle());
        assertThat(obj.getType().getUid()).isEqualTo(PrimitiveType.ARRAY.getUid());
    }

    @Test
    @DisplayName("环回边生成环引用节点")
    void testCycle() {
        StackValue array = ints(heap, 1, 0);
        heap.toHeapArray(array).setValueAtIndex(1, array);

        Obj obj = mirror.unpack(array);
        Obj back = obj.getArray().get(1);

        assertThat(obj.isCycleReference()).isFalse();
        assertThat(back.isCycleReference()).isTrue();
        assertThat(back.getPayload()).isEqualTo((long) array.getHandle());
    }

    @Test
    @DisplayName("重打包分配内容相同的新数组")
    void testRepack() {
        StackValue original = ints(heap, 1, 2, 3);
        Obj obj = mirror.unpack(original);

        StackValue repacked = ExecutionMirror.repack(obj, heap);
        HeapArray copy = heap.toHeapArray(repacked);

        assertThat(repacked.getHandle()).isNotEqualTo(original.getHandle());
        assertThat(copy.getValues()).containsExactly(
                StackValue.buildInt(1), StackValue.buildInt(2), StackValue.buildInt(3));
        assertThat(ExecutionMirror.repack(mirror.unpack(StackValue.buildInt(7)), heap)).isEqualTo(StackValue.buildInt(7));
    }

    @Test
    @DisplayName("内部标签不可解包")
    void testInternalTag() {
        assertThatThrownBy(() -> mirror.unpack(StackValue.buildClassIndex(1)))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("CLASS_INDEX");
    }
}
