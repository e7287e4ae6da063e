package proto.runtime.mirror;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.symbol.ProcedureNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import proto.runtime.Heap;
import proto.runtime.StackValue;
import proto.runtime.interpreter.ExecutableBuilder;
import proto.runtime.interpreter.ProtoRuntimeException;
import proto.runtime.interpreter.RuntimeCore;
import proto.runtime.interpreter.RuntimeOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static proto.runtime.mirror.MirrorFixtures.ints;
import static proto.runtime.mirror.MirrorFixtures.range;

@DisplayName("值渲染测试")
class ValueTracerTest {

    private ExecutableBuilder builder;
    private ClassNode point;
    private ProcedureNode area;
    private ProcedureNode main;

    @BeforeEach
    void setUp() {
        builder = new ExecutableBuilder();
        point = builder.declareClass("Point");
        builder.declareField(point, "x");
        builder.declareField(point, "y");
        area = builder.declareMethod(point, "area", false, ctx -> StackValue.NULL);
        main = builder.declareFunction(0, "main", ctx -> StackValue.NULL);
    }

    @AfterEach
    void tearDown() {
        PropertyFilter.clearRegistry();
    }

    private ExecutionMirror mirror(RuntimeOptions options) {
        RuntimeCore core = new RuntimeCore(builder.build(), options);
        return new ExecutionMirror(core.getExecutive(), core);
    }

    private ExecutionMirror mirror() {
        return mirror(new RuntimeOptions());
    }

    private static Heap heapOf(ExecutionMirror mirror) {
        return MirrorFixtures.coreOf(mirror).getHeap();
    }

    private StackValue newPoint(Heap heap, long x, long y) {
        return heap.allocateObject(point.getClassId(), new StackValue[]{StackValue.buildInt(x), StackValue.buildInt(y)});
    }

    @Nested
    @DisplayName("标量")
    class Scalars {

        @Test
        @DisplayName("跟踪模式给字符串和字符加引号")
        void testTraceQuotes() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(heap.allocateString("hi"), heap, 0)).isEqualTo("\"hi\"");
            assertThat(mirror.getStringValue(StackValue.buildChar('c'), heap, 0)).isEqualTo("'c'");
            assertThat(mirror.getStringValue(heap.allocateString("hi"), heap, 0, true)).isEqualTo("hi");
            assertThat(mirror.getStringValue(StackValue.buildChar('c'), heap, 0, true)).isEqualTo("c");
        }

        @Test
        @DisplayName("数值、布尔和空值")
        void testNumbers() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(StackValue.buildInt(-42), heap, 0)).isEqualTo("-42");
            assertThat(mirror.getStringValue(StackValue.buildDouble(1.5), heap, 0)).isEqualTo("1.500000");
            assertThat(mirror.getStringValue(StackValue.buildBoolean(true), heap, 0)).isEqualTo("true");
            assertThat(mirror.getStringValue(StackValue.NULL, heap, 0)).isEqualTo("null");
            assertThat(mirror.getStringValue(StackValue.INVALID, heap, 0)).isEqualTo("null");
            assertThat(mirror.getStringValue(StackValue.buildDefaultArg(), heap, 0)).isEqualTo("null");
        }

        @Test
        @DisplayName("函数指针带类名前缀")
        void testFunctionPointer() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(StackValue.buildFunctionPointer(area.getProcedureId()), heap, 0))
                    .isEqualTo("function: Point.area");
            assertThat(mirror.getStringValue(StackValue.buildFunctionPointer(main.getProcedureId()), heap, 0))
                    .isEqualTo("function: main");
        }

        @Test
        @DisplayName("内部标签不可渲染")
        void testInternalTag() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThatThrownBy(() -> mirror.getStringValue(StackValue.buildBlockIndex(1), heap, 0))
                    .isInstanceOf(UnsupportedFeatureException.class)
                    .hasMessage("unknown datatype BLOCK_INDEX");
        }

        @Test
        @DisplayName("未知代码块")
        void testUnknownBlock() {
            ExecutionMirror mirror = mirror();
            assertThatThrownBy(() -> mirror.getStringValue(StackValue.buildInt(1), heapOf(mirror), 7))
                    .isInstanceOf(ProtoRuntimeException.class);
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayValues {

        @Test
        @DisplayName("超出上限时只显示首尾各一半")
        void testTruncation() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(range(heap, 10), heap, 0)).isEqualTo("{ 0, 1, ..., 8, 9 }");
            assertThat(mirror.getStringValue(range(heap, 10), heap, 0, 6, -1, false)).isEqualTo("{ 0, 1, 2, ..., 7, 8, 9 }");
            assertThat(mirror.getStringValue(range(heap, 4), heap, 0)).isEqualTo("{ 0, 1, 2, 3 }");
        }

        @Test
        @DisplayName("上限为 0 时不截断")
        void testNoLimit() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(range(heap, 6), heap, 0, 0, -1, false)).isEqualTo("{ 0, 1, 2, 3, 4, 5 }");
        }

        @Test
        @DisplayName("上限为 1 时首尾保留数为 0，同样不截断")
        void testLimitOfOne() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(range(heap, 5), heap, 0, 1, -1, false)).isEqualTo("{ 0, 1, 2, 3, 4 }");
        }

        @Test
        @DisplayName("打印模式紧凑输出")
        void testPrintMode() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(ints(heap, 1, 2, 3), heap, 0, true)).isEqualTo("{1,2,3}");
            assertThat(mirror.getStringValue(ints(heap), heap, 0)).isEqualTo("{  }");
        }

        @Test
        @DisplayName("深度耗尽渲染为省略号，预算不变")
        void testDepthLimit() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue innermost = ints(heap, 1);
            StackValue level3 = heap.allocateArray(new StackValue[]{innermost});
            StackValue level2 = heap.allocateArray(new StackValue[]{level3});
            StackValue level1 = heap.allocateArray(new StackValue[]{level2});

            OutputFormatParameters params = new OutputFormatParameters(4, 2);
            assertThat(mirror.getStringValue(level1, heap, 0, params, false)).isEqualTo("{ { { ... } } }");
            assertThat(params.getCurrentOutputDepth()).isEqualTo(2);
            assertThat(mirror.getStringValue(level1, heap, 0)).isEqualTo("{ { { { 1 } } } }");
        }

        @Test
        @DisplayName("字典部分按 key=value 追加在后")
        void testDictionary() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            Map<StackValue, StackValue> dictionary = new LinkedHashMap<>();
            dictionary.put(heap.allocateString("k"), StackValue.buildInt(2));
            StackValue array = heap.allocateArray(new StackValue[]{StackValue.buildInt(1)}, dictionary);

            assertThat(mirror.getStringValue(array, heap, 0)).isEqualTo("{ 1, \"k\"=2 }");
            assertThat(mirror.getStringValue(array, heap, 0, true)).isEqualTo("{1,k=2}");
        }
    }

    @Nested
    @DisplayName("环")
    class Cycles {

        @Test
        @DisplayName("自引用数组")
        void testSelfReference() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue array = ints(heap, 1, 0);
            heap.toHeapArray(array).setValueAtIndex(1, array);

            assertThat(mirror.getStringValue(array, heap, 0)).isEqualTo("{ 1, { ... } }");
        }

        @Test
        @DisplayName("间接环")
        void testIndirectCycle() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue a = ints(heap, 0);
            StackValue b = heap.allocateArray(new StackValue[]{a});
            heap.toHeapArray(a).setValueAtIndex(0, b);

            assertThat(mirror.getStringValue(a, heap, 0)).isEqualTo("{ { { ... } } }");
        }

        @Test
        @DisplayName("共享但无环的子数组完整输出")
        void testSharedChild() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue shared = ints(heap, 1);
            StackValue parent = heap.allocateArray(new StackValue[]{shared, shared});

            assertThat(mirror.getStringValue(parent, heap, 0)).isEqualTo("{ { 1 }, { 1 } }");
        }

        @Test
        @DisplayName("对象环渲染为省略号")
        void testObjectCycle() {
            ClassNode node = builder.declareClass("Node");
            builder.declareField(node, "next");
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue self = heap.allocateObject(node.getClassId(), new StackValue[]{StackValue.NULL});
            heap.toHeapObject(self).setValueAtIndex(0, self);

            assertThat(mirror.getStringValue(self, heap, 0)).isEqualTo("Node(next = ...)");
            assertThat(mirror.getStringValue(self, heap, 0, true)).isEqualTo("Node{next = ...}");
        }
    }

    @Nested
    @DisplayName("类实例")
    class Classes {

        @Test
        @DisplayName("字段按声明顺序输出")
        void testFields() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue p = newPoint(heap, 1, 2);

            assertThat(mirror.getStringValue(p, heap, 0)).isEqualTo("Point(x = 1, y = 2)");
            assertThat(mirror.printClass(p, heap, 0, true)).isEqualTo("Point{x = 1, y = 2}");
        }

        @Test
        @DisplayName("静态字段从全局区读取")
        void testStaticField() {
            builder.declareStaticField(point, "count");
            ExecutionMirror mirror = mirror();
            RuntimeCore core = MirrorFixtures.coreOf(mirror);
            core.getRuntimeMemory().setGlobal(0, StackValue.buildInt(5));
            Heap heap = core.getHeap();

            assertThat(mirror.getStringValue(newPoint(heap, 1, 2), heap, 0)).isEqualTo("Point(x = 1, y = 2, count = 5)");
        }

        @Test
        @DisplayName("没有字段的类输出槽位值")
        void testNoFields() {
            ClassNode box = builder.declareClass("Box");
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue value = heap.allocateObject(box.getClassId(), new StackValue[]{StackValue.buildInt(3), StackValue.buildInt(4)});

            assertThat(mirror.getStringValue(value, heap, 0)).isEqualTo("Box(3, 4)");
        }

        @Test
        @DisplayName("导入类交给外部编组器")
        void testImportedClass() {
            ClassNode file = builder.declareClass("File", true);
            ExecutionMirror mirror = mirror();
            RuntimeCore core = MirrorFixtures.coreOf(mirror);
            Heap heap = core.getHeap();
            StackValue handle = heap.allocateObject(file.getClassId(), new StackValue[0]);

            assertThat(mirror.getStringValue(handle, heap, 0))
                    .isEqualTo("<foreign " + file.getClassId() + "@" + handle.getHandle() + ">");

            core.setMarshaller(value -> "File#" + value.getHandle());
            assertThat(mirror.getStringValue(handle, heap, 0)).isEqualTo("File#" + handle.getHandle());
        }

        @Test
        @DisplayName("数组中的对象受深度限制")
        void testObjectDepth() {
            ExecutionMirror mirror = mirror();
            Heap heap = heapOf(mirror);
            StackValue array = heap.allocateArray(new StackValue[]{newPoint(heap, 1, 2)});

            assertThat(mirror.getStringValue(array, heap, 0, 4, 1, false)).isEqualTo("{ ... }");
        }
    }

    @Nested
    @DisplayName("属性过滤")
    class Filtering {

        @TempDir
        Path tempDir;

        private ExecutionMirror filtered(String... lines) throws IOException {
            Path file = tempDir.resolve("filter.txt");
            Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
            return mirror(new RuntimeOptions().setRootCustomPropertyFilterPathName(file.toString()));
        }

        @Test
        @DisplayName("只显示列出的属性")
        void testVisibleProperties() throws IOException {
            ExecutionMirror mirror = filtered("; 只看 y", "Point y");
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(newPoint(heap, 1, 2), heap, 0)).isEqualTo("Point(y = 2)");
        }

        @Test
        @DisplayName("只写类名的行不过滤")
        void testClassOnlyLine() throws IOException {
            ExecutionMirror mirror = filtered("Point");
            Heap heap = heapOf(mirror);

            assertThat(mirror.getStringValue(newPoint(heap, 1, 2), heap, 0)).isEqualTo("Point(x = 1, y = 2)");
        }

        @Test
        @DisplayName("不存在的文件视为无过滤")
        void testMissingFile() {
            ExecutionMirror mirror = mirror(new RuntimeOptions()
                    .setRootCustomPropertyFilterPathName(tempDir.resolve("absent.txt").toString()));

            assertThat(mirror.getPropertyFilter().isEmpty()).isTrue();
            assertThat(mirror.getPropertyFilter().getVisibleProperties("Point")).isNull();
        }

        @Test
        @DisplayName("非法路径不影响镜像创建")
        void testMalformedPath() {
            ExecutionMirror mirror = mirror(new RuntimeOptions().setRootCustomPropertyFilterPathName("bad\0path"));
            Heap heap = heapOf(mirror);

            assertThat(mirror.getPropertyFilter()).isSameAs(PropertyFilter.NONE);
            assertThat(mirror.getStringValue(newPoint(heap, 1, 2), heap, 0)).isEqualTo("Point(x = 1, y = 2)");
        }
    }
}
