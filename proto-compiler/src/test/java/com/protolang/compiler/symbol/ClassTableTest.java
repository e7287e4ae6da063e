package com.protolang.compiler.symbol;

import com.protolang.compiler.types.PrimitiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("类表 / 过程表 / 代码块 测试")
class ClassTableTest {

    @Nested
    @DisplayName("ClassTable")
    class Classes {

        @Test
        @DisplayName("内置类型占据前 MAX_PRIMITIVES 个 id")
        void testPrimitiveIds() {
            ClassTable table = new ClassTable();
            assertThat(table.size()).isEqualTo(PrimitiveType.MAX_PRIMITIVES);
            assertThat(table.getTypeName(PrimitiveType.INT.getUid())).isEqualTo("int");
            assertThat(table.indexOf("string")).isEqualTo(PrimitiveType.STRING.getUid());
        }

        @Test
        @DisplayName("用户类从 MAX_PRIMITIVES 开始编号")
        void testUserClassIds() {
            ClassTable table = new ClassTable();
            ClassNode point = table.declareClass("Point");
            ClassNode file = table.declareClass("File", true);

            assertThat(point.getClassId()).isEqualTo(PrimitiveType.MAX_PRIMITIVES);
            assertThat(file.getClassId()).isEqualTo(PrimitiveType.MAX_PRIMITIVES + 1);
            assertThat(file.isImportedClass()).isTrue();
            assertThat(table.contains(point.getClassId())).isTrue();
            assertThat(table.contains(99)).isFalse();
            assertThat(table.contains(-1)).isFalse();
        }

        @Test
        @DisplayName("重复声明抛异常")
        void testDuplicateClass() {
            ClassTable table = new ClassTable();
            table.declareClass("Point");
            assertThatThrownBy(() -> table.declareClass("Point"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Point");
        }

        @Test
        @DisplayName("实例字段数不含静态字段和方法局部")
        void testInstanceFieldCount() {
            ClassNode point = new ClassTable().declareClass("Point");
            int ci = point.getClassId();
            point.getSymbols().append(SymbolNode.builder("x").classScope(ci).build());
            point.getSymbols().append(SymbolNode.builder("y").classScope(ci).build());
            point.getSymbols().append(SymbolNode.builder("count").classScope(ci).isStatic(true).build());
            point.getSymbols().append(SymbolNode.builder("tmp").classScope(ci).functionScope(0).build());

            assertThat(point.getInstanceFieldCount()).isEqualTo(2);
            assertThat(point.getSymbols().getRuntimeIndex()).isEqualTo(ci);
        }
    }

    @Nested
    @DisplayName("ProcedureTable")
    class Procedures {

        @Test
        @DisplayName("函数指针即过程下标")
        void testFunctionPointer() {
            ProcedureTable table = new ProcedureTable();
            ProcedureNode main = table.declare("main", Constants.GLOBAL_SCOPE, 0, false);
            ProcedureNode area = table.declare("area", 11, 0, false);

            assertThat(table.tryGetFunction(1)).isSameAs(area);
            assertThat(table.tryGetFunction(5)).isNull();
            assertThat(table.tryGetFunction(-1)).isNull();
            assertThat(main.isMethod()).isFalse();
            assertThat(area.isMethod()).isTrue();
        }
    }

    @Nested
    @DisplayName("CodeBlock")
    class Blocks {

        @Test
        @DisplayName("祖先判断和深度")
        void testAncestry() {
            CodeBlock top = new CodeBlock(0, CodeBlock.CodeBlockType.LANGUAGE, CodeBlock.Language.ASSOCIATIVE, null);
            CodeBlock inner = new CodeBlock(1, CodeBlock.CodeBlockType.LANGUAGE, CodeBlock.Language.IMPERATIVE, top);
            CodeBlock loop = new CodeBlock(2, CodeBlock.CodeBlockType.CONSTRUCT, CodeBlock.Language.IMPERATIVE, inner);

            assertThat(loop.isMyAncestorBlock(0)).isTrue();
            assertThat(loop.isMyAncestorBlock(1)).isTrue();
            assertThat(loop.isMyAncestorBlock(2)).isFalse();
            assertThat(top.isMyAncestorBlock(1)).isFalse();
            assertThat(loop.getDepth()).isEqualTo(2);
            assertThat(top.getChildren()).containsExactly(inner);
        }
    }
}
