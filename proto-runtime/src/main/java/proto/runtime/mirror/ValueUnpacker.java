package proto.runtime.mirror;

import com.protolang.compiler.types.PrimitiveType;
import com.protolang.compiler.types.ProtoType;
import com.protolang.compiler.types.TypeSystem;
import proto.runtime.Heap;
import proto.runtime.HeapArray;
import proto.runtime.StackValue;
import proto.runtime.StackValueVisitor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 把栈值解包成 {@link Obj}。
 *
 * <p>深解包递归复制数组，沿当前路径记录正在访问的数组句柄，遇到环回边时生成
 * {@link Obj#isCycleReference()} 节点而不再展开。浅解包不展开数组，只给出句柄。
 * 两者的标量表示完全一致。</p>
 */
final class ValueUnpacker {

    private final TypeSystem typeSystem;

    ValueUnpacker(TypeSystem typeSystem) {
        this.typeSystem = typeSystem;
    }

    Obj unpack(StackValue value, Heap heap) {
        return value.accept(new DeepVisitor(heap));
    }

    Obj unpackShallow(StackValue value, Heap heap) {
        return value.accept(new ShallowVisitor(heap));
    }

    // ========== 标量 ==========

    private abstract class ScalarVisitor implements StackValueVisitor<Obj> {

        final Heap heap;

        ScalarVisitor(Heap heap) {
            this.heap = heap;
        }

        @Override
        public Obj visitInvalid(StackValue value) {
            return new Obj(value, null, TypeSystem.buildPrimitiveTypeObject(PrimitiveType.VOID, 0));
        }

        @Override
        public Obj visitNull(StackValue value) {
            return new Obj(value, null, TypeSystem.buildPrimitiveTypeObject(PrimitiveType.NULL, 0));
        }

        @Override
        public Obj visitInt(StackValue value) {
            return new Obj(value, Long.valueOf(value.getIntValue()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.INT, 0));
        }

        @Override
        public Obj visitDouble(StackValue value) {
            return new Obj(value, Double.valueOf(value.getDoubleValue()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.DOUBLE, 0));
        }

        @Override
        public Obj visitBoolean(StackValue value) {
            return new Obj(value, Boolean.valueOf(value.getBooleanValue()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.BOOL, 0));
        }

        @Override
        public Obj visitChar(StackValue value) {
            return new Obj(value, Character.valueOf(value.getCharValue()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.CHAR, 0));
        }

        @Override
        public Obj visitString(StackValue value) {
            return new Obj(value, heap.getString(value), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.STRING, 0));
        }

        @Override
        public Obj visitPointer(StackValue value) {
            return new Obj(value, Long.valueOf(value.getHandle()), typeSystem.buildTypeObject(value.getMetaType(), 0));
        }

        @Override
        public Obj visitFunctionPointer(StackValue value) {
            return new Obj(value, Long.valueOf(value.getOpdata()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.FUNCTION_POINTER, 0));
        }

        @Override
        public Obj visitDefaultArg(StackValue value) {
            return new Obj(value, Long.valueOf(value.getOpdata()), TypeSystem.buildPrimitiveTypeObject(PrimitiveType.VAR, 0));
        }

        @Override
        public Obj visitInternal(StackValue value) {
            throw new UnsupportedFeatureException("unknown datatype " + value.getType());
        }
    }

    // ========== 数组 ==========

    private final class DeepVisitor extends ScalarVisitor {

        private final Set<Integer> visiting = new HashSet<>();

        DeepVisitor(Heap heap) {
            super(heap);
        }

        @Override
        public Obj visitArrayPointer(StackValue value) {
            int handle = value.getHandle();
            if (!visiting.add(handle)) {
                return Obj.cycleReference(value, TypeSystem.buildPrimitiveTypeObject(PrimitiveType.ARRAY, ProtoType.ARBITRARY_RANK));
            }
            try {
                HeapArray array = heap.toHeapArray(value);
                List<StackValue> elements = array.getValues();
                Obj[] members = new Obj[elements.size()];
                for (int i = 0; i < members.length; i++) {
                    members[i] = elements.get(i).accept(this);
                }
                // 按首元素推断元素类型，空数组为 var
                int elementUid = members.length > 0
                        ? members[0].getType().getUid()
                        : PrimitiveType.VAR.getUid();
                return new Obj(value, new DsasmArray(members), typeSystem.buildTypeObject(elementUid, ProtoType.ARBITRARY_RANK));
            } finally {
                visiting.remove(handle);
            }
        }
    }

    private final class ShallowVisitor extends ScalarVisitor {

        ShallowVisitor(Heap heap) {
            super(heap);
        }

        @Override
        public Obj visitArrayPointer(StackValue value) {
            return new Obj(value, Long.valueOf(value.getHandle()),
                    TypeSystem.buildPrimitiveTypeObject(PrimitiveType.ARRAY, ProtoType.ARBITRARY_RANK));
        }
    }
}
