package proto.runtime.mirror;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.symbol.ClassTable;
import com.protolang.compiler.symbol.Constants;
import com.protolang.compiler.symbol.ProcedureNode;
import com.protolang.compiler.symbol.SymbolNode;
import com.protolang.compiler.types.PrimitiveType;
import proto.runtime.Heap;
import proto.runtime.HeapArray;
import proto.runtime.HeapObject;
import proto.runtime.StackValue;
import proto.runtime.StackValueVisitor;
import proto.runtime.interpreter.RuntimeCore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 一次渲染调用的文本跟踪器。
 *
 * <p>打印模式和跟踪模式共用同一次遍历，只在格式上不同：</p>
 * <ul>
 *   <li>打印：字符串和字符不加引号，分隔符 {@code ","}，数组 {@code {a,b}}，类 {@code Name{...}}</li>
 *   <li>跟踪：加引号，分隔符 {@code ", "}，数组 {@code { a, b }}，类 {@code Name(...)}</li>
 * </ul>
 *
 * <p>正在访问的数组和对象句柄沿路径记录，环回时数组渲染为 {@code { ... }}，对象渲染为 {@code ...}。</p>
 */
final class ValueTracer implements StackValueVisitor<String> {

    private static final String ELLIPSIS = "...";

    private final RuntimeCore core;
    private final Heap heap;
    private final PropertyFilter filter;
    private final OutputFormatParameters params;
    private final boolean forPrint;
    private final Set<Integer> visiting = new HashSet<>();

    ValueTracer(RuntimeCore core, Heap heap, PropertyFilter filter, OutputFormatParameters params, boolean forPrint) {
        this.core = core;
        this.heap = heap;
        this.filter = filter;
        this.params = params;
        this.forPrint = forPrint;
    }

    String render(StackValue value) {
        return value.accept(this);
    }

    // ========== 标量 ==========

    @Override
    public String visitInvalid(StackValue value) {
        return "null";
    }

    @Override
    public String visitNull(StackValue value) {
        return "null";
    }

    @Override
    public String visitInt(StackValue value) {
        return Long.toString(value.getIntValue());
    }

    @Override
    public String visitDouble(StackValue value) {
        return String.format(Locale.ROOT, "%.6f", value.getDoubleValue());
    }

    @Override
    public String visitBoolean(StackValue value) {
        return value.getBooleanValue() ? "true" : "false";
    }

    @Override
    public String visitChar(StackValue value) {
        String c = String.valueOf(value.getCharValue());
        return forPrint ? c : "'" + c + "'";
    }

    @Override
    public String visitString(StackValue value) {
        String s = heap.getString(value);
        return forPrint ? s : "\"" + s + "\"";
    }

    @Override
    public String visitFunctionPointer(StackValue value) {
        ProcedureNode procedure = core.getExecutable().getProcedureTable().tryGetFunction(value.getOpdata());
        if (procedure == null) {
            return "function: " + value.getOpdata();
        }
        String className = "";
        if (procedure.getClassId() != Constants.GLOBAL_SCOPE) {
            String typeName = core.getExecutable().getClassTable().getTypeName(procedure.getClassId());
            className = typeName.substring(typeName.lastIndexOf('.') + 1) + ".";
        }
        return "function: " + className + procedure.getName();
    }

    @Override
    public String visitDefaultArg(StackValue value) {
        return "null";
    }

    @Override
    public String visitInternal(StackValue value) {
        throw new UnsupportedFeatureException("unknown datatype " + value.getType());
    }

    // ========== 数组 ==========

    @Override
    public String visitArrayPointer(StackValue value) {
        int handle = value.getHandle();
        if (!visiting.add(handle)) {
            return "{ ... }";
        }
        try {
            String elements = arrayTrace(value);
            return forPrint ? "{" + elements + "}" : "{ " + elements + " }";
        } finally {
            visiting.remove(handle);
        }
    }

    private String arrayTrace(StackValue value) {
        if (!params.continueOutputTrace()) {
            return ELLIPSIS;
        }
        try {
            HeapArray array = heap.toHeapArray(value);
            int total = array.count();

            int half = -1;
            if (params.getMaxArraySize() > 0 && total > params.getMaxArraySize()) {
                half = (int) Math.floor(params.getMaxArraySize() * 0.5);
            }

            StringBuilder sb = new StringBuilder();
            for (int n = 0; n < total; n++) {
                appendSeparator(sb);
                sb.append(render(array.getValueFromIndex(n)));

                // 前半段输出完毕，跳到尾部的后半段
                if (half > 0 && n == half - 1) {
                    sb.append(", ...");
                    n = total - half - 1;
                }
            }

            Map<StackValue, StackValue> dictionary = array.getDictionary();
            int startIndex = half > 0 ? dictionary.size() - half : 0;
            int index = -1;
            for (Map.Entry<StackValue, StackValue> entry : dictionary.entrySet()) {
                index++;
                if (index < startIndex) {
                    continue;
                }
                appendSeparator(sb);
                sb.append(render(entry.getKey())).append('=').append(render(entry.getValue()));
            }
            return sb.toString();
        } finally {
            params.restoreOutputTraceDepth();
        }
    }

    private void appendSeparator(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(forPrint ? "," : ", ");
        }
    }

    // ========== 类实例 ==========

    @Override
    public String visitPointer(StackValue value) {
        if (!params.continueOutputTrace()) {
            return ELLIPSIS;
        }
        try {
            return classTrace(value);
        } finally {
            params.restoreOutputTraceDepth();
        }
    }

    private String classTrace(StackValue value) {
        ClassTable classTable = core.getExecutable().getClassTable();
        int classType = value.getMetaType();
        if (!classTable.contains(classType)) {
            return "";
        }

        ClassNode classNode = classTable.get(classType);
        if (classNode.isImportedClass()) {
            return core.getMarshaller().getStringValue(value);
        }

        int handle = value.getHandle();
        if (!visiting.add(handle)) {
            return ELLIPSIS;
        }
        try {
            HeapObject object = heap.toHeapObject(value);
            List<String> visibleProperties = filter.getVisibleProperties(classNode.getName());
            List<SymbolNode> fields = fieldsOf(classNode);

            StringBuilder sb = new StringBuilder();
            if (!fields.isEmpty()) {
                boolean first = true;
                for (SymbolNode field : fields) {
                    if (visibleProperties != null && !visibleProperties.contains(field.getName())) {
                        continue;
                    }
                    if (!first) {
                        sb.append(", ");
                    }
                    StackValue fieldValue = field.isStatic()
                            ? core.getRuntimeMemory().getGlobal(field.getMemoryOffset())
                            : object.getValueFromIndex(field.getMemoryOffset());
                    sb.append(field.getName()).append(" = ").append(render(fieldValue));
                    first = false;
                }
            } else {
                // 没有声明字段（内置包装类），逐个输出槽位值
                for (int n = 0; n < object.count(); n++) {
                    if (n != 0) {
                        sb.append(", ");
                    }
                    sb.append(render(object.getValueFromIndex(n)));
                }
            }

            if (classType >= PrimitiveType.MAX_PRIMITIVES) {
                return forPrint
                        ? classNode.getName() + "{" + sb + "}"
                        : classNode.getName() + "(" + sb + ")";
            }
            return sb.toString();
        } finally {
            visiting.remove(handle);
        }
    }

    /** 类级字段（实例和静态），按声明顺序 */
    static List<SymbolNode> fieldsOf(ClassNode classNode) {
        List<SymbolNode> fields = new ArrayList<>();
        for (SymbolNode symbol : classNode.getSymbols().getSymbols()) {
            if (!symbol.isBlank() && symbol.isGlobalFunctionScope()) {
                fields.add(symbol);
            }
        }
        return fields;
    }
}
