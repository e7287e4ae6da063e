package proto.runtime.mirror;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.symbol.CodeBlock;
import com.protolang.compiler.symbol.Constants;
import com.protolang.compiler.symbol.SymbolNode;
import com.protolang.compiler.symbol.SymbolTable;
import proto.runtime.Heap;
import proto.runtime.HeapObject;
import proto.runtime.ProtoException;
import proto.runtime.StackValue;
import proto.runtime.StackValueVisitor;
import proto.runtime.interpreter.DebugProperties;
import proto.runtime.interpreter.DependencyGraph;
import proto.runtime.interpreter.Executable;
import proto.runtime.interpreter.Executive;
import proto.runtime.interpreter.GraphNode;
import proto.runtime.interpreter.RuntimeCore;
import proto.runtime.interpreter.RuntimeMemory;
import proto.runtime.interpreter.RuntimeOptions;
import proto.runtime.interpreter.StackFrame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 执行镜像：调试器和 REPL 检查运行时值的入口。
 *
 * <p>绑定一个执行引擎的内存和堆，只在 VM 暂停时使用，不支持并发调用。
 * 提供名称解析、值解包、有界文本渲染，以及"改值并增量重跑"。</p>
 */
public class ExecutionMirror {

    private static final Logger LOG = Logger.getLogger(ExecutionMirror.class.getName());

    /** 核心转储每行的最大长度，超出部分折到下一行 */
    private static final int MAX_DUMP_LINE_LENGTH = 1020;

    private final Executive mirrorTarget;
    private final RuntimeCore core;
    private final PropertyFilter propertyFilter;
    private final ValueUnpacker unpacker;

    public ExecutionMirror(Executive executive, RuntimeCore core) {
        if (executive == null) {
            throw new IllegalArgumentException("Can't mirror a null executive");
        }
        this.mirrorTarget = executive;
        this.core = core;
        this.propertyFilter = PropertyFilter.forPath(core.getOptions().getRootCustomPropertyFilterPathName());
        this.unpacker = new ValueUnpacker(core.getExecutable().getTypeSystem());
    }

    public Executive getMirrorTarget() {
        return mirrorTarget;
    }

    public PropertyFilter getPropertyFilter() {
        return propertyFilter;
    }

    private Executable exe() {
        return core.getExecutable();
    }

    private RuntimeMemory rmem() {
        return core.getRuntimeMemory();
    }

    // ========== 文本渲染 ==========

    public String printClass(StackValue value, Heap heap, int block, boolean forPrint) {
        return getStringValue(value, heap, block, new OutputFormatParameters(), forPrint);
    }

    public String printClass(StackValue value, Heap heap, int block, int maxArraySize, int maxOutputDepth, boolean forPrint) {
        return getStringValue(value, heap, block, new OutputFormatParameters(maxArraySize, maxOutputDepth), forPrint);
    }

    public String getStringValue(StackValue value, Heap heap, int block) {
        return getStringValue(value, heap, block, false);
    }

    public String getStringValue(StackValue value, Heap heap, int block, boolean forPrint) {
        return getStringValue(value, heap, block, new OutputFormatParameters(), forPrint);
    }

    public String getStringValue(StackValue value, Heap heap, int block, int maxArraySize, int maxOutputDepth, boolean forPrint) {
        return getStringValue(value, heap, block, new OutputFormatParameters(maxArraySize, maxOutputDepth), forPrint);
    }

    /**
     * 按给定遍历预算渲染。返回后预算的剩余深度与调用前相同。
     */
    public String getStringValue(StackValue value, Heap heap, int block, OutputFormatParameters params, boolean forPrint) {
        exe().getCompleteCodeBlock(block);
        return new ValueTracer(core, heap, propertyFilter, params, forPrint).render(value);
    }

    // ========== 核心转储 ==========

    /**
     * 顶层块中每个全局变量的最终值，每行 {@code name = value}
     */
    public String getCoreDump() {
        RuntimeOptions options = core.getOptions();
        OutputFormatParameters params = new OutputFormatParameters(
                options.getCoreDumpMaxArraySize(), options.getCoreDumpMaxOutputDepth());
        StringBuilder dump = new StringBuilder();
        for (String line : globalVarTrace(params)) {
            String remaining = line;
            while (remaining.length() > MAX_DUMP_LINE_LENGTH) {
                dump.append(remaining, 0, MAX_DUMP_LINE_LENGTH).append('\n');
                remaining = remaining.substring(MAX_DUMP_LINE_LENGTH);
            }
            dump.append(remaining).append('\n');
        }
        return dump.toString();
    }

    /** 逐变量输出到列表，不折行 */
    public void getCoreDump(List<String> variableTraces, int maxArraySize, int maxOutputDepth) {
        variableTraces.addAll(globalVarTrace(new OutputFormatParameters(maxArraySize, maxOutputDepth)));
    }

    private List<String> globalVarTrace(OutputFormatParameters params) {
        List<String> traces = new ArrayList<>();
        if (exe().getRuntimeSymbols().isEmpty()) {
            return traces;
        }
        // 只输出顶层块的符号，其他块的值可能已失效
        int blockId = 0;
        SymbolTable table = exe().getRuntimeSymbols(blockId);
        Heap heap = core.getHeap();
        for (SymbolNode symbol : table.getSymbols()) {
            params.resetOutputDepth();
            boolean isLocal = !symbol.isGlobalFunctionScope();
            boolean isStatic = symbol.getClassScope() != Constants.INVALID_INDEX && symbol.isStatic();
            if (symbol.isBlank() || symbol.isArgument() || isLocal || isStatic || symbol.isTemporary()) {
                continue;
            }
            StackValue value = rmem().getSymbolValue(symbol);
            traces.add(symbol.getName() + " = " + getStringValue(value, heap, blockId, params, false));
        }
        params.resetOutputDepth();
        return traces;
    }

    // ========== 名称解析 ==========

    /**
     * 在当前执行上下文中解析名称。
     *
     * <p>处于方法分派帧时，以帧的类 / 函数 / 函数所在块代替传入的块：
     * 先查运行块的块级变量（函数内嵌语言块），再查方法局部变量，最后查类字段。
     * 否则沿词法块链向外查找：函数块链内先查块级变量，到达函数块时先查局部变量；
     * 离开函数块链后只查块级变量。</p>
     */
    private SymbolLocation resolve(String name, int block, WatchSession session) {
        int functionIndex = Constants.GLOBAL_SCOPE;
        int ci = Constants.INVALID_INDEX;
        int functionBlock = Constants.GLOBAL_SCOPE;

        if (core.getDebugProperties().debugStackFrameContains(DebugProperties.StackFrameFlag.FEP_RUN)) {
            StackFrame frame = rmem().getCurrentStackFrame();
            ci = frame.getClassScope();
            functionIndex = frame.getFunctionScope();
            functionBlock = frame.getFunctionBlock();
            if (session != null) {
                session.setWatchClassScope(ci);
            }
        }

        if (ci != Constants.INVALID_INDEX) {
            SymbolLocation member = resolveInClass(name, ci, functionIndex, functionBlock, block);
            if (member != null) {
                return member;
            }
            // 方法内也能读全局变量
            return resolveInBlocks(name, Constants.INVALID_INDEX, Constants.GLOBAL_SCOPE, Constants.GLOBAL_SCOPE, block);
        }
        return resolveInBlocks(name, ci, functionIndex, functionBlock, block);
    }

    private SymbolLocation resolveInClass(String name, int ci, int functionIndex, int functionBlock, int block) {
        if (functionIndex != Constants.GLOBAL_SCOPE && functionBlock != core.getRunningBlock()) {
            SymbolTable blockTable = exe().getRuntimeSymbols(block);
            int index = blockTable.indexOf(name, Constants.GLOBAL_SCOPE, Constants.GLOBAL_SCOPE);
            if (index != Constants.INVALID_INDEX) {
                return located(blockTable, index, block, ci);
            }
        }

        SymbolTable classSymbols = exe().getClassTable().get(ci).getSymbols();
        // 同名局部变量遮蔽字段
        int index = classSymbols.indexOf(name, ci, functionIndex);
        if (index == Constants.INVALID_INDEX) {
            index = classSymbols.indexOfClass(name, ci, functionIndex);
        }
        return index != Constants.INVALID_INDEX ? located(classSymbols, index, block, ci) : null;
    }

    private SymbolLocation resolveInBlocks(String name, int ci, int functionIndex, int functionBlock, int block) {
        CodeBlock searchBlock = exe().getCompleteCodeBlock(block);
        int index = Constants.INVALID_INDEX;

        if (functionIndex != Constants.GLOBAL_SCOPE) {
            // 函数体内嵌的语言块：先在函数块之下的块链中查块级变量
            if (searchBlock.isMyAncestorBlock(functionBlock)) {
                while (searchBlock.getCodeBlockId() != functionBlock) {
                    index = tableOf(searchBlock).indexOf(name, ci, Constants.GLOBAL_SCOPE);
                    if (index != Constants.INVALID_INDEX) {
                        break;
                    }
                    searchBlock = searchBlock.getParent();
                }
            }
            if (index == Constants.INVALID_INDEX) {
                index = tableOf(searchBlock).indexOf(name, ci, functionIndex);
            }
            if (index == Constants.INVALID_INDEX) {
                index = tableOf(searchBlock).indexOf(name, ci, Constants.GLOBAL_SCOPE);
            }
        } else {
            index = tableOf(searchBlock).indexOf(name, ci, Constants.GLOBAL_SCOPE);
        }

        if (index == Constants.INVALID_INDEX) {
            searchBlock = searchBlock.getParent();
            while (searchBlock != null) {
                index = tableOf(searchBlock).indexOf(name, ci, Constants.GLOBAL_SCOPE);
                if (index != Constants.INVALID_INDEX) {
                    break;
                }
                searchBlock = searchBlock.getParent();
            }
        }

        if (index == Constants.INVALID_INDEX) {
            throw new NameNotFoundException(name);
        }
        return located(tableOf(searchBlock), index, searchBlock.getCodeBlockId(), ci);
    }

    private SymbolTable tableOf(CodeBlock block) {
        return exe().getRuntimeSymbols(block.getCodeBlockId());
    }

    private static SymbolLocation located(SymbolTable table, int index, int block, int ci) {
        SymbolNode symbol = table.get(index);
        checkSupported(symbol);
        return new SymbolLocation(symbol, table, block, ci);
    }

    private static void checkSupported(SymbolNode symbol) {
        if (symbol.isFixedSizeArray()) {
            throw new UnsupportedFeatureException("Fixed-size array symbols are not supported: " + symbol.getName());
        }
    }

    // ========== 读取 ==========

    /**
     * 按名称在当前执行上下文中解析并读取值（调试器 watch 用）
     *
     * @throws NameNotFoundException 名称无法解析
     * @throws UninitializedVariableException 变量未赋值
     */
    public Obj getDebugValue(String name) {
        return getDebugValue(name, null);
    }

    /** 同 {@link #getDebugValue(String)}，并把解析结果记录到 watch 会话 */
    public Obj getDebugValue(String name, WatchSession session) {
        SymbolLocation location = resolve(name, core.getRunningBlock(), session);
        StackValue value = rmem().getSymbolValue(location.symbol);
        if (value.isInvalid()) {
            throw new UninitializedVariableException(name);
        }
        if (session != null) {
            session.record(location.symbol, value);
        }
        return unpackShallow(value);
    }

    /**
     * 取 watch 表达式的结果，无论成功与否都清空会话
     */
    public Obj getWatchValue(WatchSession session) {
        List<SymbolNode> symbols = session.getWatchSymbolList();
        int count = session.getWatchStack().size();
        int n = -1;
        for (int i = 0; i < symbols.size(); i++) {
            if (Constants.WATCH_RESULT_VAR.equals(symbols.get(i).getName())) {
                n = i;
                break;
            }
        }

        try {
            if (n < 0 || n >= count) {
                return unpack(StackValue.NULL);
            }
            StackValue value = session.getWatchStack().get(n);
            return unpack(value.isInvalid() ? StackValue.NULL : value);
        } catch (ProtoException e) {
            LOG.log(Level.FINE, "watch 求值失败", e);
            return unpack(StackValue.NULL);
        } finally {
            session.clear();
        }
    }

    public Obj getValue(String name) {
        return getValue(name, 0, Constants.GLOBAL_SCOPE);
    }

    public Obj getValue(String name, int block) {
        return getValue(name, block, Constants.GLOBAL_SCOPE);
    }

    /**
     * 直接按符号表读取全局变量。block 为 0 时扫描所有块。
     *
     * @throws SymbolNotFoundException 找不到符号
     * @throws UninitializedVariableException 变量未赋值
     */
    public Obj getValue(String name, int block, int classScope) {
        SymbolNode symbol = null;
        if (block == 0) {
            for (SymbolTable table : exe().getRuntimeSymbols()) {
                int index = table.indexOf(name, classScope, Constants.GLOBAL_SCOPE);
                if (index != Constants.INVALID_INDEX) {
                    symbol = table.get(index);
                    break;
                }
            }
        } else {
            SymbolTable table = exe().getRuntimeSymbols(block);
            int index = table.indexOf(name, classScope, Constants.GLOBAL_SCOPE);
            symbol = index != Constants.INVALID_INDEX ? table.get(index) : null;
        }

        if (symbol == null) {
            throw new SymbolNotFoundException(name);
        }
        checkSupported(symbol);
        StackValue value = rmem().getSymbolValue(symbol);
        if (value.isInvalid()) {
            throw new UninitializedVariableException(name);
        }
        return unpack(value, core.getHeap());
    }

    /** 从 startBlock 起第一个同名全局变量的原始值，找不到返回 null 值 */
    public StackValue getGlobalValue(String name) {
        return getGlobalValue(name, 0);
    }

    public StackValue getGlobalValue(String name, int startBlock) {
        List<SymbolTable> tables = exe().getRuntimeSymbols();
        for (int block = startBlock; block < tables.size(); block++) {
            SymbolTable table = tables.get(block);
            int index = table.indexOf(name, Constants.INVALID_INDEX, Constants.GLOBAL_SCOPE);
            if (index != Constants.INVALID_INDEX) {
                SymbolNode symbol = table.get(index);
                checkSupported(symbol);
                return rmem().getGlobal(symbol.getMemoryOffset());
            }
        }
        return StackValue.NULL;
    }

    public StackValue getRawFirstValue(String name) {
        return getRawFirstValue(name, 0, Constants.GLOBAL_SCOPE);
    }

    /**
     * @throws SymbolNotFoundException 找不到符号
     */
    public StackValue getRawFirstValue(String name, int startBlock, int classScope) {
        List<SymbolTable> tables = exe().getRuntimeSymbols();
        for (int block = startBlock; block < tables.size(); block++) {
            SymbolTable table = tables.get(block);
            int index = table.indexOf(name, classScope, Constants.GLOBAL_SCOPE);
            if (index != Constants.INVALID_INDEX) {
                SymbolNode symbol = table.get(index);
                checkSupported(symbol);
                return rmem().getSymbolValue(symbol);
            }
        }
        throw new SymbolNotFoundException(name);
    }

    public Obj getFirstValue(String name) {
        return getFirstValue(name, 0, Constants.GLOBAL_SCOPE);
    }

    public Obj getFirstValue(String name, int startBlock, int classScope) {
        return unpack(getRawFirstValue(name, startBlock, classScope), core.getHeap());
    }

    /**
     * 第一个持有该对象的全局变量名，没有返回 null
     */
    public String getFirstNameFromValue(StackValue value) {
        if (!value.isPointer()) {
            throw new IllegalArgumentException("Value to highlight must be a pointer");
        }
        List<StackValue> stack = rmem().getStack();
        int slot = -1;
        for (int i = 0; i < rmem().getGlobOffset(); i++) {
            if (stack.get(i).equals(value)) {
                slot = i;
                break;
            }
        }
        if (slot < 0) {
            return null;
        }
        for (SymbolTable table : exe().getRuntimeSymbols()) {
            for (SymbolNode symbol : table.getSymbols()) {
                if (!symbol.isBlank() && symbol.isGlobalFunctionScope() && symbol.getMemoryOffset() == slot) {
                    return symbol.getName();
                }
            }
        }
        return null;
    }

    // ========== 类型 ==========

    /** 当前上下文中名称对应值的类型名 */
    public String getType(String name) {
        SymbolLocation location = resolve(name, core.getRunningBlock(), null);
        return rmem().getSymbolValue(location.symbol).accept(new TypeNameVisitor());
    }

    public String getType(Obj obj) {
        return obj.getDsasmValue().accept(new TypeNameVisitor());
    }

    private final class TypeNameVisitor implements StackValueVisitor<String> {
        @Override public String visitInvalid(StackValue value) { return "null"; }
        @Override public String visitNull(StackValue value) { return "null"; }
        @Override public String visitInt(StackValue value) { return "int"; }
        @Override public String visitDouble(StackValue value) { return "double"; }
        @Override public String visitBoolean(StackValue value) { return "bool"; }
        @Override public String visitChar(StackValue value) { return "char"; }
        @Override public String visitString(StackValue value) { return "string"; }
        @Override public String visitArrayPointer(StackValue value) { return "array"; }
        @Override public String visitFunctionPointer(StackValue value) { return "function pointer"; }
        @Override public String visitDefaultArg(StackValue value) { return "null"; }

        @Override
        public String visitPointer(StackValue value) {
            return exe().getClassTable().getTypeName(value.getMetaType());
        }

        @Override
        public String visitInternal(StackValue value) {
            throw new UnsupportedFeatureException("unknown datatype " + value.getType());
        }
    }

    // ========== 对象与数组成员 ==========

    public Map<String, Obj> getProperties(Obj obj) {
        return getProperties(obj, false);
    }

    /**
     * 类实例的字段，按声明顺序。只有一个标量槽位的对象字段直接展开为该标量。
     *
     * @return obj 不是类实例时返回 null
     */
    public Map<String, Obj> getProperties(Obj obj, boolean excludeStatic) {
        if (obj == null || !obj.getDsasmValue().isPointer()) {
            return null;
        }
        Heap heap = core.getHeap();
        ClassNode classNode = exe().getClassTable().get(obj.getDsasmValue().getMetaType());
        HeapObject object = heap.toHeapObject(obj.getDsasmValue());

        Map<String, Obj> result = new LinkedHashMap<>();
        for (SymbolNode field : ValueTracer.fieldsOf(classNode)) {
            if (excludeStatic && field.isStatic()) {
                continue;
            }
            StackValue value = field.isStatic()
                    ? rmem().getGlobal(field.getMemoryOffset())
                    : object.getValueFromIndex(field.getMemoryOffset());

            if (value.isPointer()) {
                HeapObject inner = heap.toHeapObject(value);
                if (inner.count() == 1) {
                    StackValue first = inner.getValueFromIndex(0);
                    if (!first.isPointer() && !first.isArray()) {
                        value = first;
                    }
                }
            }
            result.put(field.getName(), unpackShallow(value));
        }
        return result;
    }

    /** 类实例的实例字段名，按槽位顺序 */
    public List<String> getPropertyNames(Obj obj) {
        if (obj == null || !obj.getDsasmValue().isPointer()) {
            return null;
        }
        ClassNode classNode = exe().getClassTable().get(obj.getDsasmValue().getMetaType());
        List<String> names = new ArrayList<>();
        for (SymbolNode field : ValueTracer.fieldsOf(classNode)) {
            if (!field.isStatic()) {
                names.add(field.getName());
            }
        }
        return names;
    }

    /** 数组的直接元素（浅解包） */
    public List<Obj> getArrayElements(Obj obj) {
        if (obj == null || !obj.getDsasmValue().isArray()) {
            return null;
        }
        List<Obj> elements = new ArrayList<>();
        for (StackValue value : core.getHeap().toHeapArray(obj.getDsasmValue()).getValues()) {
            elements.add(unpackShallow(value));
        }
        return elements;
    }

    // ========== 解包 / 重打包 ==========

    /** 以给定堆递归解包 */
    public Obj unpack(StackValue value, Heap heap) {
        return unpacker.unpack(value, heap);
    }

    /** 以绑定的堆递归解包 */
    public Obj unpack(StackValue value) {
        return unpacker.unpack(value, core.getHeap());
    }

    /** 不展开数组，数组载荷为句柄（IDE 按需调用 {@link #getArrayElements}） */
    public Obj unpackShallow(StackValue value) {
        return unpacker.unpackShallow(value, core.getHeap());
    }

    /**
     * 把镜像值写回堆：数组快照重新分配为新数组，其余返回原栈值
     */
    public static StackValue repack(Obj obj, Heap heap) {
        DsasmArray array = obj.getArray();
        if (obj.getType().isIndexable() && array != null) {
            StackValue[] values = new StackValue[array.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = repack(array.get(i), heap);
            }
            return heap.allocateArray(values);
        }
        return obj.getDsasmValue();
    }

    // ========== 改值并重跑 ==========

    /**
     * 写入变量并标记依赖它的图节点为脏
     *
     * @return 被标记的节点数；变量没有图节点时返回 -1（未写入）
     */
    private int setValue(String varName, StackValue value) {
        Executable exe = exe();
        GraphNode graphNode = exe.getFirstGraphNode(varName);
        if (graphNode == null) {
            return -1;
        }

        rmem().setSymbolValue(graphNode.getTarget(), value);

        List<GraphNode> reachable = exe.getGraph().reachableFrom(graphNode);
        DependencyGraph.markDirty(reachable);
        LOG.log(Level.FINE, "{0} 已修改，{1} 个依赖节点标记为脏", new Object[]{varName, reachable.size()});
        return reachable.size();
    }

    /** 把变量置为 null 并标记依赖节点 */
    public void nullifyVariable(String varName) {
        if (varName != null && !varName.isEmpty()) {
            setValue(varName, StackValue.NULL);
        }
    }

    /**
     * 重设变量的整数值（null 表示置空），并以增量模式重跑所有顶层代码块
     *
     * @return 变量是否被写入；没有图节点的变量不写入
     */
    public boolean setValueAndExecute(String varName, Integer value) {
        return setValueAndExecute(varName, value == null ? StackValue.NULL : StackValue.buildInt(value.longValue()));
    }

    /**
     * 重设变量值并以增量模式重跑。重跑中的异常直接抛给调用者。
     */
    public boolean setValueAndExecute(String varName, StackValue value) {
        RuntimeOptions options = core.getOptions();
        boolean previousDelta = options.isDeltaExecution();
        options.setDeltaExecution(true);
        try {
            int nodesMarkedDirty = setValue(varName, value);
            if (nodesMarkedDirty < 0) {
                return false;
            }
            if (nodesMarkedDirty > 0) {
                LOG.log(Level.FINE, "增量重跑开始: {0}", varName);
                for (CodeBlock block : exe().getCodeBlocks()) {
                    mirrorTarget.bounce(block.getCodeBlockId(), block.getEntryPoint());
                }
                LOG.log(Level.FINE, "增量重跑结束: {0}", varName);
            }
            return true;
        } finally {
            options.setDeltaExecution(previousDelta);
        }
    }

    // ========== 比较（测试辅助） ==========

    /**
     * 比较数组快照与期望值，嵌套 List 对应子数组
     *
     * @param elementType Long / Double / Boolean / Character / String
     */
    public boolean compareArrays(DsasmArray array, List<?> expected, Class<?> elementType) {
        if (array == null || array.size() != expected.size()) {
            return false;
        }
        for (int i = 0; i < array.size(); i++) {
            Object subExpected = expected.get(i);
            DsasmArray subArray = array.get(i).getArray();

            if (subExpected instanceof List && subArray != null) {
                if (!compareArrays(subArray, (List<?>) subExpected, elementType)) {
                    return false;
                }
            } else if (!(subExpected instanceof List) && subArray == null) {
                if (!compareElement(array.get(i).getPayload(), subExpected, elementType)) {
                    return false;
                }
            } else {
                return false;
            }
        }
        return true;
    }

    public boolean compareArrays(String name, List<?> expected, Class<?> elementType, int block) {
        return compareArrays(getValue(name, block).getArray(), expected, elementType);
    }

    private static boolean compareElement(Object payload, Object expected, Class<?> elementType) {
        if (payload == null || expected == null) {
            return payload == expected;
        }
        if (elementType == Long.class) {
            return ((Number) payload).longValue() == ((Number) expected).longValue();
        } else if (elementType == Double.class) {
            return Math.abs(((Number) payload).doubleValue() - ((Number) expected).doubleValue()) <= 0.000001;
        } else if (elementType == Boolean.class) {
            return payload.equals(expected);
        } else if (elementType == Character.class) {
            return payload.equals(expected);
        } else if (elementType == String.class) {
            return payload.toString().equals(expected.toString());
        }
        throw new UnsupportedFeatureException("Comparison not implemented for " + elementType.getName());
    }

    /**
     * 镜像值与 Java 值的结构比较：数组对应 Object[]，类实例对应 Map（按字段名）
     */
    public boolean equalJavaObject(Obj obj, final Object javaValue) {
        if (javaValue == null) {
            return obj.getDsasmValue().isNull();
        }
        return obj.getDsasmValue().accept(new JavaValueComparator(obj, javaValue));
    }

    private final class JavaValueComparator implements StackValueVisitor<Boolean> {

        private final Obj obj;
        private final Object javaValue;

        JavaValueComparator(Obj obj, Object javaValue) {
            this.obj = obj;
            this.javaValue = javaValue;
        }

        @Override
        public Boolean visitArrayPointer(StackValue value) {
            if (!(javaValue instanceof Object[])) {
                return false;
            }
            Object[] expected = (Object[]) javaValue;
            List<Obj> elements = getArrayElements(obj);
            if (elements.size() != expected.length) {
                return false;
            }
            for (int i = 0; i < expected.length; i++) {
                if (!equalJavaObject(elements.get(i), expected[i])) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitInt(StackValue value) {
            return (javaValue instanceof Integer || javaValue instanceof Long)
                    && ((Number) javaValue).longValue() == value.getIntValue();
        }

        @Override
        public Boolean visitDouble(StackValue value) {
            return javaValue instanceof Double && (Double) javaValue == value.getDoubleValue();
        }

        @Override
        public Boolean visitBoolean(StackValue value) {
            return javaValue instanceof Boolean && (Boolean) javaValue == value.getBooleanValue();
        }

        @Override
        public Boolean visitChar(StackValue value) {
            return javaValue instanceof Character && (Character) javaValue == value.getCharValue();
        }

        @Override
        public Boolean visitString(StackValue value) {
            return javaValue instanceof String && javaValue.equals(core.getHeap().getString(value));
        }

        @Override
        public Boolean visitPointer(StackValue value) {
            if (!(javaValue instanceof Map)) {
                return false;
            }
            Map<String, Obj> properties = getProperties(obj);
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) javaValue).entrySet()) {
                Obj property = properties.get(String.valueOf(entry.getKey()));
                if (property == null || !equalJavaObject(property, entry.getValue())) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitNull(StackValue value) {
            return false;
        }

        @Override
        public Boolean visitInvalid(StackValue value) {
            throw new UnsupportedFeatureException("Cannot compare an uninitialized value");
        }

        @Override
        public Boolean visitFunctionPointer(StackValue value) {
            throw new UnsupportedFeatureException("Cannot compare a function pointer");
        }

        @Override
        public Boolean visitDefaultArg(StackValue value) {
            throw new UnsupportedFeatureException("Cannot compare a default argument");
        }

        @Override
        public Boolean visitInternal(StackValue value) {
            throw new UnsupportedFeatureException("unknown datatype " + value.getType());
        }
    }
}
