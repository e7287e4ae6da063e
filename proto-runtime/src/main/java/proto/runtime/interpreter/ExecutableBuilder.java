package proto.runtime.interpreter;

import com.protolang.compiler.symbol.ClassNode;
import com.protolang.compiler.symbol.ClassTable;
import com.protolang.compiler.symbol.CodeBlock;
import com.protolang.compiler.symbol.CodeBlock.CodeBlockType;
import com.protolang.compiler.symbol.CodeBlock.Language;
import com.protolang.compiler.symbol.Constants;
import com.protolang.compiler.symbol.ProcedureNode;
import com.protolang.compiler.symbol.ProcedureTable;
import com.protolang.compiler.symbol.SymbolNode;
import com.protolang.compiler.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装 {@link Executable}：声明代码块、符号、类、过程和图节点，并分配内存位置。
 *
 * <ul>
 *   <li>全局作用域符号和静态成员：全局栈绝对下标，全程序唯一</li>
 *   <li>过程局部变量和参数：相对帧指针，按过程分别编号</li>
 *   <li>实例字段：对象槽位，按类分别编号</li>
 * </ul>
 *
 * <p>全局函数的局部变量登记在声明它的代码块的表中，方法的局部变量登记在类的表中，
 * 二者都以过程 id 作为 functionScope。</p>
 */
public final class ExecutableBuilder {

    private final List<CodeBlock> blocks = new ArrayList<>();
    private final List<SymbolTable> tables = new ArrayList<>();
    private final ClassTable classTable = new ClassTable();
    private final ProcedureTable procedureTable = new ProcedureTable();
    private final Map<Integer, ProcedureBody> procedureBodies = new HashMap<>();
    private final Map<Integer, Integer> localCounts = new HashMap<>();
    private final Map<Integer, Integer> fieldCounts = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private int globalOffset;
    private int nextExprUid;

    public ExecutableBuilder() {
        addBlock(Constants.INVALID_INDEX, CodeBlockType.LANGUAGE, Language.ASSOCIATIVE);
    }

    /** 顶层程序块 */
    public int getTopBlock() {
        return 0;
    }

    // ========== 代码块 ==========

    /**
     * 新增代码块
     *
     * @param parentId 父块 id；{@link Constants#INVALID_INDEX} 表示新的顶层块
     * @return 新块 id
     */
    public int addBlock(int parentId, CodeBlockType type, Language language) {
        CodeBlock parent = parentId == Constants.INVALID_INDEX ? null : block(parentId);
        int id = blocks.size();
        blocks.add(new CodeBlock(id, type, language, parent));
        tables.add(new SymbolTable("block " + id, id));
        return id;
    }

    public SymbolTable getSymbolTable(int blockId) {
        block(blockId);
        return tables.get(blockId);
    }

    // ========== 全局变量 ==========

    public SymbolNode declareGlobal(int blockId, String name) {
        return declareGlobal(blockId, SymbolNode.builder(name));
    }

    /** 以自定义构建器声明全局变量（类型、定长数组等），作用域和位置由此处决定 */
    public SymbolNode declareGlobal(int blockId, SymbolNode.Builder builder) {
        block(blockId);
        SymbolNode node = builder
                .classScope(Constants.INVALID_INDEX)
                .functionScope(Constants.GLOBAL_SCOPE)
                .codeBlockId(blockId)
                .memoryOffset(globalOffset)
                .build();
        append(tables.get(blockId), node);
        globalOffset += node.getSize();
        return node;
    }

    // ========== 类 ==========

    public ClassNode declareClass(String name) {
        return declareClass(name, false);
    }

    public ClassNode declareClass(String name, boolean imported) {
        return classTable.declareClass(name, imported);
    }

    /** 实例字段，槽位按声明顺序分配 */
    public SymbolNode declareField(ClassNode classNode, String name) {
        Integer slot = fieldCounts.get(classNode.getClassId());
        int offset = slot != null ? slot : 0;
        SymbolNode node = SymbolNode.builder(name)
                .classScope(classNode.getClassId())
                .codeBlockId(getTopBlock())
                .memoryOffset(offset)
                .build();
        append(classNode.getSymbols(), node);
        fieldCounts.put(classNode.getClassId(), offset + 1);
        return node;
    }

    /** 静态字段，存放在全局区 */
    public SymbolNode declareStaticField(ClassNode classNode, String name) {
        SymbolNode node = SymbolNode.builder(name)
                .classScope(classNode.getClassId())
                .codeBlockId(getTopBlock())
                .isStatic(true)
                .memoryOffset(globalOffset)
                .build();
        append(classNode.getSymbols(), node);
        globalOffset += node.getSize();
        return node;
    }

    // ========== 过程 ==========

    /** 在代码块中声明全局函数 */
    public ProcedureNode declareFunction(int blockId, String name, ProcedureBody body) {
        block(blockId);
        ProcedureNode procedure = procedureTable.declare(name, Constants.GLOBAL_SCOPE, blockId, false);
        register(procedure, body);
        return procedure;
    }

    /** 声明方法，方法体属于顶层块 */
    public ProcedureNode declareMethod(ClassNode classNode, String name, boolean isStatic, ProcedureBody body) {
        ProcedureNode procedure = procedureTable.declare(name, classNode.getClassId(), getTopBlock(), isStatic);
        classNode.addProcedure(procedure);
        register(procedure, body);
        return procedure;
    }

    public SymbolNode declareLocal(ProcedureNode procedure, String name) {
        return declareLocal(procedure, name, false);
    }

    /** 参数按声明顺序接收实参 */
    public SymbolNode declareArgument(ProcedureNode procedure, String name) {
        return declareLocal(procedure, name, true);
    }

    private SymbolNode declareLocal(ProcedureNode procedure, String name, boolean isArgument) {
        int slot = localCounts.get(procedure.getProcedureId());
        SymbolNode node = SymbolNode.builder(name)
                .classScope(procedure.isMethod() ? procedure.getClassId() : Constants.INVALID_INDEX)
                .functionScope(procedure.getProcedureId())
                .codeBlockId(procedure.getCodeBlockId())
                .isArgument(isArgument)
                .memoryOffset(slot)
                .build();
        SymbolTable table = procedure.isMethod()
                ? classTable.get(procedure.getClassId()).getSymbols()
                : tables.get(procedure.getCodeBlockId());
        append(table, node);
        localCounts.put(procedure.getProcedureId(), slot + 1);
        return node;
    }

    private void register(ProcedureNode procedure, ProcedureBody body) {
        if (body == null) {
            throw new IllegalArgumentException("Procedure body must not be null: " + procedure.getName());
        }
        procedureBodies.put(procedure.getProcedureId(), body);
        localCounts.put(procedure.getProcedureId(), 0);
    }

    // ========== 关联更新图 ==========

    /**
     * 添加图节点 {@code target = expression(dependencies...)}，块内按添加顺序执行
     */
    public GraphNode addGraphNode(int blockId, SymbolNode target, UpdateExpression expression, SymbolNode... dependencies) {
        block(blockId);
        GraphNode node = new GraphNode(nextExprUid++, blockId, target, Arrays.asList(dependencies), expression);
        graph.add(node);
        return node;
    }

    public Executable build() {
        return new Executable(blocks, tables, classTable, procedureTable,
                new HashMap<>(procedureBodies),
                new HashMap<>(localCounts), graph, globalOffset);
    }

    private CodeBlock block(int blockId) {
        if (blockId < 0 || blockId >= blocks.size()) {
            throw new IllegalArgumentException("Unknown code block: " + blockId);
        }
        return blocks.get(blockId);
    }

    private static void append(SymbolTable table, SymbolNode node) {
        if (table.append(node) == Constants.INVALID_INDEX) {
            throw new IllegalArgumentException("Symbol already declared in " + table.getScopeName() + ": " + node.getName());
        }
    }
}
