package proto.runtime.interpreter;

import com.protolang.compiler.symbol.ClassTable;
import com.protolang.compiler.symbol.CodeBlock;
import com.protolang.compiler.symbol.ProcedureTable;
import com.protolang.compiler.symbol.SymbolTable;
import com.protolang.compiler.types.TypeSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 编译产物：代码块树、每块的运行时符号表、类表、过程表和关联更新图。
 * 由 {@link ExecutableBuilder} 构造，之后只读（符号表的 undefine 除外）。
 */
public final class Executable {

    private final List<CodeBlock> completeCodeBlocks;
    private final List<CodeBlock> codeBlocks;
    private final List<SymbolTable> runtimeSymbols;
    private final ClassTable classTable;
    private final ProcedureTable procedureTable;
    private final TypeSystem typeSystem;
    private final Map<Integer, ProcedureBody> procedureBodies;
    private final Map<Integer, Integer> localCounts;
    private final DependencyGraph graph;
    private final int globalStackSize;

    Executable(List<CodeBlock> completeCodeBlocks, List<SymbolTable> runtimeSymbols, ClassTable classTable,
               ProcedureTable procedureTable, Map<Integer, ProcedureBody> procedureBodies,
               Map<Integer, Integer> localCounts, DependencyGraph graph, int globalStackSize) {
        this.completeCodeBlocks = Collections.unmodifiableList(new ArrayList<>(completeCodeBlocks));
        this.runtimeSymbols = Collections.unmodifiableList(new ArrayList<>(runtimeSymbols));
        this.classTable = classTable;
        this.procedureTable = procedureTable;
        this.typeSystem = new TypeSystem(classTable);
        this.procedureBodies = procedureBodies;
        this.localCounts = localCounts;
        this.graph = graph;
        this.globalStackSize = globalStackSize;

        List<CodeBlock> topLevel = new ArrayList<>();
        for (CodeBlock block : completeCodeBlocks) {
            if (block.getParent() == null) {
                topLevel.add(block);
            }
        }
        this.codeBlocks = Collections.unmodifiableList(topLevel);
    }

    /** 所有代码块，下标即块 id */
    public List<CodeBlock> getCompleteCodeBlocks() {
        return completeCodeBlocks;
    }

    /** 顶层代码块 */
    public List<CodeBlock> getCodeBlocks() {
        return codeBlocks;
    }

    public CodeBlock getCompleteCodeBlock(int blockId) {
        if (blockId < 0 || blockId >= completeCodeBlocks.size()) {
            throw new ProtoRuntimeException("Unknown code block: " + blockId);
        }
        return completeCodeBlocks.get(blockId);
    }

    public List<SymbolTable> getRuntimeSymbols() {
        return runtimeSymbols;
    }

    public SymbolTable getRuntimeSymbols(int blockId) {
        if (blockId < 0 || blockId >= runtimeSymbols.size()) {
            throw new ProtoRuntimeException("Unknown code block: " + blockId);
        }
        return runtimeSymbols.get(blockId);
    }

    public ClassTable getClassTable() { return classTable; }
    public ProcedureTable getProcedureTable() { return procedureTable; }
    public TypeSystem getTypeSystem() { return typeSystem; }
    public DependencyGraph getGraph() { return graph; }

    /** 全局区大小：所有全局作用域符号和静态成员 */
    public int getGlobalStackSize() {
        return globalStackSize;
    }

    public ProcedureBody getProcedureBody(int procedureId) {
        return procedureBodies.get(procedureId);
    }

    /** 过程的局部槽位数（含参数） */
    public int getLocalCount(int procedureId) {
        Integer count = localCounts.get(procedureId);
        return count != null ? count : 0;
    }

    public GraphNode getFirstGraphNode(String name) {
        return graph.getFirstGraphNode(name);
    }
}
