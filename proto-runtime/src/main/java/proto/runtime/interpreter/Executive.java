package proto.runtime.interpreter;

import com.protolang.compiler.symbol.CodeBlock;
import com.protolang.compiler.symbol.Constants;
import com.protolang.compiler.symbol.ProcedureNode;
import com.protolang.compiler.symbol.SymbolNode;
import com.protolang.compiler.symbol.SymbolTable;
import proto.runtime.Heap;
import proto.runtime.ProtoException;
import proto.runtime.StackValue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 关联更新图的执行引擎。
 *
 * <p>{@link #bounce} 按声明顺序执行一个代码块的图节点：全量模式执行全部节点，
 * 增量模式只执行脏节点。每个节点执行后清除脏标记。</p>
 */
public final class Executive implements ExecutionContext {

    private static final Logger LOG = Logger.getLogger(Executive.class.getName());

    private final RuntimeCore core;

    Executive(RuntimeCore core) {
        this.core = core;
    }

    public RuntimeCore getRuntimeCore() {
        return core;
    }

    /** 依次执行每个顶层代码块 */
    public void execute() {
        for (CodeBlock block : core.getExecutable().getCodeBlocks()) {
            bounce(block.getCodeBlockId(), block.getEntryPoint());
        }
    }

    /**
     * 从入口节点开始执行一个代码块
     */
    public void bounce(int blockId, int entryPoint) {
        Executable exe = core.getExecutable();
        exe.getCompleteCodeBlock(blockId);
        boolean delta = core.getOptions().isDeltaExecution();
        List<GraphNode> nodes = exe.getGraph().getNodesForBlock(blockId);

        int previousBlock = core.getRunningBlock();
        core.setRunningBlock(blockId);
        try {
            for (int i = Math.max(entryPoint, 0); i < nodes.size(); i++) {
                GraphNode node = nodes.get(i);
                if (delta && !node.isDirty()) {
                    continue;
                }
                runNode(node);
            }
        } finally {
            core.setRunningBlock(previousBlock);
        }
    }

    private void runNode(GraphNode node) {
        try {
            StackValue value = node.getExpression().evaluate(this);
            core.getRuntimeMemory().setSymbolValue(node.getTarget(), value != null ? value : StackValue.NULL);
            node.setDirty(false);
        } catch (ProtoException e) {
            throw e;
        } catch (RuntimeException e) {
            ProtoRuntimeException error = new ProtoRuntimeException(
                    "Failed to evaluate '" + node.getTarget().getName() + "': " + e.getMessage(),
                    node.getUpdateBlock(), node.getExprUid(), e);
            error.setVmStackTrace(core.getRuntimeMemory().formatFrameTrace(0));
            throw error;
        }
    }

    // ========== ExecutionContext ==========

    @Override
    public StackValue getValue(SymbolNode symbol) {
        return core.getRuntimeMemory().getSymbolValue(symbol);
    }

    @Override
    public void setValue(SymbolNode symbol, StackValue value) {
        core.getRuntimeMemory().setSymbolValue(symbol, value);
    }

    @Override
    public Heap getHeap() {
        return core.getHeap();
    }

    @Override
    public int getRunningBlock() {
        return core.getRunningBlock();
    }

    @Override
    public StackValue callProcedure(int procedureId, StackValue thisPointer, StackValue... args) {
        Executable exe = core.getExecutable();
        ProcedureNode procedure = exe.getProcedureTable().tryGetFunction(procedureId);
        if (procedure == null) {
            throw new ProtoRuntimeException("Unknown procedure: " + procedureId);
        }
        List<SymbolNode> parameters = argumentsOf(procedure);
        if (parameters.size() != args.length) {
            throw new ProtoRuntimeException(procedure.getName() + " expects " + parameters.size()
                    + " arguments but got " + args.length);
        }

        int classScope = procedure.isMethod() ? procedure.getClassId() : Constants.INVALID_INDEX;
        StackFrame frame = new StackFrame(classScope, procedureId, procedure.getCodeBlockId(),
                thisPointer, procedure.getName());
        RuntimeMemory memory = core.getRuntimeMemory();
        memory.pushFrame(frame, exe.getLocalCount(procedureId));
        core.getDebugProperties().pushDebugFrame(EnumSet.of(DebugProperties.StackFrameFlag.FEP_RUN));
        // 过程体在其声明块中执行，名字按词法作用域解析
        int callerBlock = core.getRunningBlock();
        core.setRunningBlock(procedure.getCodeBlockId());
        try {
            for (int i = 0; i < args.length; i++) {
                memory.setSymbolValue(parameters.get(i), args[i]);
            }
            StackValue result = exe.getProcedureBody(procedureId).invoke(this);
            return result != null ? result : StackValue.NULL;
        } finally {
            core.setRunningBlock(callerBlock);
            core.getDebugProperties().popDebugFrame();
            memory.popFrame();
        }
    }

    @Override
    public void bounce(int blockId) {
        bounce(blockId, core.getExecutable().getCompleteCodeBlock(blockId).getEntryPoint());
    }

    @Override
    public void pause() {
        Consumer<RuntimeCore> handler = core.getPauseHandler();
        if (handler != null) {
            LOG.log(Level.FINE, "暂停于代码块 {0}", core.getRunningBlock());
            handler.accept(core);
        }
    }

    private List<SymbolNode> argumentsOf(ProcedureNode procedure) {
        Executable exe = core.getExecutable();
        SymbolTable table = procedure.isMethod()
                ? exe.getClassTable().get(procedure.getClassId()).getSymbols()
                : exe.getRuntimeSymbols(procedure.getCodeBlockId());
        List<SymbolNode> result = new ArrayList<>();
        for (SymbolNode symbol : table.getSymbols()) {
            if (symbol.isArgument() && symbol.getFunctionScope() == procedure.getProcedureId()) {
                result.add(symbol);
            }
        }
        return result;
    }
}
