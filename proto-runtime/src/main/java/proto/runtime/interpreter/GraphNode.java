package proto.runtime.interpreter;

import com.protolang.compiler.symbol.SymbolNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 关联更新图的一个节点：{@code target = expression(dependencies...)}。
 *
 * <p>新建节点为脏；执行后清除。增量执行只重跑脏节点。</p>
 */
public final class GraphNode {

    private final int exprUid;
    private final int updateBlock;
    private final SymbolNode target;
    private final List<SymbolNode> dependencies;
    private final UpdateExpression expression;
    private boolean dirty = true;

    public GraphNode(int exprUid, int updateBlock, SymbolNode target, List<SymbolNode> dependencies, UpdateExpression expression) {
        this.exprUid = exprUid;
        this.updateBlock = updateBlock;
        this.target = target;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.expression = expression;
    }

    public int getExprUid() { return exprUid; }
    public int getUpdateBlock() { return updateBlock; }
    public SymbolNode getTarget() { return target; }
    public List<SymbolNode> getDependencies() { return dependencies; }
    public UpdateExpression getExpression() { return expression; }

    public boolean isDirty() { return dirty; }
    public void setDirty(boolean dirty) { this.dirty = dirty; }

    /** 本节点是否读取给定符号 */
    public boolean dependsOn(SymbolNode symbol) {
        return dependencies.contains(symbol);
    }

    @Override
    public String toString() {
        return "GraphNode#" + exprUid + "(" + target.getName() + " <- " + dependencies.size() + " deps, block " + updateBlock + ")";
    }
}
