package proto.runtime.interpreter;

import com.protolang.compiler.symbol.SymbolNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 关联更新图。节点按声明顺序保存，块内执行顺序即声明顺序。
 */
public final class DependencyGraph {

    private final List<GraphNode> nodes = new ArrayList<>();

    void add(GraphNode node) {
        nodes.add(node);
    }

    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<GraphNode> getNodesForBlock(int blockId) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (node.getUpdateBlock() == blockId) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * 第一个给全局变量 {@code name} 赋值的节点，没有返回 null
     */
    public GraphNode getFirstGraphNode(String name) {
        for (GraphNode node : nodes) {
            SymbolNode target = node.getTarget();
            if (target.getName().equals(name) && target.isGlobalFunctionScope()) {
                return node;
            }
        }
        return null;
    }

    /**
     * 从源节点出发可达的全部依赖节点（传递闭包），不含源节点本身
     */
    public List<GraphNode> reachableFrom(GraphNode source) {
        Set<GraphNode> reached = new LinkedHashSet<>();
        Deque<GraphNode> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            SymbolNode changed = queue.poll().getTarget();
            for (GraphNode node : nodes) {
                if (node != source && node.dependsOn(changed) && reached.add(node)) {
                    queue.add(node);
                }
            }
        }
        return new ArrayList<>(reached);
    }

    public static void markDirty(Collection<GraphNode> dirtyNodes) {
        for (GraphNode node : dirtyNodes) {
            node.setDirty(true);
        }
    }
}
