package org.perlfront.astvisitor;

import org.perlfront.astnode.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Child-to-parent index over a finished tree, keyed by node id.
 * The tree itself holds no parent references; build one of these when you need them
 * and throw it away with the tree.
 */
public class ParentMap {
    private final Map<Integer, Node> parents;
    private final Map<Integer, Node> nodes;

    private ParentMap(Map<Integer, Node> parents, Map<Integer, Node> nodes) {
        this.parents = parents;
        this.nodes = nodes;
    }

    public static ParentMap build(Node root) {
        Map<Integer, Node> parents = new HashMap<>();
        Map<Integer, Node> nodes = new HashMap<>();
        Deque<Node> work = new ArrayDeque<>();
        work.push(root);
        nodes.put(root.getId(), root);
        while (!work.isEmpty()) {
            Node node = work.pop();
            for (Node child : ChildCollector.childrenOf(node)) {
                parents.put(child.getId(), node);
                nodes.put(child.getId(), child);
                work.push(child);
            }
        }
        return new ParentMap(parents, nodes);
    }

    /**
     * Returns the parent of the node, or null for the root.
     */
    public Node parentOf(Node node) {
        return parents.get(node.getId());
    }

    public Node nodeById(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }
}
