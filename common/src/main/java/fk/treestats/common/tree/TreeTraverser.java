package fk.treestats.common.tree;

import fk.treestats.common.collections.Stack;

import java.util.ArrayList;
import java.util.List;

/**
 * Post order walk over a {@link TreeNode}. Every child is visited before its parent and is told who its parent is and
 * whether it is the last of its siblings. The root is visited last with a null parent.
 * <p>
 * The walk keeps its own stack of pending nodes, so tree depth is not bounded by the thread stack.
 */
public class TreeTraverser<T extends TreeNode<T>> {

    private final Visitor<T> visitor;

    public TreeTraverser(Visitor<T> visitor) {
        this.visitor = visitor;
    }

    public static <T extends TreeNode<T>> void traversePost(T root, Visitor<T> visitor) {
        new TreeTraverser<>(visitor).traverse(root);
    }

    /**
     * root must not be null.
     * @param root
     */
    public void traverse(T root) {
        Stack<Pending<T>> pending = new Stack<>();
        pending.push(new Pending<>(root.node(), null, true));

        while(!pending.isEmpty()) {
            Pending<T> top = pending.top();
            if(top.nextChild < top.children.size()) {
                T child = top.children.get(top.nextChild);
                ++top.nextChild;
                pending.push(new Pending<>(child, top.node, top.nextChild == top.children.size()));
            }
            else {
                pending.pop();
                if(!visitor.visit(top.node, top.parent, top.last)) {
                    return;
                }
            }
        }
    }

    public interface Visitor<T> {
        /**
         * @return false to stop the traversal
         */
        boolean visit(T node, T parent, boolean last);
    }

    private static class Pending<T extends TreeNode<T>> {
        final T node;
        final T parent;
        final boolean last;
        final List<T> children = new ArrayList<>();
        int nextChild = 0;

        Pending(T node, T parent, boolean last) {
            this.node = node;
            this.parent = parent;
            this.last = last;
            for(T child : node.children()) {
                children.add(child.node());
            }
        }
    }
}
