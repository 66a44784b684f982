package fk.treestats.common.tree;

/**
 * Read-only view over a node of some tree. {@code T} is the view type itself, so that children can be walked with
 * the same interface as their parent.
 */
public interface TreeNode<T> {

    /**
     * @return the view of this node.
     */
    T node();

    /**
     * Children in their natural order. Must be finite and iterable more than once, empty for leaves.
     */
    Iterable<T> children();
}
