package fk.treestats.common.tree;

import java.util.function.Predicate;

/**
 * Structural helpers over any {@link TreeNode}.
 */
public class Trees {

    private Trees() {
    }

    /**
     * Copies the shape of {@code root} into a {@link SimpleTree} whose values are the original nodes.
     */
    public static <T extends TreeNode<T>> SimpleTree<T> copy(T root) {
        return new TreeBuilder<T, SimpleTree<T>>() {
            @Override
            protected SimpleTree<T> newNode(T node, T parent, Frame<T, SimpleTree<T>> children) {
                return new SimpleTree<>(node, children.getChildren());
            }
        }.build(root);
    }

    /**
     * Copies {@code root}, dropping every node that fails {@code predicate} together with its whole subtree.
     *
     * @return the filtered copy, or null if the root fails the predicate
     */
    public static <T extends TreeNode<T>> SimpleTree<T> filter(T root, Predicate<? super T> predicate) {
        return new TreeBuilder<T, SimpleTree<T>>() {
            @Override
            protected SimpleTree<T> newNode(T node, T parent, Frame<T, SimpleTree<T>> children) {
                return new SimpleTree<>(node, children.getChildren());
            }

            @Override
            protected boolean retain(T node, T parent) {
                return predicate.test(node);
            }
        }.build(root);
    }
}
