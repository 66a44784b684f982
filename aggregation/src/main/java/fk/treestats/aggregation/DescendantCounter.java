package fk.treestats.aggregation;

import fk.treestats.common.tree.Frame;
import fk.treestats.common.tree.TreeBuilder;
import fk.treestats.common.tree.TreeNode;

/**
 * Counts, for every node of a source tree, the size of the subtree rooted at it.
 */
class DescendantCounter<T extends TreeNode<T>> extends TreeBuilder<T, DescendantTreeCount<T>> {

    @Override
    protected DescendantTreeCount<T> newNode(T node, T parent, Frame<T, DescendantTreeCount<T>> children) {
        DescendantTreeCount<T> counted = new DescendantTreeCount<>(node);

        int count = 1;
        for(DescendantTreeCount<T> child : children.getChildren()) {
            count += child.getCount();
        }
        counted.setCount(count);
        counted.setChildren(children.getChildren());
        return counted;
    }
}
