package fk.treestats.aggregation;

import fk.treestats.common.tree.Frame;
import fk.treestats.common.tree.TreeBuilder;

import java.util.List;

/**
 * Copies a statistics tree with the children of every node ordered by count, largest first. Equal counts keep their
 * original relative order.
 */
class DescendantSorter<V> extends TreeBuilder<DescendantTreeCount<V>, DescendantTreeCount<V>> {

    @Override
    protected DescendantTreeCount<V> newNode(DescendantTreeCount<V> node, DescendantTreeCount<V> parent,
                                             Frame<DescendantTreeCount<V>, DescendantTreeCount<V>> children) {
        DescendantTreeCount<V> sorted = new DescendantTreeCount<>(node.getValue());
        sorted.setCount(node.getCount());
        sorted.setRatioToParent(node.getRatioToParent());
        sorted.setRatioToRoot(node.getRatioToRoot());
        sorted.setBelowThresholdCount(node.getBelowThresholdCount());

        List<DescendantTreeCount<V>> sortedChildren = children.getChildren();
        // List.sort is stable
        sortedChildren.sort((a, b) -> Integer.compare(b.getCount(), a.getCount()));
        sorted.setChildren(sortedChildren);
        return sorted;
    }
}
