package fk.treestats.aggregation;

import fk.treestats.common.tree.Frame;
import fk.treestats.common.tree.TreeBuilder;

/**
 * Copies a ratio annotated tree, leaving out every node whose ratio to root is below the threshold. The weight of
 * the nodes left out is carried by the closest retained ancestor as its below threshold count.
 */
class ThresholdFilter<V> extends TreeBuilder<DescendantTreeCount<V>, DescendantTreeCount<V>> {

    private final double threshold;

    ThresholdFilter(double threshold) {
        this.threshold = threshold;
    }

    @Override
    protected DescendantTreeCount<V> newNode(DescendantTreeCount<V> node, DescendantTreeCount<V> parent,
                                             Frame<DescendantTreeCount<V>, DescendantTreeCount<V>> children) {
        DescendantTreeCount<V> filtered = new DescendantTreeCount<>(node.getValue());

        int belowThresholdCount = 0;
        for(DescendantTreeCount<V> child : children.getChildren()) {
            belowThresholdCount += child.getBelowThresholdCount();
        }
        for(DescendantTreeCount<V> eliminated : children.getEliminated()) {
            belowThresholdCount += eliminated.getCount();
        }

        // count stays the unfiltered total
        filtered.setCount(node.getCount());
        filtered.setRatioToRoot(node.getRatioToRoot());
        filtered.setRatioToParent(parent == null ? 1.0 : (double) node.getCount() / parent.getCount());
        filtered.setBelowThresholdCount(belowThresholdCount);
        filtered.setChildren(children.getChildren());
        return filtered;
    }

    @Override
    protected boolean retain(DescendantTreeCount<V> node, DescendantTreeCount<V> parent) {
        return parent == null || node.getRatioToRoot() >= threshold;
    }
}
