package fk.treestats.aggregation;

import fk.treestats.common.collections.Stack;

/**
 * Annotates an already counted tree with ratios, in place, top down.
 */
class RatioCalculator {

    private RatioCalculator() {
    }

    static <V> void calculate(DescendantTreeCount<V> root) {
        double rootCount = root.getCount();
        root.setRatioToParent(1.0);
        root.setRatioToRoot(1.0);

        Stack<DescendantTreeCount<V>> parents = new Stack<>();
        parents.push(root);
        while(!parents.isEmpty()) {
            DescendantTreeCount<V> node = parents.pop();
            for(DescendantTreeCount<V> child : node.getChildren()) {
                child.setRatioToRoot(child.getCount() / rootCount);
                child.setRatioToParent((double) child.getCount() / node.getCount());
                parents.push(child);
            }
        }
    }
}
