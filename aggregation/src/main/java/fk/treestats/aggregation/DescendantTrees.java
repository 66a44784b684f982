package fk.treestats.aggregation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import fk.treestats.common.tree.TreeNode;
import fk.treestats.common.tree.TreeTraverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for descendant statistics over any {@link TreeNode}.
 * <p>
 * Apart from {@link #calculateRatioToRoot}, which annotates the tree it is given, every operation leaves its input
 * untouched and returns a newly built tree, so counted, filtered and sorted views can be held side by side.
 */
public class DescendantTrees {

    private static final Logger logger = LoggerFactory.getLogger(DescendantTrees.class);

    private DescendantTrees() {
    }

    /**
     * Builds the statistics tree of {@code root}, with count and children count set on every node. Ratios and below
     * threshold counts are left at 0.
     */
    public static <T extends TreeNode<T>> DescendantTreeCount<T> countDescendantTree(T root) {
        DescendantTreeCount<T> counted = new DescendantCounter<T>().build(root);
        logger.debug("Counted tree of {} nodes", counted.getCount());
        return counted;
    }

    /**
     * Sets ratio to root and ratio to parent on every node of a counted tree. Mutates {@code tree}.
     */
    public static <V> void calculateRatioToRoot(DescendantTreeCount<V> tree) {
        Preconditions.checkNotNull(tree, "tree is required");
        RatioCalculator.calculate(tree);
    }

    /**
     * Drops every node whose ratio to root is below {@code threshold}. The root is always kept.
     * <p>
     * {@code tree} should be an unfiltered tree with ratios calculated. Below threshold counts are rebuilt from the
     * children present in {@code tree}, so filtering an already filtered tree loses the weight pruned the first time.
     * To filter at a higher threshold, filter the original counted tree again.
     */
    public static <V> DescendantTreeCount<V> filterDescendantTree(DescendantTreeCount<V> tree, double threshold) {
        Preconditions.checkArgument(!Double.isNaN(threshold), "threshold must be a number");
        DescendantTreeCount<V> filtered = new ThresholdFilter<V>(threshold).build(tree);
        Preconditions.checkState(filtered != null, "root eliminated by threshold filter");
        logger.debug("Filtered tree at threshold {}: {} nodes below threshold", threshold, filtered.getBelowThresholdCount());
        return filtered;
    }

    /**
     * Orders the children of every node by count, descending. Ties keep their relative order.
     */
    public static <V> DescendantTreeCount<V> sortDescendantTree(DescendantTreeCount<V> tree) {
        return new DescendantSorter<V>().build(tree);
    }

    /**
     * @return all nodes of {@code tree} in post order
     */
    public static <V> List<DescendantTreeCount<V>> collectAllNodes(DescendantTreeCount<V> tree) {
        Preconditions.checkNotNull(tree, "tree is required");
        ImmutableList.Builder<DescendantTreeCount<V>> nodes = ImmutableList.builder();
        TreeTraverser.traversePost(tree, (node, parent, last) -> {
            nodes.add(node);
            return true;
        });
        return nodes.build();
    }

    /**
     * Counts, annotates with ratios, filters at {@code threshold} and sorts.
     */
    public static <T extends TreeNode<T>> DescendantTreeCount<T> countDescendants(T root, double threshold) {
        DescendantTreeCount<T> counted = countDescendantTree(root);
        calculateRatioToRoot(counted);
        return sortDescendantTree(filterDescendantTree(counted, threshold));
    }

    /**
     * Same as {@link #countDescendants(TreeNode, double)}, with the threshold and whether to sort taken from
     * {@code config}.
     */
    public static <T extends TreeNode<T>> DescendantTreeCount<T> countDescendants(T root, StatsConfig config) {
        logger.debug("Counting descendants, threshold: {}, sort: {}", config.getThreshold(), config.isSortChildren());
        DescendantTreeCount<T> counted = countDescendantTree(root);
        calculateRatioToRoot(counted);
        DescendantTreeCount<T> filtered = filterDescendantTree(counted, config.getThreshold());
        return config.isSortChildren() ? sortDescendantTree(filtered) : filtered;
    }
}
