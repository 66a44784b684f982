package fk.treestats.aggregation;

import fk.treestats.common.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descendant statistics for one node of a source tree. The statistics tree is itself a {@link TreeNode}, so every
 * pass over it walks it the same way the source tree was walked.
 *
 * @param <V> type of the wrapped source value
 */
public class DescendantTreeCount<V> implements TreeNode<DescendantTreeCount<V>> {

    private final V value;

    private int count = 1;
    private int childrenCount;
    private double ratioToParent;
    private double ratioToRoot;
    private int belowThresholdCount;

    private List<DescendantTreeCount<V>> children = new ArrayList<>();

    public DescendantTreeCount(V value) {
        this.value = value;
    }

    public V getValue() {
        return value;
    }

    /**
     * Size of the subtree rooted here, this node included.
     */
    public int getCount() {
        return count;
    }

    public int getChildrenCount() {
        return childrenCount;
    }

    public double getRatioToParent() {
        return ratioToParent;
    }

    public double getRatioToRoot() {
        return ratioToRoot;
    }

    /**
     * Nodes pruned below this one by {@link DescendantTrees#filterDescendantTree}. Not reflected in {@link #getCount()}.
     */
    public int getBelowThresholdCount() {
        return belowThresholdCount;
    }

    public List<DescendantTreeCount<V>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public DescendantTreeCount<V> node() {
        return this;
    }

    @Override
    public Iterable<DescendantTreeCount<V>> children() {
        return getChildren();
    }

    void setCount(int count) {
        this.count = count;
    }

    void setRatioToParent(double ratioToParent) {
        this.ratioToParent = ratioToParent;
    }

    void setRatioToRoot(double ratioToRoot) {
        this.ratioToRoot = ratioToRoot;
    }

    void setBelowThresholdCount(int belowThresholdCount) {
        this.belowThresholdCount = belowThresholdCount;
    }

    void setChildren(List<DescendantTreeCount<V>> children) {
        this.children = children;
        this.childrenCount = children.size();
    }

    @Override
    public String toString() {
        return String.format("count: %d, children: %d, node: %s (root: %f, parent: %f)",
            count, children.size(), value, ratioToRoot, ratioToParent);
    }
}
