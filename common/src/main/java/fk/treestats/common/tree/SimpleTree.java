package fk.treestats.common.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A value with an ordered list of children.
 */
public class SimpleTree<V> implements TreeNode<SimpleTree<V>> {

    private final V value;
    private final List<SimpleTree<V>> children;

    public SimpleTree(V value) {
        this(value, new ArrayList<>());
    }

    public SimpleTree(V value, List<SimpleTree<V>> children) {
        this.value = value;
        this.children = children;
    }

    @SafeVarargs
    public static <V> SimpleTree<V> of(V value, SimpleTree<V>... children) {
        return new SimpleTree<>(value, new ArrayList<>(Arrays.asList(children)));
    }

    public V getValue() {
        return value;
    }

    public int childCount() {
        return children.size();
    }

    public SimpleTree<V> getChild(int idx) {
        return children.get(idx);
    }

    @Override
    public SimpleTree<V> node() {
        return this;
    }

    @Override
    public Iterable<SimpleTree<V>> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
