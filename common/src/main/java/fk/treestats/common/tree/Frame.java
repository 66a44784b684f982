package fk.treestats.common.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Children collected for one parent while a {@link TreeBuilder} walks the source tree.
 *
 * @param <T> source node type
 * @param <R> built node type
 */
public class Frame<T, R> {

    private final T parent;
    private final List<R> children = new ArrayList<>();
    private final List<T> eliminated = new ArrayList<>();

    Frame(T parent) {
        this.parent = parent;
    }

    public T getParent() {
        return parent;
    }

    /**
     * Built children, in visiting order. The list is owned by the caller once the frame is handed out.
     */
    public List<R> getChildren() {
        return children;
    }

    /**
     * Source children that were rejected by {@link TreeBuilder#retain}.
     */
    public List<T> getEliminated() {
        return eliminated;
    }

    void add(R child) {
        children.add(child);
    }

    void eliminate(T child) {
        eliminated.add(child);
    }
}
