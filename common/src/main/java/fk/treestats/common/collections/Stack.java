package fk.treestats.common.collections;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal LIFO. Not thread safe.
 */
public class Stack<T> {

    private final List<T> items = new ArrayList<>();

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public void push(T item) {
        items.add(item);
    }

    public T pop() {
        Preconditions.checkState(!items.isEmpty(), "pop on empty stack");
        return items.remove(items.size() - 1);
    }

    public T top() {
        Preconditions.checkState(!items.isEmpty(), "top on empty stack");
        return items.get(items.size() - 1);
    }
}
