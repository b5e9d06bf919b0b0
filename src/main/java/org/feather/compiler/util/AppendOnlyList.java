package org.feather.compiler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * A growable sequence that only supports appending. Elements are never removed,
 * replaced or reordered, so an index handed out by {@link #add(Object)} stays valid
 * for the lifetime of the list.
 *
 * @param <E> The element type.
 */
public final class AppendOnlyList<E> implements Iterable<E> {

    private final ArrayList<E> elements;

    /**
     * Creates an empty list.
     *
     * @param capacityHint The number of elements to reserve room for up front. Not a limit.
     */
    public AppendOnlyList(int capacityHint) {
        if (capacityHint < 0) {
            throw new IllegalArgumentException("Capacity hint must not be negative: " + capacityHint);
        }
        this.elements = new ArrayList<>(capacityHint);
    }

    /**
     * Appends an element.
     *
     * @param element The element to append; may not be {@code null}.
     * @return The index of the appended element.
     */
    public int add(E element) {
        if (element == null) {
            throw new NullPointerException("AppendOnlyList does not accept null elements");
        }
        elements.add(element);
        return elements.size() - 1;
    }

    public E get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns a read-only view in insertion order. The view reflects later appends.
     *
     * @return An unmodifiable list view.
     */
    public List<E> asList() {
        return Collections.unmodifiableList(elements);
    }

    public Stream<E> stream() {
        return elements.stream();
    }

    @Override
    public Iterator<E> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
