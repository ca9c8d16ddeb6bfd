package wikigate.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular buffer that silently drops the oldest element when full.
 *
 * <p>Appends never block and run in O(1). Reads return snapshots in insertion
 * order (oldest first), so callers can filter and aggregate without holding
 * the buffer's lock.
 *
 * @param <T> the element type
 */
public final class RingBuffer<T> {

    private final Object[] elements;
    private int head;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be at least 1, got: " + capacity);
        }
        this.elements = new Object[capacity];
    }

    /**
     * Appends an element, overwriting the oldest one if the buffer is full.
     */
    public synchronized void add(T element) {
        final var tail = (head + size) % elements.length;
        elements[tail] = element;
        if (size < elements.length) {
            size++;
        } else {
            head = (head + 1) % elements.length;
        }
    }

    /**
     * Returns all elements, oldest first.
     */
    public List<T> snapshot() {
        return snapshot(element -> true);
    }

    /**
     * Returns the elements matching {@code filter}, oldest first.
     */
    @SuppressWarnings("unchecked")
    public synchronized List<T> snapshot(Predicate<? super T> filter) {
        final var result = new ArrayList<T>(size);
        for (int i = 0; i < size; i++) {
            final var element = (T) elements[(head + i) % elements.length];
            if (filter.test(element)) {
                result.add(element);
            }
        }
        return result;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public synchronized void clear() {
        Arrays.fill(elements, null);
        head = 0;
        size = 0;
    }
}
