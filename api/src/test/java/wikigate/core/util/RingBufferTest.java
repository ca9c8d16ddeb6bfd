package wikigate.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RingBuffer")
class RingBufferTest {

    @Test
    @DisplayName("should return elements oldest first")
    void shouldReturnElementsInInsertionOrder() {
        var buffer = new RingBuffer<Integer>(3);
        buffer.add(1);
        buffer.add(2);

        assertEquals(List.of(1, 2), buffer.snapshot());
    }

    @Test
    @DisplayName("should drop the oldest element when full")
    void shouldDropOldestWhenFull() {
        var buffer = new RingBuffer<Integer>(3);
        for (int i = 1; i <= 5; i++) {
            buffer.add(i);
        }

        assertEquals(List.of(3, 4, 5), buffer.snapshot());
        assertEquals(3, buffer.size());
    }

    @Test
    @DisplayName("should filter snapshot")
    void shouldFilterSnapshot() {
        var buffer = new RingBuffer<Integer>(10);
        for (int i = 1; i <= 6; i++) {
            buffer.add(i);
        }

        assertEquals(List.of(2, 4, 6), buffer.snapshot(i -> i % 2 == 0));
    }

    @Test
    @DisplayName("should clear all elements")
    void shouldClear() {
        var buffer = new RingBuffer<String>(2);
        buffer.add("a");

        buffer.clear();

        assertTrue(buffer.snapshot().isEmpty());
        assertEquals(2, buffer.capacity());
    }

    @Test
    @DisplayName("should reject zero capacity")
    void shouldRejectZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RingBuffer<String>(0));
    }
}
