package io.modelcache.cache;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LruIndexTest {

    @Test
    void insertion_order_is_recency_order() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);
        lru.putMostRecent("c", 3);

        assertEquals(3, lru.size());
        assertEquals("a", lru.eldestKey());
        assertEquals(List.of(1, 2, 3), lru.valuesLruFirst());
    }

    @Test
    void touch_moves_entry_to_most_recent() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);
        lru.putMostRecent("c", 3);

        assertEquals(1, lru.touch("a"));
        assertEquals(List.of(2, 3, 1), lru.valuesLruFirst());
        assertNull(lru.touch("missing"));
        assertEquals(3, lru.touch("c"));
        assertEquals(List.of(2, 1, 3), lru.valuesLruFirst());
    }

    @Test
    void peek_does_not_change_order() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);

        assertEquals(1, lru.peek("a"));
        assertEquals("a", lru.eldestKey());
    }

    @Test
    void put_existing_replaces_and_touches() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);

        assertEquals(1, lru.putMostRecent("a", 10));
        assertEquals(2, lru.size());
        assertEquals(List.of(2, 10), lru.valuesLruFirst());
    }

    @Test
    void remove_eldest_and_arbitrary_keys() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);
        lru.putMostRecent("c", 3);

        assertEquals(2, lru.remove("b"));
        assertNull(lru.remove("b"));
        assertEquals(1, lru.removeEldest());
        assertEquals("c", lru.eldestKey());
        assertEquals(3, lru.removeEldest());
        assertTrue(lru.isEmpty());
        assertNull(lru.removeEldest());
        assertNull(lru.eldestKey());
        assertNull(lru.eldestValue());
    }

    @Test
    void drain_empties_in_lru_order() {
        LruIndex<String, Integer> lru = new LruIndex<>();
        lru.putMostRecent("a", 1);
        lru.putMostRecent("b", 2);
        lru.touch("a");

        assertEquals(List.of(2, 1), lru.drain());
        assertTrue(lru.isEmpty());
        assertFalse(lru.containsKey("a"));
        lru.putMostRecent("c", 3);
        assertEquals(List.of(3), lru.valuesLruFirst());
    }
}
