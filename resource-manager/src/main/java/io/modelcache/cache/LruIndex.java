package io.modelcache.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recency-ordered map: a doubly linked list of nodes plus a hash index from key to node.
 * The head is the least recently used entry, the tail the most recent. All operations are O(1)
 * except {@link #valuesLruFirst()}. Not thread-safe; callers hold their own lock.
 */
public class LruIndex<K, V> {
    private final Map<K, Node<K, V>> index = new HashMap<>();
    private Node<K, V> head; // least recently used
    private Node<K, V> tail; // most recently used

    public int size() { return index.size(); }
    public boolean isEmpty() { return index.isEmpty(); }
    public boolean containsKey(K key) { return index.containsKey(key); }

    /** Returns the value without changing recency. */
    public V peek(K key) {
        Node<K, V> n = index.get(key);
        return n == null ? null : n.value;
    }

    /** Moves the entry to most-recently-used position and returns its value, or null if absent. */
    public V touch(K key) {
        Node<K, V> n = index.get(key);
        if (n == null) return null;
        if (n != tail) {
            unlink(n);
            linkLast(n);
        }
        return n.value;
    }

    /**
     * Inserts or replaces the entry as most recently used.
     *
     * @return the previous value, or null
     */
    public V putMostRecent(K key, V value) {
        Node<K, V> n = index.get(key);
        if (n != null) {
            V old = n.value;
            n.value = value;
            if (n != tail) {
                unlink(n);
                linkLast(n);
            }
            return old;
        }
        n = new Node<>(key, value);
        index.put(key, n);
        linkLast(n);
        return null;
    }

    public K eldestKey() { return head == null ? null : head.key; }

    public V eldestValue() { return head == null ? null : head.value; }

    /** Removes and returns the least recently used value, or null when empty. */
    public V removeEldest() {
        Node<K, V> n = head;
        if (n == null) return null;
        index.remove(n.key);
        unlink(n);
        return n.value;
    }

    public V remove(K key) {
        Node<K, V> n = index.remove(key);
        if (n == null) return null;
        unlink(n);
        return n.value;
    }

    /** Removes everything, returning the values from least to most recently used. */
    public List<V> drain() {
        List<V> out = valuesLruFirst();
        index.clear();
        head = null;
        tail = null;
        return out;
    }

    public List<V> valuesLruFirst() {
        List<V> out = new ArrayList<>(index.size());
        for (Node<K, V> n = head; n != null; n = n.next) out.add(n.value);
        return out;
    }

    private void linkLast(Node<K, V> n) {
        n.prev = tail;
        n.next = null;
        if (tail == null) head = n; else tail.next = n;
        tail = n;
    }

    private void unlink(Node<K, V> n) {
        if (n.prev == null) head = n.next; else n.prev.next = n.next;
        if (n.next == null) tail = n.prev; else n.next.prev = n.prev;
        n.prev = null;
        n.next = null;
    }

    private static final class Node<K, V> {
        final K key;
        V value;
        Node<K, V> prev;
        Node<K, V> next;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
