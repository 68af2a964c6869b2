package io.indexkit.collections.bplustree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

// A node is either a leaf (keys, values, next-leaf handle) or an internal node (keys, child handles).
// Links to other nodes are NodePool handles, never object references.
final class Node<K, V> {
    static final int NO_NODE = -1;

    final int id;
    private final boolean leaf;
    private final ArrayList<K> keys = new ArrayList<>();
    private final ArrayList<V> values;
    private final ArrayList<Integer> children;
    int parent = NO_NODE;
    int next = NO_NODE;

    private Node(int id, boolean leaf) {
        this.id = id;
        this.leaf = leaf;
        this.values = leaf ? new ArrayList<>() : null;
        this.children = leaf ? null : new ArrayList<>();
    }

    static <K, V> Node<K, V> leaf(int id) {
        return new Node<>(id, true);
    }

    static <K, V> Node<K, V> internal(int id) {
        return new Node<>(id, false);
    }

    boolean isLeaf() {
        return leaf;
    }

    List<K> getKeys() {
        return keys;
    }

    List<V> getValues() {
        if (!leaf) {
            throw new IllegalStateException("internal node " + id + " has no values");
        }
        return values;
    }

    List<Integer> getChildren() {
        if (leaf) {
            throw new IllegalStateException("leaf " + id + " has no children");
        }
        return children;
    }

    List<Integer> getChildrenOrEmpty() {
        return leaf ? Collections.emptyList() : children;
    }

    int keyCount() {
        return keys.size();
    }

    // index of the child to descend into: skips every separator <= key
    int route(K key, Comparator<? super K> comparator) {
        final int n = keys.size();
        int i = 0;
        while (i < n && comparator.compare(key, keys.get(i)) >= 0) {
            i++;
        }
        return i;
    }

    int indexOf(K key, Comparator<? super K> comparator) {
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            if (comparator.compare(key, keys.get(i)) == 0) {
                return i;
            }
        }
        return -1;
    }

    // ordered insert into a leaf; false, with nothing changed, if the key is already present
    boolean insertIntoLeaf(K key, V value, Comparator<? super K> comparator) {
        final int n = keys.size();
        int position = 0;
        while (position < n && comparator.compare(key, keys.get(position)) > 0) {
            position++;
        }
        if (position < n && comparator.compare(key, keys.get(position)) == 0) {
            return false;
        }
        keys.add(position, key);
        getValues().add(position, value);
        return true;
    }

    // moves [from, end) of src onto the end of dst
    static <T> void moveTail(List<T> src, int from, List<T> dst) {
        final List<T> tail = src.subList(from, src.size());
        dst.addAll(tail);
        tail.clear();
    }

    @Override
    public String toString() {
        return (leaf ? "L" : "I") + keys;
    }
}
