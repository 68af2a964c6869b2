package io.indexkit.collections.bplustree;

import java.util.ArrayList;

// Owns every node of one tree. A handle is the node's index in the pool; nodes are never freed.
final class NodePool<K, V> {
    private final ArrayList<Node<K, V>> nodes = new ArrayList<>();

    Node<K, V> newLeaf() {
        final Node<K, V> node = Node.leaf(nodes.size());
        nodes.add(node);
        return node;
    }

    Node<K, V> newInternal() {
        final Node<K, V> node = Node.internal(nodes.size());
        nodes.add(node);
        return node;
    }

    Node<K, V> get(int handle) {
        if (handle < 0 || handle >= nodes.size()) {
            throw new IllegalStateException("dangling node handle " + handle);
        }
        return nodes.get(handle);
    }

    int size() {
        return nodes.size();
    }
}
