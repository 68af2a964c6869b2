package io.indexkit.collections.bplustree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.indexkit.collections.bplustree.Node.NO_NODE;
import static io.indexkit.collections.bplustree.Node.moveTail;

/**
 * An in-memory B+ tree mapping unique keys to values. Values live only in the leaves, which are chained left to right in
 * key order. Internal nodes hold separator keys; a key equal to a separator belongs to the subtree on its right.
 *
 * <p>A node splits as soon as its key count reaches the order, so at rest every node holds at most {@code order - 1}
 * keys. Not thread-safe.
 */
public class BPlusTree<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(BPlusTree.class);

    public static final int DEFAULT_ORDER = 4;

    private final int order;
    private final Comparator<? super K> comparator;
    private final NodePool<K, V> pool = new NodePool<>();
    private int root;

    public BPlusTree(Comparator<? super K> comparator) {
        this(DEFAULT_ORDER, comparator);
    }

    public BPlusTree(int order, Comparator<? super K> comparator) {
        if (order < 3) {
            throw new IllegalArgumentException("the minimum sensible order is 3");
        }
        this.order = order;
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.root = pool.newLeaf().id;
    }

    public int getOrder() {
        return order;
    }

    /**
     * Looks up the value stored under {@code key}.
     *
     * @return the value, or null if the key was never inserted
     */
    public V search(K key) {
        Objects.requireNonNull(key, "key");
        final Node<K, V> leaf = findLeaf(key);
        final int i = leaf.indexOf(key, comparator);
        return i < 0 ? null : leaf.getValues().get(i);
    }

    /**
     * Inserts a new pair, splitting nodes bottom-up as needed.
     *
     * @return false, leaving the tree untouched, if the key is already present
     */
    public boolean insert(K key, V value) {
        Objects.requireNonNull(key, "key");
        final Node<K, V> rootNode = pool.get(root);
        if (rootNode.isLeaf() && rootNode.keyCount() == 0) {
            rootNode.getKeys().add(key);
            rootNode.getValues().add(value);
            return true;
        }
        final Node<K, V> leaf = findLeaf(key);
        if (!leaf.insertIntoLeaf(key, value, comparator)) {
            return false;
        }
        if (isOverfull(leaf)) {
            split(leaf);
        }
        return true;
    }

    private Node<K, V> findLeaf(K key) {
        Node<K, V> node = pool.get(root);
        while (!node.isLeaf()) {
            node = pool.get(node.getChildren().get(node.route(key, comparator)));
        }
        return node;
    }

    private boolean isOverfull(Node<K, V> node) {
        return node.keyCount() >= order;
    }

    // walks up the parent chain for as long as the node that just absorbed a separator is itself overfull
    private void split(Node<K, V> node) {
        Node<K, V> current = node;
        while (current != null) {
            final Split split = current.isLeaf() ? splitLeaf(current) : splitInternal(current);
            current = promote(current, split);
        }
    }

    private Split splitLeaf(Node<K, V> node) {
        final int mid = node.keyCount() / 2;
        final Node<K, V> sibling = pool.newLeaf();
        moveTail(node.getKeys(), mid, sibling.getKeys());
        moveTail(node.getValues(), mid, sibling.getValues());
        sibling.next = node.next;
        node.next = sibling.id;
        return new Split(sibling, sibling.getKeys().get(0));
    }

    private Split splitInternal(Node<K, V> node) {
        final int mid = node.keyCount() / 2;
        final K separator = node.getKeys().get(mid);
        final Node<K, V> sibling = pool.newInternal();
        moveTail(node.getKeys(), mid + 1, sibling.getKeys());
        node.getKeys().remove(mid);
        moveTail(node.getChildren(), mid + 1, sibling.getChildren());
        for (int child : sibling.getChildren()) {
            pool.get(child).parent = sibling.id;
        }
        return new Split(sibling, separator);
    }

    // returns the parent if it now needs splitting itself
    private Node<K, V> promote(Node<K, V> node, Split split) {
        if (node.parent == NO_NODE) {
            final Node<K, V> newRoot = pool.newInternal();
            newRoot.getKeys().add(split.key);
            newRoot.getChildren().add(node.id);
            newRoot.getChildren().add(split.sibling.id);
            node.parent = newRoot.id;
            split.sibling.parent = newRoot.id;
            root = newRoot.id;
            logger.debug("new root {} installed, height is now {}", newRoot.id, height());
            return null;
        }
        final Node<K, V> parent = pool.get(node.parent);
        final int position = parent.getChildren().indexOf(node.id);
        if (position < 0) {
            throw new IllegalStateException("node " + node.id + " is not a child of its parent " + parent.id);
        }
        parent.getKeys().add(position, split.key);
        parent.getChildren().add(position + 1, split.sibling.id);
        split.sibling.parent = parent.id;
        return isOverfull(parent) ? parent : null;
    }

    /** Number of pairs in the tree, counted along the leaf chain. */
    public int size() {
        int n = 0;
        for (Node<K, V> leaf = leftmostLeaf(); leaf != null; leaf = nextLeaf(leaf)) {
            n += leaf.keyCount();
        }
        return n;
    }

    public int leafCount() {
        int n = 0;
        for (Node<K, V> leaf = leftmostLeaf(); leaf != null; leaf = nextLeaf(leaf)) {
            n++;
        }
        return n;
    }

    public int height() {
        int h = 1;
        for (Node<K, V> node = pool.get(root); !node.isLeaf(); node = pool.get(node.getChildren().get(0))) {
            h++;
        }
        return h;
    }

    /** Visits every pair in ascending key order by following the leaf chain. */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Node<K, V> leaf = leftmostLeaf(); leaf != null; leaf = nextLeaf(leaf)) {
            final int n = leaf.keyCount();
            for (int i = 0; i < n; i++) {
                action.accept(leaf.getKeys().get(i), leaf.getValues().get(i));
            }
        }
    }

    Node<K, V> getRoot() {
        return pool.get(root);
    }

    Node<K, V> node(int handle) {
        return pool.get(handle);
    }

    Node<K, V> leftmostLeaf() {
        Node<K, V> node = pool.get(root);
        while (!node.isLeaf()) {
            node = pool.get(node.getChildren().get(0));
        }
        return node;
    }

    Node<K, V> nextLeaf(Node<K, V> leaf) {
        return leaf.next == NO_NODE ? null : pool.get(leaf.next);
    }

    public String sketch() {
        final StringBuilder b = new StringBuilder();
        sketch(pool.get(root), b);
        return b.toString();
    }

    private void sketch(Node<K, V> node, StringBuilder b) {
        b.append('(');
        final int n = node.keyCount();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                b.append(' ');
            }
            if (!node.isLeaf()) {
                sketch(pool.get(node.getChildren().get(i)), b);
                b.append(' ');
            }
            b.append(node.getKeys().get(i));
        }
        if (!node.isLeaf()) {
            b.append(' ');
            sketch(pool.get(node.getChildren().get(n)), b);
        }
        b.append(')');
    }

    /**
     * Renders the tree level by level. Each internal node is followed by a {@code Child-i:} line per child.
     * Meant for people, not parsers.
     */
    public String visualize() {
        final List<List<String>> levels = new ArrayList<>();
        visualize(pool.get(root), 0, levels);
        final StringBuilder b = new StringBuilder();
        for (List<String> level : levels) {
            b.append(String.join("\n ", level)).append('\n');
        }
        return b.toString();
    }

    private void visualize(Node<K, V> node, int level, List<List<String>> levels) {
        if (levels.size() <= level) {
            levels.add(new ArrayList<>());
        }
        levels.get(level).add(node.toString());
        final List<Integer> children = node.getChildrenOrEmpty();
        for (int i = 0; i < children.size(); i++) {
            final Node<K, V> child = pool.get(children.get(i));
            levels.get(level).add("Child-" + i + ": " + child);
            visualize(child, level + 1, levels);
        }
    }

    public void checkInvariants() {
        final Node<K, V> rootNode = pool.get(root);
        if (rootNode.parent != NO_NODE) {
            throw new IllegalStateException("root " + root + " has a parent");
        }
        final List<Node<K, V>> leaves = new ArrayList<>();
        checkNode(rootNode, null, null, leaves);
        checkLeafDepth(rootNode);
        checkLeafChain(leaves);
    }

    // collects the leaves in left-to-right tree order
    private void checkNode(Node<K, V> node, K lb, K ub, List<Node<K, V>> leaves) {
        final int n = node.keyCount();
        if (n >= order) {
            throw new IllegalStateException(String.format("node %d holds %d keys, order is %d", node.id, n, order));
        }
        for (int i = 0; i < n; i++) {
            final K key = node.getKeys().get(i);
            if (i > 0 && comparator.compare(node.getKeys().get(i - 1), key) >= 0) {
                throw new IllegalStateException("keys of node " + node.id + " are not strictly ascending");
            }
            if ((lb != null && comparator.compare(key, lb) < 0) || (ub != null && comparator.compare(key, ub) >= 0)) {
                throw new IllegalStateException("key " + key + " of node " + node.id + " is outside its separators");
            }
        }
        if (node.isLeaf()) {
            if (node.getValues().size() != n) {
                throw new IllegalStateException("wrong number of values in leaf " + node.id);
            }
            leaves.add(node);
            return;
        }
        final List<Integer> children = node.getChildren();
        if (children.size() != n + 1) {
            throw new IllegalStateException("wrong number of children in node " + node.id);
        }
        for (int i = 0; i <= n; i++) {
            final Node<K, V> child = pool.get(children.get(i));
            if (child.parent != node.id) {
                throw new IllegalStateException("child " + child.id + " does not point back at parent " + node.id);
            }
            checkNode(child, i > 0 ? node.getKeys().get(i - 1) : lb, i < n ? node.getKeys().get(i) : ub, leaves);
        }
    }

    private int checkLeafDepth(Node<K, V> node) {
        if (node.isLeaf()) {
            return 0;
        }
        final List<Integer> children = node.getChildren();
        final int depth = checkLeafDepth(pool.get(children.get(0)));
        for (int i = 1; i < children.size(); i++) {
            if (checkLeafDepth(pool.get(children.get(i))) != depth) {
                throw new IllegalStateException("not all leaves are at the same depth");
            }
        }
        return depth + 1;
    }

    private void checkLeafChain(List<Node<K, V>> leaves) {
        Node<K, V> leaf = leftmostLeaf();
        K previous = null;
        for (Node<K, V> expected : leaves) {
            if (leaf != expected) {
                throw new IllegalStateException("leaf chain skips leaf " + expected.id);
            }
            for (K key : leaf.getKeys()) {
                if (previous != null && comparator.compare(previous, key) >= 0) {
                    throw new IllegalStateException("leaf chain is not strictly ascending at " + key);
                }
                previous = key;
            }
            leaf = nextLeaf(leaf);
        }
        if (leaf != null) {
            throw new IllegalStateException("leaf chain continues past the rightmost leaf");
        }
    }

    private class Split {
        final Node<K, V> sibling;
        final K key;

        private Split(Node<K, V> sibling, K key) {
            this.sibling = sibling;
            this.key = key;
        }
    }
}
