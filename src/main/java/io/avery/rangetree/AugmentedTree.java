package io.avery.rangetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A sequence of values stored in a red-black tree, where every node caches an aggregate of its subtree computed by
 * a {@link Synthesizer}. The aggregates allow {@link #find(Selector)} to answer cumulative queries (the k-th element,
 * the element covering a given offset, ...) in logarithmic time.
 *
 * <p>Unlike a sorted set, the tree imposes no ordering of its own: values are placed relative to a {@link Cursor},
 * and the in-order sequence is whatever the caller built. Besides single-element insertion and removal, the tree
 * supports polylogarithmic {@link #split(Cursor) split}, {@link #join(AugmentedTree, Object, AugmentedTree) join},
 * {@link #insertAll(AugmentedTree, Cursor) splicing} and {@link #splitRange(Cursor, Cursor) range detachment}.
 *
 * <p>Cursors are invalidated by structural modification of their tree (insertion, removal, split, join), after
 * which most cursor methods throw {@link ConcurrentModificationException}. Replacing a value through
 * {@link Cursor#set(Object)} is not a structural modification. Removal never relocates other elements, so a cursor
 * obtained after a removal keeps designating the same element as any cursor obtained before it.
 *
 * <p>This class is not thread-safe.
 *
 * @param <E> the type of values
 * @param <S> the type of the synthesized aggregate
 */
public class AugmentedTree<E, S> implements Iterable<E> {
    /* Notes on this variant:
     *  1. Rotations and fixups do not maintain the root field. Every public operation recomputes the root by climbing
     *     from a node it knows to be attached, which lets the same fixup code run on detached trees during join/split.
     *  2. Removing a node with two children swaps it with its successor (links and colors, not values), so that no
     *     surviving element changes node. Registries built on this rely on holding a cursor across removals.
     *  3. split() is the classic top-down-by-bottom-up scheme: walking from the split node to the root, every
     *     ancestor is joined with its far subtree onto the left or right result. Each join measures both black
     *     heights from scratch, so a split costs O(log^2 n).
     */

    private static final Logger logger = LoggerFactory.getLogger(AugmentedTree.class);

    static final boolean RED = false;
    static final boolean BLACK = true;

    private final Synthesizer<? super E, S> synthesizer;
    private Node<E, S> root;
    private int modCount;

    public AugmentedTree(Synthesizer<? super E, S> synthesizer) {
        this.synthesizer = Objects.requireNonNull(synthesizer);
    }

    /**
     * The result of {@link #split(Cursor)}.
     *
     * @param left all elements before the split position
     * @param middle the element at the split position, or {@code null} if the split position was the end
     * @param right all elements after the split position
     */
    public record Split<E, S>(AugmentedTree<E, S> left, E middle, AugmentedTree<E, S> right) {}

    /**
     * A position in an {@link AugmentedTree}: either an element, or the end position just past the last element.
     * Cursors are immutable; moving produces a new cursor.
     */
    public static final class Cursor<E, S> {
        final AugmentedTree<E, S> tree;
        final Node<E, S> node;
        final int expectedModCount;

        Cursor(AugmentedTree<E, S> tree, Node<E, S> node) {
            this.tree = tree;
            this.node = node;
            this.expectedModCount = tree.modCount;
        }

        public boolean isEnd() {
            checkForComodification();
            return node == null;
        }

        public E get() {
            checkForComodification();
            if (node == null) {
                throw new NoSuchElementException();
            }
            return node.value;
        }

        public Cursor<E, S> next() {
            checkForComodification();
            if (node == null) {
                throw new NoSuchElementException();
            }
            return new Cursor<>(tree, successorOf(node));
        }

        public Cursor<E, S> previous() {
            checkForComodification();
            Node<E, S> prev = node == null ? last(tree.root) : predecessorOf(node);
            if (prev == null) {
                throw new NoSuchElementException();
            }
            return new Cursor<>(tree, prev);
        }

        /**
         * Replaces the value at this position, and re-synthesizes the aggregates of all its ancestors.
         */
        public void set(E value) {
            checkForComodification();
            if (node == null) {
                throw new NoSuchElementException();
            }
            node.value = value;
            tree.refreshUpwards(node);
        }

        // Returns a cursor to the same element that is valid for the current state of the tree. The element must
        // still be in the tree; removals never relocate surviving elements, so this holds across erase/split/join.
        Cursor<E, S> refreshed() {
            return new Cursor<>(tree, node);
        }

        void checkForComodification() {
            if (tree.modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        // Equality only looks at the designated element, so that a stale cursor can still be compared against a
        // fresh one while walking past removals.
        @Override
        public boolean equals(Object o) {
            return o instanceof Cursor<?, ?> c && c.tree == tree && c.node == node;
        }

        @Override
        public int hashCode() {
            return 31*System.identityHashCode(tree) + System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return node == null ? "Cursor[end]" : "Cursor[" + node.value + "]";
        }
    }

    public Cursor<E, S> begin() {
        return new Cursor<>(this, first(root));
    }

    public Cursor<E, S> end() {
        return new Cursor<>(this, null);
    }

    /**
     * Returns a cursor to the last element, or the end cursor if this tree is empty.
     */
    public Cursor<E, S> last() {
        return new Cursor<>(this, last(root));
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Returns the aggregate of the whole tree, or {@code null} if the tree is empty.
     */
    public S aggregate() {
        return synthOf(root);
    }

    public void clear() {
        root = null;
        modCount++;
    }

    /**
     * Inserts a value immediately before the given position.
     *
     * @return a cursor to the inserted value
     */
    public Cursor<E, S> insertBefore(Cursor<E, S> pos, E value) {
        checkOwner(pos);
        Node<E, S> node = new Node<>(value);
        Node<E, S> at = pos.node;
        if (root == null) {
            synthesize(node);
            root = node;
        }
        else {
            if (at == null) {
                Node<E, S> parent = last(root);
                parent.right = node;
                node.parent = parent;
            }
            else if (at.left == null) {
                at.left = node;
                node.parent = at;
            }
            else {
                Node<E, S> parent = last(at.left);
                parent.right = node;
                node.parent = parent;
            }
            refreshUpwards(node);
            root = fixAfterInsertion(node);
        }
        modCount++;
        return new Cursor<>(this, node);
    }

    /**
     * Removes the element at the given position.
     *
     * @return a cursor to the element that followed the removed one
     */
    public Cursor<E, S> erase(Cursor<E, S> pos) {
        checkOwner(pos);
        if (pos.node == null) {
            throw new NoSuchElementException();
        }
        Node<E, S> next = detach(pos.node);
        modCount++;
        return new Cursor<>(this, next);
    }

    /**
     * Removes every element in {@code [from, to)}.
     */
    public void erase(Cursor<E, S> from, Cursor<E, S> to) {
        splitRange(from, to);
    }

    /**
     * Splits this tree at the given position. This tree is left empty.
     */
    public Split<E, S> split(Cursor<E, S> pos) {
        checkOwner(pos);
        AugmentedTree<E, S> left = new AugmentedTree<>(synthesizer);
        AugmentedTree<E, S> right = new AugmentedTree<>(synthesizer);
        E middle = null;
        Node<E, S> node = pos.node;
        if (node == null) {
            left.root = root;
        }
        else {
            Halves<E, S> halves = splitNodes(node);
            left.root = halves.left;
            right.root = halves.right;
            middle = node.value;
        }
        root = null;
        modCount++;
        return new Split<>(left, middle, right);
    }

    /**
     * Creates a tree holding every element of {@code left}, then {@code middle}, then every element of
     * {@code right}. Both argument trees are left empty.
     *
     * @throws IllegalArgumentException if the trees are the same, or use different synthesizers
     */
    public static <E, S> AugmentedTree<E, S> join(AugmentedTree<E, S> left, E middle, AugmentedTree<E, S> right) {
        if (left == right) {
            throw new IllegalArgumentException("Cannot join a tree with itself");
        }
        if (left.synthesizer != right.synthesizer) {
            throw new IllegalArgumentException("Trees use different synthesizers");
        }
        Node<E, S> leftRoot = left.root, rightRoot = right.root;
        left.root = right.root = null;
        left.modCount++;
        right.modCount++;
        AugmentedTree<E, S> result = new AugmentedTree<>(left.synthesizer);
        result.root = result.joinNodes(leftRoot, rightRoot, new Node<>(middle));
        return result;
    }

    /**
     * Moves every element of {@code other} into this tree, as a contiguous block immediately before the given
     * position. {@code other} is left empty.
     *
     * @throws IllegalArgumentException if {@code other} is this tree, or uses a different synthesizer
     */
    public void insertAll(AugmentedTree<E, S> other, Cursor<E, S> before) {
        checkOwner(before);
        if (other == this) {
            throw new IllegalArgumentException("Cannot insert a tree into itself");
        }
        if (other.synthesizer != synthesizer) {
            throw new IllegalArgumentException("Trees use different synthesizers");
        }
        if (other.root == null) {
            return;
        }
        // The first element of other becomes the pivot of the joins
        Node<E, S> pivot = first(other.root);
        other.detach(pivot);
        Node<E, S> block = other.root;
        other.root = null;
        other.modCount++;

        Node<E, S> at = before.node;
        if (at == null) {
            root = joinNodes(root, block, pivot);
        }
        else {
            Halves<E, S> halves = splitNodes(at);
            root = joinNodes(halves.left, joinNodes(block, halves.right, at), pivot);
        }
        modCount++;
    }

    /**
     * Detaches the elements in {@code [from, to)} into a new tree, which is returned.
     *
     * @throws IllegalArgumentException if {@code from} is the end position but {@code to} is not
     */
    public AugmentedTree<E, S> splitRange(Cursor<E, S> from, Cursor<E, S> to) {
        checkOwner(from);
        checkOwner(to);
        AugmentedTree<E, S> result = new AugmentedTree<>(synthesizer);
        Node<E, S> begin = from.node, end = to.node;
        if (begin == end) {
            return result;
        }
        if (begin == null) {
            throw new IllegalArgumentException("from is past to");
        }
        assert precedes(begin, end);

        Halves<E, S> head = splitNodes(begin);
        Node<E, S> rest = joinNodes(null, head.right, begin);
        if (end != null) {
            Halves<E, S> tail = splitNodes(end);
            root = joinNodes(head.left, tail.right, end);
            result.root = tail.left;
        }
        else {
            root = head.left;
            result.root = rest;
        }
        modCount++;
        return result;
    }

    /**
     * Descends from the root as directed by the selector.
     *
     * @return a cursor to the node where the selector returned zero, or the end cursor if the descent ran off the
     * tree
     */
    public Cursor<E, S> find(Selector<? super E, ? super S> selector) {
        Node<E, S> n = root;
        while (n != null) {
            int branch = selector.select(n.value, synthOf(n.left), synthOf(n.right));
            if (branch == 0) {
                break;
            }
            n = branch < 0 ? n.left : n.right;
        }
        return new Cursor<>(this, n);
    }

    /**
     * Verifies the red-black invariants, the parent links, and that every cached aggregate equals a fresh synthesis
     * of its subtree. Violations are logged.
     *
     * @return {@code true} if the tree is consistent
     */
    public boolean checkIntegrity() {
        if (root == null) {
            return true;
        }
        if (root.parent != null) {
            return fail("root has a parent", root);
        }
        if (root.color != BLACK) {
            return fail("root is red", root);
        }
        return checkSubtree(root) >= 0;
    }

    @Override
    public Iterator<E> iterator() {
        return new Itr();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (E e : this) {
            joiner.add(String.valueOf(e));
        }
        return joiner.toString();
    }

    private class Itr implements Iterator<E> {
        Node<E, S> next = first(root);
        Node<E, S> lastReturned;
        int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public E next() {
            checkForComodification();
            if (next == null) {
                throw new NoSuchElementException();
            }
            lastReturned = next;
            next = successorOf(next);
            return lastReturned.value;
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException();
            }
            checkForComodification();
            detach(lastReturned);
            lastReturned = null;
            expectedModCount = ++modCount;
        }

        void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }

    private void checkOwner(Cursor<E, S> cursor) {
        if (cursor.tree != this) {
            throw new IllegalArgumentException("Cursor belongs to another tree");
        }
        cursor.checkForComodification();
    }

    // ----- Nodes -----

    static final class Node<E, S> {
        E value;
        S synth;
        Node<E, S> left;
        Node<E, S> right;
        Node<E, S> parent;
        boolean color = BLACK;

        Node(E value) {
            this.value = value;
        }
    }

    private record Halves<E, S>(Node<E, S> left, Node<E, S> right) {}

    private static <S> S synthOf(Node<?, S> n) {
        return n == null ? null : n.synth;
    }

    private static boolean colorOf(Node<?, ?> n) {
        return n == null ? BLACK : n.color;
    }

    private static <E, S> Node<E, S> first(Node<E, S> n) {
        if (n != null) {
            while (n.left != null) {
                n = n.left;
            }
        }
        return n;
    }

    private static <E, S> Node<E, S> last(Node<E, S> n) {
        if (n != null) {
            while (n.right != null) {
                n = n.right;
            }
        }
        return n;
    }

    private static <E, S> Node<E, S> rootOf(Node<E, S> n) {
        while (n.parent != null) {
            n = n.parent;
        }
        return n;
    }

    static <E, S> Node<E, S> successorOf(Node<E, S> n) {
        if (n.right != null) {
            return first(n.right);
        }
        Node<E, S> child = n, p = n.parent;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    static <E, S> Node<E, S> predecessorOf(Node<E, S> n) {
        if (n.left != null) {
            return last(n.left);
        }
        Node<E, S> child = n, p = n.parent;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    // Used in assertions only - linear
    private static boolean precedes(Node<?, ?> a, Node<?, ?> b) {
        if (b == null) {
            return true;
        }
        for (Node<?, ?> n = a; n != null; n = successorOf(n)) {
            if (n == b) {
                return true;
            }
        }
        return false;
    }

    private static <E, S> void replaceChild(Node<E, S> parent, Node<E, S> oldChild, Node<E, S> newChild) {
        if (parent == null) {
            return;
        }
        if (parent.left == oldChild) {
            parent.left = newChild;
        }
        else {
            parent.right = newChild;
        }
    }

    private static int blackHeight(Node<?, ?> n) {
        int height = 0;
        for (; n != null; n = n.left) {
            if (n.color == BLACK) {
                height++;
            }
        }
        return height;
    }

    // ----- Aggregates -----

    private void synthesize(Node<E, S> n) {
        n.synth = synthesizer.synthesize(n.value, synthOf(n.left), synthOf(n.right));
    }

    private void refreshUpwards(Node<E, S> n) {
        for (; n != null; n = n.parent) {
            synthesize(n);
        }
    }

    // ----- Rebalancing -----

    private void rotateLeft(Node<E, S> p) {
        Node<E, S> r = p.right;
        p.right = r.left;
        if (r.left != null) {
            r.left.parent = p;
        }
        r.parent = p.parent;
        replaceChild(p.parent, p, r);
        r.left = p;
        p.parent = r;
        synthesize(p);
        synthesize(r);
    }

    private void rotateRight(Node<E, S> p) {
        Node<E, S> l = p.left;
        p.left = l.right;
        if (l.right != null) {
            l.right.parent = p;
        }
        l.parent = p.parent;
        replaceChild(p.parent, p, l);
        l.right = p;
        p.parent = l;
        synthesize(p);
        synthesize(l);
    }

    // Rebalances after x was linked in as a leaf (or as the root of a joined pair), and returns the new root.
    // Aggregates on the path from x to the root must already be up to date.
    private Node<E, S> fixAfterInsertion(Node<E, S> x) {
        x.color = RED;
        while (x.parent != null && x.parent.color == RED) {
            Node<E, S> parent = x.parent;
            Node<E, S> grandparent = parent.parent; // a red node is never the root
            assert grandparent != null;
            if (parent == grandparent.left) {
                Node<E, S> uncle = grandparent.right;
                if (colorOf(uncle) == RED) {
                    parent.color = BLACK;
                    uncle.color = BLACK;
                    grandparent.color = RED;
                    x = grandparent;
                }
                else {
                    if (x == parent.right) {
                        x = parent;
                        rotateLeft(x);
                        parent = x.parent;
                    }
                    parent.color = BLACK;
                    grandparent.color = RED;
                    rotateRight(grandparent);
                }
            }
            else {
                Node<E, S> uncle = grandparent.left;
                if (colorOf(uncle) == RED) {
                    parent.color = BLACK;
                    uncle.color = BLACK;
                    grandparent.color = RED;
                    x = grandparent;
                }
                else {
                    if (x == parent.left) {
                        x = parent;
                        rotateRight(x);
                        parent = x.parent;
                    }
                    parent.color = BLACK;
                    grandparent.color = RED;
                    rotateLeft(grandparent);
                }
            }
        }
        Node<E, S> top = rootOf(x);
        top.color = BLACK;
        return top;
    }

    // Rebalances before the black leaf x is unlinked. x stays attached (as a phantom) during the fixup.
    private void fixAfterDeletion(Node<E, S> x) {
        while (x.parent != null && x.color == BLACK) {
            Node<E, S> parent = x.parent;
            if (x == parent.left) {
                Node<E, S> sib = parent.right;
                if (colorOf(sib) == RED) {
                    sib.color = BLACK;
                    parent.color = RED;
                    rotateLeft(parent);
                    sib = parent.right;
                }
                if (colorOf(sib.left) == BLACK && colorOf(sib.right) == BLACK) {
                    sib.color = RED;
                    x = parent;
                }
                else {
                    if (colorOf(sib.right) == BLACK) {
                        sib.left.color = BLACK;
                        sib.color = RED;
                        rotateRight(sib);
                        sib = parent.right;
                    }
                    sib.color = parent.color;
                    parent.color = BLACK;
                    sib.right.color = BLACK;
                    rotateLeft(parent);
                    break;
                }
            }
            else {
                Node<E, S> sib = parent.left;
                if (colorOf(sib) == RED) {
                    sib.color = BLACK;
                    parent.color = RED;
                    rotateRight(parent);
                    sib = parent.left;
                }
                if (colorOf(sib.left) == BLACK && colorOf(sib.right) == BLACK) {
                    sib.color = RED;
                    x = parent;
                }
                else {
                    if (colorOf(sib.left) == BLACK) {
                        sib.right.color = BLACK;
                        sib.color = RED;
                        rotateLeft(sib);
                        sib = parent.left;
                    }
                    sib.color = parent.color;
                    parent.color = BLACK;
                    sib.left.color = BLACK;
                    rotateRight(parent);
                    break;
                }
            }
        }
        x.color = BLACK;
    }

    // Unlinks node from this tree, keeping every other element in its own node. Returns the successor of node.
    private Node<E, S> detach(Node<E, S> node) {
        Node<E, S> successor = successorOf(node);
        if (node.left != null && node.right != null) {
            swapWithSuccessor(node, successor);
            refreshUpwards(node);
        }
        Node<E, S> parent = node.parent;
        Node<E, S> child = node.left != null ? node.left : node.right;
        if (child != null) {
            // A node with a single child must be black, with a red leaf child
            assert node.color == BLACK && child.color == RED;
            child.color = BLACK;
            child.parent = parent;
            if (parent == null) {
                root = child;
            }
            else {
                replaceChild(parent, node, child);
                refreshUpwards(parent);
            }
        }
        else if (parent == null) {
            root = null;
        }
        else {
            if (node.color == BLACK) {
                fixAfterDeletion(node);
                parent = node.parent;
            }
            replaceChild(parent, node, null);
            refreshUpwards(parent);
            root = rootOf(parent);
        }
        node.left = node.right = node.parent = null;
        return successor;
    }

    // Exchanges the tree positions (and colors) of node and its successor next, the leftmost node of node's right
    // subtree. Values stay in their nodes.
    private void swapWithSuccessor(Node<E, S> node, Node<E, S> next) {
        next.left = node.left;
        node.left = null;
        if (next.parent == node) {
            node.right = next.right;
            next.parent = node.parent;
            node.parent = next;
            next.right = node;
        }
        else {
            Node<E, S> tmp = next.right;
            next.right = node.right;
            node.right = tmp;
            tmp = next.parent;
            next.parent = node.parent;
            node.parent = tmp;
            next.right.parent = next;
            node.parent.left = node;
        }
        next.left.parent = next;
        if (node.right != null) {
            node.right.parent = node;
        }
        if (next.parent == null) {
            root = next;
        }
        else {
            replaceChild(next.parent, node, next);
        }
        boolean color = node.color;
        node.color = next.color;
        next.color = color;
    }

    // ----- Split & join on detached subtrees -----

    // Joins two detached trees with black roots (either may be null) around the isolated node mid. Returns the root.
    private Node<E, S> joinNodes(Node<E, S> left, Node<E, S> right, Node<E, S> mid) {
        assert mid.parent == null && mid.left == null && mid.right == null;
        if (left == null && right == null) {
            mid.color = BLACK;
            synthesize(mid);
            return mid;
        }
        if (left == null) {
            Node<E, S> at = first(right);
            at.left = mid;
            mid.parent = at;
        }
        else if (right == null) {
            Node<E, S> at = last(left);
            at.right = mid;
            mid.parent = at;
        }
        else {
            int leftHeight = blackHeight(left);
            int rightHeight = blackHeight(right);
            if (leftHeight == rightHeight) {
                mid.color = BLACK;
                mid.left = left;
                mid.right = right;
                left.parent = right.parent = mid;
                synthesize(mid);
                return mid;
            }
            if (leftHeight < rightHeight) {
                // Attach the left tree along the left spine of the right tree, at a black node of equal height
                Node<E, S> pivot = descendSpine(right, rightHeight - leftHeight, true);
                Node<E, S> parent = pivot.parent;
                mid.left = left;
                mid.right = pivot;
                mid.parent = parent;
                parent.left = mid;
                left.parent = pivot.parent = mid;
            }
            else {
                Node<E, S> pivot = descendSpine(left, leftHeight - rightHeight, false);
                Node<E, S> parent = pivot.parent;
                mid.left = pivot;
                mid.right = right;
                mid.parent = parent;
                parent.right = mid;
                right.parent = pivot.parent = mid;
            }
        }
        refreshUpwards(mid);
        return fixAfterInsertion(mid);
    }

    // Walks down a spine from a black node, passing the given number of black levels and skipping red nodes
    private static <E, S> Node<E, S> descendSpine(Node<E, S> n, int levels, boolean leftSpine) {
        for (int i = 0; i < levels; i++) {
            n = leftSpine ? n.left : n.right;
            while (n.color == RED) {
                n = leftSpine ? n.left : n.right;
            }
        }
        return n;
    }

    // Splits the tree containing n into the detached trees before and after n. n is left isolated.
    private Halves<E, S> splitNodes(Node<E, S> n) {
        Node<E, S> left = n.left, right = n.right;
        if (left != null) {
            n.left = null;
            left.parent = null;
            left.color = BLACK;
        }
        if (right != null) {
            n.right = null;
            right.parent = null;
            right.color = BLACK;
        }
        Node<E, S> pivot = n.parent;
        if (pivot == null) {
            return new Halves<>(left, right);
        }
        n.parent = null;
        boolean fromLeft = n == pivot.left;
        replaceChild(pivot, n, null);
        while (true) {
            // pivot is now isolated from the side we came from; detach its other subtree and join
            Node<E, S> joinLeft, joinRight;
            if (fromLeft) {
                joinLeft = right;
                joinRight = pivot.right;
                if (joinRight != null) {
                    pivot.right = null;
                    joinRight.parent = null;
                    joinRight.color = BLACK;
                }
            }
            else {
                joinLeft = pivot.left;
                joinRight = left;
                if (joinLeft != null) {
                    pivot.left = null;
                    joinLeft.parent = null;
                    joinLeft.color = BLACK;
                }
            }

            Node<E, S> nextPivot = pivot.parent;
            boolean nextFromLeft = false;
            if (nextPivot != null) {
                nextFromLeft = pivot == nextPivot.left;
                pivot.parent = null;
                replaceChild(nextPivot, pivot, null);
            }

            Node<E, S> joined = joinNodes(joinLeft, joinRight, pivot);
            if (fromLeft) {
                right = joined;
            }
            else {
                left = joined;
            }

            if (nextPivot == null) {
                return new Halves<>(left, right);
            }
            pivot = nextPivot;
            fromLeft = nextFromLeft;
        }
    }

    // ----- Integrity -----

    // Returns the black height of the subtree, or -1 if it is corrupt
    private int checkSubtree(Node<E, S> n) {
        if (n == null) {
            return 0;
        }
        if ((n.left != null && n.left.parent != n) || (n.right != null && n.right.parent != n)) {
            fail("broken parent link", n);
            return -1;
        }
        if (n.color == RED && (colorOf(n.left) == RED || colorOf(n.right) == RED)) {
            fail("red node has a red child", n);
            return -1;
        }
        int leftHeight = checkSubtree(n.left);
        if (leftHeight < 0) {
            return -1;
        }
        int rightHeight = checkSubtree(n.right);
        if (rightHeight < 0) {
            return -1;
        }
        if (leftHeight != rightHeight) {
            fail("inconsistent black height", n);
            return -1;
        }
        S expected = synthesizer.synthesize(n.value, synthOf(n.left), synthOf(n.right));
        if (!Objects.equals(expected, n.synth)) {
            fail("stale aggregate " + n.synth + ", expected " + expected, n);
            return -1;
        }
        return leftHeight + (n.color == BLACK ? 1 : 0);
    }

    private static boolean fail(String reason, Node<?, ?> at) {
        logger.warn("Tree integrity violated at {}: {}", at.value, reason);
        return false;
    }
}
