package io.avery.rangetree;

/**
 * Computes the aggregate cached at each node of an {@link AugmentedTree}, from the node's own value and the
 * aggregates of its two subtrees.
 *
 * <p>The result must only depend on the in-order sequence of values in the subtree, not on its shape, since
 * rotations re-synthesize nodes without notifying anyone.
 *
 * @param <E> the type of values held by the tree
 * @param <S> the type of the synthesized aggregate
 */
@FunctionalInterface
public interface Synthesizer<E, S> {
    /**
     * Synthesizes the aggregate of a subtree.
     *
     * @param value the value of the subtree's root
     * @param left the aggregate of the left subtree, or {@code null} if there is no left child
     * @param right the aggregate of the right subtree, or {@code null} if there is no right child
     * @return the aggregate of the whole subtree
     */
    S synthesize(E value, S left, S right);
}
