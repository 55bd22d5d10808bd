package io.avery.rangetree;

/**
 * Drives a root-to-leaf descent in {@link AugmentedTree#find(Selector)}. Implementations are usually stateful,
 * accumulating whatever the descent skips over (a count, an offset sum) so that the caller can reconstruct the
 * position of the result afterward.
 *
 * @param <E> the type of values held by the tree
 * @param <S> the type of the synthesized aggregate
 */
@FunctionalInterface
public interface Selector<E, S> {
    /**
     * Chooses where to continue the search.
     *
     * @param value the value of the current node
     * @param left the aggregate of the left subtree, or {@code null} if there is no left child
     * @param right the aggregate of the right subtree, or {@code null} if there is no right child
     * @return a negative number to continue in the left subtree, zero to select the current node, or a positive
     * number to continue in the right subtree (descending into an absent child ends the search at the end cursor)
     */
    int select(E value, S left, S right);
}
