package io.avery.rangetree;

/**
 * Receives the edits applied to a document, so that positions recorded against the document stay valid.
 *
 * <p>All three arguments use the same unit as the positions the listener was populated with.
 */
public interface ModificationListener {
    /**
     * Called after {@code erasedLength} units starting at {@code position} have been replaced by
     * {@code insertedLength} new units.
     *
     * @param position the position of the edit
     * @param erasedLength the number of units removed at {@code position}
     * @param insertedLength the number of units inserted at {@code position}
     * @throws IndexOutOfBoundsException if any argument is negative
     */
    void onModification(int position, int erasedLength, int insertedLength);
    
    static void checkModification(int position, int erasedLength, int insertedLength) {
        if (position < 0)
            throw new IndexOutOfBoundsException("position = " + position);
        if (erasedLength < 0)
            throw new IndexOutOfBoundsException("erasedLength = " + erasedLength);
        if (insertedLength < 0)
            throw new IndexOutOfBoundsException("insertedLength = " + insertedLength);
    }
}
