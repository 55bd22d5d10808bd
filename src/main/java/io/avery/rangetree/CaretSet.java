package io.avery.rangetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * A sorted set of carets, each with an optional selection and some associated data. Carets that overlap, or that
 * touch where at least one of them has no selection, are merged on insertion, so the set always holds a sorted
 * partition of disjoint carets.
 *
 * <p>Carets are stored relative to the end of the previous caret, so an edit only needs to re-encode the carets it
 * touches and the first caret after them.
 *
 * @param <D> the type of data associated with each caret
 */
public class CaretSet<D> implements ModificationListener, Iterable<CaretSet.Entry<D>> {
    private static final Logger logger = LoggerFactory.getLogger(CaretSet.class);

    /**
     * A caret with an optional selection, in absolute positions.
     *
     * @param selectionBegin the first position of the selection
     * @param selectionLength the length of the selection, or zero if there is no selection
     * @param caretOffset the position of the caret, relative to {@code selectionBegin}
     */
    public record Caret(int selectionBegin, int selectionLength, int caretOffset) {
        public Caret {
            if (selectionBegin < 0)
                throw new IndexOutOfBoundsException("selectionBegin = " + selectionBegin);
            if (selectionLength < 0)
                throw new IndexOutOfBoundsException("selectionLength = " + selectionLength);
            if (caretOffset < 0 || caretOffset > selectionLength)
                throw new IllegalArgumentException("caretOffset(" + caretOffset + ") outside of selection of length " + selectionLength);
        }

        /**
         * Creates a caret without a selection.
         */
        public static Caret at(int position) {
            return new Caret(position, 0, 0);
        }

        public int selectionEnd() {
            return selectionBegin + selectionLength;
        }

        public int caretPosition() {
            return selectionBegin + caretOffset;
        }

        public boolean hasSelection() {
            return selectionLength > 0;
        }
    }

    public record Entry<D>(Caret caret, D data) {}

    // offset is from the end of the previous caret (or from 0)
    private record Item<D>(int offset, int length, int caretOffset, D data) {
        Item<D> withOffset(int newOffset) {
            return new Item<>(newOffset, length, caretOffset, data);
        }
    }

    private record Summary(int count, int span) {}

    private static int countOf(Summary s) {
        return s == null ? 0 : s.count;
    }

    private static int spanOf(Summary s) {
        return s == null ? 0 : s.span;
    }

    private final AugmentedTree<Item<D>, Summary> carets = new AugmentedTree<>(
        (item, left, right) -> new Summary(
            countOf(left) + 1 + countOf(right),
            spanOf(left) + item.offset + item.length + spanOf(right)
        )
    );
    private final Supplier<? extends D> defaultData;

    /**
     * Creates an empty caret set whose {@link #reset()} caret carries {@code null} data.
     */
    public CaretSet() {
        this(() -> null);
    }

    /**
     * Creates an empty caret set.
     *
     * @param defaultData supplies the data of the caret created by {@link #reset()}
     */
    public CaretSet(Supplier<? extends D> defaultData) {
        this.defaultData = Objects.requireNonNull(defaultData);
    }

    /**
     * A caret in the set, together with the absolute position it is stored relative to. Positions become invalid
     * when the set is modified.
     */
    public static final class Position<D> {
        final AugmentedTree.Cursor<Item<D>, Summary> cursor;
        final int prevEnd;

        Position(AugmentedTree.Cursor<Item<D>, Summary> cursor, int prevEnd) {
            this.cursor = cursor;
            this.prevEnd = prevEnd;
        }

        public boolean isEnd() {
            return cursor.isEnd();
        }

        public int selectionBegin() {
            return prevEnd + cursor.get().offset;
        }

        public int selectionEnd() {
            Item<D> item = cursor.get();
            return prevEnd + item.offset + item.length;
        }

        public Caret caret() {
            Item<D> item = cursor.get();
            return new Caret(prevEnd + item.offset, item.length, item.caretOffset);
        }

        public D data() {
            return cursor.get().data;
        }

        public Position<D> next() {
            return new Position<>(cursor.next(), selectionEnd());
        }

        public Position<D> previous() {
            AugmentedTree.Cursor<Item<D>, Summary> prev = cursor.previous();
            Item<D> item = prev.get();
            return new Position<>(prev, prevEnd - item.length - item.offset);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Position<?> p && cursor.equals(p.cursor);
        }

        @Override
        public int hashCode() {
            return cursor.hashCode();
        }

        @Override
        public String toString() {
            return cursor.node == null ? "Position[end]" : "Position[" + caret() + "]";
        }
    }

    public Position<D> begin() {
        return new Position<>(carets.begin(), 0);
    }

    public Position<D> end() {
        Summary all = carets.aggregate();
        return new Position<>(carets.end(), spanOf(all));
    }

    public int size() {
        return countOf(carets.aggregate());
    }

    public boolean isEmpty() {
        return carets.isEmpty();
    }

    /**
     * Adds a caret, merging it with every caret it overlaps or touches. The merged caret keeps the data and the
     * absolute caret position of the added one.
     *
     * @return the position of the merged caret
     */
    public Position<D> add(Caret caret, D data) {
        int newBegin = caret.selectionBegin(), newEnd = caret.selectionEnd();
        boolean hasSelection = caret.hasSelection();

        Position<D> first = findFirstEndingAtOrAfter(newBegin);
        if (!first.isEnd() && first.selectionEnd() == newBegin && hasSelection && first.cursor.get().length > 0) {
            // Two selections sharing a boundary stay separate
            first = first.next();
        }
        int begin = newBegin, end = newEnd;
        Position<D> stop = first;
        for (; !stop.isEnd(); stop = stop.next()) {
            int entryBegin = stop.selectionBegin();
            if (entryBegin > newEnd || (entryBegin == newEnd && hasSelection && stop.cursor.get().length > 0)) {
                break;
            }
            begin = Math.min(begin, entryBegin);
            end = Math.max(end, stop.selectionEnd());
        }
        int stopBegin = stop.isEnd() ? 0 : stop.selectionBegin();

        carets.erase(first.cursor, stop.cursor);
        var before = stop.cursor.refreshed();
        var inserted = carets.insertBefore(
            before,
            new Item<>(begin - first.prevEnd, end - begin, caret.caretPosition() - begin, data)
        );
        before = before.refreshed();
        if (!before.isEnd()) {
            before.set(before.get().withOffset(stopBegin - end));
        }
        return new Position<>(inserted.refreshed(), first.prevEnd);
    }

    /**
     * Removes the caret at the given position.
     *
     * @return the position of the following caret
     */
    public Position<D> remove(Position<D> pos) {
        if (pos.isEnd()) {
            throw new NoSuchElementException();
        }
        Position<D> next = pos.next();
        int nextBegin = next.isEnd() ? 0 : next.selectionBegin();
        var after = carets.erase(pos.cursor);
        if (!after.isEnd()) {
            after.set(after.get().withOffset(nextBegin - pos.prevEnd));
        }
        return new Position<>(after, pos.prevEnd);
    }

    /**
     * Returns the first caret whose selection ends at or after the given position, or the end position if there is
     * none.
     */
    public Position<D> findFirstEndingAtOrAfter(int position) {
        if (position < 0) {
            throw new IndexOutOfBoundsException("position = " + position);
        }
        var finder = new EndFinder<D>(position);
        var cursor = carets.find(finder);
        return cursor.isEnd() ? end() : new Position<>(cursor, position - finder.remaining);
    }

    /**
     * Returns whether the given position lies inside a selection, boundaries included. Carets without a selection
     * are ignored.
     */
    public boolean isInSelection(int position) {
        Position<D> pos = findFirstEndingAtOrAfter(position);
        while (!pos.isEnd() && pos.cursor.get().length == 0 && pos.selectionBegin() <= position) {
            pos = pos.next();
        }
        return !pos.isEnd() && pos.selectionBegin() <= position;
    }

    /**
     * Replaces all carets with a single caret at position 0.
     */
    public void reset() {
        carets.clear();
        carets.insertBefore(carets.end(), new Item<>(0, 0, 0, defaultData.get()));
    }

    /**
     * Adjusts all carets for an edit. Carets strictly inside the erased text are removed, and selection boundaries
     * inside it are moved to the edit position. At a pure insertion point, a selection that starts there moves after
     * the inserted text, a selection that ends there does not grow, and a caret without a selection grows to cover
     * the inserted text. Carets without a selection that end up touching a neighbour are then dropped.
     */
    @Override
    public void onModification(int position, int erasedLength, int insertedLength) {
        ModificationListener.checkModification(position, erasedLength, insertedLength);
        if (erasedLength == 0 && insertedLength == 0) {
            return;
        }
        Position<D> start = findFirstEndingAtOrAfter(position);
        if (start.isEnd()) {
            return;
        }
        // Include the previous caret, which a shrunk caret may now touch
        Position<D> from = start.cursor.equals(carets.begin()) ? start : start.previous();
        int eraseEnd = position + erasedLength;
        int diff = insertedLength - erasedLength;

        List<Entry<D>> adjusted = new ArrayList<>();
        Position<D> stop = from;
        for (; !stop.isEnd(); stop = stop.next()) {
            Caret caret = stop.caret();
            if (!stop.equals(from) && caret.selectionBegin() > eraseEnd) {
                break;
            }
            Caret moved = adjust(caret, position, erasedLength, insertedLength);
            if (moved != null) {
                adjusted.add(new Entry<>(moved, stop.data()));
            }
        }
        int stopBegin = stop.isEnd() ? 0 : stop.selectionBegin();
        mergeTouching(adjusted);
        logger.trace("Edit ({}, {}, {}) rewrote {} carets", position, erasedLength, insertedLength, adjusted.size());

        carets.erase(from.cursor, stop.cursor);
        var before = stop.cursor.refreshed();
        int prevEnd = from.prevEnd;
        for (Entry<D> entry : adjusted) {
            Caret caret = entry.caret();
            carets.insertBefore(before, new Item<>(
                caret.selectionBegin() - prevEnd, caret.selectionLength(), caret.caretOffset(), entry.data()
            ));
            before = before.refreshed();
            prevEnd = caret.selectionEnd();
        }
        if (!before.isEnd()) {
            before.set(before.get().withOffset(stopBegin + diff - prevEnd));
        }
    }

    // Returns the caret after the edit, or null if it is removed
    private static Caret adjust(Caret caret, int position, int erasedLength, int insertedLength) {
        int eraseEnd = position + erasedLength;
        int diff = insertedLength - erasedLength;
        int begin = caret.selectionBegin(), end = caret.selectionEnd();
        if (begin > position && end < eraseEnd) {
            return null;
        }
        if (begin > position || (begin == position && erasedLength == 0 && caret.hasSelection())) {
            begin = Math.max(begin, eraseEnd) + diff;
        }
        if (end < eraseEnd || (end == position && erasedLength == 0 && caret.hasSelection())) {
            end = Math.min(end, position);
        }
        else {
            end += diff;
        }
        if (begin > end) {
            return null;
        }
        int caretPosition = caret.caretPosition();
        if (caretPosition > position) {
            caretPosition = caretPosition >= eraseEnd ? caretPosition + diff : position;
        }
        caretPosition = Math.max(begin, Math.min(caretPosition, end));
        return new Caret(begin, end - begin, caretPosition - begin);
    }

    private static <D> void mergeTouching(List<Entry<D>> entries) {
        int prev = 0;
        int cur = 1;
        while (cur < entries.size()) {
            Caret p = entries.get(prev).caret();
            Caret c = entries.get(cur).caret();
            if (!c.hasSelection() && c.selectionBegin() == p.selectionEnd()) {
                entries.remove(cur);
                continue;
            }
            if (!p.hasSelection() && p.selectionBegin() == c.selectionBegin()) {
                entries.remove(prev);
                cur = prev + 1;
                continue;
            }
            prev = cur;
            cur++;
        }
    }

    /**
     * Verifies the underlying tree, and that carets are sorted and only touch where both have a selection.
     * Violations are logged.
     */
    public boolean checkIntegrity() {
        if (!carets.checkIntegrity()) {
            return false;
        }
        int prevLength = -1;
        for (Item<D> item : carets) {
            if (item.offset < 0 || item.length < 0 || item.caretOffset < 0 || item.caretOffset > item.length) {
                logger.warn("Malformed caret {}", item);
                return false;
            }
            if (prevLength >= 0 && item.offset == 0 && (prevLength == 0 || item.length == 0)) {
                logger.warn("Caret {} touches its predecessor without both having a selection", item);
                return false;
            }
            prevLength = item.length;
        }
        return true;
    }

    @Override
    public Iterator<Entry<D>> iterator() {
        return new Iterator<>() {
            Position<D> next = begin();

            @Override
            public boolean hasNext() {
                return !next.isEnd();
            }

            @Override
            public Entry<D> next() {
                if (next.isEnd()) {
                    throw new NoSuchElementException();
                }
                Entry<D> entry = new Entry<>(next.caret(), next.data());
                next = next.next();
                return entry;
            }
        };
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Entry<D> entry : this) {
            Caret c = entry.caret();
            joiner.add("(" + c.selectionBegin() + "," + c.selectionLength() + "," + c.caretOffset() + ")");
        }
        return joiner.toString();
    }

    // Finds the first caret whose end is at or after the target. Leaves the unconsumed part of the target behind.
    private static final class EndFinder<D> implements Selector<Item<D>, Summary> {
        int remaining;

        EndFinder(int target) {
            this.remaining = target;
        }

        @Override
        public int select(Item<D> item, Summary left, Summary right) {
            int leftSpan = spanOf(left);
            if (left != null && remaining <= leftSpan) {
                return -1;
            }
            remaining -= leftSpan;
            int span = item.offset + item.length;
            if (remaining <= span) {
                return 0;
            }
            remaining -= span;
            return 1;
        }
    }
}
