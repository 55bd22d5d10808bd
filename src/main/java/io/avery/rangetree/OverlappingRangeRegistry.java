package io.avery.rangetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A registry of ranges that may overlap one another, such as decorations or diagnostics attached to a document.
 * Ranges are kept sorted by their first position and never merged.
 *
 * <p>Each range is stored relative to the first position of the previous range. An edit therefore only needs to
 * rewrite the ranges that start inside it, plus the first range after it; every later range moves implicitly.
 * Together with a per-subtree maximum end position, this answers point and interval intersection queries in
 * O(log n + k).
 *
 * <p>Ranges are closed: a range {@code [b, b + len]} intersects point {@code p} when {@code b <= p <= b + len}.
 *
 * @param <T> the type of value attached to each range
 */
public class OverlappingRangeRegistry<T> implements ModificationListener, Iterable<OverlappingRangeRegistry.Range<T>> {
    private static final Logger logger = LoggerFactory.getLogger(OverlappingRangeRegistry.class);

    public record Range<T>(int begin, int length, T value) {
        public int end() {
            return begin + length;
        }
    }

    // offset is from the first position of the previous range (or from 0)
    record Item<T>(int offset, int length, T value) {
        Item<T> withOffset(int newOffset) {
            return new Item<>(newOffset, length, value);
        }

        Item<T> withLength(int newLength) {
            return new Item<>(offset, newLength, value);
        }
    }

    // maxEnd is relative to the first position of the range before the subtree
    record Summary(int count, int offsetSum, int maxEnd) {}

    private static final Synthesizer<Item<?>, Summary> SYNTHESIZER = (item, left, right) -> {
        int maxEnd = 0;
        int base = 0;
        int count = 1;
        if (left != null) {
            maxEnd = left.maxEnd;
            base = left.offsetSum;
            count += left.count;
        }
        base += item.offset;
        maxEnd = Math.max(maxEnd, base + item.length);
        int offsetSum = base;
        if (right != null) {
            maxEnd = Math.max(maxEnd, base + right.maxEnd);
            offsetSum += right.offsetSum;
            count += right.count;
        }
        return new Summary(count, offsetSum, maxEnd);
    };

    private final AugmentedTree<Item<T>, Summary> ranges = new AugmentedTree<>(SYNTHESIZER);

    /**
     * A range in the registry, together with the first position of the previous range. Positions become invalid
     * when the registry is modified.
     */
    public static final class Position<T> {
        final AugmentedTree.Cursor<Item<T>, Summary> cursor;
        final int prevBegin;

        Position(AugmentedTree.Cursor<Item<T>, Summary> cursor, int prevBegin) {
            this.cursor = cursor;
            this.prevBegin = prevBegin;
        }

        public boolean isEnd() {
            return cursor.isEnd();
        }

        public int begin() {
            return prevBegin + cursor.get().offset;
        }

        public int length() {
            return cursor.get().length;
        }

        public int end() {
            Item<T> item = cursor.get();
            return prevBegin + item.offset + item.length;
        }

        public T value() {
            return cursor.get().value;
        }

        public Range<T> range() {
            Item<T> item = cursor.get();
            return new Range<>(prevBegin + item.offset, item.length, item.value);
        }

        public Position<T> next() {
            return new Position<>(cursor.next(), begin());
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
            return cursor.node == null ? "Position[end]" : "Position[" + range() + "]";
        }
    }

    /**
     * The result of a point query.
     *
     * @param begin the first range that ends at or after the point. Ranges from here to {@code end} may still miss
     *              the point; use {@link #findNextRangeEndingAtOrAfter(int, Position)} to step through the ones that
     *              do not
     * @param end the first range that starts after the point
     */
    public record PointQuery<T>(Position<T> begin, Position<T> end) {}

    /**
     * The result of a range query.
     *
     * @param beforeBegin the first range that ends at or after the start of the query. Ranges from here to
     *                    {@code begin} start before the query and may miss it
     * @param begin the first range that starts inside the query
     * @param end the first range that starts after the query. Every range in {@code [begin, end)} intersects it
     */
    public record RangeQuery<T>(Position<T> beforeBegin, Position<T> begin, Position<T> end) {}

    public Position<T> begin() {
        return new Position<>(ranges.begin(), 0);
    }

    public Position<T> end() {
        Summary all = ranges.aggregate();
        return new Position<>(ranges.end(), all == null ? 0 : all.offsetSum);
    }

    public int size() {
        Summary all = ranges.aggregate();
        return all == null ? 0 : all.count;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public void clear() {
        ranges.clear();
    }

    /**
     * Inserts a range before all ranges that start at the same position.
     *
     * @return the position of the inserted range
     */
    public Position<T> insertRange(int begin, int length, T value) {
        return insert(find(new StartFinder<>(begin, true), begin), begin, length, value);
    }

    /**
     * Inserts a range after all ranges that start at the same position.
     *
     * @return the position of the inserted range
     */
    public Position<T> insertRangeAfter(int begin, int length, T value) {
        return insert(find(new StartFinder<>(begin, false), begin), begin, length, value);
    }

    private Position<T> insert(Position<T> before, int begin, int length, T value) {
        if (length < 0) {
            throw new IndexOutOfBoundsException("length = " + length);
        }
        int offset = begin - before.prevBegin;
        if (!before.isEnd()) {
            Item<T> next = before.cursor.get();
            before.cursor.set(next.withOffset(next.offset - offset));
        }
        var inserted = ranges.insertBefore(before.cursor, new Item<>(offset, length, value));
        return new Position<>(inserted, before.prevBegin);
    }

    /**
     * Removes the range at the given position.
     *
     * @return the position of the following range
     */
    public Position<T> erase(Position<T> pos) {
        if (pos.isEnd()) {
            throw new NoSuchElementException();
        }
        int offset = pos.cursor.get().offset;
        var next = ranges.erase(pos.cursor);
        if (!next.isEnd()) {
            Item<T> item = next.get();
            next.set(item.withOffset(item.offset + offset));
        }
        return new Position<>(next, pos.prevBegin);
    }

    /**
     * Returns the first range (in start order) that ends strictly after the given position, or the end position.
     */
    public Position<T> findFirstRangeEndingAfter(int position) {
        return find(new ExtentFinder<>(position, false), position);
    }

    public PointQuery<T> findIntersectingRanges(int point) {
        return new PointQuery<>(
            find(new ExtentFinder<>(point, true), point),
            find(new StartFinder<>(point, false), point)
        );
    }

    public RangeQuery<T> findIntersectingRanges(int begin, int end) {
        if (begin > end) {
            throw new IllegalArgumentException("begin(" + begin + ") > end(" + end + ")");
        }
        return new RangeQuery<>(
            find(new ExtentFinder<>(begin, true), begin),
            find(new StartFinder<>(begin, true), begin),
            find(new StartFinder<>(end, false), end)
        );
    }

    /**
     * Returns every range that contains the given point, in start order.
     */
    public List<Range<T>> rangesIntersecting(int point) {
        List<Range<T>> result = new ArrayList<>();
        Position<T> pos = findIntersectingRanges(point).begin();
        while (!pos.isEnd() && pos.begin() <= point) {
            result.add(pos.range());
            pos = findNextRangeEndingAtOrAfter(point, pos);
        }
        return result;
    }

    /**
     * Returns every range that intersects {@code [begin, end]}, in start order.
     */
    public List<Range<T>> rangesIntersecting(int begin, int end) {
        RangeQuery<T> query = findIntersectingRanges(begin, end);
        List<Range<T>> result = new ArrayList<>();
        Position<T> pos = query.beforeBegin();
        while (!pos.isEnd() && pos.begin() < begin) {
            result.add(pos.range());
            pos = findNextRangeEndingAtOrAfter(begin, pos);
        }
        for (pos = query.begin(); !pos.equals(query.end()); pos = pos.next()) {
            result.add(pos.range());
        }
        return result;
    }

    /**
     * Returns the first range after {@code from} (in start order) that ends at or after the given position, or the
     * end position. Skips whole subtrees whose ranges all end before the position.
     */
    public Position<T> findNextRangeEndingAtOrAfter(int position, Position<T> from) {
        if (from.isEnd()) {
            throw new NoSuchElementException();
        }
        from.cursor.checkForComodification();
        int prevBegin = from.prevBegin;
        AugmentedTree.Node<Item<T>, Summary> n = from.cursor.node;
        while (n.right == null || prevBegin + n.value.offset + n.right.synth.maxEnd < position) {
            // Nothing in the right subtree qualifies; climb to the next ancestor that follows n
            while (n.parent != null && n == n.parent.right) {
                if (n.left != null) {
                    prevBegin -= n.left.synth.offsetSum;
                }
                prevBegin -= n.parent.value.offset;
                n = n.parent;
            }
            if (n.parent == null) {
                return end();
            }
            prevBegin += n.value.offset;
            if (n.right != null) {
                prevBegin += n.right.synth.offsetSum;
            }
            n = n.parent;
            if (prevBegin + n.value.offset + n.value.length >= position) {
                return new Position<>(new AugmentedTree.Cursor<>(ranges, n), prevBegin);
            }
        }
        // The right subtree holds a range that ends late enough
        prevBegin += n.value.offset;
        n = n.right;
        if (position <= prevBegin) {
            while (n.left != null) {
                n = n.left;
            }
            return new Position<>(new AugmentedTree.Cursor<>(ranges, n), prevBegin);
        }
        var finder = new ExtentFinder<T>(position - prevBegin, true);
        while (true) {
            int branch = finder.select(n.value, synthOf(n.left), synthOf(n.right));
            if (branch == 0) {
                break;
            }
            n = branch < 0 ? n.left : n.right;
        }
        return new Position<>(new AugmentedTree.Cursor<>(ranges, n), position - finder.remaining);
    }

    /**
     * Adjusts all ranges for an edit. With {@code eraseEnd = position + erasedLength}:
     * <ul>
     *     <li>a range starting before {@code position} and ending after it grows by the net inserted length if it
     *     ends after {@code eraseEnd}, and is cut at {@code position} otherwise;</li>
     *     <li>a range starting inside {@code [position, eraseEnd)} is removed if it ends by {@code eraseEnd}, and
     *     otherwise loses its erased head and starts after the inserted text;</li>
     *     <li>a range starting at or after {@code eraseEnd} moves by the net inserted length.</li>
     * </ul>
     */
    @Override
    public void onModification(int position, int erasedLength, int insertedLength) {
        ModificationListener.checkModification(position, erasedLength, insertedLength);
        if (erasedLength == 0 && insertedLength == 0) {
            return;
        }
        int eraseEnd = position + erasedLength;
        int diff = insertedLength - erasedLength;

        // Ranges that start before the edit and reach past its position
        int adjusted = 0;
        Position<T> pos = findFirstRangeEndingAfter(position);
        while (!pos.isEnd() && pos.begin() < position) {
            Item<T> item = pos.cursor.get();
            int end = pos.end();
            pos.cursor.set(item.withLength(end > eraseEnd ? item.length + diff : position - pos.begin()));
            adjusted++;
            pos = findNextRangeEndingAtOrAfter(position + 1, pos);
        }

        // Ranges that start inside the edit. prevBegin tracks positions before the edit, lastBegin after it.
        Position<T> first = find(new StartFinder<>(position, true), position);
        var cursor = first.cursor;
        int prevBegin = first.prevBegin;
        int lastBegin = first.prevBegin;
        int movedBegin = position + insertedLength;
        int removed = 0;
        while (!cursor.isEnd()) {
            Item<T> item = cursor.get();
            int begin = prevBegin + item.offset;
            if (begin > eraseEnd) {
                break;
            }
            prevBegin = begin;
            if (begin < eraseEnd && begin + item.length <= eraseEnd) {
                cursor = ranges.erase(cursor);
                removed++;
            }
            else {
                cursor.set(new Item<>(movedBegin - lastBegin, item.length - (eraseEnd - begin), item.value));
                lastBegin = movedBegin;
                cursor = cursor.next();
                adjusted++;
            }
        }
        if (!cursor.isEnd()) {
            Item<T> item = cursor.get();
            cursor.set(item.withOffset(prevBegin + item.offset + diff - lastBegin));
        }
        logger.trace("Edit ({}, {}, {}) adjusted {} and removed {} ranges",
                     position, erasedLength, insertedLength, adjusted, removed);
    }

    /**
     * Verifies the underlying tree, and that no offset or length is negative. Violations are logged.
     */
    public boolean checkIntegrity() {
        if (!ranges.checkIntegrity()) {
            return false;
        }
        for (Item<T> item : ranges) {
            if (item.offset < 0 || item.length < 0) {
                logger.warn("Malformed range {}", item);
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<Range<T>> iterator() {
        return new Iterator<>() {
            Position<T> next = begin();

            @Override
            public boolean hasNext() {
                return !next.isEnd();
            }

            @Override
            public Range<T> next() {
                if (next.isEnd()) {
                    throw new NoSuchElementException();
                }
                Range<T> range = next.range();
                next = next.next();
                return range;
            }
        };
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Range<T> range : this) {
            joiner.add("[" + range.begin() + "," + range.end() + "]=" + range.value());
        }
        return joiner.toString();
    }

    private Position<T> find(Finder<T> finder, int position) {
        if (position < 0) {
            throw new IndexOutOfBoundsException("position = " + position);
        }
        var cursor = ranges.find(finder);
        return new Position<>(cursor, position - finder.remaining);
    }

    private static Summary synthOf(AugmentedTree.Node<?, Summary> n) {
        return n == null ? null : n.synth;
    }

    // Descends while consuming the target, leaving it relative to the first position of the range before the
    // result
    private abstract static class Finder<T> implements Selector<Item<T>, Summary> {
        int remaining;
        final boolean inclusive;

        Finder(int target, boolean inclusive) {
            this.remaining = target;
            this.inclusive = inclusive;
        }

        boolean reaches(int target, int bound) {
            return inclusive ? target <= bound : target < bound;
        }
    }

    // First range starting at (inclusive) or after the target
    private static final class StartFinder<T> extends Finder<T> {
        StartFinder(int target, boolean inclusive) {
            super(target, inclusive);
        }

        @Override
        public int select(Item<T> item, Summary left, Summary right) {
            if (left != null) {
                if (reaches(remaining, left.offsetSum)) {
                    return -1;
                }
                remaining -= left.offsetSum;
            }
            if (reaches(remaining, item.offset)) {
                return 0;
            }
            remaining -= item.offset;
            return 1;
        }
    }

    // First range (in start order) ending at (inclusive) or after the target
    private static final class ExtentFinder<T> extends Finder<T> {
        ExtentFinder(int target, boolean inclusive) {
            super(target, inclusive);
        }

        @Override
        public int select(Item<T> item, Summary left, Summary right) {
            if (left != null) {
                if (reaches(remaining, left.maxEnd)) {
                    return -1;
                }
                remaining -= left.offsetSum;
            }
            if (reaches(remaining, item.offset + item.length)) {
                return 0;
            }
            remaining -= item.offset;
            return 1;
        }
    }
}
