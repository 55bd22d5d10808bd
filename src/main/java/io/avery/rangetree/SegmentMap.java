package io.avery.rangetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A run-length map assigning a value to every position in {@code [0, ∞)}, such as the syntax class of each
 * character of a document. The map is a sequence of segments, each a value and a length, always terminated by a
 * zero-length segment whose value applies to every position past the other segments.
 *
 * <p>Overwriting a range merges the new segment with neighbours that hold an equal value.
 *
 * @param <T> the type of value
 */
public class SegmentMap<T> implements ModificationListener, Iterable<SegmentMap.Segment<T>> {
    private static final Logger logger = LoggerFactory.getLogger(SegmentMap.class);

    public record Segment<T>(T value, int length) {
        Segment<T> withLength(int newLength) {
            return new Segment<>(value, newLength);
        }
    }

    private record Summary(int count, int length) {}

    private static final Synthesizer<Segment<?>, Summary> SYNTHESIZER = (segment, left, right) -> {
        int count = 1;
        int length = segment.length;
        if (left != null) {
            count += left.count;
            length += left.length;
        }
        if (right != null) {
            count += right.count;
            length += right.length;
        }
        return new Summary(count, length);
    };

    private final AugmentedTree<Segment<T>, Summary> segments = new AugmentedTree<>(SYNTHESIZER);

    /**
     * Creates a map where every position holds the given value.
     */
    public SegmentMap(T defaultValue) {
        clear(defaultValue);
    }

    /**
     * A segment of the map, together with its first position. Positions become invalid when the map is modified.
     */
    public static final class Position<T> {
        final AugmentedTree.Cursor<Segment<T>, Summary> cursor;
        final int start;

        Position(AugmentedTree.Cursor<Segment<T>, Summary> cursor, int start) {
            this.cursor = cursor;
            this.start = start;
        }

        public boolean isEnd() {
            return cursor.isEnd();
        }

        public int start() {
            return start;
        }

        public T value() {
            return cursor.get().value;
        }

        public int length() {
            return cursor.get().length;
        }

        public Segment<T> segment() {
            return cursor.get();
        }

        public Position<T> next() {
            return new Position<>(cursor.next(), start + length());
        }

        @Override
        public String toString() {
            return cursor.node == null ? "Position[end]" : "Position[" + start + ": " + segment() + "]";
        }
    }

    /**
     * Removes every segment, leaving a map where every position holds the given value.
     */
    public void clear(T defaultValue) {
        segments.clear();
        segments.insertBefore(segments.end(), new Segment<>(defaultValue, 0));
    }

    /**
     * Returns the value of every position past the last non-empty segment.
     */
    public T defaultValue() {
        return segments.last().get().value;
    }

    /**
     * Returns the number of segments, including the terminating one.
     */
    public int size() {
        return segments.aggregate().count;
    }

    /**
     * Returns the total length of all segments. Positions from here on hold the {@link #defaultValue()}.
     */
    public int length() {
        return segments.aggregate().length;
    }

    public T getAt(int position) {
        return getSegmentAt(position).value();
    }

    /**
     * Returns the segment that contains the given position. At a boundary this is the segment starting there; past
     * the end it is the terminating segment.
     */
    public Position<T> getSegmentAt(int position) {
        if (position < 0) {
            throw new IndexOutOfBoundsException("position = " + position);
        }
        var finder = new PositionFinder<T>(position);
        var cursor = segments.find(finder);
        return new Position<>(cursor, position - finder.remaining);
    }

    public Position<T> begin() {
        return new Position<>(segments.begin(), 0);
    }

    /**
     * Sets the value of every position in {@code [begin, end)}.
     *
     * @throws IllegalArgumentException if {@code begin > end}
     */
    public void setRange(int begin, int end, T value) {
        if (begin < 0) {
            throw new IndexOutOfBoundsException("begin = " + begin);
        }
        if (begin > end) {
            throw new IllegalArgumentException("begin(" + begin + ") > end(" + end + ")");
        }
        if (begin == end) {
            return;
        }
        Position<T> first = getSegmentAt(begin);
        Position<T> last = getSegmentAt(end);
        Insertion<T> at = eraseWithoutMerging(first.cursor, begin - first.start, last.cursor, end - last.start);
        insertAt(at.cursor, at.offset, value, end - begin);
    }

    /**
     * Adjusts the map for an edit. The erased positions are removed, and the inserted ones take the value that
     * {@code position} held before the edit. Segments after the edit move implicitly.
     */
    @Override
    public void onModification(int position, int erasedLength, int insertedLength) {
        ModificationListener.checkModification(position, erasedLength, insertedLength);
        if (erasedLength == 0 && insertedLength == 0) {
            return;
        }
        int eraseEnd = position + erasedLength;
        Position<T> first = getSegmentAt(position);
        Position<T> last = getSegmentAt(eraseEnd);
        T value = first.value();
        Insertion<T> at = eraseWithoutMerging(first.cursor, position - first.start, last.cursor, eraseEnd - last.start);
        insertAt(at.cursor, at.offset, value, insertedLength);
        logger.trace("Edit ({}, {}, {}) filled with {}", position, erasedLength, insertedLength, value);
    }

    /**
     * Returns a scanner that reports the value at the given position and walks forward from there.
     */
    public Scanner scanner(int position) {
        return new Scanner(position);
    }

    /**
     * Walks forward through the map, tracking the current value and where it next changes. Used by consumers that
     * step through a document in increasing positions, such as a renderer. A scanner must not outlive a
     * modification of its map.
     */
    public final class Scanner {
        private AugmentedTree.Cursor<Segment<T>, Summary> next;
        private int nextPosition;
        private T current;

        Scanner(int position) {
            seek(position);
        }

        private void seek(int position) {
            Position<T> pos = getSegmentAt(position);
            current = pos.value();
            nextPosition = pos.start + pos.length();
            next = pos.cursor.next();
        }

        public T current() {
            return current;
        }

        /**
         * Moves to the given position, which must not be before the previous one.
         *
         * @return whether the current value may have changed
         */
        public boolean moveForward(int position) {
            if (position < nextPosition || next.isEnd()) {
                return false;
            }
            Segment<T> segment = next.get();
            nextPosition += segment.length;
            if (position < nextPosition) {
                current = segment.value;
                next = next.next();
                return true;
            }
            seek(position);
            return true;
        }

        /**
         * Returns the distance from the given position to the next value change, or {@link Integer#MAX_VALUE} if
         * the value never changes again.
         */
        public int forecast(int position) {
            return next.isEnd() ? Integer.MAX_VALUE : nextPosition - position;
        }
    }

    /**
     * Verifies the underlying tree, that lengths are non-negative, that only the last segment is empty, and that no
     * two adjacent segments hold equal values. Violations are logged.
     */
    public boolean checkIntegrity() {
        if (!segments.checkIntegrity()) {
            return false;
        }
        if (segments.isEmpty()) {
            logger.warn("Segment map has no terminating segment");
            return false;
        }
        Segment<T> previous = null;
        for (Segment<T> segment : segments) {
            if (segment.length < 0) {
                logger.warn("Negative segment length {}", segment);
                return false;
            }
            if (previous != null) {
                if (previous.length == 0) {
                    logger.warn("Empty segment {} before the terminating one", previous);
                    return false;
                }
                if (Objects.equals(previous.value, segment.value)) {
                    logger.warn("Adjacent segments {} and {} hold equal values", previous, segment);
                    return false;
                }
            }
            previous = segment;
        }
        if (segments.last().get().length != 0) {
            logger.warn("Terminating segment {} is not empty", segments.last().get());
            return false;
        }
        return true;
    }

    /**
     * Iterates over all segments, including the terminating one.
     */
    @Override
    public Iterator<Segment<T>> iterator() {
        return segments.iterator();
    }

    @Override
    public String toString() {
        return segments.toString();
    }

    private record Insertion<T>(AugmentedTree.Cursor<Segment<T>, Summary> cursor, int offset) {}

    // Removes [begin segment + beginOffset, end segment + endOffset) without merging the segments left on either
    // side. Returns where the removed text used to be.
    private Insertion<T> eraseWithoutMerging(AugmentedTree.Cursor<Segment<T>, Summary> begin, int beginOffset,
                                             AugmentedTree.Cursor<Segment<T>, Summary> end, int endOffset) {
        if (begin.equals(end)) {
            Segment<T> segment = begin.get();
            int length = endOffset - beginOffset;
            begin.set(segment.withLength(Math.max(segment.length, length) - length));
            return new Insertion<>(begin, beginOffset);
        }
        if (beginOffset > 0) {
            // Keep the head of the first segment; an empty terminating segment stays empty
            Segment<T> segment = begin.get();
            begin.set(segment.withLength(Math.min(segment.length, beginOffset)));
            begin = begin.next();
        }
        if (endOffset > 0) {
            Segment<T> segment = end.get();
            end.set(segment.withLength(Math.max(segment.length, endOffset) - endOffset));
        }
        segments.erase(begin, end);
        return new Insertion<>(end.refreshed(), 0);
    }

    // Inserts a run of the given value at offset into the segment at the cursor, merging with equal neighbours
    private void insertAt(AugmentedTree.Cursor<Segment<T>, Summary> at, int offset, T value, int length) {
        if (length == 0) {
            // Nothing to insert, but the removal may have left equal values side by side
            if (offset == 0 && !at.equals(segments.begin())) {
                var prev = at.previous();
                Segment<T> previous = prev.get();
                if (Objects.equals(previous.value, at.get().value)) {
                    at.set(at.get().withLength(at.get().length + previous.length));
                    segments.erase(prev);
                    at = at.refreshed();
                }
            }
        }
        else if (offset == 0) {
            AugmentedTree.Cursor<Segment<T>, Summary> prev = null;
            boolean mergeBefore = false;
            if (!at.equals(segments.begin())) {
                prev = at.previous();
                mergeBefore = Objects.equals(prev.get().value, value);
            }
            Segment<T> current = at.get();
            if (mergeBefore) {
                if (Objects.equals(current.value, value)) {
                    at.set(current.withLength(current.length + prev.get().length + length));
                    segments.erase(prev);
                    at = at.refreshed();
                }
                else {
                    prev.set(prev.get().withLength(prev.get().length + length));
                }
            }
            else if (Objects.equals(current.value, value)) {
                at.set(current.withLength(current.length + length));
            }
            else {
                segments.insertBefore(at, new Segment<>(value, length));
                at = at.refreshed();
            }
        }
        else {
            Segment<T> current = at.get();
            if (Objects.equals(current.value, value)) {
                at.set(current.withLength(current.length + length));
            }
            else {
                // Split the segment around the new run
                segments.insertBefore(at, new Segment<>(current.value, offset));
                at = at.refreshed();
                segments.insertBefore(at, new Segment<>(value, length));
                at = at.refreshed();
                at.set(current.withLength(Math.max(current.length, offset) - offset));
            }
        }
        if (at.next().isEnd()) {
            at.set(at.get().withLength(0));
        }
    }

    // Finds the segment containing the target, or the last segment if the target is past the end
    private static final class PositionFinder<T> implements Selector<Segment<T>, Summary> {
        int remaining;

        PositionFinder(int target) {
            this.remaining = target;
        }

        @Override
        public int select(Segment<T> segment, Summary left, Summary right) {
            if (left != null) {
                if (remaining < left.length) {
                    return -1;
                }
                remaining -= left.length;
            }
            if (remaining < segment.length || right == null) {
                return 0;
            }
            remaining -= segment.length;
            return 1;
        }
    }
}
