package io.avery.rangetree;

import io.avery.rangetree.CaretSet.Caret;
import io.avery.rangetree.CaretSet.Entry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments.ArgumentSet;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.*;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class CaretSetTest {
    static List<Caret> carets(CaretSet<?> set) {
        List<Caret> list = new ArrayList<>();
        for (var entry : set) {
            list.add(entry.caret());
        }
        return list;
    }

    static <D> List<Entry<D>> entries(CaretSet<D> set) {
        List<Entry<D>> list = new ArrayList<>();
        set.forEach(list::add);
        return list;
    }

    static <D> List<D> data(CaretSet<D> set) {
        return entries(set).stream().map(Entry::data).toList();
    }

    static Caret c(int begin, int length, int offset) {
        return new Caret(begin, length, offset);
    }

    @Test
    void testAddMerges() {
        CaretSet<String> set = new CaretSet<>();
        set.add(c(30, 20, 10), "a");
        assertEquals(List.of(c(30, 20, 10)), carets(set));
        set.add(c(5, 20, 5), "b");
        assertEquals(List.of(c(5, 20, 5), c(30, 20, 10)), carets(set));
        set.add(c(60, 10, 5), "c");
        set.add(c(52, 5, 5), "d");
        assertEquals(List.of(c(5, 20, 5), c(30, 20, 10), c(52, 5, 5), c(60, 10, 5)), carets(set));

        // Overlaps the first caret only
        set.add(c(20, 7, 5), "e");
        assertEquals(List.of(c(5, 22, 20), c(30, 20, 10), c(52, 5, 5), c(60, 10, 5)), carets(set));

        // Ends exactly where the second caret begins; both have selections, so they stay apart
        set.add(c(20, 10, 5), "f");
        assertEquals(List.of(c(5, 25, 20), c(30, 20, 10), c(52, 5, 5), c(60, 10, 5)), carets(set));

        // Swallows a caret entirely
        set.add(c(51, 8, 3), "g");
        assertEquals(List.of(c(5, 25, 20), c(30, 20, 10), c(51, 8, 3), c(60, 10, 5)), carets(set));

        // Merges three carets and the gaps between them
        set.add(c(40, 25, 5), "h");
        assertEquals(List.of(c(5, 25, 20), c(30, 40, 15)), carets(set));
        assertEquals(List.of("f", "h"), data(set));
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testAddReturnsUsablePosition() {
        CaretSet<String> set = new CaretSet<>();
        var pos = set.add(c(30, 20, 10), "a");
        assertEquals(c(30, 20, 10), pos.caret());
        assertTrue(pos.next().isEnd());

        // Inserting before an existing caret re-encodes it, and the returned position walks onto it
        pos = set.add(c(5, 20, 5), "b");
        assertEquals(c(5, 20, 5), pos.caret());
        assertEquals("b", pos.data());
        assertEquals(c(30, 20, 10), pos.next().caret());
        assertEquals("a", pos.next().data());

        set.reset();
        pos = set.add(c(5, 20, 5), "c");
        assertEquals(c(5, 20, 5), pos.caret());
        assertEquals(List.of(Caret.at(0), c(5, 20, 5)), carets(set));
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testAddTouchingCarets() {
        CaretSet<String> set = new CaretSet<>();
        set.add(c(10, 10, 0), "a");
        // A caret without selection touching a selection merges into it
        set.add(Caret.at(20), "b");
        assertEquals(List.of(c(10, 10, 10)), carets(set));
        set.add(Caret.at(10), "c");
        assertEquals(List.of(c(10, 10, 0)), carets(set));
        // Two carets at the same place merge
        set.add(Caret.at(40), "d");
        set.add(Caret.at(40), "e");
        assertEquals(List.of(c(10, 10, 0), c(40, 0, 0)), carets(set));
        assertEquals(2, set.size());
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testRemove() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(5, 5, 0), 1);
        set.add(c(20, 5, 0), 2);
        set.add(c(40, 5, 0), 3);
        var second = set.begin().next();
        var after = set.remove(second);
        assertEquals(c(40, 5, 0), after.caret());
        assertEquals(3, after.data());
        assertEquals(List.of(c(5, 5, 0), c(40, 5, 0)), carets(set));
        assertThrows(NoSuchElementException.class, () -> set.remove(set.end()));
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testFindFirstEndingAtOrAfter() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(5, 5, 0), 1);
        set.add(Caret.at(20), 2);
        assertEquals(1, set.findFirstEndingAtOrAfter(0).data());
        assertEquals(1, set.findFirstEndingAtOrAfter(10).data());
        assertEquals(2, set.findFirstEndingAtOrAfter(11).data());
        assertEquals(2, set.findFirstEndingAtOrAfter(20).data());
        assertTrue(set.findFirstEndingAtOrAfter(21).isEnd());
        assertThrows(IndexOutOfBoundsException.class, () -> set.findFirstEndingAtOrAfter(-1));
    }

    @Test
    void testIsInSelection() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(10, 5, 0), 1);
        set.add(Caret.at(20), 2);
        set.add(c(30, 2, 2), 3);
        assertFalse(set.isInSelection(9));
        assertTrue(set.isInSelection(10));
        assertTrue(set.isInSelection(15));
        assertFalse(set.isInSelection(16));
        assertFalse(set.isInSelection(20));
        assertTrue(set.isInSelection(32));
        assertFalse(set.isInSelection(33));
    }

    @Test
    void testReset() {
        CaretSet<String> set = new CaretSet<>(() -> "primary");
        assertTrue(set.isEmpty());
        set.add(c(10, 5, 0), "x");
        set.reset();
        assertEquals(List.of(new Entry<>(Caret.at(0), "primary")), entries(set));
    }

    @Test
    void testCaretValidation() {
        assertThrows(IndexOutOfBoundsException.class, () -> c(-1, 0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> c(0, -1, 0));
        assertThrows(IllegalArgumentException.class, () -> c(0, 3, 4));
    }

    @Test
    void testOnModification() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(10, 5, 5), 1);
        set.add(Caret.at(20), 2);
        set.add(c(30, 10, 0), 3);

        // A caret at the insertion point grows over the inserted text; later carets move
        set.onModification(20, 0, 5);
        assertEquals(List.of(c(10, 5, 5), c(20, 5, 0), c(35, 10, 0)), carets(set));

        // Erasure cuts the first caret, swallows the second and moves the third
        set.onModification(12, 20, 0);
        assertEquals(List.of(c(10, 2, 2), c(15, 10, 0)), carets(set));

        // A no-op edit changes nothing
        set.onModification(0, 0, 0);
        set.onModification(12, 0, 0);
        assertEquals(List.of(c(10, 2, 2), c(15, 10, 0)), carets(set));

        // Selections may end up touching
        set.onModification(12, 3, 0);
        assertEquals(List.of(c(10, 2, 2), c(12, 10, 0)), carets(set));
        assertEquals(List.of(1, 3), data(set));
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testOnModificationDropsTouchingCaret() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(0, 5, 0), 1);
        set.add(Caret.at(8), 2);
        set.add(c(100, 5, 0), 3);
        set.onModification(5, 3, 0);
        assertEquals(List.of(c(0, 5, 0), c(97, 5, 0)), carets(set));
        assertTrue(set.checkIntegrity());
    }

    @Test
    void testSelectionAtInsertionPoint() {
        CaretSet<Integer> set = new CaretSet<>();
        set.add(c(0, 10, 10), 1);
        set.add(c(20, 10, 0), 2);
        // Ends at the insertion point: does not grow. Starts there: moves after the inserted text
        set.onModification(10, 0, 4);
        set.onModification(24, 0, 6);
        assertEquals(List.of(c(0, 10, 10), c(30, 10, 0)), carets(set));
    }

    static Stream<ArgumentSet> provideSeeds() {
        return IntStream.range(1, 9).mapToObj(seed -> argumentSet("seed" + seed, seed));
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void testFuzz(int seed) {
        Random random = new Random(seed);
        CaretSet<Integer> set = new CaretSet<>();
        List<Entry<Integer>> reference = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            switch (random.nextInt(4)) {
                case 0 -> {
                    Caret caret;
                    if (random.nextDouble() < 0.1) {
                        caret = Caret.at(random.nextInt(0, 5001));
                    }
                    else {
                        int length = random.nextInt(0, 201);
                        double x = random.nextDouble();
                        int offset = x < 0.1 ? 0 : x < 0.2 ? length : random.nextInt(0, length+1);
                        caret = c(random.nextInt(0, 5001), length, offset);
                    }
                    int data = random.nextInt();
                    set.add(caret, data);
                    referenceAdd(reference, caret, data);
                }
                case 1 -> {
                    if (reference.isEmpty()) {
                        break;
                    }
                    int point = random.nextInt(0, reference.get(reference.size()-1).caret().selectionEnd() + 1);
                    var pos = set.findFirstEndingAtOrAfter(point);
                    if (pos.isEnd() || pos.selectionBegin() > point) {
                        break;
                    }
                    int index = 0;
                    while (reference.get(index).caret().selectionEnd() < point) {
                        index++;
                    }
                    set.remove(pos);
                    reference.remove(index);
                }
                case 2 -> {
                    if (reference.isEmpty()) {
                        break;
                    }
                    int lastEnd = reference.get(reference.size()-1).caret().selectionEnd();
                    int point = random.nextInt(0, Math.max(5000, lastEnd) + 1);
                    int erased = random.nextDouble() > 0.05 ? random.nextInt(0, 1001) : 0;
                    int inserted = random.nextDouble() > 0.05 ? random.nextInt(0, 1001) : 0;
                    set.onModification(point, erased, inserted);
                    referenceModify(reference, point, erased, inserted);
                }
                default -> {
                    int point = random.nextInt(0, 5001);
                    var pos = set.findFirstEndingAtOrAfter(point);
                    var expected = reference.stream().filter(e -> e.caret().selectionEnd() >= point).findFirst();
                    if (expected.isEmpty()) {
                        assertTrue(pos.isEnd());
                    }
                    else {
                        assertEquals(expected.get(), new Entry<>(pos.caret(), pos.data()));
                    }
                }
            }
            assertEquals(reference, entries(set));
            assertTrue(set.checkIntegrity());
        }
    }

    static void referenceAdd(List<Entry<Integer>> reference, Caret caret, int data) {
        int newBegin = caret.selectionBegin(), newEnd = caret.selectionEnd();
        int insertAt = reference.size();
        for (int i = 0; i < reference.size(); ) {
            Caret e = reference.get(i).caret();
            if (e.selectionEnd() < caret.selectionBegin()
                || (e.selectionEnd() == caret.selectionBegin() && e.hasSelection() && caret.hasSelection())) {
                i++;
                continue;
            }
            if (e.selectionBegin() > caret.selectionEnd()
                || (e.selectionBegin() == caret.selectionEnd() && e.hasSelection() && caret.hasSelection())) {
                insertAt = i;
                break;
            }
            newBegin = Math.min(newBegin, e.selectionBegin());
            newEnd = Math.max(newEnd, e.selectionEnd());
            reference.remove(i);
            insertAt = reference.size();
        }
        reference.add(insertAt, new Entry<>(c(newBegin, newEnd - newBegin, caret.caretPosition() - newBegin), data));
    }

    static void referenceModify(List<Entry<Integer>> reference, int point, int erased, int inserted) {
        int eraseEnd = point + erased;
        int diff = inserted - erased;
        for (ListIterator<Entry<Integer>> iter = reference.listIterator(); iter.hasNext(); ) {
            Entry<Integer> entry = iter.next();
            Caret caret = entry.caret();
            int begin = caret.selectionBegin(), end = caret.selectionEnd();
            if (begin > point && end < eraseEnd) {
                iter.remove();
                continue;
            }
            if (begin > point || (begin == point && erased == 0 && caret.hasSelection())) {
                begin = Math.max(begin, eraseEnd) + diff;
            }
            if (end < eraseEnd || (end == point && erased == 0 && caret.hasSelection())) {
                end = Math.min(end, point);
            }
            else {
                end += diff;
            }
            if (begin > end) {
                iter.remove();
                continue;
            }
            int position = caret.caretPosition();
            if (position > point) {
                position = position >= eraseEnd ? position + diff : point;
            }
            position = Math.max(begin, Math.min(position, end));
            iter.set(new Entry<>(c(begin, end - begin, position - begin), entry.data()));
        }
        for (int prev = 0, cur = 1; cur < reference.size(); ) {
            Caret p = reference.get(prev).caret();
            Caret q = reference.get(cur).caret();
            if (!q.hasSelection() && q.selectionBegin() == p.selectionEnd()) {
                reference.remove(cur);
                continue;
            }
            if (!p.hasSelection() && p.selectionBegin() == q.selectionBegin()) {
                reference.remove(prev);
                cur = prev + 1;
                continue;
            }
            prev = cur;
            cur++;
        }
    }
}
