package org.formlang.automata.operations;

import org.apache.commons.lang3.tuple.Pair;
import org.formlang.automata.base.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class HopcroftProcessingListTest {

    private static final Symbol A = Symbol.of("a");
    private static final Symbol B = Symbol.of("b");

    private HopcroftProcessingList processingList;

    @BeforeEach
    void setUp() {
        processingList = new HopcroftProcessingList(3, List.of(A, B));
    }

    @Test
    @DisplayName("同一个对不会同时出现两次")
    void testInsertIsDeduplicated() {
        assertAll(
                () -> assertTrue(processingList.isEmpty()),
                () -> assertTrue(processingList.insert(1, A)),
                () -> assertFalse(processingList.insert(1, A)),
                () -> assertTrue(processingList.contains(1, A)),
                () -> assertFalse(processingList.contains(1, B)),
                () -> assertFalse(processingList.isEmpty())
        );
    }

    @Test
    @DisplayName("弹出后可以重新插入")
    void testPop() {
        processingList.insert(2, B);
        Pair<Integer, Symbol> popped = processingList.pop();

        assertAll(
                () -> assertEquals(Pair.of(2, B), popped),
                () -> assertFalse(processingList.contains(2, B)),
                () -> assertTrue(processingList.isEmpty()),
                () -> assertTrue(processingList.insert(2, B)),
                () -> assertThrows(IllegalArgumentException.class, () -> processingList.insert(0, Symbol.of("c")))
        );
    }

    @Test
    @DisplayName("空列表弹出抛出 NoSuchElementException")
    void testPopEmpty() {
        assertThrows(NoSuchElementException.class, () -> processingList.pop());
    }
}
