package org.formlang.automata.transition;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.exceptions.DuplicateTransitionException;
import org.formlang.automata.exceptions.InvalidEpsilonTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicTransitionFunctionTest {

    private static final State Q0 = State.of("q0");
    private static final State Q1 = State.of("q1");
    private static final State Q2 = State.of("q2");
    private static final Symbol A = Symbol.of("a");

    private DeterministicTransitionFunction function;

    @BeforeEach
    void setUp() {
        function = new DeterministicTransitionFunction();
    }

    @Test
    @DisplayName("添加和查询唯一目标")
    void testAddAndGetNextState() {
        assertAll(
                () -> assertTrue(function.addTransition(Q0, A, Q1)),
                () -> assertFalse(function.addTransition(Q0, A, Q1), "Same edge twice changes nothing"),
                () -> assertEquals(Q1, function.getNextState(Q0, A)),
                () -> assertEquals(Set.of(Q1), function.apply(Q0, A)),
                () -> assertNull(function.getNextState(Q1, A)),
                () -> assertTrue(function.apply(Q1, A).isEmpty()),
                () -> assertEquals(1, function.getNumberTransitions()),
                () -> assertTrue(function.isDeterministic())
        );
    }

    @Test
    @DisplayName("第二个不同的目标抛出 DuplicateTransitionException，且不覆盖原目标")
    void testDuplicateTransition() {
        function.addTransition(Q0, A, Q1);

        DuplicateTransitionException exception =
                assertThrows(DuplicateTransitionException.class, () -> function.addTransition(Q0, A, Q2));
        assertAll(
                () -> assertEquals(Q0, exception.getSource()),
                () -> assertEquals(A, exception.getSymbol()),
                () -> assertEquals(Q2, exception.getRequestedTarget()),
                () -> assertEquals(Q1, exception.getExistingTarget()),
                () -> assertEquals(Q1, function.getNextState(Q0, A)),
                () -> assertEquals(1, function.getNumberTransitions())
        );
    }

    @Test
    @DisplayName("epsilon 边抛出 InvalidEpsilonTransitionException")
    void testEpsilonRejected() {
        InvalidEpsilonTransitionException exception = assertThrows(InvalidEpsilonTransitionException.class,
                () -> function.addTransition(Q0, Symbol.EPSILON, Q1));
        assertAll(
                () -> assertEquals(Q0, exception.getSource()),
                () -> assertEquals(Q1, exception.getTarget()),
                () -> assertEquals(0, function.getNumberTransitions())
        );
    }

    @Test
    @DisplayName("删除后可以重新指向其他目标")
    void testRemoveThenRedirect() {
        function.addTransition(Q0, A, Q1);

        assertAll(
                () -> assertFalse(function.removeTransition(Q0, A, Q2)),
                () -> assertTrue(function.removeTransition(Q0, A, Q1)),
                () -> assertTrue(function.addTransition(Q0, A, Q2)),
                () -> assertEquals(Q2, function.getNextState(Q0, A)),
                () -> assertEquals(1, function.getEdges().size())
        );
    }

    @Test
    @DisplayName("拷贝与原对象相互独立")
    void testCopy() {
        function.addTransition(Q0, A, Q1);
        DeterministicTransitionFunction copy = function.copy();
        copy.removeTransition(Q0, A, Q1);

        assertAll(
                () -> assertEquals(Q1, function.getNextState(Q0, A)),
                () -> assertNull(copy.getNextState(Q0, A))
        );
    }
}
