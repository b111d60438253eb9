package org.formlang.automata.operations;

import org.formlang.automata.LanguageAssertions;
import org.formlang.automata.base.State;
import org.formlang.automata.models.DeterministicFiniteAutomaton;
import org.formlang.automata.models.EpsilonNFA;
import org.formlang.automata.operations.HopcroftMinimizer.SplitterStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HopcroftMinimizerTest {

    /**
     * a 的个数模 3 为 0：用长度为 6 的环实现，终止状态为 0 和 3，最小自动机有 3 个状态。
     */
    private static DeterministicFiniteAutomaton countModuloThree() {
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
        for (int i = 0; i < 6; i++) {
            dfa.addTransition(i, "a", (i + 1) % 6);
            dfa.addTransition(i, "b", i);
        }
        dfa.addStartState(0);
        dfa.addFinalState(0);
        dfa.addFinalState(3);
        return dfa;
    }

    @Nested
    @DisplayName("最小性 (Minimality)")
    class MinimalityTests {

        @ParameterizedTest
        @EnumSource(SplitterStrategy.class)
        @DisplayName("状态数等于 Myhill-Nerode 等价类的个数")
        void testNumberOfClasses(SplitterStrategy strategy) {
            DeterministicFiniteAutomaton dfa = countModuloThree();
            DeterministicFiniteAutomaton minimal = HopcroftMinimizer.minimize(dfa, strategy);

            assertEquals(3, minimal.getNumberStates());
            LanguageAssertions.assertSameLanguage(dfa::accepts, minimal::accepts,
                    LanguageAssertions.alphabetOf(dfa), 7);
        }

        @ParameterizedTest
        @EnumSource(SplitterStrategy.class)
        @DisplayName("子集构造得到的 8 个状态都不等价")
        void testAlreadyMinimal(SplitterStrategy strategy) {
            DeterministicFiniteAutomaton dfa = DeterminizerTest.thirdFromLastIsA().toDeterministic();
            DeterministicFiniteAutomaton minimal = HopcroftMinimizer.minimize(dfa, strategy);

            assertEquals(8, minimal.getNumberStates());
            LanguageAssertions.assertSameLanguage(dfa::accepts, minimal::accepts,
                    LanguageAssertions.alphabetOf(dfa), 6);
        }

        @Test
        @DisplayName("最小化是幂等的")
        void testIdempotent() {
            DeterministicFiniteAutomaton minimal = countModuloThree().minimize();
            DeterministicFiniteAutomaton twice = minimal.minimize();

            assertAll(
                    () -> assertEquals(minimal.getNumberStates(), twice.getNumberStates()),
                    () -> assertTrue(twice.isDeterministic()),
                    () -> assertTrue(minimal.isEquivalentTo(twice))
            );
        }
    }

    @Nested
    @DisplayName("死状态与不可达状态 (Dead and Unreachable States)")
    class DeadStateTests {

        @Test
        @DisplayName("不可达状态和死状态不出现在结果中")
        void testDeadAndUnreachableDropped() {
            DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
            dfa.addTransition("s", "a", "f");
            dfa.addTransition("s", "b", "dead");
            dfa.addTransition("dead", "a", "dead");
            dfa.addTransition("unreachable", "a", "f");
            dfa.addStartState("s");
            dfa.addFinalState("f");

            DeterministicFiniteAutomaton minimal = dfa.minimize();

            assertAll(
                    () -> assertEquals(2, minimal.getNumberStates()),
                    () -> assertEquals(1, minimal.getNumberTransitions()),
                    () -> assertTrue(minimal.accepts(List.of("a"))),
                    () -> assertFalse(minimal.accepts(List.of("b", "a"))),
                    () -> assertNull(minimal.getNextState("s", "b"))
            );
        }

        @Test
        @DisplayName("起始状态是死状态时得到单状态空语言自动机")
        void testDeadStart() {
            DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
            dfa.addTransition(0, "a", 1);
            dfa.addTransition(1, "a", 0);
            dfa.addStartState(0);

            DeterministicFiniteAutomaton minimal = dfa.minimize();

            assertAll(
                    () -> assertEquals(1, minimal.getNumberStates()),
                    () -> assertTrue(minimal.getFinalStates().isEmpty()),
                    () -> assertEquals(State.merge(List.of()), minimal.getStartState()),
                    () -> assertEquals(0, minimal.getNumberTransitions())
            );
        }

        @Test
        @DisplayName("只含一个终止起始状态且没有边")
        void testSingleFinalStart() {
            DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
            dfa.addStartState("q");
            dfa.addFinalState("q");
            dfa.addSymbol("a");

            DeterministicFiniteAutomaton minimal = dfa.minimize();

            assertAll(
                    () -> assertEquals(1, minimal.getNumberStates()),
                    () -> assertTrue(minimal.accepts(List.of())),
                    () -> assertFalse(minimal.accepts(List.of("a")))
            );
        }
    }

    @ParameterizedTest
    @EnumSource(SplitterStrategy.class)
    @DisplayName("状态名称中含有分隔符时，不同的等价类得到不同的名字")
    void testStateNamesContainingSeparator(SplitterStrategy strategy) {
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
        dfa.addTransition("s", "a", "0;1");
        dfa.addTransition("s", "b", "0");
        dfa.addTransition("s", "c", "1");
        dfa.addTransition("0", "x", "f");
        dfa.addTransition("1", "x", "f");
        dfa.addTransition("0;1", "a", "0;1");
        dfa.addStartState("s");
        dfa.addFinalState("0;1");
        dfa.addFinalState("f");

        DeterministicFiniteAutomaton minimal = HopcroftMinimizer.minimize(dfa, strategy);

        assertAll(
                () -> assertEquals(4, minimal.getNumberStates()),
                () -> assertEquals(State.of("0;1"), minimal.getNextState("s", "b")),
                () -> assertEquals(State.of("0\\;1"), minimal.getNextState("s", "a")),
                () -> assertFalse(minimal.isFinalState("0;1")),
                () -> assertTrue(minimal.isFinalState("0\\;1")),
                () -> assertFalse(minimal.accepts(List.of("b")))
        );
        LanguageAssertions.assertSameLanguage(dfa::accepts, minimal::accepts, LanguageAssertions.alphabetOf(dfa), 4);
    }

    @Test
    @DisplayName("对 epsilon-NFA 先确定化再最小化")
    void testMinimizeEpsilonNfa() {
        EpsilonNFA enfa = new EpsilonNFA();
        enfa.addTransition(0, "epsilon", 1);
        enfa.addTransition(0, "epsilon", 2);
        enfa.addTransition(1, "a", 3);
        enfa.addTransition(2, "a", 4);
        enfa.addStartState(0);
        enfa.addFinalState(3);
        enfa.addFinalState(4);

        DeterministicFiniteAutomaton minimal = enfa.minimize();

        assertEquals(2, minimal.getNumberStates());
        LanguageAssertions.assertSameLanguage(enfa::accepts, minimal::accepts, LanguageAssertions.alphabetOf(enfa), 4);
    }
}
