package org.formlang.automata.models;

import org.formlang.automata.LanguageAssertions;
import org.formlang.regex.Regex;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class FiniteAutomatonTest {

    private static final int MAX_LENGTH = 5;

    private EpsilonNFA first;
    private EpsilonNFA second;
    private Set<String> alphabet;

    @BeforeAll
    void setUp() {
        // a*b
        first = EpsilonNFATest.aStarB();
        // 以 b 结尾、长度为偶数的单词
        second = new EpsilonNFA();
        second.addTransition("even", "a", "odd");
        second.addTransition("even", "b", "odd");
        second.addTransition("odd", "a", "even");
        second.addTransition("odd", "b", "evenAfterB");
        second.addTransition("evenAfterB", "a", "odd");
        second.addTransition("evenAfterB", "b", "odd");
        second.addStartState("even");
        second.addFinalState("evenAfterB");
        alphabet = LanguageAssertions.alphabetOf(first, second);
    }

    private static boolean inStar(FiniteAutomaton automaton, List<String> word) {
        // reachable[i]：前 i 个字母可以被分成若干段，每段都被接受
        boolean[] reachable = new boolean[word.size() + 1];
        reachable[0] = true;
        for (int end = 1; end <= word.size(); end++) {
            for (int begin = 0; begin < end && !reachable[end]; begin++) {
                reachable[end] = reachable[begin] && automaton.accepts(word.subList(begin, end));
            }
        }
        return reachable[word.size()];
    }

    private static boolean inConcatenation(FiniteAutomaton left, FiniteAutomaton right, List<String> word) {
        for (int split = 0; split <= word.size(); split++) {
            if (left.accepts(word.subList(0, split)) && right.accepts(word.subList(split, word.size()))) {
                return true;
            }
        }
        return false;
    }

    @Nested
    @DisplayName("闭包运算 (Closure Operations)")
    class ClosureOperationTests {

        @Test
        @DisplayName("并")
        void testUnion() {
            EpsilonNFA union = first.union(second);
            LanguageAssertions.assertSameLanguage(w -> first.accepts(w) || second.accepts(w), union::accepts,
                    alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("连接")
        void testConcatenate() {
            EpsilonNFA concatenation = first.concatenate(second);
            LanguageAssertions.assertSameLanguage(w -> inConcatenation(first, second, w), concatenation::accepts,
                    alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("Kleene 星：新的起始状态同时也是终止状态")
        void testKleeneStar() {
            EpsilonNFA star = first.kleeneStar();
            assertAll(
                    () -> assertEquals(1, star.getStartStates().size()),
                    () -> assertTrue(star.getFinalStates().containsAll(star.getStartStates())),
                    () -> assertTrue(star.accepts(List.of()))
            );
            LanguageAssertions.assertSameLanguage(w -> inStar(first, w), star::accepts, alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("反转")
        void testReverse() {
            EpsilonNFA reversed = first.reverse();
            LanguageAssertions.assertSameLanguage(w -> {
                List<String> copy = new ArrayList<>(w);
                Collections.reverse(copy);
                return first.accepts(copy);
            }, reversed::accepts, alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("交")
        void testIntersection() {
            EpsilonNFA intersection = first.intersection(second);
            LanguageAssertions.assertSameLanguage(w -> first.accepts(w) && second.accepts(w), intersection::accepts,
                    alphabet, MAX_LENGTH);
            assertTrue(intersection.accepts(List.of("a", "b")));
        }

        @Test
        @DisplayName("补集只接受原字母表上的单词")
        void testComplement() {
            EpsilonNFA complement = first.complement();
            Set<String> firstAlphabet = Set.of("a", "b");
            LanguageAssertions.assertSameLanguage(w -> firstAlphabet.containsAll(w) && !first.accepts(w),
                    complement::accepts, alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("差")
        void testDifference() {
            EpsilonNFA difference = first.difference(second);
            LanguageAssertions.assertSameLanguage(w -> first.accepts(w) && !second.accepts(w), difference::accepts,
                    alphabet, MAX_LENGTH);
        }

        @Test
        @DisplayName("运算不修改操作数")
        void testOperandsUnchanged() {
            int transitions = first.getNumberTransitions();
            first.union(second);
            first.kleeneStar();
            first.difference(second);
            assertAll(
                    () -> assertEquals(transitions, first.getNumberTransitions()),
                    () -> assertEquals(1, first.getStartStates().size())
            );
        }
    }

    @Nested
    @DisplayName("等价性 (Equivalence)")
    class EquivalenceTests {

        @Test
        @DisplayName("不同形状的自动机接受相同语言时等价")
        void testEquivalentShapes() {
            DeterministicFiniteAutomaton parallel = DeterministicFiniteAutomatonTest.parallelAStarB();
            assertAll(
                    () -> assertTrue(first.isEquivalentTo(parallel)),
                    () -> assertTrue(parallel.isEquivalentTo(first)),
                    () -> assertTrue(first.isEquivalentTo(Regex.of("a*.b").toEpsilonNfa())),
                    () -> assertTrue(first.isEquivalentTo(first.toDeterministic()))
            );
        }

        @Test
        @DisplayName("语言不同时不等价")
        void testNotEquivalent() {
            assertAll(
                    () -> assertFalse(first.isEquivalentTo(second)),
                    () -> assertFalse(first.isEquivalentTo(Regex.of("a*").toEpsilonNfa())),
                    () -> assertFalse(first.isEquivalentTo(first.kleeneStar()))
            );
        }

        @Test
        @DisplayName("空语言的自动机彼此等价")
        void testEmptyLanguages() {
            EpsilonNFA noStart = new EpsilonNFA();
            noStart.addTransition(0, "a", 1);
            noStart.addFinalState(1);
            EpsilonNFA noFinal = new EpsilonNFA();
            noFinal.addTransition(0, "b", 0);
            noFinal.addStartState(0);

            assertAll(
                    () -> assertTrue(noStart.isEquivalentTo(noFinal)),
                    () -> assertTrue(noStart.isEquivalentTo(Regex.empty().toEpsilonNfa())),
                    () -> assertFalse(noStart.isEquivalentTo(Regex.epsilon().toEpsilonNfa()))
            );
        }
    }
}
