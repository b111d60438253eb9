package org.formlang.automata.base;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateTest {

    @Nested
    @DisplayName("创建与相等性 (Creation and Equality)")
    class CreationTests {

        @Test
        @DisplayName("相同的值得到相等的状态")
        void testEqualityByValue() {
            State q0 = State.of("q0");
            State other = State.of("q0");

            assertAll("States with the same value",
                    () -> assertEquals(q0, other),
                    () -> assertEquals(q0.hashCode(), other.hashCode()),
                    () -> assertNotEquals(State.of("q1"), q0),
                    () -> assertNotEquals(State.of(0), State.of("0"), "Integer and String values differ")
            );
        }

        @Test
        @DisplayName("包装已有的状态时原样返回")
        void testOfExistingState() {
            State q0 = State.of("q0");
            assertSame(q0, State.of(q0));
        }

        @Test
        @DisplayName("null 值抛出 NullPointerException")
        void testNullValue() {
            assertThrows(NullPointerException.class, () -> State.of(null));
        }
    }

    @Nested
    @DisplayName("合并 (Merge)")
    class MergeTests {

        @Test
        @DisplayName("合并结果排序并去重")
        void testMergeIsSortedAndDeduplicated() {
            State merged = State.merge(List.of(State.of("b"), State.of("a"), State.of("b")));
            assertEquals("a;b", merged.toString());
        }

        @Test
        @DisplayName("内容相同的集合得到相等的合并状态")
        void testMergeIsOrderIndependent() {
            State first = State.merge(List.of(State.of(2), State.of(1)));
            State second = State.merge(List.of(State.of(1), State.of(2)));
            assertEquals(first, second);
        }

        @Test
        @DisplayName("成员名称中的分隔符和反斜杠被转义")
        void testMergeEscapesSeparator() {
            State single = State.merge(List.of(State.of("0;1")));
            State pair = State.merge(List.of(State.of("0"), State.of("1")));
            assertAll(
                    () -> assertEquals("0\\;1", single.toString()),
                    () -> assertEquals("0;1", pair.toString()),
                    () -> assertNotEquals(single, pair),
                    () -> assertNotEquals(State.merge(List.of(State.of("a\\"), State.of("b"))),
                            State.merge(List.of(State.of("a\\;b"))))
            );
        }

        @Test
        @DisplayName("空集合合并为空字符串状态")
        void testMergeEmpty() {
            assertEquals(State.of(""), State.merge(List.of()));
        }
    }

    @Test
    @DisplayName("边的字符串形式")
    void testTransitionToString() {
        Transition transition = new Transition(State.of("q0"), Symbol.of("a"), State.of("q1"));
        assertAll(
                () -> assertEquals("q0 --[a]--> q1", transition.toString()),
                () -> assertFalse(transition.isEpsilon()),
                () -> assertTrue(new Transition(State.of("q0"), Symbol.EPSILON, State.of("q1")).isEpsilon()),
                () -> assertEquals(transition, new Transition(State.of("q0"), Symbol.of("a"), State.of("q1")))
        );
    }
}
