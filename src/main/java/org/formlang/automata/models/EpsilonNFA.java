package org.formlang.automata.models;

import org.formlang.automata.base.State;
import org.formlang.automata.operations.Determinizer;
import org.formlang.automata.transition.NondeterministicTransitionFunction;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * 带 epsilon 边的非确定性有限自动机，是最一般的自动机形式。
 * 可以有多个起始状态，epsilon 边上的符号是 {@link org.formlang.automata.base.Symbol#EPSILON}。
 */
public class EpsilonNFA extends FiniteAutomaton {

    public EpsilonNFA() {
        super(new NondeterministicTransitionFunction());
    }

    /**
     * epsilon 闭包：只经过 epsilon 边能从 state 到达的状态集合，包含 state 本身。
     */
    public Set<State> eclose(Object state) {
        return epsilonClosure(Collections.singleton(State.of(Objects.requireNonNull(state, "State cannot be null."))));
    }

    /**
     * 一组状态的 epsilon 闭包的并集。
     */
    public Set<State> ecloseAll(Collection<State> from) {
        return epsilonClosure(Objects.requireNonNull(from, "States cannot be null."));
    }

    /**
     * 通过闭包消去 epsilon 边。
     * @return 一个与当前自动机等价的、没有 epsilon 边的 NFA。
     */
    public NondeterministicFiniteAutomaton removeEpsilonTransitions() {
        return NondeterministicFiniteAutomaton.fromEpsilonNfa(this);
    }

    /**
     * 子集构造。
     */
    @Override
    public DeterministicFiniteAutomaton toDeterministic() {
        return Determinizer.determinize(this);
    }

    @Override
    public EpsilonNFA copy() {
        EpsilonNFA copy = new EpsilonNFA();
        copyInto(copy);
        return copy;
    }
}
