package org.formlang.automata.models;

import org.apache.commons.lang3.tuple.Pair;
import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.operations.Determinizer;
import org.formlang.automata.operations.HopcroftMinimizer;
import org.formlang.automata.operations.HopcroftMinimizer.SplitterStrategy;
import org.formlang.automata.transition.DeterministicTransitionFunction;

import java.util.Objects;

/**
 * 确定性有限自动机：至多一个起始状态，转移函数为 {@link DeterministicTransitionFunction}。
 */
public class DeterministicFiniteAutomaton extends FiniteAutomaton {

    private final DeterministicTransitionFunction deterministicTransitions;

    public DeterministicFiniteAutomaton() {
        this(new DeterministicTransitionFunction());
    }

    private DeterministicFiniteAutomaton(DeterministicTransitionFunction transitionFunction) {
        super(transitionFunction);
        this.deterministicTransitions = transitionFunction;
    }

    /**
     * 子集构造，参见 {@link Determinizer}。
     */
    public static DeterministicFiniteAutomaton fromEpsilonNfa(EpsilonNFA enfa) {
        return Determinizer.determinize(enfa);
    }

    /**
     * 设置起始状态，原来的起始状态（如果有）会被替换。
     */
    @Override
    public boolean addStartState(Object state) {
        State start = State.of(Objects.requireNonNull(state, "Start state cannot be null."));
        if (startStates.contains(start)) {
            return false;
        }
        startStates.clear();
        return super.addStartState(start);
    }

    /**
     * @return 起始状态，没有时返回 null。
     */
    public State getStartState() {
        return startStates.isEmpty() ? null : startStates.iterator().next();
    }

    /**
     * @return state 经过 symbol 的唯一目标状态，没有转移时返回 null。
     */
    public State getNextState(Object state, Object symbol) {
        return deterministicTransitions.getNextState(State.of(state), Symbol.of(symbol));
    }

    @Override
    public boolean isDeterministic() {
        return true;
    }

    @Override
    public DeterministicFiniteAutomaton toDeterministic() {
        return copy();
    }

    /**
     * 使用默认的 {@link SplitterStrategy#SMALLER_CLASS} 策略最小化。
     */
    @Override
    public DeterministicFiniteAutomaton minimize() {
        return minimize(SplitterStrategy.SMALLER_CLASS);
    }

    public DeterministicFiniteAutomaton minimize(SplitterStrategy strategy) {
        return HopcroftMinimizer.minimize(this, strategy);
    }

    /**
     * 用一个新的陷阱状态在当前字母表上补全转移，再翻转终止状态。
     * 原来的状态 q 在结果中的名字为 (0, q)，陷阱状态为 (1, trash)。
     */
    public DeterministicFiniteAutomaton getComplement() {
        DeterministicFiniteAutomaton complement = new DeterministicFiniteAutomaton();
        symbols.forEach(complement::addSymbol);
        State trash = State.of(Pair.of(1, "trash"));
        State start = getStartState();
        complement.addStartState(start == null ? trash : tag(0, start));
        for (State state : states) {
            State tagged = tag(0, state);
            complement.addState(tagged);
            if (!finalStates.contains(state)) {
                complement.addFinalState(tagged);
            }
            for (Symbol symbol : symbols) {
                State next = deterministicTransitions.getNextState(state, symbol);
                complement.addTransition(tagged, symbol, next == null ? trash : tag(0, next));
            }
        }
        complement.addFinalState(trash);
        for (Symbol symbol : symbols) {
            complement.addTransition(trash, symbol, trash);
        }
        return complement;
    }

    @Override
    public DeterministicFiniteAutomaton copy() {
        DeterministicFiniteAutomaton copy = new DeterministicFiniteAutomaton();
        copyInto(copy);
        return copy;
    }
}
