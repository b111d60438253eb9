package org.formlang.automata.models;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.exceptions.InvalidEpsilonTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 不带 epsilon 边的非确定性有限自动机。
 */
public class NondeterministicFiniteAutomaton extends EpsilonNFA {

    private static final Logger logger = LoggerFactory.getLogger(NondeterministicFiniteAutomaton.class);

    /**
     * @throws InvalidEpsilonTransitionException symbol 是 epsilon。
     */
    @Override
    public boolean addTransition(State source, Symbol symbol, State target) {
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        if (symbol.isEpsilon()) {
            logger.error("NFA 不允许 epsilon 边: {} -> {}", source, target);
            throw new InvalidEpsilonTransitionException(source, target);
        }
        return super.addTransition(source, symbol, target);
    }

    /**
     * 通过闭包消去 epsilon 边：
     * 起始状态为原起始状态的闭包，闭包中含有终止状态的状态成为终止状态，
     * 对闭包中的状态经过 a 到达的状态再取闭包，得到 s --a--> t。
     */
    public static NondeterministicFiniteAutomaton fromEpsilonNfa(EpsilonNFA enfa) {
        Objects.requireNonNull(enfa, "Epsilon NFA cannot be null.");
        NondeterministicFiniteAutomaton nfa = new NondeterministicFiniteAutomaton();
        enfa.getSymbols().forEach(nfa::addSymbol);
        for (State start : enfa.ecloseAll(enfa.getStartStates())) {
            nfa.addStartState(start);
        }
        for (State state : enfa.getStates()) {
            nfa.addState(state);
            Set<State> closure = enfa.eclose(state);
            if (!Collections.disjoint(closure, enfa.getFinalStates())) {
                nfa.addFinalState(state);
            }
            for (Symbol symbol : enfa.getSymbols()) {
                Set<State> reached = new LinkedHashSet<>();
                for (State inClosure : closure) {
                    reached.addAll(enfa.apply(inClosure, symbol));
                }
                for (State target : enfa.ecloseAll(reached)) {
                    nfa.addTransition(state, symbol, target);
                }
            }
        }
        logger.debug("消去 epsilon 边: {} 条边 -> {} 条边", enfa.getNumberTransitions(), nfa.getNumberTransitions());
        return nfa;
    }

    @Override
    public NondeterministicFiniteAutomaton removeEpsilonTransitions() {
        return copy();
    }

    @Override
    public NondeterministicFiniteAutomaton copy() {
        NondeterministicFiniteAutomaton copy = new NondeterministicFiniteAutomaton();
        copyInto(copy);
        return copy;
    }
}
