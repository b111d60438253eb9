package org.formlang.automata.transition;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.base.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 非确定性转移函数，(state, symbol) 映射到一个状态集合。
 * 允许 epsilon 边。
 */
public class NondeterministicTransitionFunction implements TransitionFunction {

    private static final Logger logger = LoggerFactory.getLogger(NondeterministicTransitionFunction.class);

    private final Map<State, Map<Symbol, Set<State>>> transitions = new LinkedHashMap<>();
    private int numberTransitions = 0;

    @Override
    public boolean addTransition(State source, Symbol symbol, State target) {
        Objects.requireNonNull(source, "Source state cannot be null.");
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        Objects.requireNonNull(target, "Target state cannot be null.");
        boolean added = transitions
                .computeIfAbsent(source, k -> new LinkedHashMap<>())
                .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                .add(target);
        if (added) {
            numberTransitions++;
            logger.debug("添加转移 {} --[{}]--> {}", source, symbol, target);
        }
        return added;
    }

    @Override
    public boolean removeTransition(State source, Symbol symbol, State target) {
        Map<Symbol, Set<State>> bySymbol = transitions.get(source);
        if (bySymbol == null) {
            return false;
        }
        Set<State> targets = bySymbol.get(symbol);
        if (targets == null || !targets.remove(target)) {
            return false;
        }
        // 不保存空集合
        if (targets.isEmpty()) {
            bySymbol.remove(symbol);
            if (bySymbol.isEmpty()) {
                transitions.remove(source);
            }
        }
        numberTransitions--;
        logger.debug("删除转移 {} --[{}]--> {}", source, symbol, target);
        return true;
    }

    @Override
    public Set<State> apply(State source, Symbol symbol) {
        Map<Symbol, Set<State>> bySymbol = transitions.get(source);
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Set<State> targets = bySymbol.get(symbol);
        return targets == null ? Collections.emptySet() : new LinkedHashSet<>(targets);
    }

    @Override
    public int getNumberTransitions() {
        return numberTransitions;
    }

    @Override
    public Map<Symbol, Set<State>> getTransitionsFrom(State source) {
        Map<Symbol, Set<State>> result = new LinkedHashMap<>();
        Map<Symbol, Set<State>> bySymbol = transitions.get(source);
        if (bySymbol != null) {
            bySymbol.forEach((symbol, targets) -> result.put(symbol, new LinkedHashSet<>(targets)));
        }
        return result;
    }

    @Override
    public Set<State> getNextStatesFrom(State source) {
        Set<State> result = new LinkedHashSet<>();
        Map<Symbol, Set<State>> bySymbol = transitions.get(source);
        if (bySymbol != null) {
            bySymbol.values().forEach(result::addAll);
        }
        return result;
    }

    @Override
    public Set<Transition> getEdges() {
        Set<Transition> edges = new LinkedHashSet<>();
        transitions.forEach((source, bySymbol) ->
                bySymbol.forEach((symbol, targets) ->
                        targets.forEach(target -> edges.add(new Transition(source, symbol, target)))));
        return edges;
    }

    @Override
    public Map<State, Map<Symbol, Set<State>>> toMap() {
        Map<State, Map<Symbol, Set<State>>> result = new LinkedHashMap<>();
        transitions.forEach((source, bySymbol) -> result.put(source, getTransitionsFrom(source)));
        return result;
    }

    @Override
    public boolean isDeterministic() {
        for (Map<Symbol, Set<State>> bySymbol : transitions.values()) {
            for (Set<State> targets : bySymbol.values()) {
                if (targets.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public NondeterministicTransitionFunction copy() {
        NondeterministicTransitionFunction copy = new NondeterministicTransitionFunction();
        for (Transition edge : getEdges()) {
            copy.addTransition(edge.getSource(), edge.getSymbol(), edge.getTarget());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "NondeterministicTransitionFunction" + getEdges();
    }
}
