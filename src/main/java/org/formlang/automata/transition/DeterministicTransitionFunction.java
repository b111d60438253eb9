package org.formlang.automata.transition;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.base.Transition;
import org.formlang.automata.exceptions.DuplicateTransitionException;
import org.formlang.automata.exceptions.InvalidEpsilonTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 确定性转移函数，(state, symbol) 至多映射到一个状态。
 * 这一约束由存储结构本身保证：添加第二个不同的目标会抛出 {@link DuplicateTransitionException}，
 * 添加 epsilon 边会抛出 {@link InvalidEpsilonTransitionException}。
 */
public class DeterministicTransitionFunction implements TransitionFunction {

    private static final Logger logger = LoggerFactory.getLogger(DeterministicTransitionFunction.class);

    private final Map<State, Map<Symbol, State>> transitions = new LinkedHashMap<>();
    private int numberTransitions = 0;

    @Override
    public boolean addTransition(State source, Symbol symbol, State target) {
        Objects.requireNonNull(source, "Source state cannot be null.");
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        Objects.requireNonNull(target, "Target state cannot be null.");
        if (symbol.isEpsilon()) {
            logger.error("确定性转移函数不允许 epsilon 边: {} -> {}", source, target);
            throw new InvalidEpsilonTransitionException(source, target);
        }
        State existing = getNextState(source, symbol);
        if (existing != null) {
            if (existing.equals(target)) {
                return false;
            }
            logger.error("重复的确定性转移: {} --[{}]--> {}，已存在目标 {}", source, symbol, target, existing);
            throw new DuplicateTransitionException(source, symbol, target, existing);
        }
        transitions.computeIfAbsent(source, k -> new LinkedHashMap<>()).put(symbol, target);
        numberTransitions++;
        logger.debug("添加确定性转移 {} --[{}]--> {}", source, symbol, target);
        return true;
    }

    @Override
    public boolean removeTransition(State source, Symbol symbol, State target) {
        Map<Symbol, State> bySymbol = transitions.get(source);
        if (bySymbol == null || !Objects.equals(bySymbol.get(symbol), target)) {
            return false;
        }
        bySymbol.remove(symbol);
        if (bySymbol.isEmpty()) {
            transitions.remove(source);
        }
        numberTransitions--;
        logger.debug("删除确定性转移 {} --[{}]--> {}", source, symbol, target);
        return true;
    }

    /**
     * @return source 经过 symbol 的唯一目标状态，没有转移时返回 null。
     */
    public State getNextState(State source, Symbol symbol) {
        Map<Symbol, State> bySymbol = transitions.get(source);
        return bySymbol == null ? null : bySymbol.get(symbol);
    }

    @Override
    public Set<State> apply(State source, Symbol symbol) {
        State target = getNextState(source, symbol);
        return target == null ? Collections.emptySet() : Collections.singleton(target);
    }

    @Override
    public int getNumberTransitions() {
        return numberTransitions;
    }

    @Override
    public Map<Symbol, Set<State>> getTransitionsFrom(State source) {
        Map<Symbol, Set<State>> result = new LinkedHashMap<>();
        Map<Symbol, State> bySymbol = transitions.get(source);
        if (bySymbol != null) {
            bySymbol.forEach((symbol, target) -> result.put(symbol, new LinkedHashSet<>(Set.of(target))));
        }
        return result;
    }

    @Override
    public Set<State> getNextStatesFrom(State source) {
        Map<Symbol, State> bySymbol = transitions.get(source);
        return bySymbol == null ? new LinkedHashSet<>() : new LinkedHashSet<>(bySymbol.values());
    }

    @Override
    public Set<Transition> getEdges() {
        Set<Transition> edges = new LinkedHashSet<>();
        transitions.forEach((source, bySymbol) ->
                bySymbol.forEach((symbol, target) -> edges.add(new Transition(source, symbol, target))));
        return edges;
    }

    @Override
    public Map<State, Map<Symbol, Set<State>>> toMap() {
        Map<State, Map<Symbol, Set<State>>> result = new LinkedHashMap<>();
        transitions.keySet().forEach(source -> result.put(source, getTransitionsFrom(source)));
        return result;
    }

    @Override
    public boolean isDeterministic() {
        return true;
    }

    @Override
    public DeterministicTransitionFunction copy() {
        DeterministicTransitionFunction copy = new DeterministicTransitionFunction();
        for (Transition edge : getEdges()) {
            copy.addTransition(edge.getSource(), edge.getSymbol(), edge.getTarget());
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DeterministicTransitionFunction" + getEdges();
    }
}
