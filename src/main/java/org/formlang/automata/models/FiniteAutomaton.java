package org.formlang.automata.models;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.base.Transition;
import org.formlang.automata.transition.TransitionFunction;
import org.formlang.regex.Regex;
import org.formlang.regex.StateElimination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 有限自动机的公共结构：状态集合、输入字母表（不含 epsilon）、起始状态、终止状态和转移函数。
 * <p>
 * 自动机通过 addTransition / addStartState / addFinalState 等方法逐步构造，
 * 之后由 accepts、toDeterministic、minimize、toRegex 等方法只读地查询。
 * 所有转换操作都返回新的对象，不会修改当前自动机。
 */
public abstract class FiniteAutomaton implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(FiniteAutomaton.class);

    protected final Set<State> states = new LinkedHashSet<>();
    protected final Set<Symbol> symbols = new LinkedHashSet<>();
    protected final Set<State> startStates = new LinkedHashSet<>();
    protected final Set<State> finalStates = new LinkedHashSet<>();
    protected final TransitionFunction transitionFunction;

    protected FiniteAutomaton(TransitionFunction transitionFunction) {
        this.transitionFunction = Objects.requireNonNull(transitionFunction, "Transition function cannot be null.");
    }

    // --- 结构 ---

    /**
     * 添加一条边，并自动登记新的状态和符号。epsilon 不会加入字母表。
     * 校验在修改之前完成，失败时自动机保持原状。
     * @return 如果这条边是新加入的则返回 true。
     */
    public boolean addTransition(State source, Symbol symbol, State target) {
        Objects.requireNonNull(source, "Source state cannot be null.");
        Objects.requireNonNull(symbol, "Symbol cannot be null.");
        Objects.requireNonNull(target, "Target state cannot be null.");
        boolean added = transitionFunction.addTransition(source, symbol, target);
        states.add(source);
        states.add(target);
        if (!symbol.isEpsilon()) {
            symbols.add(symbol);
        }
        return added;
    }

    /**
     * 便捷方法：参数会分别通过 State.of / Symbol.of 转换。
     */
    public boolean addTransition(Object source, Object symbol, Object target) {
        return addTransition(State.of(source), Symbol.of(symbol), State.of(target));
    }

    /**
     * 批量添加边，每个三元组为 (源状态, 符号, 目标状态)。
     * @return 如果至少有一条边是新加入的则返回 true。
     */
    public boolean addTransitions(Collection<? extends Triple<?, ?, ?>> transitions) {
        Objects.requireNonNull(transitions, "Transitions cannot be null.");
        boolean changed = false;
        for (Triple<?, ?, ?> transition : transitions) {
            changed |= addTransition(transition.getLeft(), transition.getMiddle(), transition.getRight());
        }
        return changed;
    }

    public boolean removeTransition(State source, Symbol symbol, State target) {
        return transitionFunction.removeTransition(source, symbol, target);
    }

    public boolean removeTransition(Object source, Object symbol, Object target) {
        return removeTransition(State.of(source), Symbol.of(symbol), State.of(target));
    }

    protected void addState(State state) {
        states.add(Objects.requireNonNull(state, "State cannot be null."));
    }

    public boolean addStartState(Object state) {
        State start = State.of(Objects.requireNonNull(state, "Start state cannot be null."));
        states.add(start);
        return startStates.add(start);
    }

    public boolean removeStartState(Object state) {
        State start = State.of(Objects.requireNonNull(state, "Start state cannot be null."));
        boolean removed = startStates.remove(start);
        if (!removed) {
            logger.warn("{} 不是起始状态，忽略删除请求", start);
        }
        return removed;
    }

    public boolean addFinalState(Object state) {
        State finalState = State.of(Objects.requireNonNull(state, "Final state cannot be null."));
        states.add(finalState);
        return finalStates.add(finalState);
    }

    public boolean removeFinalState(Object state) {
        State finalState = State.of(Objects.requireNonNull(state, "Final state cannot be null."));
        boolean removed = finalStates.remove(finalState);
        if (!removed) {
            logger.warn("{} 不是终止状态，忽略删除请求", finalState);
        }
        return removed;
    }

    public boolean isFinalState(Object state) {
        return finalStates.contains(State.of(state));
    }

    /**
     * 向字母表中添加符号，epsilon 会被忽略。
     */
    public boolean addSymbol(Object symbol) {
        Symbol s = Symbol.of(Objects.requireNonNull(symbol, "Symbol cannot be null."));
        if (s.isEpsilon()) {
            return false;
        }
        return symbols.add(s);
    }

    public Set<State> getStates() {
        return Collections.unmodifiableSet(states);
    }

    public Set<Symbol> getSymbols() {
        return Collections.unmodifiableSet(symbols);
    }

    public Set<State> getStartStates() {
        return Collections.unmodifiableSet(startStates);
    }

    public Set<State> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    public int getNumberStates() {
        return states.size();
    }

    public int getNumberSymbols() {
        return symbols.size();
    }

    public int getNumberTransitions() {
        return transitionFunction.getNumberTransitions();
    }

    public Set<State> apply(Object state, Object symbol) {
        return transitionFunction.apply(State.of(state), Symbol.of(symbol));
    }

    public boolean containsTransition(Object source, Object symbol, Object target) {
        return apply(source, symbol).contains(State.of(target));
    }

    public Map<Symbol, Set<State>> getTransitionsFrom(Object state) {
        return transitionFunction.getTransitionsFrom(State.of(state));
    }

    public Set<State> getNextStatesFrom(Object state) {
        return transitionFunction.getNextStatesFrom(State.of(state));
    }

    public Set<Transition> getEdges() {
        return transitionFunction.getEdges();
    }

    public Map<State, Map<Symbol, Set<State>>> toMap() {
        return transitionFunction.toMap();
    }

    public abstract FiniteAutomaton copy();

    /**
     * 把当前自动机的全部内容复制到 target 中，状态和符号对象保持不变。
     */
    protected void copyInto(FiniteAutomaton target) {
        target.states.addAll(states);
        target.symbols.addAll(symbols);
        for (State start : startStates) {
            target.addStartState(start);
        }
        target.finalStates.addAll(finalStates);
        for (Transition edge : getEdges()) {
            target.addTransition(edge.getSource(), edge.getSymbol(), edge.getTarget());
        }
    }

    // --- 查询 ---

    /**
     * 通过 epsilon 边能从给定状态集合到达的全部状态，包括这些状态本身。
     */
    protected Set<State> epsilonClosure(Collection<State> from) {
        Set<State> closure = new LinkedHashSet<>(from);
        Deque<State> toProcess = new ArrayDeque<>(from);
        while (!toProcess.isEmpty()) {
            State current = toProcess.pop();
            for (State next : transitionFunction.apply(current, Symbol.EPSILON)) {
                if (closure.add(next)) {
                    toProcess.push(next);
                }
            }
        }
        return closure;
    }

    @Override
    public boolean accepts(Iterable<?> word) {
        Objects.requireNonNull(word, "Word cannot be null.");
        Set<State> current = epsilonClosure(startStates);
        for (Object letter : word) {
            Symbol symbol = Symbol.of(letter);
            if (symbol.isEpsilon()) {
                continue;
            }
            Set<State> next = new LinkedHashSet<>();
            for (State state : current) {
                next.addAll(transitionFunction.apply(state, symbol));
            }
            current = epsilonClosure(next);
            if (current.isEmpty()) {
                return false;
            }
        }
        return !Collections.disjoint(current, finalStates);
    }

    /**
     * 至多一个起始状态、转移函数是确定性的，并且每个状态的 epsilon 闭包只含它自己时返回 true。
     * 只有 epsilon 自环的自动机仍然是确定性的。
     */
    @Override
    public boolean isDeterministic() {
        if (startStates.size() > 1 || !transitionFunction.isDeterministic()) {
            return false;
        }
        return states.stream().allMatch(state -> epsilonClosure(Set.of(state)).equals(Set.of(state)));
    }

    /**
     * @return 没有终止状态可以从起始状态到达时返回 true。
     */
    public boolean isEmpty() {
        return Collections.disjoint(getReachableStates(), finalStates);
    }

    /**
     * 从起始状态可达的部分（包括 epsilon 边）中不存在环时返回 true。
     */
    public boolean isAcyclic() {
        return !hasCycleWithin(null);
    }

    /**
     * 只看 allowed 中的状态（为 null 时不限制）时，从起始状态出发能否走到一个环。
     */
    private boolean hasCycleWithin(Set<State> allowed) {
        Map<State, Boolean> onStack = new HashMap<>();
        for (State start : startStates) {
            if ((allowed == null || allowed.contains(start)) && hasCycleFrom(start, onStack, allowed)) {
                return true;
            }
        }
        return false;
    }

    // 迭代式 DFS，onStack 中 true 表示在当前路径上，false 表示已经处理完
    private boolean hasCycleFrom(State root, Map<State, Boolean> onStack, Set<State> allowed) {
        if (onStack.containsKey(root)) {
            return false;
        }
        Deque<Pair<State, Iterator<State>>> stack = new ArrayDeque<>();
        onStack.put(root, true);
        stack.push(Pair.of(root, getNextStatesFrom(root).iterator()));
        while (!stack.isEmpty()) {
            Pair<State, Iterator<State>> top = stack.peek();
            if (top.getRight().hasNext()) {
                State next = top.getRight().next();
                if (allowed != null && !allowed.contains(next)) {
                    continue;
                }
                Boolean status = onStack.get(next);
                if (Boolean.TRUE.equals(status)) {
                    return true;
                }
                if (status == null) {
                    onStack.put(next, true);
                    stack.push(Pair.of(next, getNextStatesFrom(next).iterator()));
                }
            } else {
                onStack.put(top.getLeft(), false);
                stack.pop();
            }
        }
        return false;
    }

    protected Set<State> getReachableStates() {
        Set<State> visited = new LinkedHashSet<>(startStates);
        Deque<State> toProcess = new ArrayDeque<>(startStates);
        while (!toProcess.isEmpty()) {
            State current = toProcess.pop();
            for (State next : transitionFunction.getNextStatesFrom(current)) {
                if (visited.add(next)) {
                    toProcess.push(next);
                }
            }
        }
        return visited;
    }

    /**
     * @return 能够到达某个终止状态的全部状态。
     */
    protected Set<State> getCoReachableStates() {
        Map<State, Set<State>> predecessors = new HashMap<>();
        for (Transition edge : getEdges()) {
            predecessors.computeIfAbsent(edge.getTarget(), k -> new HashSet<>()).add(edge.getSource());
        }
        Set<State> visited = new LinkedHashSet<>(finalStates);
        Deque<State> toProcess = new ArrayDeque<>(finalStates);
        while (!toProcess.isEmpty()) {
            State current = toProcess.pop();
            for (State previous : predecessors.getOrDefault(current, Collections.emptySet())) {
                if (visited.add(previous)) {
                    toProcess.push(previous);
                }
            }
        }
        return visited;
    }

    /**
     * 广度优先地枚举长度不超过 maxLength 的被接受单词，每个单词只出现一次，短的在前。
     * 只会走向能到达终止状态的状态；每个状态上同一个单词只处理一次，因此 epsilon 环也会终止。
     *
     * @param maxLength 单词的最大长度，负数时返回空列表。
     * @return 被接受的单词，单词中不包含 epsilon。
     */
    public List<List<Symbol>> getAcceptedWords(int maxLength) {
        List<List<Symbol>> result = new ArrayList<>();
        if (maxLength < 0) {
            return result;
        }
        Set<State> leadingToFinal = getCoReachableStates();
        Map<State, Set<List<Symbol>>> wordsByState = new HashMap<>();
        Set<List<Symbol>> accepted = new LinkedHashSet<>();
        Deque<Pair<State, List<Symbol>>> toVisit = new ArrayDeque<>();
        for (State start : startStates) {
            toVisit.add(Pair.of(start, Collections.<Symbol>emptyList()));
        }
        while (!toVisit.isEmpty()) {
            Pair<State, List<Symbol>> current = toVisit.poll();
            State state = current.getLeft();
            List<Symbol> word = current.getRight();
            if (word.size() > maxLength) {
                continue;
            }
            if (!wordsByState.computeIfAbsent(state, k -> new HashSet<>()).add(word)) {
                continue;
            }
            transitionFunction.getTransitionsFrom(state).forEach((symbol, targets) -> {
                List<Symbol> nextWord = word;
                if (!symbol.isEpsilon()) {
                    List<Symbol> extended = new ArrayList<>(word);
                    extended.add(symbol);
                    nextWord = Collections.unmodifiableList(extended);
                }
                for (State target : targets) {
                    if (leadingToFinal.contains(target)) {
                        toVisit.add(Pair.of(target, nextWord));
                    }
                }
            });
            if (finalStates.contains(state)) {
                accepted.add(word);
            }
        }
        result.addAll(accepted);
        result.sort(Comparator.comparingInt(List::size));
        logger.debug("枚举到 {} 个长度不超过 {} 的单词", result.size(), maxLength);
        return result;
    }

    /**
     * 枚举全部被接受的单词，只允许在语言有限时调用，
     * 即能够到达终止状态的那部分自动机中没有环。
     * @throws IllegalStateException 通向终止状态的路径上有环，语言可能是无限的。
     */
    public List<List<Symbol>> getAcceptedWords() {
        if (hasCycleWithin(getCoReachableStates())) {
            logger.error("自动机中有环，无法枚举全部单词");
            throw new IllegalStateException("The automaton contains a cycle, a maximum word length is required.");
        }
        return getAcceptedWords(states.size());
    }

    // --- 转换 ---

    /**
     * @return 当前自动机的 epsilon-NFA 副本，状态和符号对象保持不变。
     */
    @Override
    public EpsilonNFA toEpsilonNfa() {
        EpsilonNFA enfa = new EpsilonNFA();
        copyInto(enfa);
        return enfa;
    }

    @Override
    public DeterministicFiniteAutomaton toDeterministic() {
        return toEpsilonNfa().toDeterministic();
    }

    @Override
    public DeterministicFiniteAutomaton minimize() {
        return toDeterministic().minimize();
    }

    @Override
    public Regex toRegex() {
        return StateElimination.toRegex(this);
    }

    /**
     * 把两个自动机分别最小化，然后同时广度优先遍历两个最小自动机，检查它们在所有符号上同构。
     * @return 两个自动机接受同一个语言时返回 true。
     */
    public boolean isEquivalentTo(FiniteAutomaton other) {
        Objects.requireNonNull(other, "Other automaton cannot be null.");
        DeterministicFiniteAutomaton left = this.minimize();
        DeterministicFiniteAutomaton right = other.minimize();
        Set<Symbol> alphabet = new LinkedHashSet<>(left.getSymbols());
        alphabet.addAll(right.getSymbols());

        Map<State, State> leftToRight = new HashMap<>();
        Map<State, State> rightToLeft = new HashMap<>();
        Deque<Pair<State, State>> toProcess = new ArrayDeque<>();
        leftToRight.put(left.getStartState(), right.getStartState());
        rightToLeft.put(right.getStartState(), left.getStartState());
        toProcess.add(Pair.of(left.getStartState(), right.getStartState()));
        while (!toProcess.isEmpty()) {
            Pair<State, State> pair = toProcess.poll();
            if (left.isFinalState(pair.getLeft()) != right.isFinalState(pair.getRight())) {
                return false;
            }
            for (Symbol symbol : alphabet) {
                State leftNext = left.getNextState(pair.getLeft(), symbol);
                State rightNext = right.getNextState(pair.getRight(), symbol);
                if (leftNext == null && rightNext == null) {
                    continue;
                }
                if (leftNext == null || rightNext == null) {
                    return false;
                }
                State mapped = leftToRight.get(leftNext);
                if (mapped == null) {
                    if (rightToLeft.containsKey(rightNext)) {
                        return false;
                    }
                    leftToRight.put(leftNext, rightNext);
                    rightToLeft.put(rightNext, leftNext);
                    toProcess.add(Pair.of(leftNext, rightNext));
                } else if (!mapped.equals(rightNext)) {
                    return false;
                }
            }
        }
        return true;
    }

    // --- 闭包运算，结果的状态都带有操作数编号，两个操作数之间不会共享状态 ---

    protected static State tag(int index, State state) {
        return State.of(Pair.of(index, state.getValue()));
    }

    private static void copyTagged(FiniteAutomaton source, int index, EpsilonNFA target,
                                   boolean withStartStates, boolean withFinalStates) {
        source.symbols.forEach(target::addSymbol);
        source.states.forEach(state -> target.addState(tag(index, state)));
        for (Transition edge : source.getEdges()) {
            target.addTransition(tag(index, edge.getSource()), edge.getSymbol(), tag(index, edge.getTarget()));
        }
        if (withStartStates) {
            source.startStates.forEach(state -> target.addStartState(tag(index, state)));
        }
        if (withFinalStates) {
            source.finalStates.forEach(state -> target.addFinalState(tag(index, state)));
        }
    }

    /**
     * @return 接受 L(this) ∪ L(other) 的 epsilon-NFA。
     */
    public EpsilonNFA union(FiniteAutomaton other) {
        Objects.requireNonNull(other, "Other automaton cannot be null.");
        EpsilonNFA result = new EpsilonNFA();
        copyTagged(this, 0, result, true, true);
        copyTagged(other, 1, result, true, true);
        return result;
    }

    /**
     * @return 接受 L(this)·L(other) 的 epsilon-NFA。
     */
    public EpsilonNFA concatenate(FiniteAutomaton other) {
        Objects.requireNonNull(other, "Other automaton cannot be null.");
        EpsilonNFA result = new EpsilonNFA();
        copyTagged(this, 0, result, true, false);
        copyTagged(other, 1, result, false, true);
        for (State finalState : finalStates) {
            for (State otherStart : other.startStates) {
                result.addTransition(tag(0, finalState), Symbol.EPSILON, tag(1, otherStart));
            }
        }
        return result;
    }

    /**
     * 新建一个既是起始状态又是终止状态的状态，用 epsilon 边连接原来的起始和终止状态。
     * @return 接受 L(this)* 的 epsilon-NFA。
     */
    public EpsilonNFA kleeneStar() {
        EpsilonNFA result = new EpsilonNFA();
        copyTagged(this, 0, result, false, true);
        State newStart = State.of(Pair.of(1, "start"));
        result.addStartState(newStart);
        result.addFinalState(newStart);
        for (State start : startStates) {
            result.addTransition(newStart, Symbol.EPSILON, tag(0, start));
        }
        for (State finalState : finalStates) {
            result.addTransition(tag(0, finalState), Symbol.EPSILON, newStart);
        }
        return result;
    }

    /**
     * @return 接受 L(this) 中所有单词反转的 epsilon-NFA。
     */
    public EpsilonNFA reverse() {
        EpsilonNFA result = new EpsilonNFA();
        symbols.forEach(result::addSymbol);
        states.forEach(result::addState);
        for (Transition edge : getEdges()) {
            result.addTransition(edge.getTarget(), edge.getSymbol(), edge.getSource());
        }
        startStates.forEach(result::addFinalState);
        finalStates.forEach(result::addStartState);
        return result;
    }

    /**
     * 乘积构造，只生成从起始状态对可达的状态对。状态的值是 commons-lang3 的 Pair。
     * @return 接受 L(this) ∩ L(other) 的 epsilon-NFA。
     */
    public EpsilonNFA intersection(FiniteAutomaton other) {
        Objects.requireNonNull(other, "Other automaton cannot be null.");
        EpsilonNFA left = this.toEpsilonNfa();
        EpsilonNFA right = other.toEpsilonNfa();
        EpsilonNFA result = new EpsilonNFA();
        List<Symbol> alphabet = new ArrayList<>();
        for (Symbol symbol : left.symbols) {
            if (right.symbols.contains(symbol)) {
                alphabet.add(symbol);
                result.addSymbol(symbol);
            }
        }
        Deque<Pair<State, State>> toProcess = new ArrayDeque<>();
        Set<Pair<State, State>> processed = new HashSet<>();
        for (State leftStart : left.ecloseAll(left.startStates)) {
            for (State rightStart : right.ecloseAll(right.startStates)) {
                Pair<State, State> pair = Pair.of(leftStart, rightStart);
                result.addStartState(combine(pair));
                processed.add(pair);
                toProcess.add(pair);
            }
        }
        while (!toProcess.isEmpty()) {
            Pair<State, State> pair = toProcess.poll();
            State current = combine(pair);
            if (left.finalStates.contains(pair.getLeft()) && right.finalStates.contains(pair.getRight())) {
                result.addFinalState(current);
            }
            for (Symbol symbol : alphabet) {
                Set<State> leftNext = left.ecloseAll(left.transitionFunction.apply(pair.getLeft(), symbol));
                Set<State> rightNext = right.ecloseAll(right.transitionFunction.apply(pair.getRight(), symbol));
                for (State l : leftNext) {
                    for (State r : rightNext) {
                        Pair<State, State> next = Pair.of(l, r);
                        result.addTransition(current, symbol, combine(next));
                        if (processed.add(next)) {
                            toProcess.add(next);
                        }
                    }
                }
            }
        }
        logger.debug("交集构造完成，共 {} 个状态", result.getNumberStates());
        return result;
    }

    private static State combine(Pair<State, State> pair) {
        return State.of(Pair.of(pair.getLeft().getValue(), pair.getRight().getValue()));
    }

    /**
     * 先确定化，再用一个新的陷阱状态在字母表上补全，最后翻转终止状态。
     * @return 在当前字母表上接受 Σ* \ L(this) 的 epsilon-NFA。
     */
    public EpsilonNFA complement() {
        return toDeterministic().getComplement().toEpsilonNfa();
    }

    /**
     * 在两个字母表的并集上，与 other 的补集求交。
     * @return 接受 L(this) \ L(other) 的 epsilon-NFA。
     */
    public EpsilonNFA difference(FiniteAutomaton other) {
        Objects.requireNonNull(other, "Other automaton cannot be null.");
        EpsilonNFA widened = other.toEpsilonNfa();
        symbols.forEach(widened::addSymbol);
        return intersection(widened.complement());
    }

    @Override
    public String toString() {
        return String.format("%s{states=%s, symbols=%s, start=%s, final=%s, transitions=%s}",
                getClass().getSimpleName(), states, symbols, startStates, finalStates, getEdges());
    }
}
