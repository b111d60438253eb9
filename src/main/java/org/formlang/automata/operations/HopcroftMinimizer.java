package org.formlang.automata.operations;

import org.apache.commons.lang3.tuple.Pair;
import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.models.DeterministicFiniteAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hopcroft 划分细化算法，计算与给定 DFA 等价的唯一最小 DFA。
 * <p>
 * 只考虑从起始状态可达的状态，并加入一个内部陷阱状态使转移函数完全。
 * 细化结束后，包含陷阱状态的类（即所有无法到达终止状态的状态）会被丢弃，
 * 所以结果是部分的（没有显式的死状态）。
 */
public final class HopcroftMinimizer {

    private static final Logger logger = LoggerFactory.getLogger(HopcroftMinimizer.class);

    /**
     * 初始化待处理列表的方式。两种方式得到的最小自动机相同。
     */
    public enum SplitterStrategy {
        /** 把终止类和非终止类都加入列表 */
        BOTH_CLASSES,
        /** 只加入较小的一个类 */
        SMALLER_CLASS
    }

    // 陷阱状态的值，依靠对象身份保证不与任何已有状态相等
    private static final class TrashMarker {
        @Override
        public String toString() {
            return "trash";
        }
    }

    private HopcroftMinimizer() {
    }

    public static DeterministicFiniteAutomaton minimize(DeterministicFiniteAutomaton dfa, SplitterStrategy strategy) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");
        Objects.requireNonNull(strategy, "Splitter strategy cannot be null.");
        State start = dfa.getStartState();
        if (start == null) {
            logger.info("没有起始状态，最小化结果为单状态空语言自动机");
            return emptyLanguage(dfa);
        }
        List<Symbol> alphabet = new ArrayList<>(dfa.getSymbols());
        alphabet.sort(null);

        // 可达状态加上陷阱状态，构造完全的转移表和反向转移表
        State trash = State.of(new TrashMarker());
        List<State> reachable = getReachableStates(dfa, start, alphabet);
        List<State> allStates = new ArrayList<>(reachable);
        allStates.add(trash);
        Map<State, Map<Symbol, State>> delta = new HashMap<>();
        Map<State, Map<Symbol, List<State>>> inverse = new HashMap<>();
        for (State state : allStates) {
            Map<Symbol, State> row = new HashMap<>();
            for (Symbol symbol : alphabet) {
                State next = state.equals(trash) ? null : dfa.getNextState(state, symbol);
                if (next == null) {
                    next = trash;
                }
                row.put(symbol, next);
                inverse.computeIfAbsent(next, k -> new HashMap<>())
                        .computeIfAbsent(symbol, k -> new ArrayList<>())
                        .add(state);
            }
            delta.put(state, row);
        }

        // 初始划分：终止状态和非终止状态，空类不创建
        Partition partition = new Partition();
        List<State> finals = new ArrayList<>();
        List<State> nonFinals = new ArrayList<>();
        for (State state : allStates) {
            if (dfa.isFinalState(state) && !state.equals(trash)) {
                finals.add(state);
            } else {
                nonFinals.add(state);
            }
        }
        List<Integer> initialClasses = new ArrayList<>();
        if (!finals.isEmpty()) {
            initialClasses.add(partition.addClass(finals));
        }
        initialClasses.add(partition.addClass(nonFinals));

        HopcroftProcessingList processingList = new HopcroftProcessingList(allStates.size(), alphabet);
        if (strategy == SplitterStrategy.SMALLER_CLASS && initialClasses.size() == 2) {
            int smaller = partition.getClassSize(initialClasses.get(0)) <= partition.getClassSize(initialClasses.get(1))
                    ? initialClasses.get(0) : initialClasses.get(1);
            alphabet.forEach(symbol -> processingList.insert(smaller, symbol));
        } else {
            for (int classIndex : initialClasses) {
                alphabet.forEach(symbol -> processingList.insert(classIndex, symbol));
            }
        }

        while (!processingList.isEmpty()) {
            Pair<Integer, Symbol> splitter = processingList.pop();
            Symbol symbol = splitter.getRight();
            Set<State> preimage = new HashSet<>();
            for (State member : partition.getClassMembers(splitter.getLeft())) {
                Map<Symbol, List<State>> incoming = inverse.get(member);
                if (incoming != null) {
                    preimage.addAll(incoming.getOrDefault(symbol, Collections.emptyList()));
                }
            }
            for (int classIndex : partition.getValidSets(preimage)) {
                // Y ∩ inv 留在原类中，Y \ inv 移到新类
                List<State> outside = new ArrayList<>();
                for (State member : partition.getClassMembers(classIndex)) {
                    if (!preimage.contains(member)) {
                        outside.add(member);
                    }
                }
                int newClass = partition.split(classIndex, outside);
                for (Symbol b : alphabet) {
                    if (!processingList.contains(newClass, b)) {
                        processingList.insert(newClass, b);
                    }
                }
            }
        }

        return buildMinimal(dfa, partition, delta, alphabet, start, trash);
    }

    private static DeterministicFiniteAutomaton buildMinimal(DeterministicFiniteAutomaton dfa, Partition partition,
                                                             Map<State, Map<Symbol, State>> delta, List<Symbol> alphabet,
                                                             State start, State trash) {
        int deadClass = partition.getClassIndex(trash);
        if (partition.getClassIndex(start) == deadClass) {
            logger.info("起始状态无法到达终止状态，最小化结果为单状态空语言自动机");
            return emptyLanguage(dfa);
        }
        Map<Integer, State> nameOf = new HashMap<>();
        for (int i = 0; i < partition.getNumberClasses(); i++) {
            if (i != deadClass && partition.getClassSize(i) > 0) {
                nameOf.put(i, State.merge(partition.getClassMembers(i)));
            }
        }
        DeterministicFiniteAutomaton minimal = new DeterministicFiniteAutomaton();
        dfa.getSymbols().forEach(minimal::addSymbol);
        minimal.addStartState(nameOf.get(partition.getClassIndex(start)));
        nameOf.forEach((classIndex, name) -> {
            // 同一个类中的状态在每个符号上都到达同一个类，取任意一个成员即可
            State representative = partition.getClassMembers(classIndex).get(0);
            if (dfa.isFinalState(representative)) {
                minimal.addFinalState(name);
            }
            for (Symbol symbol : alphabet) {
                int targetClass = partition.getClassIndex(delta.get(representative).get(symbol));
                if (targetClass != deadClass) {
                    minimal.addTransition(name, symbol, nameOf.get(targetClass));
                }
            }
        });
        logger.info("最小化完成: {} 个状态 -> {} 个状态", dfa.getNumberStates(), minimal.getNumberStates());
        return minimal;
    }

    /**
     * 空语言的最小自动机：一个非终止的起始状态。
     */
    private static DeterministicFiniteAutomaton emptyLanguage(DeterministicFiniteAutomaton dfa) {
        DeterministicFiniteAutomaton minimal = new DeterministicFiniteAutomaton();
        dfa.getSymbols().forEach(minimal::addSymbol);
        minimal.addStartState(State.merge(Collections.emptyList()));
        return minimal;
    }

    private static List<State> getReachableStates(DeterministicFiniteAutomaton dfa, State start, List<Symbol> alphabet) {
        Set<State> visited = new LinkedHashSet<>();
        Deque<State> toProcess = new ArrayDeque<>();
        visited.add(start);
        toProcess.add(start);
        while (!toProcess.isEmpty()) {
            State current = toProcess.poll();
            for (Symbol symbol : alphabet) {
                State next = dfa.getNextState(current, symbol);
                if (next != null && visited.add(next)) {
                    toProcess.add(next);
                }
            }
        }
        return new ArrayList<>(visited);
    }
}
