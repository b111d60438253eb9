package org.formlang.automata.operations;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.models.DeterministicFiniteAutomaton;
import org.formlang.automata.models.EpsilonNFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 子集构造：把 epsilon-NFA 转换成等价的确定性自动机。
 * <p>
 * 每个可达的状态子集对应结果中的一个状态，名字由 {@link State#merge} 给出；
 * 已处理集合以合并后的状态为键，相同的子集总是得到相同的名字，所以每个子集只入队一次。
 */
public final class Determinizer {

    private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

    private Determinizer() {
    }

    public static DeterministicFiniteAutomaton determinize(EpsilonNFA enfa) {
        Objects.requireNonNull(enfa, "Epsilon NFA cannot be null.");
        DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
        List<Symbol> alphabet = new ArrayList<>(enfa.getSymbols());
        alphabet.sort(null);
        alphabet.forEach(dfa::addSymbol);

        Set<State> start = enfa.ecloseAll(enfa.getStartStates());
        if (start.isEmpty()) {
            logger.info("没有起始状态，确定化结果为空自动机");
            return dfa;
        }
        State startState = State.merge(start);
        dfa.addStartState(startState);

        Set<State> processed = new HashSet<>();
        Deque<Set<State>> toProcess = new ArrayDeque<>();
        processed.add(startState);
        toProcess.add(start);
        while (!toProcess.isEmpty()) {
            Set<State> current = toProcess.poll();
            State from = State.merge(current);
            if (!Collections.disjoint(current, enfa.getFinalStates())) {
                dfa.addFinalState(from);
            }
            for (Symbol symbol : alphabet) {
                Set<State> reached = new LinkedHashSet<>();
                for (State state : current) {
                    reached.addAll(enfa.apply(state, symbol));
                }
                Set<State> next = enfa.ecloseAll(reached);
                if (next.isEmpty()) {
                    continue;
                }
                State to = State.merge(next);
                dfa.addTransition(from, symbol, to);
                if (processed.add(to)) {
                    toProcess.add(next);
                }
            }
            logger.debug("处理子集 {}", from);
        }
        logger.info("确定化完成: {} 个状态 -> {} 个状态", enfa.getNumberStates(), dfa.getNumberStates());
        return dfa;
    }
}
