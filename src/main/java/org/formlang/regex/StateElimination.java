package org.formlang.regex;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.base.Transition;
import org.formlang.automata.exceptions.AutomatonShapeException;
import org.formlang.automata.models.EpsilonNFA;
import org.formlang.automata.models.FiniteAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 状态消去法：从自动机构造等价的正则表达式。
 * <p>
 * 所有工作都在一个私有的边图 {@code Map<State, Map<State, Regex>>} 上完成，不会修改调用者的自动机。
 * 图中没有某个键表示"没有边"，{@link Regex#epsilon()} 表示恒等，两者不会混淆。
 * 消去到只剩起始和终止状态后，用
 * <pre>
 * L = (ss + se·ee*·es)* · se · ee*
 * </pre>
 * 得到结果，其中 ss、se、es、ee 分别是 起始->起始、起始->终止、终止->起始、终止->终止 的边。
 */
public final class StateElimination {

    private static final Logger logger = LoggerFactory.getLogger(StateElimination.class);

    // 多个起始状态时新建的起始状态的值，依靠对象身份保证不与已有状态相等
    private static final class FreshStart {
        @Override
        public String toString() {
            return "start";
        }
    }

    private StateElimination() {
    }

    /**
     * 任意形状的自动机：多个起始状态用 epsilon 边汇合到一个新的起始状态，
     * 多个终止状态逐个求解（每次只保留一个终止状态），结果取并。
     * 没有起始状态或没有终止状态时返回 {@link Regex#empty()}。
     */
    public static Regex toRegex(FiniteAutomaton automaton) {
        Objects.requireNonNull(automaton, "Automaton cannot be null.");
        EpsilonNFA work = automaton.toEpsilonNfa();
        if (work.getStartStates().isEmpty() || work.getFinalStates().isEmpty()) {
            logger.info("自动机没有起始状态或终止状态，正则表达式为空语言");
            return Regex.empty();
        }
        if (work.getStartStates().size() > 1) {
            State start = State.of(new FreshStart());
            for (State oldStart : new ArrayList<>(work.getStartStates())) {
                work.addTransition(start, Symbol.EPSILON, oldStart);
                work.removeStartState(oldStart);
            }
            work.addStartState(start);
        }
        List<State> finals = new ArrayList<>(work.getFinalStates());
        Regex result = null;
        for (State finalState : finals) {
            EpsilonNFA single = work.copy();
            for (State other : finals) {
                if (!other.equals(finalState)) {
                    single.removeFinalState(other);
                }
            }
            Regex partial = reduce(single);
            result = result == null ? partial : union(result, partial);
        }
        logger.info("状态消去完成: {} 个状态 -> 正则表达式 {}", automaton.getNumberStates(), result);
        return result;
    }

    /**
     * 对恰好一个起始状态和一个终止状态的自动机做状态消去。
     * @throws AutomatonShapeException 起始状态或终止状态的个数不是 1。
     */
    public static Regex reduce(FiniteAutomaton automaton) {
        Objects.requireNonNull(automaton, "Automaton cannot be null.");
        if (automaton.getStartStates().size() != 1 || automaton.getFinalStates().size() != 1) {
            logger.error("状态消去要求恰好一个起始状态和一个终止状态，实际为 {} 和 {}",
                    automaton.getStartStates().size(), automaton.getFinalStates().size());
            throw new AutomatonShapeException(automaton.getStartStates().size(), automaton.getFinalStates().size());
        }
        State start = automaton.getStartStates().iterator().next();
        State end = automaton.getFinalStates().iterator().next();
        Map<State, Map<State, Regex>> graph = buildGraph(automaton);
        prune(graph, start, end);
        if (!graph.containsKey(end) || !graph.containsKey(start)) {
            return Regex.empty();
        }
        for (State state : new ArrayList<>(graph.keySet())) {
            if (!state.equals(start) && !state.equals(end)) {
                eliminate(graph, state);
            }
        }
        Regex startLoop = graph.get(start).get(start);
        if (start.equals(end)) {
            return startLoop == null ? Regex.epsilon() : star(startLoop);
        }
        Regex startToEnd = graph.get(start).get(end);
        if (startToEnd == null) {
            return Regex.empty();
        }
        Regex endToStart = graph.get(end).get(start);
        Regex endLoop = graph.get(end).get(end);
        Regex endLoopStar = endLoop == null ? Regex.epsilon() : star(endLoop);
        Regex cycle = startLoop;
        if (endToStart != null) {
            cycle = union(cycle, concatenate(concatenate(startToEnd, endLoopStar), endToStart));
        }
        Regex prefix = cycle == null ? Regex.epsilon() : star(cycle);
        return concatenate(concatenate(prefix, startToEnd), endLoopStar);
    }

    private static Map<State, Map<State, Regex>> buildGraph(FiniteAutomaton automaton) {
        Map<State, Map<State, Regex>> graph = new LinkedHashMap<>();
        for (State state : automaton.getStates()) {
            graph.put(state, new LinkedHashMap<>());
        }
        for (Transition edge : automaton.getEdges()) {
            Regex label = edge.isEpsilon() ? Regex.epsilon() : Regex.symbol(edge.getSymbol());
            // 平行边合并成一条并
            graph.get(edge.getSource()).merge(edge.getTarget(), label, StateElimination::union);
        }
        return graph;
    }

    /**
     * 删除不在 起始状态 -> 终止状态 的任何路径上的状态。
     */
    private static void prune(Map<State, Map<State, Regex>> graph, State start, State end) {
        Set<State> reachable = search(start, graph);
        Map<State, Map<State, Regex>> reversed = new HashMap<>();
        graph.forEach((source, targets) -> targets.keySet().forEach(target ->
                reversed.computeIfAbsent(target, k -> new LinkedHashMap<>()).put(source, Regex.epsilon())));
        Set<State> coReachable = search(end, reversed);
        graph.keySet().removeIf(state -> !reachable.contains(state) || !coReachable.contains(state));
        for (Map<State, Regex> targets : graph.values()) {
            targets.keySet().removeIf(target -> !graph.containsKey(target));
        }
    }

    private static Set<State> search(State from, Map<State, Map<State, Regex>> graph) {
        Set<State> visited = new LinkedHashSet<>();
        Deque<State> toProcess = new ArrayDeque<>();
        visited.add(from);
        toProcess.add(from);
        while (!toProcess.isEmpty()) {
            State current = toProcess.pop();
            for (State next : graph.getOrDefault(current, Map.of()).keySet()) {
                if (visited.add(next)) {
                    toProcess.push(next);
                }
            }
        }
        return visited;
    }

    /**
     * 消去 state：对每条 p -> state -> q 的路径，在 p 和 q 之间加上 in · loop* · out。
     */
    private static void eliminate(Map<State, Map<State, Regex>> graph, State state) {
        Map<State, Regex> outgoing = graph.remove(state);
        Regex loop = outgoing.remove(state);
        Regex loopStar = loop == null ? Regex.epsilon() : star(loop);
        for (Map.Entry<State, Map<State, Regex>> entry : graph.entrySet()) {
            Regex incoming = entry.getValue().remove(state);
            if (incoming == null) {
                continue;
            }
            Regex prefix = concatenate(incoming, loopStar);
            outgoing.forEach((target, out) ->
                    entry.getValue().merge(target, concatenate(prefix, out), StateElimination::union));
        }
        logger.debug("消去状态 {}，剩余 {} 个状态", state, graph.size());
    }

    // --- 内部化简：ε·r = r，∅·r = ∅，∅|r = r，ε* = ∅* = ε ---

    private static Regex concatenate(Regex left, Regex right) {
        if (left.getOperator() == RegexOperator.EMPTY || right.getOperator() == RegexOperator.EMPTY) {
            return Regex.empty();
        }
        if (left.getOperator() == RegexOperator.EPSILON) {
            return right;
        }
        if (right.getOperator() == RegexOperator.EPSILON) {
            return left;
        }
        return left.concatenate(right);
    }

    private static Regex union(Regex left, Regex right) {
        if (left == null) {
            return right;
        }
        if (left.getOperator() == RegexOperator.EMPTY) {
            return right;
        }
        if (right.getOperator() == RegexOperator.EMPTY || left.equals(right)) {
            return left;
        }
        return left.union(right);
    }

    private static Regex star(Regex regex) {
        return switch (regex.getOperator()) {
            case EPSILON, EMPTY -> Regex.epsilon();
            case KLEENE_STAR -> regex;
            default -> regex.kleeneStar();
        };
    }
}
