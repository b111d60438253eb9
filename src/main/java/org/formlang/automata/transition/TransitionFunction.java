package org.formlang.automata.transition;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.base.Transition;

import java.util.Map;
import java.util.Set;

/**
 * 自动机的转移函数 (state, symbol) -> 状态集合。
 * 不存在的键等价于没有转移，实现类永远不会保存空集合。
 */
public interface TransitionFunction {

    /**
     * 添加一条边。重复添加同一条边不会改变任何东西。
     * @return 如果这条边是新加入的则返回 true。
     */
    boolean addTransition(State source, Symbol symbol, State target);

    /**
     * 删除一条边。
     * @return 如果这条边原本存在则返回 true。
     */
    boolean removeTransition(State source, Symbol symbol, State target);

    /**
     * @return 从 source 经过 symbol 可以到达的状态集合，没有转移时返回空集合。
     */
    Set<State> apply(State source, Symbol symbol);

    int getNumberTransitions();

    /**
     * @return 从 source 出发的所有转移，按符号分组。
     */
    Map<Symbol, Set<State>> getTransitionsFrom(State source);

    /**
     * @return 从 source 出发经过任意一条边能到达的状态。
     */
    Set<State> getNextStatesFrom(State source);

    Set<Transition> getEdges();

    /**
     * @return 转移函数的深拷贝，以嵌套 Map 的形式表示。
     */
    Map<State, Map<Symbol, Set<State>>> toMap();

    /**
     * @return 每个 (state, symbol) 至多有一个目标状态时返回 true。
     */
    boolean isDeterministic();

    TransitionFunction copy();
}
