package org.formlang.automata.exceptions;

import lombok.Getter;
import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;

/**
 * 确定性转移函数中，同一个 (状态, 符号) 已经有一个不同的目标状态时抛出。
 */
@Getter
public class DuplicateTransitionException extends IllegalStateException {

    private final State source;
    private final Symbol symbol;
    private final State requestedTarget;
    private final State existingTarget;

    public DuplicateTransitionException(State source, Symbol symbol, State requestedTarget, State existingTarget) {
        super(String.format("Transition from %s with %s already goes to %s, cannot add a transition to %s.",
                source, symbol, existingTarget, requestedTarget));
        this.source = source;
        this.symbol = symbol;
        this.requestedTarget = requestedTarget;
        this.existingTarget = existingTarget;
    }
}
