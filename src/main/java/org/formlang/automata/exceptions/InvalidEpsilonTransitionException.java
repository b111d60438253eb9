package org.formlang.automata.exceptions;

import lombok.Getter;
import org.formlang.automata.base.State;

/**
 * 在不允许 epsilon 边的结构上添加 epsilon 边时抛出。
 */
@Getter
public class InvalidEpsilonTransitionException extends IllegalArgumentException {

    private final State source;
    private final State target;

    public InvalidEpsilonTransitionException(State source, State target) {
        super(String.format("Epsilon transition from %s to %s is not allowed here.", source, target));
        this.source = source;
        this.target = target;
    }
}
