package org.formlang.automata.exceptions;

import lombok.Getter;

/**
 * 自动机的起始状态或终止状态个数不满足操作的前提条件时抛出。
 */
@Getter
public class AutomatonShapeException extends IllegalArgumentException {

    private final int numberStartStates;
    private final int numberFinalStates;

    public AutomatonShapeException(int numberStartStates, int numberFinalStates) {
        super(String.format("Expected exactly one start state and one final state, got %d start state(s) and %d final state(s).",
                numberStartStates, numberFinalStates));
        this.numberStartStates = numberStartStates;
        this.numberFinalStates = numberFinalStates;
    }
}
