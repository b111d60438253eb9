package org.formlang.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 代表自动机中的一条边 (q, a, q')。
 * 此类是不可变的。
 */
@Getter
public final class Transition {

    private final State source;
    private final Symbol symbol;
    private final State target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param symbol 边上的符号 (a)，可以是 epsilon
     * @param target 目标状态 (q')
     */
    public Transition(State source, Symbol symbol, State target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, symbol, target);
    }

    public boolean isEpsilon() {
        return symbol.isEpsilon();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source.equals(that.source) &&
                symbol.equals(that.symbol) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s", source, symbol, target);
    }
}
