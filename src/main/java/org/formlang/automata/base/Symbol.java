package org.formlang.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 代表自动机字母表中的一个符号，或者特殊的 epsilon 符号。
 * 符号的种类由 {@link Kind} 标记，判断一条边是否为 epsilon 边只需要看种类。
 * Symbol 是不可变对象。
 */
@Getter
public final class Symbol implements Comparable<Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Symbol.class);

    /**
     * 符号的种类
     */
    public enum Kind {
        LABELED,
        EPSILON
    }

    /** 被解释为 epsilon 的文本 */
    private static final Set<String> EPSILON_TEXTS = Set.of("epsilon", "ε", "ɛ");

    // epsilon 符号的唯一实例，永远不属于自动机的输入字母表
    public static final Symbol EPSILON = new Symbol(Kind.EPSILON, "epsilon");

    private final Kind kind;
    private final Object value;

    private final int hashCode;

    private Symbol(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "Symbol value cannot be null.");
        this.hashCode = Objects.hash(kind, value);
        logger.debug("创建 Symbol: {} ({})", value, kind);
    }

    /**
     * 工厂方法：把任意值包装成符号。
     * 已经是 Symbol 的值原样返回；文本 "epsilon"、"ε"、"ɛ" 返回 {@link #EPSILON}。
     * @param value 符号的值。
     * @return 对应的 Symbol 实例。
     */
    public static Symbol of(Object value) {
        if (value instanceof Symbol) {
            return (Symbol) value;
        }
        Objects.requireNonNull(value, "Symbol value cannot be null.");
        if (value instanceof String && EPSILON_TEXTS.contains(value)) {
            return EPSILON;
        }
        return new Symbol(Kind.LABELED, value);
    }

    public boolean isEpsilon() {
        return kind == Kind.EPSILON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return switch (kind) {
            case EPSILON -> symbol.kind == Kind.EPSILON;
            case LABELED -> symbol.kind == Kind.LABELED && value.equals(symbol.value);
        };
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : String.valueOf(value);
    }

    @Override
    public int compareTo(Symbol other) {
        // epsilon 排在最前面
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.toString().compareTo(other.toString());
    }
}
