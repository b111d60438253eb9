package org.formlang.regex;

import lombok.Getter;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.models.Automaton;
import org.formlang.automata.models.DeterministicFiniteAutomaton;
import org.formlang.automata.models.EpsilonNFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 正则表达式，表示为一棵不可变的语法树。
 * <p>
 * 叶子节点是符号、epsilon 或空语言，内部节点是连接、并和 Kleene 星。
 * union / concatenate / kleeneStar 按字面构造新树，不做任何化简。
 * <p>
 * 文本形式见 {@link RegexReader}，例如：
 * <pre>
 *     Regex regex = Regex.of("a*.(b|c)");
 *     regex.accepts(List.of("a", "a", "b")); // true
 * </pre>
 */
public final class Regex {

    private static final Logger logger = LoggerFactory.getLogger(Regex.class);

    private static final Regex EPSILON = new Regex(RegexOperator.EPSILON, null, Collections.emptyList());
    private static final Regex EMPTY = new Regex(RegexOperator.EMPTY, null, Collections.emptyList());

    private static final String SPECIAL_CHARACTERS = ".|+*()$\\ ";

    @Getter
    private final RegexOperator operator;
    /** 只有 SYMBOL 节点不为 null */
    @Getter
    private final Symbol symbol;
    @Getter
    private final List<Regex> sons;

    private final int hashCode;

    // 惰性构造的 Thompson 自动机，只在内部用于 accepts
    private EpsilonNFA cachedEnfa;

    private Regex(RegexOperator operator, Symbol symbol, List<Regex> sons) {
        if (sons.size() != operator.getArity()) {
            throw new IllegalArgumentException(String.format("%s expects %d operand(s), got %d.",
                    operator.getDisplayName(), operator.getArity(), sons.size()));
        }
        this.operator = operator;
        this.symbol = symbol;
        this.sons = sons;
        this.hashCode = Objects.hash(operator, symbol, sons);
    }

    /**
     * 由单个符号构成的正则表达式。如果符号是 epsilon，返回 {@link #epsilon()}。
     */
    public static Regex symbol(Object value) {
        Symbol s = Symbol.of(Objects.requireNonNull(value, "Symbol cannot be null."));
        if (s.isEpsilon()) {
            return EPSILON;
        }
        return new Regex(RegexOperator.SYMBOL, s, Collections.emptyList());
    }

    public static Regex epsilon() {
        return EPSILON;
    }

    public static Regex empty() {
        return EMPTY;
    }

    /**
     * 读取文本形式的正则表达式。
     * @throws MisformedRegexException 文本格式错误。
     */
    public static Regex of(String text) {
        return new RegexReader(text).read();
    }

    /**
     * 通过状态消去法从自动机构造等价的正则表达式。
     */
    public static Regex fromAutomaton(Automaton automaton) {
        return Objects.requireNonNull(automaton, "Automaton cannot be null.").toRegex();
    }

    public Regex union(Regex other) {
        return new Regex(RegexOperator.UNION, null,
                List.of(this, Objects.requireNonNull(other, "Other regex cannot be null.")));
    }

    public Regex concatenate(Regex other) {
        return new Regex(RegexOperator.CONCATENATION, null,
                List.of(this, Objects.requireNonNull(other, "Other regex cannot be null.")));
    }

    public Regex kleeneStar() {
        return new Regex(RegexOperator.KLEENE_STAR, null, List.of(this));
    }

    /**
     * @return 叶子节点的个数（符号、epsilon 和空语言都计数）。
     */
    public int getNumberSymbols() {
        if (operator.isLeaf()) {
            return 1;
        }
        return sons.stream().mapToInt(Regex::getNumberSymbols).sum();
    }

    /**
     * @return 内部节点（运算符）的个数。
     */
    public int getNumberOperators() {
        if (operator.isLeaf()) {
            return 0;
        }
        return 1 + sons.stream().mapToInt(Regex::getNumberOperators).sum();
    }

    /**
     * 语法树的缩进表示，每行一个节点，子节点比父节点多缩进一个空格。
     */
    public String getTreeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        sb.append(" ".repeat(depth))
                .append(operator == RegexOperator.SYMBOL ? symbol.toString() : operator.getDisplayName())
                .append('\n');
        for (Regex son : sons) {
            son.appendTree(sb, depth + 1);
        }
    }

    /**
     * Thompson 构造，每次调用都返回一个新的自动机。
     */
    public EpsilonNFA toEpsilonNfa() {
        return ThompsonConstruction.build(this);
    }

    public DeterministicFiniteAutomaton toMinimalDfa() {
        return toEpsilonNfa().minimize();
    }

    public boolean accepts(Iterable<?> word) {
        if (cachedEnfa == null) {
            cachedEnfa = toEpsilonNfa();
            logger.debug("为 {} 构造了 {} 个状态的自动机", this, cachedEnfa.getNumberStates());
        }
        return cachedEnfa.accepts(word);
    }

    public boolean isEquivalentTo(Regex other) {
        Objects.requireNonNull(other, "Other regex cannot be null.");
        return toEpsilonNfa().isEquivalentTo(other.toEpsilonNfa());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Regex regex = (Regex) o;
        return operator == regex.operator &&
                Objects.equals(symbol, regex.symbol) &&
                sons.equals(regex.sons);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 完全加括号的文本形式，可以被 {@link #of(String)} 读回为等价的表达式。
     */
    @Override
    public String toString() {
        return switch (operator) {
            case SYMBOL -> escape(symbol.toString());
            case EPSILON -> "$";
            case EMPTY -> "()";
            case CONCATENATION -> "(" + sons.get(0) + "." + sons.get(1) + ")";
            case UNION -> "(" + sons.get(0) + "|" + sons.get(1) + ")";
            case KLEENE_STAR -> "(" + sons.get(0) + ")*";
        };
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
