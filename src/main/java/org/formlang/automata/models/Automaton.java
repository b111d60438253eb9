package org.formlang.automata.models;

import org.formlang.regex.Regex;

/**
 * 外部组件（文法、下推自动机、转换器）使用自动机时依赖的窄接口。
 */
public interface Automaton {

    /**
     * 判断自动机是否接受给定的单词。单词中的 epsilon 符号会被忽略。
     * @param word 单词，每个元素会通过 {@link org.formlang.automata.base.Symbol#of(Object)} 转换成符号。
     */
    boolean accepts(Iterable<?> word);

    boolean isDeterministic();

    /**
     * @return 一个新的、与当前自动机等价的确定性自动机。
     */
    DeterministicFiniteAutomaton toDeterministic();

    /**
     * @return 一个新的、与当前自动机等价的最小确定性自动机。
     */
    DeterministicFiniteAutomaton minimize();

    EpsilonNFA toEpsilonNfa();

    Regex toRegex();
}
