package org.formlang.regex;

import lombok.Getter;

/**
 * 正则表达式语法树中节点的种类。
 */
@Getter
public enum RegexOperator {
    SYMBOL("Symbol", 0),
    EPSILON("Epsilon", 0),
    EMPTY("Empty", 0),
    CONCATENATION("Concatenation", 2),
    UNION("Union", 2),
    KLEENE_STAR("Kleene Star", 1);

    private final String displayName;
    private final int arity;

    RegexOperator(String displayName, int arity) {
        this.displayName = displayName;
        this.arity = arity;
    }

    public boolean isLeaf() {
        return arity == 0;
    }
}
