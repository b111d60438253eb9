package org.formlang.regex;

import lombok.Getter;

/**
 * 正则表达式文本格式错误时抛出。
 */
@Getter
public class MisformedRegexException extends IllegalArgumentException {

    private final String regex;
    private final int position;

    public MisformedRegexException(String message, String regex, int position) {
        super(String.format("%s (regex \"%s\", position %d)", message, regex, position));
        this.regex = regex;
        this.position = position;
    }
}
