package org.formlang.regex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 递归下降地读取文本形式的正则表达式。
 * <pre>
 * union  := concat (('|' | '+') concat?)*
 * concat := star ('.'? star)*
 * star   := atom '*'*
 * atom   := '(' union? ')' | 'epsilon' | '$' | symbol
 * </pre>
 * 符号之间用空格或特殊字符 {@code . | + * ( ) $} 分隔，{@code \} 转义下一个字符。
 * 空文本和 {@code ()} 表示空语言；{@code |} 右侧的分支可以为空（{@code "a|"} 即 a ∪ ∅）。
 */
public class RegexReader {

    private static final Logger logger = LoggerFactory.getLogger(RegexReader.class);

    private enum TokenType {
        SYMBOL, EPSILON, UNION, CONCATENATION, KLEENE_STAR, OPEN, CLOSE
    }

    private static final class Token {
        private final TokenType type;
        private final String text;
        private final int position;

        private Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private final String text;
    private final List<Token> tokens;
    private int current = 0;

    public RegexReader(String text) {
        this.text = Objects.requireNonNull(text, "Regex text cannot be null.");
        this.tokens = tokenize(text);
    }

    /**
     * @return 读到的正则表达式。
     * @throws MisformedRegexException 括号不匹配、运算符缺少左操作数等。
     */
    public Regex read() {
        if (tokens.isEmpty()) {
            return Regex.empty();
        }
        Regex regex = parseUnion();
        if (current < tokens.size()) {
            throw misformed("Unexpected '" + peek().text + "'", peek().position);
        }
        logger.debug("读取正则表达式 \"{}\" -> {}", text, regex);
        return regex;
    }

    private Regex parseUnion() {
        Regex left = parseConcatenation();
        while (check(TokenType.UNION)) {
            current++;
            Regex right = startsAtom() ? parseConcatenation() : Regex.empty();
            left = left.union(right);
        }
        return left;
    }

    private Regex parseConcatenation() {
        Regex left = parseStar();
        while (true) {
            if (check(TokenType.CONCATENATION)) {
                current++;
                if (!startsAtom()) {
                    throw misformed("Missing right operand of '.'", positionOfCurrent());
                }
                left = left.concatenate(parseStar());
            } else if (startsAtom()) {
                left = left.concatenate(parseStar());
            } else {
                return left;
            }
        }
    }

    private Regex parseStar() {
        Regex regex = parseAtom();
        while (check(TokenType.KLEENE_STAR)) {
            current++;
            regex = regex.kleeneStar();
        }
        return regex;
    }

    private Regex parseAtom() {
        if (current >= tokens.size()) {
            throw misformed("Missing operand", text.length());
        }
        Token token = tokens.get(current++);
        switch (token.type) {
            case SYMBOL:
                return Regex.symbol(token.text);
            case EPSILON:
                return Regex.epsilon();
            case OPEN:
                Regex inner = check(TokenType.CLOSE) ? Regex.empty() : parseUnion();
                if (!check(TokenType.CLOSE)) {
                    throw misformed("Missing ')'", positionOfCurrent());
                }
                current++;
                return inner;
            default:
                throw misformed("Missing left operand of '" + token.text + "'", token.position);
        }
    }

    private boolean check(TokenType type) {
        return current < tokens.size() && tokens.get(current).type == type;
    }

    private boolean startsAtom() {
        return check(TokenType.SYMBOL) || check(TokenType.EPSILON) || check(TokenType.OPEN);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private int positionOfCurrent() {
        return current < tokens.size() ? peek().position : text.length();
    }

    private MisformedRegexException misformed(String message, int position) {
        logger.error("正则表达式格式错误: {} (\"{}\" 第 {} 个字符)", message, text, position);
        return new MisformedRegexException(message, text, position);
    }

    private List<Token> tokenize(String input) {
        List<Token> result = new ArrayList<>();
        StringBuilder symbol = new StringBuilder();
        boolean escaped = false;
        int symbolStart = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '\\') {
                if (i + 1 >= input.length()) {
                    throw misformed("Dangling escape character", i);
                }
                if (symbol.length() == 0) {
                    symbolStart = i;
                }
                symbol.append(input.charAt(++i));
                escaped = true;
                continue;
            }
            TokenType special = specialType(c);
            if (c == ' ' || special != null) {
                flushSymbol(result, symbol, escaped, symbolStart);
                escaped = false;
                if (special != null) {
                    result.add(new Token(special, String.valueOf(c), i));
                }
                continue;
            }
            if (symbol.length() == 0) {
                symbolStart = i;
            }
            symbol.append(c);
        }
        flushSymbol(result, symbol, escaped, symbolStart);
        return result;
    }

    private static void flushSymbol(List<Token> result, StringBuilder symbol, boolean escaped, int position) {
        if (symbol.length() == 0) {
            return;
        }
        String value = symbol.toString();
        TokenType type = !escaped && value.equals("epsilon") ? TokenType.EPSILON : TokenType.SYMBOL;
        result.add(new Token(type, value, position));
        symbol.setLength(0);
    }

    private static TokenType specialType(char c) {
        return switch (c) {
            case '.' -> TokenType.CONCATENATION;
            case '|', '+' -> TokenType.UNION;
            case '*' -> TokenType.KLEENE_STAR;
            case '(' -> TokenType.OPEN;
            case ')' -> TokenType.CLOSE;
            case '$' -> TokenType.EPSILON;
            default -> null;
        };
    }
}
