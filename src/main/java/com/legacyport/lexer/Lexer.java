package com.legacyport.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 单遍扫描源码，只产出注释、字符串、关键字、数字与标识符五类 token。
 * 运算符、标点与空白不生成 token，保留在 token 之间的原文区间里。
 */
public class Lexer {
    public static final String DEFAULT_SOURCE_NAME = "<string>";

    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "br", "rb", "fr", "rf", "ur"
    );

    private final Set<String> keywords;

    public Lexer() {
        this(Keywords.ALL);
    }

    public Lexer(Set<String> keywords) {
        if (keywords == null) {
            throw new IllegalArgumentException("保留字集合不能为空");
        }
        this.keywords = Set.copyOf(keywords);
    }

    public List<Token> tokenize(String text) {
        return tokenize(text, DEFAULT_SOURCE_NAME);
    }

    /**
     * 将整份源码切分为按 start 排序且互不重叠的 token 序列。
     *
     * @param text 源码全文
     * @param sourceName 出错时报告的源文件名
     * @return 不可变 token 列表
     * @throws LexerException 字符串未闭合时抛出
     */
    public List<Token> tokenize(String text, String sourceName) {
        if (text == null) {
            throw new IllegalArgumentException("源码不能为空");
        }
        String name = sourceName == null ? DEFAULT_SOURCE_NAME : sourceName;

        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);

            if (currentChar == '#') {
                int end = commentEnd(text, index);
                tokens.add(new Token(TokenType.COMMENT, tokens.size(), index, end));
                index = end;
                continue;
            }

            if (currentChar == '"' || currentChar == '\'') {
                int end = readString(text, index, index, name);
                tokens.add(new Token(TokenType.STRING, tokens.size(), index, end));
                index = end;
                continue;
            }

            if (isIdentifierStart(currentChar)) {
                int wordStart = index;
                while (index < text.length() && isIdentifierPart(text.charAt(index))) {
                    index++;
                }
                String word = text.substring(wordStart, index);
                if (index < text.length() && isQuote(text.charAt(index)) && isStringPrefix(word)) {
                    int end = readString(text, wordStart, index, name);
                    tokens.add(new Token(TokenType.STRING, tokens.size(), wordStart, end));
                    index = end;
                    continue;
                }
                TokenType type = keywords.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
                tokens.add(new Token(type, tokens.size(), wordStart, index));
                continue;
            }

            if (isNumberStart(text, index)) {
                int end = readNumber(text, index);
                tokens.add(new Token(TokenType.NUMBER, tokens.size(), index, end));
                index = end;
                continue;
            }

            index++;
        }
        return List.copyOf(tokens);
    }

    /**
     * 注释止于换行符之前，\r\n 中的 \r 也不计入注释。
     */
    private int commentEnd(String text, int commentStart) {
        int newline = text.indexOf('\n', commentStart);
        if (newline < 0) {
            return text.length();
        }
        if (newline > commentStart && text.charAt(newline - 1) == '\r') {
            return newline - 1;
        }
        return newline;
    }

    /**
     * 读取字符串字面量，返回结束偏移（开区间）。
     */
    private int readString(String text, int tokenStart, int quoteIndex, String sourceName) {
        char quote = text.charAt(quoteIndex);
        boolean triple = quoteIndex + 2 < text.length()
                && text.charAt(quoteIndex + 1) == quote
                && text.charAt(quoteIndex + 2) == quote;
        int index = quoteIndex + (triple ? 3 : 1);

        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar == '\\') {
                // 续行的 \r\n 整体属于转义
                boolean crlf = index + 2 < text.length()
                        && text.charAt(index + 1) == '\r'
                        && text.charAt(index + 2) == '\n';
                index += crlf ? 3 : 2;
                continue;
            }
            if (triple) {
                if (currentChar == quote
                        && index + 2 < text.length()
                        && text.charAt(index + 1) == quote
                        && text.charAt(index + 2) == quote) {
                    return index + 3;
                }
            } else {
                if (currentChar == quote) {
                    return index + 1;
                }
                if (currentChar == '\n' || currentChar == '\r') {
                    throw new LexerException("字符串在行尾未闭合", sourceName, tokenStart, text);
                }
            }
            index++;
        }
        String message = triple ? "三引号字符串未闭合" : "字符串未闭合";
        throw new LexerException(message, sourceName, tokenStart, text);
    }

    private int readNumber(String text, int numberStart) {
        int index = numberStart;
        if (text.charAt(index) == '0' && index + 1 < text.length()
                && "xXoObB".indexOf(text.charAt(index + 1)) >= 0) {
            index += 2;
            while (index < text.length()
                    && (Character.digit(text.charAt(index), 16) >= 0 || text.charAt(index) == '_')) {
                index++;
            }
            return consumeSuffix(text, index);
        }

        index = consumeDigits(text, index);
        if (index < text.length() && text.charAt(index) == '.') {
            index = consumeDigits(text, index + 1);
        }
        if (index < text.length() && (text.charAt(index) == 'e' || text.charAt(index) == 'E')) {
            int exponent = index + 1;
            if (exponent < text.length() && (text.charAt(exponent) == '+' || text.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < text.length() && isAsciiDigit(text.charAt(exponent))) {
                index = consumeDigits(text, exponent);
            }
        }
        return consumeSuffix(text, index);
    }

    private int consumeDigits(String text, int from) {
        int index = from;
        while (index < text.length() && (isAsciiDigit(text.charAt(index)) || text.charAt(index) == '_')) {
            index++;
        }
        return index;
    }

    private int consumeSuffix(String text, int index) {
        if (index < text.length() && "jJlL".indexOf(text.charAt(index)) >= 0) {
            return index + 1;
        }
        return index;
    }

    private boolean isNumberStart(String text, int index) {
        char currentChar = text.charAt(index);
        if (isAsciiDigit(currentChar)) {
            return true;
        }
        return currentChar == '.' && index + 1 < text.length() && isAsciiDigit(text.charAt(index + 1));
    }

    private boolean isStringPrefix(String word) {
        return word.length() <= 2 && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT));
    }

    private static boolean isQuote(char ch) {
        return ch == '"' || ch == '\'';
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentifierStart(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    static boolean isIdentifierPart(char ch) {
        return ch == '_' || Character.isLetterOrDigit(ch);
    }
}
