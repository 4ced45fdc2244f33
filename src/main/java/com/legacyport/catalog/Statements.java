package com.legacyport.catalog;

import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 基于同行字符的语句边界判断，供多个规则共用。
 */
final class Statements {
    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
        "if", "elif", "else", "for", "while", "with", "try", "except", "finally", "def", "class"
    );

    private Statements() {
    }

    /**
     * token 是否位于一条简单语句的开头：行首、分号之后，或复合语句头部冒号之后。
     */
    static boolean startsStatement(TokenGraph graph, Token token) {
        Optional<Character> previous = graph.previousChar(token);
        if (previous.isEmpty() || previous.get() == ';') {
            return true;
        }
        if (previous.get() != ':') {
            return false;
        }
        List<Token> lineTokens = graph.lineTokens(token);
        if (lineTokens.isEmpty()) {
            return false;
        }
        Token first = lineTokens.get(0);
        if (!first.is(TokenType.KEYWORD) || !COMPOUND_KEYWORDS.contains(graph.text(first))) {
            return false;
        }
        for (Token candidate : lineTokens) {
            if (candidate.start() >= token.start()) {
                break;
            }
            if (candidate.is(TokenType.KEYWORD) && "lambda".equals(graph.text(candidate))) {
                return false;
            }
        }
        return true;
    }

    /**
     * offset 之后同一行内是否已无语句内容：只剩空白、分号或注释。
     */
    static boolean endsStatement(TokenGraph graph, int offset) {
        String text = graph.text();
        int lineEnd = graph.lineEnd(offset);
        for (int index = offset; index < lineEnd; index++) {
            char ch = text.charAt(index);
            if (Character.isWhitespace(ch)) {
                continue;
            }
            return ch == ';' || ch == '#';
        }
        return true;
    }

    /**
     * token 是否为所在行的第一个非注释 token。
     */
    static boolean isFirstOnLine(TokenGraph graph, Token token) {
        List<Token> lineTokens = graph.lineTokens(token);
        return !lineTokens.isEmpty() && lineTokens.get(0).equals(token) && graph.previousChar(token).isEmpty();
    }

    static boolean isKeyword(TokenGraph graph, Token token, String word) {
        return token.is(TokenType.KEYWORD) && word.equals(graph.text(token));
    }

    static boolean isIdentifier(TokenGraph graph, Token token, String word) {
        return token.is(TokenType.IDENTIFIER) && word.equals(graph.text(token));
    }

    /**
     * [from, to) 内是否只有空白。
     */
    static boolean isBlank(String text, int from, int to) {
        for (int index = from; index < to; index++) {
            if (!Character.isWhitespace(text.charAt(index))) {
                return false;
            }
        }
        return true;
    }
}
