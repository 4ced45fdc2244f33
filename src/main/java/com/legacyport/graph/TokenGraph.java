package com.legacyport.graph;

import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * token 序列之上的只读查询层：邻居、同行 token、同行非空白字符与原文字符搜索。
 * 构建后不再变化，可被多个规则反复查询。
 */
public final class TokenGraph {
    private final String text;
    private final List<Token> tokens;
    private final int[] lineStarts;
    private final int[] tokenStarts;
    private final List<List<Token>> tokensByLine;

    public TokenGraph(String text, List<Token> tokens) {
        if (text == null || tokens == null) {
            throw new IllegalArgumentException("源码与 token 列表不能为空");
        }
        this.text = text;
        this.tokens = List.copyOf(tokens);
        this.lineStarts = computeLineStarts(text);
        this.tokenStarts = new int[this.tokens.size()];
        for (int index = 0; index < this.tokens.size(); index++) {
            Token token = this.tokens.get(index);
            if (token.index() != index) {
                throw new IllegalArgumentException("token 序号与位置不一致: " + token);
            }
            if (index > 0 && this.tokens.get(index - 1).end() > token.start()) {
                throw new IllegalArgumentException("token 区间重叠: " + this.tokens.get(index - 1) + ", " + token);
            }
            tokenStarts[index] = token.start();
        }
        this.tokensByLine = groupByLine();
    }

    public String text() {
        return text;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * token 在原文中的文本。
     */
    public String text(Token token) {
        return text.substring(token.start(), token.end());
    }

    public Optional<Token> previous(Token token) {
        int index = token.index() - 1;
        return index >= 0 ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    public Optional<Token> next(Token token) {
        int index = token.index() + 1;
        return index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    /**
     * 与该 token 起始于同一物理行的全部非注释 token，按文档顺序排列。
     */
    public List<Token> lineTokens(Token token) {
        return tokensByLine.get(lineIndex(token.start()));
    }

    /**
     * 同一行内 token 左侧最近的非空白字符。
     */
    public Optional<Character> previousChar(Token token) {
        int lineStart = lineStart(token.start());
        for (int index = token.start() - 1; index >= lineStart; index--) {
            char ch = text.charAt(index);
            if (!isBlank(ch)) {
                return Optional.of(ch);
            }
        }
        return Optional.empty();
    }

    /**
     * 同一行内 token 右侧最近的非空白字符。
     */
    public Optional<Character> nextChar(Token token) {
        int lineEnd = lineEnd(token.end());
        for (int index = token.end(); index < lineEnd; index++) {
            char ch = text.charAt(index);
            if (!isBlank(ch)) {
                return Optional.of(ch);
            }
        }
        return Optional.empty();
    }

    // 文件开头的 BOM 按空白处理
    private static boolean isBlank(char ch) {
        return Character.isWhitespace(ch) || ch == '\uFEFF';
    }

    public boolean previousCharIs(Token token, char expected) {
        return previousChar(token).filter(ch -> ch == expected).isPresent();
    }

    public boolean nextCharIs(Token token, char expected) {
        return nextChar(token).filter(ch -> ch == expected).isPresent();
    }

    /**
     * token 所在行的缩进字符数。
     */
    public int indentation(Token token) {
        int lineStart = lineStart(token.start());
        int index = lineStart;
        while (index < token.start() && (text.charAt(index) == ' ' || text.charAt(index) == '\t')) {
            index++;
        }
        return index - lineStart;
    }

    /**
     * 从 from 起向右查找字符，找不到返回 -1。
     */
    public int findForward(int from, char ch) {
        return text.indexOf(ch, Math.max(0, from));
    }

    /**
     * 在 before 之前向左查找字符，找不到返回 -1。
     */
    public int findBackward(int before, char ch) {
        if (before <= 0) {
            return -1;
        }
        return text.lastIndexOf(ch, before - 1);
    }

    /**
     * 查找与 openOffset 处左括号配对的右括号，跳过字符串与注释，找不到返回 -1。
     */
    public int findClosingBracket(int openOffset) {
        if (openOffset < 0 || openOffset >= text.length()) {
            return -1;
        }
        int depth = 0;
        int index = openOffset;
        while (index < text.length()) {
            Optional<Token> covering = tokenAt(index);
            if (covering.isPresent()
                    && (covering.get().is(TokenType.STRING) || covering.get().is(TokenType.COMMENT))) {
                index = covering.get().end();
                continue;
            }
            char ch = text.charAt(index);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
                if (depth == 0) {
                    return index;
                }
                if (depth < 0) {
                    return -1;
                }
            }
            index++;
        }
        return -1;
    }

    /**
     * 覆盖指定偏移的 token。
     */
    public Optional<Token> tokenAt(int offset) {
        int position = Arrays.binarySearch(tokenStarts, offset);
        int candidate = position >= 0 ? position : -position - 2;
        if (candidate < 0 || candidate >= tokens.size()) {
            return Optional.empty();
        }
        Token token = tokens.get(candidate);
        return offset >= token.start() && offset < token.end() ? Optional.of(token) : Optional.empty();
    }

    /**
     * 偏移所在行首的偏移。
     */
    public int lineStart(int offset) {
        return lineStarts[lineIndex(offset)];
    }

    /**
     * 偏移所在行的行尾偏移（换行符位置，末行为文本长度）。
     */
    public int lineEnd(int offset) {
        int newline = text.indexOf('\n', Math.max(0, offset));
        return newline < 0 ? text.length() : newline;
    }

    /**
     * 偏移所在行号，从 1 开始。
     */
    public int lineNumber(int offset) {
        return lineIndex(offset) + 1;
    }

    private int lineIndex(int offset) {
        int position = Arrays.binarySearch(lineStarts, offset);
        return position >= 0 ? position : -position - 2;
    }

    private List<List<Token>> groupByLine() {
        List<List<Token>> lines = new ArrayList<>(lineStarts.length);
        for (int line = 0; line < lineStarts.length; line++) {
            lines.add(new ArrayList<>());
        }
        for (Token token : tokens) {
            if (!token.is(TokenType.COMMENT)) {
                lines.get(lineIndex(token.start())).add(token);
            }
        }
        List<List<Token>> frozen = new ArrayList<>(lines.size());
        for (List<Token> line : lines) {
            frozen.add(Collections.unmodifiableList(line));
        }
        return Collections.unmodifiableList(frozen);
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == '\n') {
                starts.add(index + 1);
            }
        }
        int[] result = new int[starts.size()];
        for (int index = 0; index < result.length; index++) {
            result[index] = starts.get(index);
        }
        return result;
    }
}
