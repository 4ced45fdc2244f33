package com.legacyport.fixer;

import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;

/**
 * 规则可见的上下文：只读的 token 图，以及记录编辑的入口。
 */
public final class FixContext {
    private final TokenGraph graph;
    private final EditLog editLog;
    private final String sourceName;

    FixContext(TokenGraph graph, EditLog editLog, String sourceName) {
        this.graph = graph;
        this.editLog = editLog;
        this.sourceName = sourceName;
    }

    public TokenGraph graph() {
        return graph;
    }

    public String sourceName() {
        return sourceName;
    }

    public String text(Token token) {
        return graph.text(token);
    }

    /**
     * 用新文本替换 token 自身的区间，等价于设置该 token 的 fix。
     */
    public void replace(Token token, String replacement) {
        editLog.replace(token.start(), token.end(), replacement);
    }

    /**
     * 替换任意非空原文区间，可以跨越多个 token 或 token 间的字符。
     */
    public void replace(int start, int end, String replacement) {
        editLog.replace(start, end, replacement);
    }

    /**
     * 在 offset 处插入零宽文本，不消耗原文。
     */
    public void insert(int offset, String text) {
        editLog.insert(offset, text);
    }
}
