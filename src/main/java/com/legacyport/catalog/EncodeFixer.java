package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

/**
 * 无参的 .encode() / .decode() 补上 "utf-8"，旧方言默认编码为 ascii。
 */
public class EncodeFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (!token.is(TokenType.IDENTIFIER)) {
            return;
        }
        String name = graph.text(token);
        if (!"encode".equals(name) && !"decode".equals(name)) {
            return;
        }
        if (!graph.previousCharIs(token, '.') || !graph.nextCharIs(token, '(')) {
            return;
        }
        int open = graph.findForward(token.end(), '(');
        int close = graph.findClosingBracket(open);
        if (close < 0 || !Statements.isBlank(graph.text(), open + 1, close)) {
            return;
        }
        context.replace(token.start(), close + 1, name + "(\"utf-8\")");
    }
}
