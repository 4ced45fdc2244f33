package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.Optional;

/**
 * 文本/字节类型的局部启发式映射：str( → unicode(，chr( → unichr(，
 * isinstance(..., str) → isinstance(..., basestring)。
 * 只看调用形态，变量真正持有的类型无法得知，多态场景下的结果不保证正确。
 */
public class UnicodeFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (!token.is(TokenType.IDENTIFIER) || !graph.nextCharIs(token, '(') || graph.previousCharIs(token, '.')) {
            return;
        }
        String name = graph.text(token);
        switch (name) {
            case "str" -> context.replace(token, "unicode");
            case "chr" -> context.replace(token, "unichr");
            case "isinstance" -> fixIsinstance(token, context);
            default -> {
            }
        }
    }

    private void fixIsinstance(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        int open = graph.findForward(token.end(), '(');
        int close = graph.findClosingBracket(open);
        if (close < 0) {
            return;
        }
        Optional<Token> cursor = graph.next(token);
        while (cursor.isPresent() && cursor.get().start() < close) {
            Token candidate = cursor.get();
            if (Statements.isIdentifier(graph, candidate, "str") && !graph.previousCharIs(candidate, '.')) {
                context.replace(candidate, "basestring");
            }
            cursor = graph.next(candidate);
        }
    }
}
