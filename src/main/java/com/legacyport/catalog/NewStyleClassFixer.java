package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.Optional;

/**
 * 没有基类的类显式继承 object：class Foo: 与 class Foo(): 都改为 class Foo(object):。
 */
public class NewStyleClassFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (!Statements.isKeyword(graph, token, "class")) {
            return;
        }
        Optional<Token> next = graph.next(token);
        if (next.isEmpty() || !next.get().is(TokenType.IDENTIFIER)) {
            return;
        }
        Token name = next.get();
        if (graph.nextCharIs(name, ':')) {
            context.replace(name, graph.text(name) + "(object)");
            return;
        }
        if (graph.nextCharIs(name, '(')) {
            int open = graph.findForward(name.end(), '(');
            int close = graph.findClosingBracket(open);
            if (close > open && Statements.isBlank(graph.text(), open + 1, close)) {
                context.replace(open, close + 1, "(object)");
            }
        }
    }
}
