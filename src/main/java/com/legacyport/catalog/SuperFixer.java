package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * 类方法中的 super() → super(Cls, self)。
 * 按缩进跟踪 class 与 def 的嵌套，第二个参数取所在方法的第一个形参名。
 */
public class SuperFixer implements Fixer {

    private record Scope(boolean isClass, int indentation, String name, String firstParameter) {
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (token.is(TokenType.COMMENT)) {
            return;
        }
        if (Statements.isFirstOnLine(graph, token)) {
            int indentation = graph.indentation(token);
            while (!scopes.isEmpty() && scopes.peek().indentation() >= indentation) {
                scopes.pop();
            }
        }
        if (Statements.isKeyword(graph, token, "class")) {
            enterClass(token, graph);
            return;
        }
        if (Statements.isKeyword(graph, token, "def")) {
            enterFunction(token, graph);
            return;
        }
        if (Statements.isIdentifier(graph, token, "super")) {
            rewriteSuper(token, context);
        }
    }

    private void enterClass(Token token, TokenGraph graph) {
        Optional<Token> name = graph.next(token);
        if (name.isPresent() && name.get().is(TokenType.IDENTIFIER)) {
            scopes.push(new Scope(true, graph.indentation(token), graph.text(name.get()), null));
        }
    }

    private void enterFunction(Token token, TokenGraph graph) {
        Optional<Token> name = graph.next(token);
        if (name.isEmpty() || !graph.nextCharIs(name.get(), '(')) {
            return;
        }
        String firstParameter = null;
        Optional<Token> parameter = graph.next(name.get());
        if (parameter.isPresent()
                && parameter.get().is(TokenType.IDENTIFIER)
                && graph.previousCharIs(parameter.get(), '(')) {
            firstParameter = graph.text(parameter.get());
        }
        scopes.push(new Scope(false, graph.indentation(token), graph.text(name.get()), firstParameter));
    }

    private void rewriteSuper(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (graph.previousCharIs(token, '.') || !graph.nextCharIs(token, '(')) {
            return;
        }
        int open = graph.findForward(token.end(), '(');
        int close = graph.findClosingBracket(open);
        if (close < 0 || !Statements.isBlank(graph.text(), open + 1, close)) {
            return;
        }

        Iterator<Scope> iterator = scopes.iterator();
        if (!iterator.hasNext()) {
            return;
        }
        Scope function = iterator.next();
        if (function.isClass() || function.firstParameter() == null || !iterator.hasNext()) {
            return;
        }
        Scope owner = iterator.next();
        if (!owner.isClass()) {
            return;
        }
        context.replace(token.start(), close + 1,
            "super(" + owner.name() + ", " + function.firstParameter() + ")");
    }
}
