package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;

/**
 * range(...) → xrange(...)。属性访问 obj.range(...) 与方法定义 def range(...) 不改写。
 */
public class RangeFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (!Statements.isIdentifier(graph, token, "range")) {
            return;
        }
        if (!graph.nextCharIs(token, '(') || graph.previousCharIs(token, '.')) {
            return;
        }
        boolean definition = graph.previous(token)
            .filter(previous -> Statements.isKeyword(graph, previous, "def"))
            .isPresent();
        if (!definition) {
            context.replace(token, "xrange");
        }
    }
}
