package com.legacyport.catalog;

import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 识别文件中 {@code from __future__ import ...} 引入的特性名。
 */
public final class FutureImports {
    public static final String MODULE = "__future__";

    private FutureImports() {
    }

    /**
     * 文件中所有 __future__ 导入的特性名，按出现顺序排列。
     */
    public static Set<String> features(TokenGraph graph) {
        Set<String> features = new LinkedHashSet<>();
        for (Token token : graph.tokens()) {
            if (!Statements.isKeyword(graph, token, "from")) {
                continue;
            }
            Optional<Token> module = graph.next(token);
            if (module.isEmpty() || !Statements.isIdentifier(graph, module.get(), MODULE)) {
                continue;
            }
            Optional<Token> importKeyword = graph.next(module.get());
            if (importKeyword.isEmpty() || !Statements.isKeyword(graph, importKeyword.get(), "import")) {
                continue;
            }
            collectNames(graph, importKeyword.get(), features);
        }
        return features;
    }

    public static boolean imports(TokenGraph graph, String feature) {
        return features(graph).contains(feature);
    }

    private static void collectNames(TokenGraph graph, Token importKeyword, Set<String> features) {
        int end = graph.lineEnd(importKeyword.end());
        if (graph.nextCharIs(importKeyword, '(')) {
            int close = graph.findClosingBracket(graph.findForward(importKeyword.end(), '('));
            end = close < 0 ? graph.text().length() : close;
        }
        int semicolon = graph.findForward(importKeyword.end(), ';');
        if (semicolon >= 0 && semicolon < end) {
            end = semicolon;
        }

        Optional<Token> cursor = graph.next(importKeyword);
        boolean aliasNext = false;
        while (cursor.isPresent() && cursor.get().start() < end) {
            Token token = cursor.get();
            if (Statements.isKeyword(graph, token, "as")) {
                aliasNext = true;
            } else if (token.is(TokenType.IDENTIFIER)) {
                if (!aliasNext) {
                    features.add(graph.text(token));
                }
                aliasNext = false;
            }
            cursor = graph.next(token);
        }
    }
}
