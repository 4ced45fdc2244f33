package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 按 {@link ImportMappingTable} 改写 import 与 from ... import 语句。
 * 模块改名取最长匹配的点分前缀；整条语句替换只作用于不带别名、只导入该模块的 import 语句。
 */
public class ImportFixer implements Fixer {
    private final ImportMappingTable table;

    public ImportFixer(ImportMappingTable table) {
        if (table == null) {
            throw new IllegalArgumentException("导入改写表不能为空");
        }
        this.table = table;
    }

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        if (!token.is(TokenType.KEYWORD) || !Statements.startsStatement(graph, token)) {
            return;
        }
        String keyword = graph.text(token);
        if ("from".equals(keyword)) {
            fixFromImport(token, context);
        } else if ("import".equals(keyword)) {
            fixImport(token, context);
        }
    }

    private void fixFromImport(Token fromKeyword, FixContext context) {
        TokenGraph graph = context.graph();
        Optional<Token> first = graph.next(fromKeyword);
        if (first.isEmpty() || graph.previousCharIs(first.get(), '.')) {
            return;
        }
        List<Token> path = readPath(graph, first.get());
        if (path.isEmpty()) {
            return;
        }
        Optional<Token> after = graph.next(path.get(path.size() - 1));
        if (after.isPresent() && Statements.isKeyword(graph, after.get(), "import")) {
            rename(path, context);
        }
    }

    private void fixImport(Token importKeyword, FixContext context) {
        TokenGraph graph = context.graph();
        int statementEnd = statementEnd(graph, importKeyword);
        List<List<Token>> items = new ArrayList<>();
        boolean aliased = false;

        Optional<Token> cursor = graph.next(importKeyword);
        while (cursor.isPresent() && cursor.get().start() < statementEnd && !cursor.get().is(TokenType.COMMENT)) {
            List<Token> path = readPath(graph, cursor.get());
            if (path.isEmpty()) {
                return;
            }
            items.add(path);
            cursor = graph.next(path.get(path.size() - 1));
            if (cursor.isPresent() && cursor.get().start() < statementEnd
                    && Statements.isKeyword(graph, cursor.get(), "as")) {
                aliased = true;
                cursor = graph.next(cursor.get()).flatMap(graph::next);
            }
            if (cursor.isEmpty() || cursor.get().start() >= statementEnd) {
                break;
            }
            if (!graph.previousCharIs(cursor.get(), ',')) {
                break;
            }
        }

        if (items.size() == 1 && !aliased) {
            List<Token> path = items.get(0);
            Optional<String> statement = table.lookup(joinPath(graph, path, path.size()))
                .filter(ImportMappingTable::isStatement);
            if (statement.isPresent()) {
                context.replace(importKeyword.start(), path.get(path.size() - 1).end(), statement.get());
                return;
            }
        }
        for (List<Token> path : items) {
            rename(path, context);
        }
    }

    /**
     * 用最长匹配的改名条目替换路径前缀。
     */
    private void rename(List<Token> path, FixContext context) {
        TokenGraph graph = context.graph();
        for (int parts = path.size(); parts > 0; parts--) {
            Optional<String> replacement = table.lookup(joinPath(graph, path, parts));
            if (replacement.isPresent() && !ImportMappingTable.isStatement(replacement.get())) {
                context.replace(path.get(0).start(), path.get(parts - 1).end(), replacement.get());
                return;
            }
        }
    }

    /**
     * 从 first 开始读取以点号连接的标识符序列。
     */
    private List<Token> readPath(TokenGraph graph, Token first) {
        List<Token> path = new ArrayList<>();
        if (!first.is(TokenType.IDENTIFIER)) {
            return path;
        }
        path.add(first);
        Token current = first;
        while (true) {
            Optional<Token> next = graph.next(current);
            if (next.isEmpty() || !next.get().is(TokenType.IDENTIFIER)) {
                return path;
            }
            String gap = graph.text().substring(current.end(), next.get().start()).strip();
            if (!".".equals(gap)) {
                return path;
            }
            path.add(next.get());
            current = next.get();
        }
    }

    private String joinPath(TokenGraph graph, List<Token> path, int parts) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < parts; index++) {
            if (index > 0) {
                builder.append('.');
            }
            builder.append(graph.text(path.get(index)));
        }
        return builder.toString();
    }

    private int statementEnd(TokenGraph graph, Token keyword) {
        int end = graph.lineEnd(keyword.end());
        int semicolon = graph.findForward(keyword.end(), ';');
        return semicolon >= 0 && semicolon < end ? semicolon : end;
    }
}
