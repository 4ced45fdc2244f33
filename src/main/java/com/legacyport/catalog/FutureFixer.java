package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 在首条语句所在行之前插入一行 __future__ 导入，补齐旧方言缺省关闭的语义：
 * 文件含有 import 语句时加 absolute_import，代码中出现真除法 / 或 /= 时加 division。
 * 开头的注释、模块文档字符串与 BOM 保持在插入位置之前，文件已导入的特性不再重复。
 */
public class FutureFixer implements Fixer {
    public static final String ABSOLUTE_IMPORT = "absolute_import";
    public static final String DIVISION = "division";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private boolean docstringSeen;
    private boolean done;

    @Override
    public void fix(Token token, FixContext context) {
        if (done || token.is(TokenType.COMMENT)) {
            return;
        }
        if (!docstringSeen && token.is(TokenType.STRING)
                && token.index() == firstCodeIndex(context.graph())
                && Statements.endsStatement(context.graph(), token.end())) {
            docstringSeen = true;
            return;
        }
        done = true;

        TokenGraph graph = context.graph();
        List<String> missing = missingFeatures(graph);
        if (missing.isEmpty()) {
            return;
        }
        int offset = graph.lineStart(token.start());
        if (offset == 0 && !graph.text().isEmpty() && graph.text().charAt(0) == BYTE_ORDER_MARK) {
            offset = 1;
        }
        context.insert(offset, importLine(missing));
    }

    public static String importLine(List<String> features) {
        return "from " + FutureImports.MODULE + " import " + String.join(", ", features) + "\n";
    }

    static List<String> missingFeatures(TokenGraph graph) {
        Set<String> imported = FutureImports.features(graph);
        List<String> missing = new ArrayList<>(2);
        if (!imported.contains(ABSOLUTE_IMPORT) && hasImportStatement(graph)) {
            missing.add(ABSOLUTE_IMPORT);
        }
        if (!imported.contains(DIVISION) && usesTrueDivision(graph)) {
            missing.add(DIVISION);
        }
        return missing;
    }

    /**
     * 是否存在 import 语句，__future__ 导入不计。
     */
    static boolean hasImportStatement(TokenGraph graph) {
        for (Token token : graph.tokens()) {
            if (!Statements.startsStatement(graph, token)) {
                continue;
            }
            if (Statements.isKeyword(graph, token, "import")) {
                return true;
            }
            if (Statements.isKeyword(graph, token, "from")) {
                Optional<Token> module = graph.next(token);
                if (module.isEmpty() || !Statements.isIdentifier(graph, module.get(), FutureImports.MODULE)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 在 token 之间的代码文本中查找单独的 /，// 为整除，两种方言语义相同。
     */
    static boolean usesTrueDivision(TokenGraph graph) {
        String text = graph.text();
        int gapStart = 0;
        for (Token token : graph.tokens()) {
            if (containsDivision(text, gapStart, token.start())) {
                return true;
            }
            gapStart = token.end();
        }
        return containsDivision(text, gapStart, text.length());
    }

    private static boolean containsDivision(String text, int from, int to) {
        for (int index = from; index < to; index++) {
            if (text.charAt(index) != '/') {
                continue;
            }
            boolean slashBefore = index > from && text.charAt(index - 1) == '/';
            boolean slashAfter = index + 1 < to && text.charAt(index + 1) == '/';
            if (!slashBefore && !slashAfter) {
                return true;
            }
        }
        return false;
    }

    private static int firstCodeIndex(TokenGraph graph) {
        for (Token token : graph.tokens()) {
            if (!token.is(TokenType.COMMENT)) {
                return token.index();
            }
        }
        return -1;
    }
}
