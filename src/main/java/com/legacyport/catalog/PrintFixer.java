package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.graph.TokenGraph;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

/**
 * print(a, b) → print a, b。
 * 只改写独占一条语句、括号在同一行内闭合、没有关键字参数、星号展开、生成器表达式
 * 与末尾逗号的调用；其余形态无法等价表达为旧方言的 print 语句，原样保留。
 * 文件已导入 print_function 时不做任何改写。
 */
public class PrintFixer implements Fixer {
    public static final String PRINT_FUNCTION = "print_function";

    private Boolean printFunctionImported;

    @Override
    public void fix(Token token, FixContext context) {
        TokenGraph graph = context.graph();
        boolean printWord = token.is(TokenType.KEYWORD) || token.is(TokenType.IDENTIFIER);
        if (!printWord || !"print".equals(graph.text(token))) {
            return;
        }
        if (!graph.nextCharIs(token, '(') || !Statements.startsStatement(graph, token)) {
            return;
        }
        // 已导入 print_function 的文件在旧方言里 print 仍是函数
        if (printFunctionImported == null) {
            printFunctionImported = FutureImports.imports(graph, PRINT_FUNCTION);
        }
        if (printFunctionImported) {
            return;
        }
        int open = graph.findForward(token.end(), '(');
        int close = graph.findClosingBracket(open);
        if (close < 0 || graph.lineNumber(close) != graph.lineNumber(token.start())) {
            return;
        }
        if (!Statements.endsStatement(graph, close + 1)) {
            return;
        }

        String text = graph.text();
        int argumentsStart = skipWhitespace(text, open + 1, close);
        if (argumentsStart == close) {
            context.replace(token.start(), close + 1, "print");
            return;
        }
        int argumentsEnd = close;
        while (argumentsEnd > argumentsStart && Character.isWhitespace(text.charAt(argumentsEnd - 1))) {
            argumentsEnd--;
        }
        if (text.charAt(argumentsEnd - 1) == ',' || !isPlainArgumentList(graph, open, close)) {
            return;
        }

        context.replace(token.start(), argumentsStart, "print ");
        context.replace(argumentsEnd, close + 1, "");
    }

    /**
     * 扫描括号内最外层的参数，遇到关键字参数、星号展开或 for 子句即返回 false。
     */
    private boolean isPlainArgumentList(TokenGraph graph, int open, int close) {
        String text = graph.text();
        int depth = 0;
        char previousSignificant = '(';
        int index = open + 1;
        while (index < close) {
            var covering = graph.tokenAt(index);
            if (covering.isPresent()) {
                Token inner = covering.get();
                if (depth == 0 && !isPlainToken(graph, inner)) {
                    return false;
                }
                previousSignificant = text.charAt(inner.end() - 1);
                index = inner.end();
                continue;
            }
            char ch = text.charAt(index);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
            } else if (ch == '*' && depth == 0 && (previousSignificant == '(' || previousSignificant == ',')) {
                return false;
            }
            if (!Character.isWhitespace(ch)) {
                previousSignificant = ch;
            }
            index++;
        }
        return true;
    }

    private boolean isPlainToken(TokenGraph graph, Token token) {
        if (Statements.isKeyword(graph, token, "for")) {
            return false;
        }
        if (!token.is(TokenType.IDENTIFIER)) {
            return true;
        }
        boolean afterSeparator = graph.previousCharIs(token, '(') || graph.previousCharIs(token, ',');
        if (!afterSeparator || !graph.nextCharIs(token, '=')) {
            return true;
        }
        int equals = graph.findForward(token.end(), '=');
        return equals + 1 < graph.text().length() && graph.text().charAt(equals + 1) == '=';
    }

    private static int skipWhitespace(String text, int from, int to) {
        int index = from;
        while (index < to && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }
}
