package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.lexer.Token;
import com.legacyport.lexer.TokenType;

/**
 * 没有 b/u/f 前缀的字符串字面量加上 u 前缀，r'x' 变为 ur'x'。
 */
public class UnicodeLiteralsFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        if (!token.is(TokenType.STRING)) {
            return;
        }
        String literal = context.text(token);
        int index = 0;
        if (literal.charAt(index) == 'r' || literal.charAt(index) == 'R') {
            index++;
        }
        char first = literal.charAt(index);
        if (first == '"' || first == '\'') {
            context.replace(token, "u" + literal);
        }
    }
}
