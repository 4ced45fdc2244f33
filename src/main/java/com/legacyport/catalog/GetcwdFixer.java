package com.legacyport.catalog;

import com.legacyport.fixer.FixContext;
import com.legacyport.fixer.Fixer;
import com.legacyport.lexer.Token;

/**
 * getcwd() → getcwdu()，旧方言中 getcwdu 才返回文本类型。
 */
public class GetcwdFixer implements Fixer {

    @Override
    public void fix(Token token, FixContext context) {
        if (Statements.isIdentifier(context.graph(), token, "getcwd") && context.graph().nextCharIs(token, '(')) {
            context.replace(token, "getcwdu");
        }
    }
}
