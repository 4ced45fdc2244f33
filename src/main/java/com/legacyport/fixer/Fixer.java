package com.legacyport.fixer;

import com.legacyport.lexer.Token;

/**
 * 改写规则。引擎按文档顺序对每个 token 调用一次，规则只能通过 {@link FixContext} 记录编辑，
 * 不能直接修改原文。
 */
@FunctionalInterface
public interface Fixer {

    void fix(Token token, FixContext context);
}
