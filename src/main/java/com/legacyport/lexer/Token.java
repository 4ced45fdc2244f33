package com.legacyport.lexer;

/**
 * 词法单元，只记录类型与在整份源码中的字符区间，end 为开区间。
 */
public record Token(
    TokenType type,
    int index,
    int start,
    int end
) {
    public Token {
        if (type == null) {
            throw new IllegalArgumentException("token 类型不能为空");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("非法 token 区间: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
