package com.legacyport.lexer;

public enum TokenType {
    COMMENT,
    STRING,
    KEYWORD,
    NUMBER,
    IDENTIFIER
}
