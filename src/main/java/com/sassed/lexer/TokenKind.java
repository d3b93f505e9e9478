package com.sassed.lexer;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    URL,
    HASH,
    VARIABLE,
    AT_KEYWORD,
    FLAG,
    INTERPOLATION_START,
    INTERPOLATION_END,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COLON,
    COMMA,
    ELLIPSIS,
    OPERATOR,
    DELIM,
    COMMENT,
    EOF
}
