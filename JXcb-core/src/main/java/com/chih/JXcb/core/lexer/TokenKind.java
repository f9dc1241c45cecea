package com.chih.JXcb.core.lexer;

/**
 * 词法单元类型
 *
 * @since 2026/10/19
 */
public enum TokenKind {
    TEXT,
    COMMENT,
    CODE,
    START_DIRECTIVE,
    END_DIRECTIVE,
    IDENT,
    NAME,
    OPEN_PAREN,
    CLOSE_PAREN,
    COMMA,
    DOLLAR,
    OTHER
}
