package com.chih.JXcb.core.lexer;

/**
 * 词法单元 (不可变)
 * <p>
 * {@code leading} 只在指令模式下有意义：该 Token 之前被丢弃的那段纯空白原文，
 * 拼接参数文本时原样补回。
 * </p>
 *
 * @param kind   类型
 * @param text   原始文本
 * @param line   起始行号 (从 1 开始)
 * @param leading 前面被丢弃的空白，没有时为空串
 * @since 2026/10/19
 */
public record Token(TokenKind kind, String text, int line, String leading) {

    public Token(TokenKind kind, String text) {
        this(kind, text, 1, "");
    }

    public boolean spaced() {
        return !leading.isEmpty();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }
}
