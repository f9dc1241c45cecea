package com.chih.JXcb.core.lexer;

/**
 * 逐字符读取器，顺带维护行号
 *
 * @since 2026/10/19
 */
class CharReader {

    static final int EOF = -1;

    private final String text;
    private int pos;
    private int line = 1;

    CharReader(String text) {
        this.text = text;
    }

    boolean eof() {
        return pos >= text.length();
    }

    int peek() {
        return peek(0);
    }

    int peek(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : EOF;
    }

    int next() {
        if (eof()) {
            return EOF;
        }
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
        }
        return c;
    }

    int line() {
        return line;
    }
}
