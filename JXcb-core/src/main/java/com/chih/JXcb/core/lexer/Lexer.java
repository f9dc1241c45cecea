package com.chih.JXcb.core.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板词法分析器
 * <p>
 * 将原始模板文本切分为有序的 Token 序列。词法分析永远不会失败：
 * 任何输入都会被完整地切分为 TEXT 与可识别的结构。
 * </p>
 *
 * <h3>以 # 开头的结构：</h3>
 * <ul>
 *   <li>{@code ##} 行注释，吃到行尾 (包括换行符)</li>
 *   <li>{@code #{ ... }#} 代码块，遇到第一个 {@code }#} 结束，不支持嵌套</li>
 *   <li>{@code #( ... )} 指令，进入指令模式，按括号深度找到顶层的 {@code )}</li>
 *   <li>{@code #name} 插值简写</li>
 * </ul>
 *
 * <h3>空白处理：</h3>
 * <ul>
 *   <li>纯空白的缓冲区不会产生 Token (指令两侧的换行、缩进因此不会进入输出)</li>
 *   <li>开启 trimDirectiveLines 时，紧贴指令 / 代码块 / 注释的文本会去掉含换行的首尾空白</li>
 * </ul>
 *
 * @since 2026/10/19
 */
public class Lexer {

    private final CharReader reader;

    private final boolean trimDirectiveLines;

    private final StringBuilder buffer = new StringBuilder();

    private final List<Token> tokens = new ArrayList<>();

    // 当前缓冲区起始行号
    private int bufferLine = 1;

    // 指令模式下，前面刚丢弃的纯空白原文
    private String leading = "";

    // 上一个结构是否为指令 / 代码块 / 注释 (用于裁剪后续文本的前导空白)
    private boolean afterConstruct;

    public Lexer(String text) {
        this(text, true);
    }

    public Lexer(String text, boolean trimDirectiveLines) {
        this.reader = new CharReader(text == null ? "" : text);
        this.trimDirectiveLines = trimDirectiveLines;
    }

    public List<Token> lex() {
        while (!reader.eof()) {
            int c = reader.peek();
            if (c != '#') {
                advance();
                continue;
            }

            int c2 = reader.peek(1);
            if (c2 == '#') {
                flushText(true);
                lexComment();
            } else if (c2 == '{') {
                flushText(true);
                lexCode();
            } else if (c2 == '(') {
                flushText(true);
                lexDirective();
            } else if (isNameChar(c2)) {
                flushText(false);
                lexName();
            } else {
                // 孤立的 #，按普通文本处理
                advance();
            }
        }
        flushText(false);
        return tokens;
    }

    private void lexComment() {
        while (!reader.eof()) {
            if (advance() == '\n') {
                break;
            }
        }
        emit(TokenKind.COMMENT);
        afterConstruct = true;
    }

    private void lexCode() {
        advance();
        advance();
        while (!reader.eof()) {
            if (reader.peek() == '}' && reader.peek(1) == '#') {
                advance();
                advance();
                break;
            }
            advance();
        }
        emit(TokenKind.CODE);
        afterConstruct = true;
    }

    private void lexDirective() {
        advance();
        advance();
        emitStructural(TokenKind.START_DIRECTIVE);
        leading = "";

        // 已经消费了开括号，深度从 1 开始
        int depth = 1;
        while (!reader.eof()) {
            int c = reader.peek();
            if (c == ')') {
                advance();
                if (depth == 1) {
                    break;
                }
                depth--;
                emit(TokenKind.CLOSE_PAREN);
            } else if (c == '(') {
                advance();
                depth++;
                emit(TokenKind.OPEN_PAREN);
            } else if (c == ',') {
                advance();
                emit(TokenKind.COMMA);
            } else if (c == '$') {
                advance();
                emit(TokenKind.DOLLAR);
            } else if (isNameChar(c)) {
                lexIdent();
            } else {
                lexOther();
            }
        }

        // 顶层闭括号 (或输入结束时的空串) 作为 END_DIRECTIVE 的文本
        emitStructural(TokenKind.END_DIRECTIVE);
        leading = "";
        afterConstruct = true;
    }

    private void lexIdent() {
        while (isNameChar(reader.peek())) {
            advance();
        }
        emit(TokenKind.IDENT);
    }

    private void lexOther() {
        while (!reader.eof()) {
            int c = reader.peek();
            if (isNameChar(c) || c == '(' || c == ')' || c == ',' || c == '$') {
                break;
            }
            advance();
        }
        String run = buffer.toString();
        if (!emit(TokenKind.OTHER)) {
            leading += run;
        }
    }

    private void lexName() {
        advance();
        while (isNameChar(reader.peek())) {
            advance();
        }
        emit(TokenKind.NAME);
        afterConstruct = false;
    }

    /**
     * 输出缓冲区中的文本
     *
     * @param beforeConstruct 文本后面紧跟指令 / 代码块 / 注释
     */
    private void flushText(boolean beforeConstruct) {
        if (trimDirectiveLines && buffer.length() > 0) {
            String text = buffer.toString();
            if (afterConstruct) {
                text = trimLeadingLineBreak(text);
            }
            if (beforeConstruct) {
                text = trimTrailingLineBreak(text);
            }
            buffer.setLength(0);
            buffer.append(text);
        }
        emit(TokenKind.TEXT);
        afterConstruct = false;
    }

    /**
     * 仅当内容含非空白字符时才产生 Token
     *
     * @return 是否产生了 Token
     */
    private boolean emit(TokenKind kind) {
        String text = buffer.toString();
        buffer.setLength(0);
        if (text.isBlank()) {
            return false;
        }
        tokens.add(new Token(kind, text, bufferLine, leading));
        leading = "";
        return true;
    }

    private void emitStructural(TokenKind kind) {
        tokens.add(new Token(kind, buffer.toString(), bufferLine, ""));
        buffer.setLength(0);
    }

    private int advance() {
        if (buffer.length() == 0) {
            bufferLine = reader.line();
        }
        int c = reader.next();
        if (c != CharReader.EOF) {
            buffer.append((char) c);
        }
        return c;
    }

    static boolean isNameChar(int c) {
        return c != CharReader.EOF && (Character.isLetter(c) || c == '_');
    }

    private static String trimLeadingLineBreak(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i).indexOf('\n') >= 0 ? text.substring(i) : text;
    }

    private static String trimTrailingLineBreak(String text) {
        int i = text.length();
        while (i > 0 && Character.isWhitespace(text.charAt(i - 1))) {
            i--;
        }
        return text.substring(i).indexOf('\n') >= 0 ? text.substring(0, i) : text;
    }
}
