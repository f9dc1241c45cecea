package com.chih.JXcb.core.support;

import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.engine.Diagnostics;
import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.lexer.TokenKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 指令参数工具：把参数 Token 还原为表达式文本，或切分宏调用的实参列表
 *
 * @since 2026/10/19
 */
public final class DirectiveArguments {

    private DirectiveArguments() {
    }

    public static String join(List<Token> tokens) {
        return join(tokens, 0);
    }

    /**
     * 从下标 from 开始拼接 Token 原文；被丢弃过空白的 Token 前原样补回那段空白
     */
    public static String join(List<Token> tokens, int from) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.spaced() && sb.length() > 0) {
                sb.append(token.leading());
            }
            sb.append(token.text());
        }
        return sb.toString();
    }

    /**
     * 切分宏调用实参 {@code (a, f(b, c), d)}
     * <p>
     * 按括号深度切分，只有顶层的逗号才是分隔符；{@code ()} 表示零个实参。
     * 第一个 Token 不是 {@code (} 或缺少闭括号时报告诊断，返回已收集到的部分。
     * 闭括号之后的 Token 被忽略。
     * </p>
     */
    public static List<String> splitCallArguments(List<Token> args, Diagnostics diagnostics, int line) {
        if (args.isEmpty()) {
            return Collections.emptyList();
        }
        if (!args.get(0).is(TokenKind.OPEN_PAREN)) {
            diagnostics.report(DiagnosticKind.EXPECTED_OPEN_PAREN, line,
                    "expected '(' before macro arguments, found '" + args.get(0).text() + "'");
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        boolean closed = false;

        for (int i = 1; i < args.size(); i++) {
            Token token = args.get(i);
            if (token.is(TokenKind.OPEN_PAREN)) {
                depth++;
            } else if (token.is(TokenKind.CLOSE_PAREN)) {
                if (depth == 0) {
                    closed = true;
                    break;
                }
                depth--;
            } else if (token.is(TokenKind.COMMA) && depth == 0) {
                result.add(join(current));
                current.clear();
                continue;
            }
            current.add(token);
        }

        if (!current.isEmpty() || !result.isEmpty()) {
            result.add(join(current));
        }
        if (!closed) {
            diagnostics.report(DiagnosticKind.EXPECTED_CLOSE_PAREN, line, "expected ')' after macro arguments");
        }
        return result;
    }
}
