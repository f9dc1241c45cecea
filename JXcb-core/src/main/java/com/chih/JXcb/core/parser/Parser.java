package com.chih.JXcb.core.parser;

import com.chih.JXcb.core.domain.DiagnosticKind;
import com.chih.JXcb.core.engine.Diagnostics;
import com.chih.JXcb.core.lexer.Token;
import com.chih.JXcb.core.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 将 Token 序列转换为扁平的条目序列
 * <p>
 * 单遍扫描，除当前指令范围外不做前瞻。指令参数按原样捕获，不做语义解释；
 * 注释被丢弃；其他出现在顶层的 Token 报告 UNEXPECTED_TOKEN 后跳过。
 * </p>
 *
 * @since 2026/10/19
 */
public class Parser {

    private static final String CODE_OPEN = "#{";
    private static final String CODE_CLOSE = "}#";

    private final List<Token> tokens;

    private final Diagnostics diagnostics;

    private int pos;

    public Parser(List<Token> tokens, Diagnostics diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    public List<Item> parse() {
        List<Item> items = new ArrayList<>();

        while (pos < tokens.size()) {
            Token token = tokens.get(pos);

            switch (token.kind()) {
                case TEXT -> items.add(new Text(token.text()));
                case CODE -> items.add(new CodeBlock(codeBody(token), token.line()));
                case NAME -> items.add(new Interpolation(token.text().substring(1), token.line()));
                case START_DIRECTIVE -> {
                    Directive directive = parseDirective(token);
                    if (directive != null) {
                        items.add(directive);
                    }
                }
                case COMMENT -> {
                    // 注释不产生条目
                }
                default -> diagnostics.report(DiagnosticKind.UNEXPECTED_TOKEN, token.line(),
                        "unexpected token: " + token.text());
            }

            pos++;
        }

        return items;
    }

    /**
     * 解析一个指令，返回时 pos 停在 END_DIRECTIVE 上
     */
    private Directive parseDirective(Token start) {
        pos++;
        if (pos >= tokens.size() || tokens.get(pos).is(TokenKind.END_DIRECTIVE)) {
            diagnostics.report(DiagnosticKind.EMPTY_DIRECTIVE, start.line(), "empty directive");
            return null;
        }

        String name = tokens.get(pos).text();
        pos++;

        List<Token> args = new ArrayList<>();
        while (pos < tokens.size() && !tokens.get(pos).is(TokenKind.END_DIRECTIVE)) {
            args.add(tokens.get(pos));
            pos++;
        }

        return new Directive(name, args, start.line());
    }

    private String codeBody(Token token) {
        String text = token.text();
        if (text.length() >= CODE_OPEN.length() + CODE_CLOSE.length() && text.endsWith(CODE_CLOSE)) {
            return text.substring(CODE_OPEN.length(), text.length() - CODE_CLOSE.length());
        }
        diagnostics.report(DiagnosticKind.UNTERMINATED_CODE, token.line(), "code block is missing '}#'");
        return text.substring(CODE_OPEN.length());
    }
}
