package com.chih.JXcb.core.parser;

import com.chih.JXcb.core.lexer.Token;

import java.util.List;

/**
 * 块指令：if / for / macro，body 为已完全解析的嵌套条目序列
 *
 * @since 2026/10/19
 */
public record BlockDirective(String name, List<Token> args, List<Item> body, int line) implements Item {

    public BlockDirective {
        args = List.copyOf(args);
        body = List.copyOf(body);
    }

    public BlockDirective(Directive opening, List<Item> body) {
        this(opening.name(), opening.args(), body, opening.line());
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitBlockDirective(this);
    }
}
