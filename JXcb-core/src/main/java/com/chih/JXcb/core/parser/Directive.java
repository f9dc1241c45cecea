package com.chih.JXcb.core.parser;

import com.chih.JXcb.core.lexer.Token;

import java.util.List;

/**
 * 普通指令：{@code #(name args...)}
 * <p>
 * name 为标识符 (宏名、if / for / macro / end) 或字面量 {@code $} (内联求值)。
 * 参数按原始 Token 保存，解析阶段不做任何语义解释。
 * </p>
 *
 * @since 2026/10/19
 */
public record Directive(String name, List<Token> args, int line) implements Item {

    public static final String END = "end";

    public Directive {
        args = List.copyOf(args);
    }

    /**
     * 是否为 {@code #(end blockName)}
     */
    public boolean closes(String blockName) {
        return END.equals(name) && !args.isEmpty() && args.get(0).text().equals(blockName);
    }

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitDirective(this);
    }
}
