package com.chih.JXcb.core.parser;

/**
 * 代码块：{@code #{ ... }#}，只执行不输出
 *
 * @since 2026/10/19
 */
public record CodeBlock(String body, int line) implements Item {

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
