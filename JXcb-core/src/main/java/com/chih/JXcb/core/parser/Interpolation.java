package com.chih.JXcb.core.parser;

/**
 * 插值：{@code #name}，求值后输出
 *
 * @since 2026/10/19
 */
public record Interpolation(String expression, int line) implements Item {

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitInterpolation(this);
    }
}
