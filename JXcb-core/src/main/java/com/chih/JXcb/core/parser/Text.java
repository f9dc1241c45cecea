package com.chih.JXcb.core.parser;

/**
 * 原样输出的文本
 *
 * @since 2026/10/19
 */
public record Text(String value) implements Item {

    @Override
    public <R> R accept(ItemVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
