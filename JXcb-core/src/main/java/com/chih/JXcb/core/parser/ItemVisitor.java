package com.chih.JXcb.core.parser;

/**
 * 条目访问者
 *
 * @param <R> 返回值类型
 * @since 2026/10/19
 */
public interface ItemVisitor<R> {

    R visitText(Text text);

    R visitInterpolation(Interpolation interpolation);

    R visitCodeBlock(CodeBlock codeBlock);

    R visitDirective(Directive directive);

    R visitBlockDirective(BlockDirective blockDirective);
}
