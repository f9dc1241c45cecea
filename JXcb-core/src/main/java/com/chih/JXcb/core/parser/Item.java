package com.chih.JXcb.core.parser;

/**
 * 模板条目 (封闭的和类型)
 * <p>
 * 解析器产出扁平的 Text / Interpolation / CodeBlock / Directive 序列，
 * 分析器再把块指令折叠为 BlockDirective。通过 {@link ItemVisitor} 做穷尽分派，
 * 新增条目类型时所有访问者都会在编译期报错。
 * </p>
 *
 * @since 2026/10/19
 */
public sealed interface Item permits Text, Interpolation, CodeBlock, Directive, BlockDirective {

    <R> R accept(ItemVisitor<R> visitor);
}
