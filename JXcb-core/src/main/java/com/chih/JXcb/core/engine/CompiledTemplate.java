package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.domain.Diagnostic;
import com.chih.JXcb.core.parser.Item;

import java.util.List;

/**
 * 编译结果：分析后的条目树 + 编译期诊断
 * <p>
 * 不可变，可以多次渲染；每次渲染都使用全新的环境和宏注册表。
 * </p>
 *
 * @param items       分析后的条目树
 * @param diagnostics 词法 / 解析 / 分析阶段的诊断
 */
public record CompiledTemplate(List<Item> items, List<Diagnostic> diagnostics) {

    public CompiledTemplate {
        items = List.copyOf(items);
        diagnostics = List.copyOf(diagnostics);
    }
}
