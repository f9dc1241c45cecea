package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.parser.Item;

import java.util.List;

/**
 * 宏定义：由 {@code #(macro name(params))...#(end macro)} 创建
 *
 * @since 2026/10/19
 */
public record Macro(String name, List<String> parameters, List<Item> body) {

    public Macro {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }
}
