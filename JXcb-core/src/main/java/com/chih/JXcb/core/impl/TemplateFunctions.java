package com.chih.JXcb.core.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板中可直接调用的全局函数，例如 {@code #(for i in range(3))}
 *
 * @since 2026/10/19
 */
public class TemplateFunctions {

    public List<Integer> range(int end) {
        return range(0, end, 1);
    }

    public List<Integer> range(int start, int end) {
        return range(start, end, 1);
    }

    /**
     * 半开区间 [start, end)，step 可为负数
     *
     * @throws IllegalArgumentException step 为 0
     */
    public List<Integer> range(int start, int end, int step) {
        if (step == 0) {
            throw new IllegalArgumentException("range() step must not be zero");
        }
        List<Integer> values = new ArrayList<>();
        // long 计数，end 接近 int 边界时不会回绕
        if (step > 0) {
            for (long i = start; i < end; i += step) {
                values.add((int) i);
            }
        } else {
            for (long i = start; i > end; i += step) {
                values.add((int) i);
            }
        }
        return values;
    }
}
