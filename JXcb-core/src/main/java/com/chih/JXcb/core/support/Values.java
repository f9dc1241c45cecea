package com.chih.JXcb.core.support;

import com.chih.JXcb.core.exception.TemplateEvaluationException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 求值结果的真值判断、迭代与字符串化规则
 *
 * @since 2026/10/19
 */
public final class Values {

    private Values() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigDecimal d) {
            return d.signum() != 0;
        }
        if (value instanceof BigInteger i) {
            return i.signum() != 0;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * 把 for 循环源转换为 Iterable
     *
     * @param source 原始表达式文本，仅用于错误信息
     * @throws TemplateEvaluationException 值不可迭代
     */
    public static Iterable<?> toIterable(Object value, String source) {
        if (value instanceof Iterable<?> iterable) {
            return iterable;
        }
        if (value instanceof Iterator<?> iterator) {
            return once(iterator);
        }
        if (value instanceof Map<?, ?> map) {
            return map.keySet();
        }
        if (value instanceof CharSequence s) {
            List<String> chars = new ArrayList<>(s.length());
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        throw new TemplateEvaluationException(source,
                "not iterable: " + (value == null ? "null" : value.getClass().getName()));
    }

    private static <T> Iterable<T> once(Iterator<T> iterator) {
        return () -> iterator;
    }

    /**
     * null 输出为空串
     */
    public static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
