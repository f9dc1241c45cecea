package com.chih.JXcb.core.support;

/**
 * 公共缩进去除工具
 * <p>
 * 模板作者可以把代码块、表达式缩进到与周围标记对齐，交给求值器之前统一去除公共缩进。
 * </p>
 *
 * @since 2026/10/19
 */
public final class Indentation {

    private static final String TAB = "    ";

    private Indentation() {
    }

    /**
     * 去除公共缩进
     * <ol>
     *   <li>制表符替换为 4 个空格</li>
     *   <li>按行切分，取非空白行的最小前导空格数 (全部为空白行时为 0)</li>
     *   <li>每行最多去除这么多前导空格，再以 \n 拼接</li>
     * </ol>
     */
    public static String dedent(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String[] lines = text.replace("\t", TAB).split("\n", -1);

        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isBlank()) {
                indent = Math.min(indent, leadingSpaces(line));
            }
        }
        if (indent == Integer.MAX_VALUE) {
            indent = 0;
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            String line = lines[i];
            sb.append(line, Math.min(indent, leadingSpaces(line)), line.length());
        }
        return sb.toString();
    }

    static int leadingSpaces(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return i;
    }
}
