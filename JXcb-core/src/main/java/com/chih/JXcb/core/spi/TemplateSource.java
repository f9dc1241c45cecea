package com.chih.JXcb.core.spi;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 支持扩展不同的存储源（如文件系统、Classpath）。
 * </p>
 *
 * @since 2026/10/19
 */
public interface TemplateSource {

    /**
     * 按 ID 加载模板原文
     *
     * @param id 模板 ID (通常是相对路径，如 {@code page.html.xcb})
     * @return 模板文本；不存在时返回 null
     */
    String load(String id);
}
