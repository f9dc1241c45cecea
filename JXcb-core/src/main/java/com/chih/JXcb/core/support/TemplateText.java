package com.chih.JXcb.core.support;

import com.chih.JXcb.core.exception.TemplateLoadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 模板原文读取与规范化
 *
 * @since 2026/10/19
 */
public final class TemplateText {

    // 10MB
    public static final long MAX_FILE_SIZE = 10L * 1024 * 1024;

    private static final char BOM = '\uFEFF';

    private TemplateText() {
    }

    /**
     * 去掉 UTF-8 BOM，并把 CRLF / CR 统一为 LF
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return null;
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        return content.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * 以 UTF-8 读取整个文件
     *
     * @throws TemplateLoadException 读取失败或文件超过 10MB
     */
    public static String read(Path path) {
        try {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                throw new TemplateLoadException(path.toString(),
                        new IOException("File too large (" + size + " bytes), limit is " + MAX_FILE_SIZE));
            }
            return normalizeContent(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateLoadException(path.toString(), e);
        }
    }
}
