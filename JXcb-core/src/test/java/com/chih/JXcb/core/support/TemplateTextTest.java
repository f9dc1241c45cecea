package com.chih.JXcb.core.support;

import com.chih.JXcb.core.exception.TemplateLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateText 测试")
class TemplateTextTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("去除 BOM 并统一换行符")
    void testNormalize() {
        assertThat(TemplateText.normalizeContent("\uFEFFa\r\nb\rc\n")).isEqualTo("a\nb\nc\n");
        assertThat(TemplateText.normalizeContent(null)).isNull();
    }

    @Test
    @DisplayName("以 UTF-8 读取文件")
    void testRead() throws IOException {
        Path file = tempDir.resolve("t.xcb");
        Files.write(file, "héllo\r\n#x".getBytes(StandardCharsets.UTF_8));

        assertThat(TemplateText.read(file)).isEqualTo("héllo\n#x");
    }

    @Test
    @DisplayName("文件不存在时抛出 TemplateLoadException")
    void testMissing() {
        assertThatThrownBy(() -> TemplateText.read(tempDir.resolve("none.xcb")))
                .isInstanceOf(TemplateLoadException.class)
                .hasMessageContaining("none.xcb");
    }
}
