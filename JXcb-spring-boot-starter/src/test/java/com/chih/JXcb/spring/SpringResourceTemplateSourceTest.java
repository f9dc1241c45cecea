package com.chih.JXcb.spring;

import com.chih.JXcb.core.spi.TemplateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SpringResourceTemplateSource 测试")
class SpringResourceTemplateSourceTest {

    @TempDir
    Path tempDir;

    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();

    @Test
    @DisplayName("从 classpath 加载模板")
    void testClasspath() {
        TemplateSource source = new SpringResourceTemplateSource(resourceLoader, "classpath:templates");

        assertThat(source.load("count.xcb")).isEqualTo("#(for i in range(n))#i#(end for)");
        assertThat(source.load("missing.xcb")).isNull();
    }

    @Test
    @DisplayName("从文件系统加载模板并规范化换行")
    void testFileSystem() throws IOException {
        Files.writeString(tempDir.resolve("page.xcb"), "a\r\nb");

        SpringResourceTemplateSource source =
                new SpringResourceTemplateSource(resourceLoader, tempDir.toUri().toString());

        assertThat(source.getLocation()).endsWith("/");
        assertThat(source.load("page.xcb")).isEqualTo("a\nb");
    }

    @Test
    @DisplayName("拒绝包含 .. 或空白的 ID")
    void testInvalidIds() {
        TemplateSource source = new SpringResourceTemplateSource(resourceLoader, "classpath:templates/");

        assertThat(source.load("../application.yml")).isNull();
        assertThat(source.load("")).isNull();
    }

    @Test
    @DisplayName("位置不能为空")
    void testEmptyLocation() {
        assertThatThrownBy(() -> new SpringResourceTemplateSource(resourceLoader, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
