package com.chih.JXcb.core.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileTemplateSource 测试")
class FileTemplateSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("按相对路径加载模板")
    void testLoad() throws IOException {
        Files.createDirectories(tempDir.resolve("mail"));
        Files.writeString(tempDir.resolve("mail/welcome.xcb"), "Hi #name\r\n");

        FileTemplateSource source = new FileTemplateSource(tempDir.toString());

        assertThat(source.load("mail/welcome.xcb")).isEqualTo("Hi #name\n");
        assertThat(source.load("missing.xcb")).isNull();
        assertThat(source.load(" ")).isNull();
    }

    @Test
    @DisplayName("多个根目录按顺序查找")
    void testMultipleRoots() throws IOException {
        Path first = Files.createDirectories(tempDir.resolve("first"));
        Path second = Files.createDirectories(tempDir.resolve("second"));
        Files.writeString(first.resolve("a.xcb"), "first");
        Files.writeString(second.resolve("a.xcb"), "second");
        Files.writeString(second.resolve("b.xcb"), "only-second");

        FileTemplateSource source = new FileTemplateSource(List.of(first, second));

        assertThat(source.load("a.xcb")).isEqualTo("first");
        assertThat(source.load("b.xcb")).isEqualTo("only-second");
    }

    @Test
    @DisplayName("拒绝越出根目录的 ID")
    void testTraversalRejected() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.writeString(tempDir.resolve("secret.xcb"), "secret");

        assertThat(new FileTemplateSource(List.of(root)).load("../secret.xcb")).isNull();
    }

    @Test
    @DisplayName("至少需要一个根目录")
    void testNoRoots() {
        assertThatThrownBy(() -> new FileTemplateSource(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
