package com.chih.JXcb.core.support;

import com.chih.JXcb.core.engine.XcbTemplateEngine;
import com.chih.JXcb.core.exception.XcbException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * 黄金文件测试套件
 * <p>
 * 递归查找目录下所有 {@code <name>.xcb}，渲染后与同目录的 {@code <name>} (无扩展名) 逐字节比较。
 * 比较的是命令行打印的形式，即渲染结果末尾再加一个换行。
 * </p>
 *
 * <h3>失败时：</h3>
 * <ul>
 *   <li>写出 {@code <name>.err}，包含期望与实际文本及分隔横幅</li>
 *   <li>渲染异常视为失败，实际文本为 {@code error: <message>}</li>
 *   <li>缺少期望文件视为失败，期望文本为空</li>
 * </ul>
 * 通过时删除残留的 {@code .err} 文件。
 *
 * @since 2026/10/19
 */
public class GoldenFileSuite {

    private static final Logger log = LoggerFactory.getLogger(GoldenFileSuite.class);

    public static final String TEMPLATE_SUFFIX = ".xcb";
    public static final String ERROR_SUFFIX = ".err";

    static final String EXPECTED_BANNER = "==== Expected ====\n";
    static final String ACTUAL_BANNER = "==== Actual ======\n";
    static final String CLOSING_BANNER = "==================\n";

    private final XcbTemplateEngine engine;

    public GoldenFileSuite(XcbTemplateEngine engine) {
        this.engine = engine;
    }

    /**
     * 单个用例的结果
     *
     * @param name     期望文件相对于套件目录的路径
     * @param passed   是否通过
     * @param expected 期望文本
     * @param actual   实际文本
     */
    public record Result(String name, boolean passed, String expected, String actual) {

        public String line() {
            return (passed ? "[ ] " : "[x] ") + name;
        }
    }

    public record Report(List<Result> results) {

        public Report {
            results = List.copyOf(results);
        }

        public long passed() {
            return results.stream().filter(Result::passed).count();
        }

        public long failed() {
            return results.size() - passed();
        }

        public boolean allPassed() {
            return failed() == 0;
        }

        public List<String> lines() {
            List<String> lines = new ArrayList<>();
            for (Result result : results) {
                lines.add(result.line());
            }
            lines.add(passed() + " passed, " + failed() + " failed");
            return Collections.unmodifiableList(lines);
        }
    }

    public Report run(Path directory) {
        List<Path> templates;
        try (Stream<Path> files = Files.walk(directory)) {
            templates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TEMPLATE_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + directory, e);
        }

        log.info("Running {} golden test(s) under {}", templates.size(), directory);
        List<Result> results = new ArrayList<>();
        for (Path template : templates) {
            results.add(runOne(directory, template));
        }
        return new Report(results);
    }

    private Result runOne(Path directory, Path template) {
        String fileName = template.getFileName().toString();
        Path expectedPath = template.resolveSibling(fileName.substring(0, fileName.length() - TEMPLATE_SUFFIX.length()));
        Path errorPath = expectedPath.resolveSibling(expectedPath.getFileName() + ERROR_SUFFIX);
        String name = directory.relativize(expectedPath).toString();

        String expected = "";
        if (Files.isRegularFile(expectedPath)) {
            expected = TemplateText.read(expectedPath);
        } else {
            log.warn("Missing expected output file: {}", expectedPath);
        }

        String actual;
        try {
            actual = engine.render(TemplateText.read(template), null).output() + "\n";
        } catch (XcbException e) {
            log.warn("Render of {} failed: {}", template, e.getMessage());
            actual = "error: " + e.getMessage() + "\n";
        }

        boolean passed = Files.isRegularFile(expectedPath) && expected.equals(actual);
        try {
            if (passed) {
                Files.deleteIfExists(errorPath);
            } else {
                Files.writeString(errorPath, errorReport(expected, actual), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update " + errorPath, e);
        }
        return new Result(name, passed, expected, actual);
    }

    static String errorReport(String expected, String actual) {
        return EXPECTED_BANNER + expected + CLOSING_BANNER + ACTUAL_BANNER + actual + CLOSING_BANNER;
    }
}
