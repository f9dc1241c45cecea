package com.chih.JXcb.core.impl;

import com.chih.JXcb.core.spi.TemplateSource;
import com.chih.JXcb.core.support.TemplateText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 基于文件系统的模板源
 * <p>
 * 模板 ID 是相对于根目录的路径，多个根目录按顺序查找，第一个命中的生效。
 * 越出根目录的 ID (如 {@code ../secret}) 视为不存在。
 * </p>
 * <p>
 * <strong>使用示例：</strong>
 * <pre>{@code
 * TemplateSource source = new FileTemplateSource("/templates", "/shared/templates");
 * String text = source.load("page.html.xcb");
 * }</pre>
 * </p>
 *
 * @since 2026/10/19
 */
public class FileTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateSource.class);

    private final List<Path> roots;

    public FileTemplateSource(String... roots) {
        this(Arrays.stream(roots).map(Paths::get).toList());
    }

    public FileTemplateSource(List<Path> roots) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("At least one template root is required");
        }
        this.roots = new ArrayList<>();
        for (Path root : roots) {
            this.roots.add(root.toAbsolutePath().normalize());
        }
    }

    @Override
    public String load(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        for (Path root : roots) {
            Path candidate = root.resolve(id).normalize();
            if (!candidate.startsWith(root)) {
                log.warn("Rejected template id outside of root {}: {}", root, id);
                continue;
            }
            if (Files.isRegularFile(candidate)) {
                log.debug("Loading template '{}' from {}", id, candidate);
                return TemplateText.read(candidate);
            }
        }
        return null;
    }

    public List<Path> getRoots() {
        return List.copyOf(roots);
    }
}
