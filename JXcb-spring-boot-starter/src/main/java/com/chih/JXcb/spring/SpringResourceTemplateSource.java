package com.chih.JXcb.spring;

import com.chih.JXcb.core.exception.TemplateLoadException;
import com.chih.JXcb.core.spi.TemplateSource;
import com.chih.JXcb.core.support.TemplateText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * 基于 Spring Resource 的模板源
 * <p>
 * 模板 ID 拼接在配置的根位置之后交给 {@link ResourceLoader} 解析，
 * 因此 classpath:、file: 等协议都可以使用。
 * </p>
 *
 * <h3>支持的位置：</h3>
 * <ul>
 *   <li>Classpath 资源：classpath:templates/</li>
 *   <li>文件系统资源：file:/opt/app/templates/</li>
 * </ul>
 *
 * @see org.springframework.core.io.Resource
 * @since 2026/10/19
 */
public class SpringResourceTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateSource.class);

    private final ResourceLoader resourceLoader;

    private final String location;

    public SpringResourceTemplateSource(ResourceLoader resourceLoader, String location) {
        if (!StringUtils.hasText(location)) {
            throw new IllegalArgumentException("Template location must not be empty");
        }
        this.resourceLoader = resourceLoader;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @Override
    public String load(String id) {
        if (!StringUtils.hasText(id) || id.contains("..")) {
            return null;
        }

        Resource resource = resourceLoader.getResource(location + id);
        if (!resource.exists() || !resource.isReadable()) {
            log.debug("Template '{}' not found under {}", id, location);
            return null;
        }

        try (InputStream is = resource.getInputStream()) {
            return TemplateText.normalizeContent(StreamUtils.copyToString(is, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateLoadException(id, e);
        }
    }

    public String getLocation() {
        return location;
    }
}
