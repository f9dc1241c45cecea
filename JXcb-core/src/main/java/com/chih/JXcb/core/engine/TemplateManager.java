package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.exception.TemplateNotFoundException;
import com.chih.JXcb.core.impl.NoOpRenderMetrics;
import com.chih.JXcb.core.spi.RenderMetrics;
import com.chih.JXcb.core.spi.TemplateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 核心管理器：按 ID 加载模板、编译并渲染，同时记录监控指标
 * <p>
 * 不做跨渲染缓存：每次调用都重新加载和编译，宏与变量不会在两次渲染之间残留。
 * </p>
 *
 * @since 2026/10/19
 */
public class TemplateManager {

    private static final Logger log = LoggerFactory.getLogger(TemplateManager.class);

    private final TemplateSource source;
    private final XcbTemplateEngine engine;
    private final RenderMetrics metrics;

    public TemplateManager(TemplateSource source, XcbTemplateEngine engine) {
        this(source, engine, new NoOpRenderMetrics());
    }

    public TemplateManager(TemplateSource source, XcbTemplateEngine engine, RenderMetrics metrics) {
        this.source = source;
        this.engine = engine;
        this.metrics = metrics != null ? metrics : new NoOpRenderMetrics();
    }

    /**
     * 渲染指定模板
     *
     * @throws TemplateNotFoundException 模板不存在
     */
    public RenderResult render(String templateId, Map<String, ?> variables) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            String text = source.load(templateId);
            if (text == null) {
                throw new TemplateNotFoundException(templateId);
            }
            RenderResult result = engine.render(engine.compile(text), variables);
            success = true;
            return result;
        } finally {
            long duration = System.nanoTime() - start;
            metrics.recordRender(templateId, duration, success);
            log.debug("Rendered '{}' in {} µs, success={}", templateId, duration / 1000, success);
        }
    }

    public String renderToString(String templateId, Map<String, ?> variables) {
        return render(templateId, variables).output();
    }

    public XcbTemplateEngine getEngine() {
        return engine;
    }
}
