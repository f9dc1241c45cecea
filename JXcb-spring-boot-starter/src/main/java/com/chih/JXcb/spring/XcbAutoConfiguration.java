package com.chih.JXcb.spring;

import com.chih.JXcb.core.engine.TemplateManager;
import com.chih.JXcb.core.engine.XcbTemplateEngine;
import com.chih.JXcb.core.impl.JexlExpressionEvaluator;
import com.chih.JXcb.core.impl.NoOpRenderMetrics;
import com.chih.JXcb.core.spi.ExpressionEvaluator;
import com.chih.JXcb.core.spi.RenderMetrics;
import com.chih.JXcb.core.spi.TemplateSource;
import com.chih.JXcb.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * JXcb Spring Boot 自动配置类
 * <p>
 * 所有 Bean 都带有 {@code @ConditionalOnMissingBean}，用户自定义的实现优先。
 * </p>
 *
 * <h3>默认组件：</h3>
 * <ul>
 *   <li>{@link ExpressionEvaluator}：JEXL 实现</li>
 *   <li>{@link XcbTemplateEngine}：使用 {@code j-xcb.*} 绑定的渲染选项</li>
 *   <li>{@link TemplateSource}：从 {@code j-xcb.template-location} 加载</li>
 *   <li>{@link RenderMetrics}：存在 MeterRegistry 时使用 Micrometer，否则为空实现</li>
 *   <li>{@link TemplateManager}</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * // 自定义求值器（可选）
 * @Bean
 * public ExpressionEvaluator expressionEvaluator() {
 *     return new JexlExpressionEvaluator(new MyFunctions());
 * }
 * }</pre>
 *
 * @since 2026/10/19
 * @see XcbProperties
 * @see SpringResourceTemplateSource
 * @see TemplateManager
 */
@Configuration
@EnableConfigurationProperties(XcbProperties.class)
public class XcbAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ExpressionEvaluator.class)
    public ExpressionEvaluator expressionEvaluator() {
        return new JexlExpressionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean(XcbTemplateEngine.class)
    public XcbTemplateEngine xcbTemplateEngine(ExpressionEvaluator evaluator, XcbProperties properties) {
        return new XcbTemplateEngine(evaluator, properties.toRenderOptions());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateSource.class)
    public TemplateSource templateSource(ResourceLoader resourceLoader, XcbProperties properties) {
        return new SpringResourceTemplateSource(resourceLoader, properties.getTemplateLocation());
    }

    /**
     * 监控组件配置：Micrometer 在类路径中且容器里有 MeterRegistry 时启用
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(ObjectProvider<MeterRegistry> registry) {
            MeterRegistry meterRegistry = registry.getIfAvailable();
            return meterRegistry != null ? new MicrometerRenderMetrics(meterRegistry) : new NoOpRenderMetrics();
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateManager.class)
    public TemplateManager templateManager(TemplateSource source, XcbTemplateEngine engine, RenderMetrics metrics) {
        return new TemplateManager(source, engine, metrics);
    }
}
