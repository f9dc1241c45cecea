package com.chih.JXcb.spring.metrics;

import com.chih.JXcb.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jxcb.render.timer: 模板渲染耗时，tags: template={templateId}, result={success|failure}</li>
 *   <li>jxcb.render.count: 模板渲染次数，tags 同上</li>
 * </ul>
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    public static final String TIMER_NAME = "jxcb.render.timer";
    public static final String COUNTER_NAME = "jxcb.render.count";

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateId, long durationNs, boolean success) {
        String result = success ? "success" : "failure";

        Timer.builder(TIMER_NAME)
                .description("Timer for template rendering")
                .tag("template", templateId)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder(COUNTER_NAME)
                .description("Counter for template rendering")
                .tag("template", templateId)
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
