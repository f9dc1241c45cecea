package com.chih.JXcb.spring.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MicrometerRenderMetrics 测试")
class MicrometerRenderMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private final MicrometerRenderMetrics metrics = new MicrometerRenderMetrics(registry);

    @Test
    @DisplayName("按模板和结果打标签")
    void testRecord() {
        metrics.recordRender("a.xcb", TimeUnit.MILLISECONDS.toNanos(5), true);
        metrics.recordRender("a.xcb", TimeUnit.MILLISECONDS.toNanos(7), true);
        metrics.recordRender("a.xcb", TimeUnit.MILLISECONDS.toNanos(1), false);

        assertThat(registry.get("jxcb.render.count").tag("template", "a.xcb").tag("result", "success")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("jxcb.render.count").tag("result", "failure")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("jxcb.render.timer").tag("result", "success")
                .timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(12.0);
    }
}
