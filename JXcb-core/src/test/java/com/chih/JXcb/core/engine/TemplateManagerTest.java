package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.exception.TemplateEvaluationException;
import com.chih.JXcb.core.exception.TemplateNotFoundException;
import com.chih.JXcb.core.spi.RenderMetrics;
import com.chih.JXcb.core.spi.TemplateSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateManager 测试")
class TemplateManagerTest {

    private final Map<String, String> templates = Map.of(
            "greet.xcb", "#(macro greet(n))Hi #n#(end macro)#(greet(who))",
            "broken.xcb", "#nobody");

    private final TemplateSource source = templates::get;

    private final List<String> recorded = new ArrayList<>();

    private final RenderMetrics metrics = (id, durationNs, success) -> recorded.add(id + ":" + success);

    private final TemplateManager manager = new TemplateManager(source, new XcbTemplateEngine(), metrics);

    @Test
    @DisplayName("按 ID 渲染并记录成功指标")
    void testRender() {
        assertThat(manager.renderToString("greet.xcb", Map.of("who", "Ann"))).isEqualTo("Hi Ann");
        assertThat(recorded).containsExactly("greet.xcb:true");
    }

    @Test
    @DisplayName("每次渲染互相独立")
    void testNoStateBetweenRenders() {
        RenderResult first = manager.render("greet.xcb", Map.of("who", "Ann"));
        RenderResult second = manager.render("greet.xcb", Map.of("who", "Bob"));

        assertThat(first.output()).isEqualTo("Hi Ann");
        assertThat(second.output()).isEqualTo("Hi Bob");
        assertThat(second.variables()).containsOnlyKeys("who");
    }

    @Test
    @DisplayName("模板不存在")
    void testNotFound() {
        assertThatThrownBy(() -> manager.render("nope.xcb", Map.of()))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("nope.xcb");
        assertThat(recorded).containsExactly("nope.xcb:false");
    }

    @Test
    @DisplayName("求值失败时记录失败指标")
    void testFailureRecorded() {
        assertThatThrownBy(() -> manager.render("broken.xcb", Map.of()))
                .isInstanceOf(TemplateEvaluationException.class);
        assertThat(recorded).containsExactly("broken.xcb:false");
    }

    @Test
    @DisplayName("默认使用空指标实现")
    void testDefaultMetrics() {
        TemplateManager plain = new TemplateManager(source, new XcbTemplateEngine());

        assertThat(plain.renderToString("greet.xcb", Map.of("who", "Zoe"))).isEqualTo("Hi Zoe");
    }
}
