package com.chih.JXcb.spring;

import com.chih.JXcb.core.domain.ErrorPolicy;
import com.chih.JXcb.core.domain.RenderOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JXcb 配置
 *
 * <pre>{@code
 * j-xcb:
 *   error-policy: abort
 *   trim-directive-lines: true
 *   report-unterminated-blocks: true
 *   max-expansion-depth: 32
 *   template-location: file:./templates/
 * }</pre>
 *
 * @since 2026/10/19
 */
@ConfigurationProperties(prefix = "j-xcb")
public class XcbProperties {

    /**
     * 结构性错误的处理策略：continue (记录诊断后继续) 或 abort (抛出异常)
     */
    private ErrorPolicy errorPolicy = ErrorPolicy.CONTINUE;

    /**
     * 去掉指令 / 代码块 / 注释两侧含换行的空白
     */
    private boolean trimDirectiveLines = true;

    /**
     * 找不到 end 的块是否报告诊断
     */
    private boolean reportUnterminatedBlocks = false;

    /**
     * 宏展开的最大嵌套深度
     */
    private int maxExpansionDepth = RenderOptions.DEFAULT_MAX_EXPANSION_DEPTH;

    /**
     * 模板根位置，模板 ID 拼接在其后
     * 支持 classpath: 和 file:
     */
    private String templateLocation = "classpath:templates/";

    public RenderOptions toRenderOptions() {
        return RenderOptions.builder()
                .errorPolicy(errorPolicy)
                .trimDirectiveLines(trimDirectiveLines)
                .reportUnterminatedBlocks(reportUnterminatedBlocks)
                .maxExpansionDepth(maxExpansionDepth)
                .build();
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public void setErrorPolicy(ErrorPolicy errorPolicy) {
        this.errorPolicy = errorPolicy;
    }

    public boolean isTrimDirectiveLines() {
        return trimDirectiveLines;
    }

    public void setTrimDirectiveLines(boolean trimDirectiveLines) {
        this.trimDirectiveLines = trimDirectiveLines;
    }

    public boolean isReportUnterminatedBlocks() {
        return reportUnterminatedBlocks;
    }

    public void setReportUnterminatedBlocks(boolean reportUnterminatedBlocks) {
        this.reportUnterminatedBlocks = reportUnterminatedBlocks;
    }

    public int getMaxExpansionDepth() {
        return maxExpansionDepth;
    }

    public void setMaxExpansionDepth(int maxExpansionDepth) {
        this.maxExpansionDepth = maxExpansionDepth;
    }

    public String getTemplateLocation() {
        return templateLocation;
    }

    public void setTemplateLocation(String templateLocation) {
        this.templateLocation = templateLocation;
    }
}
