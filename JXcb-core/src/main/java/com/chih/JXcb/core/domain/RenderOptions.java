package com.chih.JXcb.core.domain;

import java.util.Objects;

/**
 * 渲染选项 (不可变)
 * <p>
 * 编译和渲染过程中所有可调行为的唯一入口。
 * </p>
 *
 * <h3>默认值：</h3>
 * <ul>
 *   <li>errorPolicy: CONTINUE - 结构性错误只记录诊断</li>
 *   <li>trimDirectiveLines: true - 去掉指令所在行残留的换行与缩进</li>
 *   <li>reportUnterminatedBlocks: false - 未闭合的块静默吞掉剩余内容</li>
 *   <li>maxExpansionDepth: 64 - 宏展开最大嵌套层数</li>
 * </ul>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * RenderOptions options = RenderOptions.builder()
 *         .errorPolicy(ErrorPolicy.ABORT)
 *         .reportUnterminatedBlocks(true)
 *         .build();
 * }</pre>
 *
 * @since 2026/10/19
 */
public final class RenderOptions {

    public static final int DEFAULT_MAX_EXPANSION_DEPTH = 64;

    private static final RenderOptions DEFAULTS = builder().build();

    private final ErrorPolicy errorPolicy;

    private final boolean trimDirectiveLines;

    private final boolean reportUnterminatedBlocks;

    private final int maxExpansionDepth;

    private RenderOptions(Builder builder) {
        this.errorPolicy = builder.errorPolicy;
        this.trimDirectiveLines = builder.trimDirectiveLines;
        this.reportUnterminatedBlocks = builder.reportUnterminatedBlocks;
        this.maxExpansionDepth = builder.maxExpansionDepth;
    }

    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public boolean isTrimDirectiveLines() {
        return trimDirectiveLines;
    }

    public boolean isReportUnterminatedBlocks() {
        return reportUnterminatedBlocks;
    }

    public int getMaxExpansionDepth() {
        return maxExpansionDepth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RenderOptions that)) {
            return false;
        }
        return trimDirectiveLines == that.trimDirectiveLines
                && reportUnterminatedBlocks == that.reportUnterminatedBlocks
                && maxExpansionDepth == that.maxExpansionDepth
                && errorPolicy == that.errorPolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorPolicy, trimDirectiveLines, reportUnterminatedBlocks, maxExpansionDepth);
    }

    @Override
    public String toString() {
        return "RenderOptions{" +
                "errorPolicy=" + errorPolicy +
                ", trimDirectiveLines=" + trimDirectiveLines +
                ", reportUnterminatedBlocks=" + reportUnterminatedBlocks +
                ", maxExpansionDepth=" + maxExpansionDepth +
                '}';
    }

    public static final class Builder {

        private ErrorPolicy errorPolicy = ErrorPolicy.CONTINUE;
        private boolean trimDirectiveLines = true;
        private boolean reportUnterminatedBlocks = false;
        private int maxExpansionDepth = DEFAULT_MAX_EXPANSION_DEPTH;

        private Builder() {
        }

        public Builder errorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy");
            return this;
        }

        public Builder trimDirectiveLines(boolean trimDirectiveLines) {
            this.trimDirectiveLines = trimDirectiveLines;
            return this;
        }

        public Builder reportUnterminatedBlocks(boolean reportUnterminatedBlocks) {
            this.reportUnterminatedBlocks = reportUnterminatedBlocks;
            return this;
        }

        public Builder maxExpansionDepth(int maxExpansionDepth) {
            if (maxExpansionDepth < 1) {
                throw new IllegalArgumentException("maxExpansionDepth must be positive: " + maxExpansionDepth);
            }
            this.maxExpansionDepth = maxExpansionDepth;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(this);
        }
    }
}
