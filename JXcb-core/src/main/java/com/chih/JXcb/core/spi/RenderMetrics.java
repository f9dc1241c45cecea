package com.chih.JXcb.core.spi;

/**
 * 监控指标 SPI 接口
 */
public interface RenderMetrics {

    /**
     * 记录一次模板渲染
     *
     * @param templateId 模板 ID
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordRender(String templateId, long durationNs, boolean success);
}
