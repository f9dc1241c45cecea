package com.chih.JXcb.core.impl;

import com.chih.JXcb.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String templateId, long durationNs, boolean success) {
        // Do nothing
    }
}
