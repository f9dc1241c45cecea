package com.chih.JXcb.core.exception;

/**
 * 外部求值器拒绝了表达式 / 语句，渲染终止
 */
public class TemplateEvaluationException extends XcbException {

    private final String source;

    public TemplateEvaluationException(String source, Throwable cause) {
        super("Failed to evaluate: " + source, cause);
        this.source = source;
    }

    public TemplateEvaluationException(String source, String reason) {
        super("Failed to evaluate: " + source + " (" + reason + ")");
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
