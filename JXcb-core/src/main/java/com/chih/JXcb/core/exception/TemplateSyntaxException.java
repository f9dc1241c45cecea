package com.chih.JXcb.core.exception;

import com.chih.JXcb.core.domain.Diagnostic;

/**
 * 错误策略为 ABORT 时，结构性诊断以此异常抛出
 */
public class TemplateSyntaxException extends XcbException {

    private final Diagnostic diagnostic;

    public TemplateSyntaxException(Diagnostic diagnostic) {
        super("Template syntax error at " + diagnostic);
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
