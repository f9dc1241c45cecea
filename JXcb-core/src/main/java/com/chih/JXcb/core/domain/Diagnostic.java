package com.chih.JXcb.core.domain;

/**
 * 一条结构性诊断
 *
 * @param kind    类型
 * @param line    模板行号
 * @param message 描述
 * @since 2026/10/19
 */
public record Diagnostic(DiagnosticKind kind, int line, String message) {

    @Override
    public String toString() {
        return "line " + line + ": " + message + " (" + kind + ")";
    }
}
