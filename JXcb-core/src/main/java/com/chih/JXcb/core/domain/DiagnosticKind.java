package com.chih.JXcb.core.domain;

/**
 * 结构性诊断类型 (均为非致命)
 *
 * @since 2026/10/19
 */
public enum DiagnosticKind {
    UNEXPECTED_TOKEN,
    EMPTY_DIRECTIVE,
    UNTERMINATED_CODE,
    MISSING_CONDITION,
    MISSING_IN,
    MALFORMED_FOR,
    MISSING_MACRO_NAME,
    EXPECTED_OPEN_PAREN,
    EXPECTED_CLOSE_PAREN,
    INVALID_PARAMETER,
    ARGUMENT_COUNT,
    UNTERMINATED_BLOCK,
    UNKNOWN_BLOCK
}
