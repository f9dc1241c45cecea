package com.chih.JXcb.core.domain;

/**
 * 结构性错误的处理策略
 * <p>
 * 求值错误 (外部求值器抛出) 不受此策略影响，始终终止渲染。
 * </p>
 *
 * @since 2026/10/19
 */
public enum ErrorPolicy {

    /**
     * 记录诊断后尽力继续 (默认)
     */
    CONTINUE,

    /**
     * 第一条诊断即抛出 TemplateSyntaxException
     */
    ABORT
}
