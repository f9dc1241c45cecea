package com.chih.JXcb.core.spi;

import com.chih.JXcb.core.engine.Environment;

/**
 * 表达式 / 语句求值器 SPI
 * <p>
 * 模板引擎本身不实现任何表达式语义，插值、条件、循环源、宏实参和代码块
 * 全部委托给该接口，方便替换为受限解释器、嵌入式脚本引擎等实现。
 * </p>
 * <p>
 * 两个方法失败时都应抛出 {@link com.chih.JXcb.core.exception.TemplateEvaluationException}，
 * 引擎不会捕获，渲染随即终止。
 * </p>
 *
 * @since 2026/10/19
 */
public interface ExpressionEvaluator {

    /**
     * 求值一个表达式
     *
     * @param expression  已去除公共缩进的表达式文本
     * @param environment 当前变量环境
     * @return 表达式的值
     */
    Object evaluate(String expression, Environment environment);

    /**
     * 执行一段语句，只对环境产生副作用
     *
     * @param statements  已去除公共缩进的语句文本
     * @param environment 当前变量环境
     */
    void execute(String statements, Environment environment);
}
