package com.chih.JXcb.core.impl;

import com.chih.JXcb.core.engine.Environment;
import com.chih.JXcb.core.exception.TemplateEvaluationException;
import com.chih.JXcb.core.spi.ExpressionEvaluator;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于 Apache Commons JEXL 3 的求值器实现
 *
 * <h3>特性：</h3>
 * <ul>
 *   <li>严格模式：引用未绑定的变量直接失败</li>
 *   <li>表达式 / 脚本解析结果由 JEXL 内部缓存</li>
 *   <li>全局函数见 {@link TemplateFunctions}</li>
 * </ul>
 *
 * @since 2026/10/19
 */
public class JexlExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JexlExpressionEvaluator.class);

    private static final int CACHE_SIZE = 256;

    private final JexlEngine jexl;

    public JexlExpressionEvaluator() {
        this(new TemplateFunctions());
    }

    /**
     * @param functions 全局函数对象，其公共方法可在模板中不带前缀地调用
     */
    public JexlExpressionEvaluator(Object functions) {
        Map<String, Object> namespaces = new HashMap<>();
        namespaces.put(null, functions);

        this.jexl = new JexlBuilder()
                .permissions(JexlPermissions.UNRESTRICTED)
                .namespaces(namespaces)
                .strict(true)
                .silent(false)
                .cache(CACHE_SIZE)
                .create();
    }

    @Override
    public Object evaluate(String expression, Environment environment) {
        try {
            return jexl.createExpression(expression).evaluate(new EnvironmentJexlContext(environment));
        } catch (JexlException e) {
            log.error("Failed to evaluate expression: {}", expression, e);
            throw new TemplateEvaluationException(expression, e);
        }
    }

    @Override
    public void execute(String statements, Environment environment) {
        try {
            jexl.createScript(statements).execute(new EnvironmentJexlContext(environment));
        } catch (JexlException e) {
            log.error("Failed to execute statements: {}", statements, e);
            throw new TemplateEvaluationException(statements, e);
        }
    }
}
