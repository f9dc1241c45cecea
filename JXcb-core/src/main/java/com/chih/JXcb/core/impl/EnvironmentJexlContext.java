package com.chih.JXcb.core.impl;

import com.chih.JXcb.core.engine.Environment;
import org.apache.commons.jexl3.JexlContext;

/**
 * 把 {@link Environment} 适配为 JEXL 上下文：读按作用域链查找，写按最近绑定赋值
 */
class EnvironmentJexlContext implements JexlContext {

    private final Environment environment;

    EnvironmentJexlContext(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Object get(String name) {
        return environment.lookup(name);
    }

    @Override
    public void set(String name, Object value) {
        environment.assign(name, value);
    }

    @Override
    public boolean has(String name) {
        return environment.isBound(name);
    }
}
