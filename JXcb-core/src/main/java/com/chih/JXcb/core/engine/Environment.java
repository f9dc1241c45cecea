package com.chih.JXcb.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 变量环境 (作用域栈)
 * <p>
 * 整个渲染过程共享一个实例。根作用域保存渲染变量；for 循环和宏展开
 * 各自压入一个只含循环变量 / 参数的子作用域，结束时弹出。
 * </p>
 *
 * <h3>读写规则：</h3>
 * <ul>
 *   <li>读取：由内向外逐层查找</li>
 *   <li>赋值：更新最近一个已绑定该名字的作用域，都没有则写入根作用域</li>
 *   <li>绑定为 null 与未绑定是两种不同的状态</li>
 * </ul>
 * <p>
 * 因此块结构引入的名字既不会泄漏到块外，也不会覆盖块外已有的绑定；
 * 而代码块在循环体内计算出的新变量在循环结束后依然可见。
 * </p>
 *
 * @since 2026/10/19
 */
public class Environment {

    private static final Logger log = LoggerFactory.getLogger(Environment.class);

    // 栈顶为最内层作用域，栈底为根作用域
    private final Deque<Map<String, Object>> scopes = new ArrayDeque<>();

    public Environment() {
        this(Collections.emptyMap());
    }

    public Environment(Map<String, ?> variables) {
        scopes.push(variables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(variables));
    }

    public boolean isBound(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return 最近作用域中的值；未绑定时返回 null
     */
    public Object lookup(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                return scope.get(name);
            }
        }
        return null;
    }

    public void assign(String name, Object value) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                scope.put(name, value);
                return;
            }
        }
        scopes.peekLast().put(name, value);
    }

    /**
     * 在当前 (最内层) 作用域绑定，遮蔽外层同名变量
     */
    public void bindLocal(String name, Object value) {
        scopes.peek().put(name, value);
    }

    public void pushScope() {
        pushScope(Collections.emptyMap());
    }

    public void pushScope(Map<String, ?> bindings) {
        scopes.push(new LinkedHashMap<>(bindings));
        log.debug("Scope pushed, depth={}, bindings={}", scopes.size(), bindings.keySet());
    }

    public void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the root scope");
        }
        scopes.pop();
        log.debug("Scope popped, depth={}", scopes.size());
    }

    public int depth() {
        return scopes.size();
    }

    /**
     * 根作用域快照
     */
    public Map<String, Object> rootVariables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(scopes.peekLast()));
    }

    /**
     * 当前可见的全部变量 (内层覆盖外层)
     */
    public Map<String, Object> visibleVariables() {
        Map<String, Object> visible = new LinkedHashMap<>();
        Iterator<Map<String, Object>> outerFirst = scopes.descendingIterator();
        while (outerFirst.hasNext()) {
            visible.putAll(outerFirst.next());
        }
        return Collections.unmodifiableMap(visible);
    }
}
