package com.chih.JXcb.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 宏注册表，生命周期与单次渲染相同。后注册的同名宏覆盖先前的定义，宏不会被移除。
 *
 * @since 2026/10/19
 */
public class MacroRegistry {

    private static final Logger log = LoggerFactory.getLogger(MacroRegistry.class);

    private final Map<String, Macro> macros = new HashMap<>();

    public void register(Macro macro) {
        Macro previous = macros.put(macro.name(), macro);
        if (previous != null) {
            log.debug("Macro '{}' redefined with parameters {}", macro.name(), macro.parameters());
        } else {
            log.debug("Macro '{}' registered with parameters {}", macro.name(), macro.parameters());
        }
    }

    /**
     * @return 宏定义；不存在时返回 null
     */
    public Macro find(String name) {
        return macros.get(name);
    }

    public boolean contains(String name) {
        return macros.containsKey(name);
    }

    public int size() {
        return macros.size();
    }
}
