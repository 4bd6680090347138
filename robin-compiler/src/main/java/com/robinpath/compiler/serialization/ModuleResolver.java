package com.robinpath.compiler.serialization;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 推断命令所属模块
 *
 * <p>带点号的命令名取第一段作为模块名；不带点号的名称查询已注册的模块函数表，
 * 查不到时返回 null（全局命令）。</p>
 */
public final class ModuleResolver {

    private final Map<String, String> functions;

    public ModuleResolver() {
        this(Collections.<String, String>emptyMap());
    }

    /**
     * @param functions 函数名到模块名的映射，如 {@code create -> array}
     */
    public ModuleResolver(Map<String, String> functions) {
        this.functions = new HashMap<String, String>(functions);
    }

    /** 带点号名称的模块前缀，没有点号返回 null */
    public static String moduleOf(String name) {
        if (name == null) return null;
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : null;
    }

    public String resolve(String name) {
        String module = moduleOf(name);
        if (module != null) {
            return module;
        }
        return name != null ? functions.get(name) : null;
    }

    /** 注册一个模块函数 */
    public void register(String module, String function) {
        functions.put(function, module);
    }
}
