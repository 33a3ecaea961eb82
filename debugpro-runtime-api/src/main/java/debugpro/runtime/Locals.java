package debugpro.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个捕获作用域的局部绑定。
 *
 * <p>由 {@link Frames#run} / {@link Frames#call} 创建并交给调用体；调用体通过
 * {@link #bind} 登记需要出现在崩溃报告中的局部变量。</p>
 */
public final class Locals {

    private final String scopeName;
    private final Locals parent;
    private final Map<String, Object> bindings = new LinkedHashMap<>();

    Locals(String scopeName, Locals parent) {
        this.scopeName = scopeName;
        this.parent = parent;
    }

    public String getScopeName() {
        return scopeName;
    }

    /**
     * 登记（或覆盖）一个绑定，并原样返回值，便于 {@code List<X> xs = locals.bind("xs", ...)}。
     */
    public <T> T bind(String name, T value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("binding name must not be empty");
        }
        bindings.put(name, value);
        return value;
    }

    public boolean isBound(String name) {
        for (Locals scope = this; scope != null; scope = scope.parent) {
            if (scope.bindings.containsKey(name)) return true;
        }
        return false;
    }

    /**
     * 按名称解析绑定：先当前作用域，再逐层向外。
     *
     * @throws UndefinedIdentifierException 名称在整条作用域链上都未绑定
     */
    public Object lookup(String name) {
        for (Locals scope = this; scope != null; scope = scope.parent) {
            if (scope.bindings.containsKey(name)) {
                return scope.bindings.get(name);
            }
        }
        throw new UndefinedIdentifierException(name);
    }

    /** 当前作用域绑定的只读副本 */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }
}
