package debugpro.runtime;

import java.util.Map;

/**
 * 异常逃出作用域时保存的绑定快照。
 */
public final class ScopeSnapshot {

    private final String name;
    private final Map<String, Object> bindings;

    public ScopeSnapshot(String name, Map<String, Object> bindings) {
        this.name = name;
        this.bindings = bindings;
    }

    public String getName() { return name; }
    public Map<String, Object> getBindings() { return bindings; }

    @Override
    public String toString() {
        return name + bindings.keySet();
    }
}
