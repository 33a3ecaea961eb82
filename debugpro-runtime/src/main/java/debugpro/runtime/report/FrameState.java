package debugpro.runtime.report;

import java.util.Collections;
import java.util.Map;

/**
 * 帧状态：按模块 / 可调用 / 值分桶的绑定（名称 → 打印形式）。
 */
public final class FrameState {

    private final Map<String, String> modules;
    private final Map<String, String> callables;
    private final Map<String, String> values;

    FrameState(Map<String, String> modules, Map<String, String> callables, Map<String, String> values) {
        this.modules = Collections.unmodifiableMap(modules);
        this.callables = Collections.unmodifiableMap(callables);
        this.values = Collections.unmodifiableMap(values);
    }

    public Map<String, String> getModules() { return modules; }
    public Map<String, String> getCallables() { return callables; }
    public Map<String, String> getValues() { return values; }
}
