package debugpro.runtime.report;

import debugpro.runtime.BindingKind;
import debugpro.runtime.CallFrame;
import debugpro.runtime.report.analysis.Failures;
import debugpro.runtime.report.analysis.ValuePrinter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 帧状态提取：枚举绑定并按打印形式分类。只读，不抛出。
 */
public final class FrameStateExtractor {

    /** 保留名前缀，枚举时跳过 */
    public static final String RESERVED_PREFIX = "__";

    private static final String[] MODULE_MARKERS = {
            "module ", "unnamed module", "package ", "class ", "interface "
    };
    private static final String[] MODIFIERS = {
            "public ", "protected ", "private ", "static ", "final ", "abstract ", "synchronized ", "native "
    };

    private FrameStateExtractor() {}

    public static FrameState extract(CallFrame frame) {
        Map<String, String> modules = new LinkedHashMap<>();
        Map<String, String> callables = new LinkedHashMap<>();
        Map<String, String> values = new LinkedHashMap<>();

        for (Map.Entry<String, Object> binding : frame.getBindings().entrySet()) {
            String name = binding.getKey();
            if (isReserved(name)) continue;

            String repr;
            try {
                repr = ValuePrinter.print(binding.getValue());
            } catch (Throwable e) {
                Failures.rethrowIfFatal(e);
                values.put(name, ValuePrinter.unprintable(e));
                continue;
            }
            switch (classify(repr)) {
                case MODULE:   modules.put(name, repr); break;
                case CALLABLE: callables.put(name, repr); break;
                default:       values.put(name, repr); break;
            }
        }
        return new FrameState(modules, callables, values);
    }

    public static boolean isReserved(String name) {
        return name.startsWith(RESERVED_PREFIX);
    }

    /**
     * 按打印形式分类：{@code Module}/{@code Package}/{@code Class} 的 toString 视为模块，
     * lambda、方法引用和反射 {@code Method}/{@code Constructor} 视为可调用。
     */
    public static BindingKind classify(String repr) {
        for (String marker : MODULE_MARKERS) {
            if (repr.startsWith(marker)) return BindingKind.MODULE;
        }
        if (repr.contains("$$Lambda")) return BindingKind.CALLABLE;
        if (repr.indexOf('(') > 0) {
            for (String modifier : MODIFIERS) {
                if (repr.startsWith(modifier)) return BindingKind.CALLABLE;
            }
        }
        return BindingKind.VALUE;
    }
}
