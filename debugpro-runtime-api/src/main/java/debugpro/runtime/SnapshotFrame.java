package debugpro.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CallFrame} 的不可变实现。
 *
 * <p>链从内向外构建：先创建故障帧，再把它作为 {@code next} 传给调用者帧。</p>
 */
public final class SnapshotFrame implements CallFrame {

    private final Map<String, Object> bindings;
    private final String sourceFile;
    private final int sourceLine;
    private final String callableName;
    private final CallFrame next;

    public SnapshotFrame(String callableName, String sourceFile, int sourceLine,
                         Map<String, ?> bindings, CallFrame next) {
        this.callableName = callableName != null ? callableName : TOP_LEVEL;
        this.sourceFile = sourceFile != null ? sourceFile : "<unknown>";
        this.sourceLine = Math.max(1, sourceLine);
        this.bindings = bindings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<String, Object>(bindings))
                : Collections.<String, Object>emptyMap();
        this.next = next;
    }

    @Override
    public Map<String, Object> getBindings() { return bindings; }

    @Override
    public String getSourceFile() { return sourceFile; }

    @Override
    public int getSourceLine() { return sourceLine; }

    @Override
    public String getCallableName() { return callableName; }

    @Override
    public CallFrame getNext() { return next; }

    @Override
    public String toString() {
        return callableName + " (" + sourceFile + ":" + sourceLine + ")";
    }
}
