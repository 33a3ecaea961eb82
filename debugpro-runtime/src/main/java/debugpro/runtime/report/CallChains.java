package debugpro.runtime.report;

import debugpro.runtime.CallFrame;
import debugpro.runtime.Frames;
import debugpro.runtime.ScopeSnapshot;
import debugpro.runtime.SnapshotFrame;
import debugpro.runtime.report.source.SourceResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 从异常的栈轨迹构建 {@link CallFrame} 链（链头为最外层调用者）。
 *
 * <p>平台帧和捕获机制自身的帧被略去。每个 {@code Frames.run/call} 入口之后的
 * 第一个应用帧获得对应作用域快照的绑定，并以作用域名作为调用名。</p>
 */
public final class CallChains {

    private CallChains() {}

    /**
     * @return 链头；没有任何应用帧时返回 null
     */
    public static CallFrame fromThrowable(Throwable t, DebugProConfig config, SourceResolver resolver) {
        StackTraceElement[] trace = t.getStackTrace();
        List<ScopeSnapshot> scopes = Frames.capturedScopes(t);

        // 外层 → 内层
        List<FrameSpec> specs = new ArrayList<>();
        int scopeIndex = 0;
        boolean scopePending = false;
        for (int i = trace.length - 1; i >= 0; i--) {
            StackTraceElement element = trace[i];
            String className = element.getClassName();
            if (Frames.isScopeEntry(className, element.getMethodName())) {
                scopePending = true;
                continue;
            }
            if (Frames.isCaptureFrame(className) || config.isExcluded(className)) {
                continue;
            }
            ScopeSnapshot scope = null;
            if (scopePending && scopeIndex < scopes.size()) {
                scope = scopes.get(scopeIndex++);
            }
            scopePending = false;
            specs.add(new FrameSpec(element, scope));
        }

        CallFrame next = null;
        for (int i = specs.size() - 1; i >= 0; i--) {
            FrameSpec spec = specs.get(i);
            StackTraceElement element = spec.element;
            String file = resolver.resolve(element.getClassName(), element.getFileName());
            next = new SnapshotFrame(spec.callableName(), file, element.getLineNumber(), spec.bindings(), next);
        }
        return next;
    }

    private static final class FrameSpec {
        final StackTraceElement element;
        final ScopeSnapshot scope;

        FrameSpec(StackTraceElement element, ScopeSnapshot scope) {
            this.element = element;
            this.scope = scope;
        }

        String callableName() {
            if (scope != null && scope.getName() != null) {
                return scope.getName();
            }
            String method = element.getMethodName();
            return "main".equals(method) ? CallFrame.TOP_LEVEL : method;
        }

        Map<String, Object> bindings() {
            return scope != null ? scope.getBindings() : Collections.<String, Object>emptyMap();
        }
    }
}
