package debugpro.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * 显式帧捕获：JVM 不暴露栈帧的局部变量，因此由调用点主动登记。
 *
 * <pre>
 * Frames.run("loadUser", locals -&gt; {
 *     Map&lt;String, User&gt; users = locals.bind("users", repository.all());
 *     Lookups.get(users, id);
 * });
 * </pre>
 *
 * <p>异常逃出最内层作用域时，整条作用域栈被快照并挂到该异常上（先挂者胜，
 * 外层作用域不会覆盖），随后原样重新抛出。作用域栈按线程隔离。</p>
 */
public final class Frames {

    @FunctionalInterface
    public interface Block {
        void run(Locals locals) throws Exception;
    }

    @FunctionalInterface
    public interface Body<T> {
        T call(Locals locals) throws Exception;
    }

    private static final ThreadLocal<Deque<Locals>> SCOPES = new ThreadLocal<Deque<Locals>>() {
        @Override
        protected Deque<Locals> initialValue() {
            return new ArrayDeque<>();
        }
    };

    /** 异常 → 作用域快照（外层在前）；WeakHashMap 对 Throwable 按同一性比较 */
    private static final Map<Throwable, List<ScopeSnapshot>> CAPTURED =
            Collections.synchronizedMap(new WeakHashMap<Throwable, List<ScopeSnapshot>>());

    private Frames() {}

    public static void run(String name, Block block) throws Exception {
        call(name, locals -> {
            block.run(locals);
            return null;
        });
    }

    public static <T> T call(String name, Body<T> body) throws Exception {
        Deque<Locals> stack = SCOPES.get();
        Locals locals = new Locals(name, stack.peek());
        stack.push(locals);
        try {
            return body.call(locals);
        } catch (Throwable t) {
            capture(t, stack);
            throw t;
        } finally {
            stack.pop();
            if (stack.isEmpty()) {
                SCOPES.remove();
            }
        }
    }

    /** 当前线程的作用域深度 */
    public static int depth() {
        Deque<Locals> stack = SCOPES.get();
        int depth = stack.size();
        if (depth == 0) {
            SCOPES.remove();
        }
        return depth;
    }

    /**
     * 返回挂在异常上的作用域快照，外层在前；没有捕获时返回空列表。
     */
    public static List<ScopeSnapshot> capturedScopes(Throwable t) {
        List<ScopeSnapshot> scopes = CAPTURED.get(t);
        return scopes != null ? scopes : Collections.<ScopeSnapshot>emptyList();
    }

    /**
     * 判断栈帧是否属于捕获机制本身（报告中应略去）。
     */
    public static boolean isCaptureFrame(String className) {
        return className.equals(Frames.class.getName())
                || className.startsWith(Frames.class.getName() + "$")
                || className.equals(Locals.class.getName())
                || className.equals(Lookups.class.getName());
    }

    /** 判断栈帧是否是作用域入口（{@link #run} / {@link #call}） */
    public static boolean isScopeEntry(String className, String methodName) {
        return className.equals(Frames.class.getName())
                && ("run".equals(methodName) || "call".equals(methodName));
    }

    private static void capture(Throwable t, Deque<Locals> stack) {
        synchronized (CAPTURED) {
            if (CAPTURED.containsKey(t)) return;
            List<ScopeSnapshot> scopes = new ArrayList<>(stack.size());
            Iterator<Locals> outerFirst = stack.descendingIterator();
            while (outerFirst.hasNext()) {
                Locals scope = outerFirst.next();
                scopes.add(new ScopeSnapshot(scope.getScopeName(), scope.snapshot()));
            }
            CAPTURED.put(t, Collections.unmodifiableList(scopes));
        }
    }
}
