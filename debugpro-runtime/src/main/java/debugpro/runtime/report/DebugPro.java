package debugpro.runtime.report;

import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * DebugPro 入口：安装进程级未捕获异常处理器。
 *
 * <pre>
 * public static void main(String[] args) throws Exception {
 *     DebugPro.install();
 *     Frames.run("main", locals -&gt; { ... });
 * }
 * </pre>
 *
 * <p>同一时刻只有一个处理器生效；重复安装以最后一次为准，并保留首次安装前的
 * 处理器作为默认错误输出。无需显式卸载。</p>
 */
public final class DebugPro {

    private static final Logger LOG = Logger.getLogger(DebugPro.class.getName());

    static final String BANNER = "[debug-pro] Custom exception handler enabled";

    private static volatile DebugProHandler installed;
    private static Thread.UncaughtExceptionHandler original;

    private DebugPro() {}

    public static void install() {
        install(DebugProConfig.fromSystemProperties());
    }

    public static void install(DebugProConfig config) {
        install(config, System.out, System.err);
    }

    public static synchronized void install(DebugProConfig config, PrintStream out, PrintStream err) {
        Thread.UncaughtExceptionHandler current = Thread.getDefaultUncaughtExceptionHandler();
        if (!(current instanceof DebugProHandler)) {
            original = current;
        }
        DebugProHandler handler = new DebugProHandler(new CrashReporter(config), out, err, original);
        Thread.setDefaultUncaughtExceptionHandler(handler);
        installed = handler;
        LOG.fine("Installed uncaught exception handler (previous: " + current + ")");
        out.println(BANNER);
    }

    /**
     * 恢复首次安装前的处理器。
     */
    public static synchronized void uninstall() {
        if (Thread.getDefaultUncaughtExceptionHandler() == installed && installed != null) {
            Thread.setDefaultUncaughtExceptionHandler(original);
        }
        installed = null;
        original = null;
    }

    public static boolean isInstalled() {
        return Thread.getDefaultUncaughtExceptionHandler() instanceof DebugProHandler;
    }

    /** 当前安装的处理器，未安装时为 null */
    public static DebugProHandler handler() {
        return installed;
    }

    /**
     * 只渲染、不打印。
     *
     * @return 报告文本；没有应用帧时为 null
     */
    public static String render(Throwable t) {
        DebugProHandler handler = installed;
        CrashReporter reporter = handler != null
                ? handler.getReporter()
                : new CrashReporter(DebugProConfig.fromSystemProperties());
        Report report = reporter.analyze(t);
        return report != null ? report.getText() : null;
    }
}
