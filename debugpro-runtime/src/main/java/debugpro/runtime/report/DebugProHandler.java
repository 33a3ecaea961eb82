package debugpro.runtime.report;

import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 未捕获异常处理器：打印诊断报告；没有类别详情时再交给默认错误输出。
 *
 * <p>报告流水线的任何失败都不会越过此处。</p>
 */
public final class DebugProHandler implements Thread.UncaughtExceptionHandler {

    private static final Logger LOG = Logger.getLogger(DebugProHandler.class.getName());

    private final CrashReporter reporter;
    private final PrintStream out;
    private final PrintStream err;
    private final Thread.UncaughtExceptionHandler fallback;

    DebugProHandler(CrashReporter reporter, PrintStream out, PrintStream err,
                    Thread.UncaughtExceptionHandler fallback) {
        this.reporter = reporter;
        this.out = out;
        this.err = err;
        this.fallback = fallback;
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        Report report = null;
        try {
            report = reporter.analyze(error);
        } catch (Throwable e) {
            LOG.log(Level.WARNING, "Failed to build diagnostic report", e);
        }
        if (report != null) {
            out.print(report.getText());
            out.flush();
        }
        if (report == null || !report.hasDetail()) {
            presentDefault(thread, error);
        }
    }

    CrashReporter getReporter() {
        return reporter;
    }

    /** 安装前生效的处理器；为 null 时使用 JVM 默认格式 */
    Thread.UncaughtExceptionHandler getFallback() {
        return fallback;
    }

    private void presentDefault(Thread thread, Throwable error) {
        if (fallback != null) {
            fallback.uncaughtException(thread, error);
            return;
        }
        // 与 ThreadGroup.uncaughtException 相同的格式；不能委托给它，否则会再次进入本处理器
        err.print("Exception in thread \"" + thread.getName() + "\" ");
        error.printStackTrace(err);
        err.flush();
    }
}
