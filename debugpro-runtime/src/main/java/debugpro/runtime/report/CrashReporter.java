package debugpro.runtime.report;

import debugpro.runtime.CallFrame;
import debugpro.runtime.RaisedError;
import debugpro.runtime.SourceWindow;
import debugpro.runtime.report.analysis.AnalysisResult;
import debugpro.runtime.report.analysis.DetailExtractors;
import debugpro.runtime.report.analysis.ErrorClassifier;
import debugpro.runtime.report.source.SourceContextProvider;
import debugpro.runtime.report.source.SourceResolver;

/**
 * 报告流水线：调用链 → 栈遍历 → {帧状态、源码上下文、类别详情} → 渲染。
 */
public final class CrashReporter {

    private final DebugProConfig config;
    private final SourceResolver resolver;
    private final SourceContextProvider sources;
    private final ReportRenderer renderer;

    public CrashReporter(DebugProConfig config) {
        this.config = config;
        this.resolver = new SourceResolver(config.getSourceRoots());
        this.sources = SourceContextProvider.shared(config.getCacheSize());
        this.renderer = new ReportRenderer(config.isColor());
    }

    /** 进程级源码缓存 */
    SourceContextProvider getSources() {
        return sources;
    }

    /**
     * 分析异常。
     *
     * @return 报告；没有任何应用帧时返回 null
     */
    public Report analyze(Throwable t) {
        CallFrame chain = CallChains.fromThrowable(t, config, resolver);
        RaisedError error = new RaisedError(ErrorClassifier.classify(t), t.getMessage(), chain, t);
        return report(error);
    }

    /**
     * 为已构建好调用链的错误生成报告；空链返回 null。
     */
    public Report report(RaisedError error) {
        StackWalk walk = CallStackWalker.walk(error.getStackChain());
        if (walk == null) {
            return null;
        }
        CallFrame fault = walk.getFaultFrame();
        FrameState state = FrameStateExtractor.extract(fault);
        SourceWindow window = sources.window(fault.getSourceFile(), fault.getSourceLine());
        String faultLine = sources.getLine(fault.getSourceFile(), fault.getSourceLine()).trim();
        AnalysisResult analysis = DetailExtractors.analyze(error, fault, faultLine);
        return new Report(renderer.render(error, walk, state, window, analysis), analysis);
    }
}
