package debugpro.runtime.report;

import debugpro.runtime.report.analysis.AnalysisResult;

/**
 * 渲染好的报告文本及其分析结果。
 */
public final class Report {

    private final String text;
    private final AnalysisResult analysis;

    Report(String text, AnalysisResult analysis) {
        this.text = text;
        this.analysis = analysis;
    }

    public String getText() {
        return text;
    }

    public AnalysisResult getAnalysis() {
        return analysis;
    }

    /** 没有详情时，调用方应继续输出默认错误信息 */
    public boolean hasDetail() {
        return analysis.hasDetail();
    }

    @Override
    public String toString() {
        return text;
    }
}
