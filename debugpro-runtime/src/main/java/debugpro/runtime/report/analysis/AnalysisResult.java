package debugpro.runtime.report.analysis;

import debugpro.runtime.detail.DiagnosticDetail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分析结果：可选的详情 + 非致命备注。
 *
 * <p>没有错误通道：分析中的失败只会变成备注。</p>
 */
public final class AnalysisResult {

    private static final AnalysisResult EMPTY = new AnalysisResult(null, Collections.<String>emptyList());

    private final DiagnosticDetail detail;
    private final List<String> notes;

    private AnalysisResult(DiagnosticDetail detail, List<String> notes) {
        this.detail = detail;
        this.notes = Collections.unmodifiableList(new ArrayList<>(notes));
    }

    public static AnalysisResult of(DiagnosticDetail detail, List<String> notes) {
        return new AnalysisResult(detail, notes);
    }

    public static AnalysisResult none(List<String> notes) {
        return notes.isEmpty() ? EMPTY : new AnalysisResult(null, notes);
    }

    public static AnalysisResult none() {
        return EMPTY;
    }

    /** 详情，未能提取时为 null */
    public DiagnosticDetail getDetail() {
        return detail;
    }

    public boolean hasDetail() {
        return detail != null;
    }

    public List<String> getNotes() {
        return notes;
    }
}
