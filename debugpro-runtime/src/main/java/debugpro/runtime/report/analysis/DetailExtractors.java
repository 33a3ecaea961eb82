package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.ErrorCategory;
import debugpro.runtime.RaisedError;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 按类别分派到唯一的分析器（不做回退或混合）。
 */
public final class DetailExtractors {

    private static final Logger LOG = Logger.getLogger(DetailExtractors.class.getName());

    private static final DetailExtractor KEY_LOOKUP = new KeyLookupExtractor();
    private static final DetailExtractor COLLECTION = new CollectionExtractor();
    private static final DetailExtractor MEMBER = new MemberExtractor();
    private static final DetailExtractor UNDEFINED_NAME = new UndefinedNameExtractor();

    private DetailExtractors() {}

    /**
     * @return 类别对应的分析器；{@link ErrorCategory#OTHER} 返回 null
     */
    public static DetailExtractor forCategory(ErrorCategory category) {
        switch (category) {
            case KEY_LOOKUP:           return KEY_LOOKUP;
            case INDEX_RANGE:
            case TYPE_MISMATCH:        return COLLECTION;
            case MEMBER_NOT_FOUND:     return MEMBER;
            case UNDEFINED_IDENTIFIER: return UNDEFINED_NAME;
            default:                   return null;
        }
    }

    public static AnalysisResult analyze(RaisedError error, CallFrame faultFrame, String faultLine) {
        DetailExtractor extractor = forCategory(error.getCategory());
        if (extractor == null) {
            return AnalysisResult.none();
        }
        try {
            return extractor.extract(error, faultFrame, faultLine != null ? faultLine : "");
        } catch (Throwable e) {
            Failures.rethrowIfFatal(e);
            String note = "Analysis failed for " + error.getCategory().getLabel() + ": " + e;
            LOG.fine(note);
            List<String> notes = new ArrayList<>();
            notes.add(note);
            return AnalysisResult.none(notes);
        }
    }
}
