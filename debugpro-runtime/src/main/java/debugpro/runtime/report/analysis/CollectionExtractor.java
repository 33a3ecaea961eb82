package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.ErrorCategory;
import debugpro.runtime.RaisedError;
import debugpro.runtime.detail.CollectionDetail;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 越界与类型不匹配共用：找出故障行中可求长度的值，给出长度、合法下标和尝试的下标。
 */
final class CollectionExtractor implements DetailExtractor {

    private static final Logger LOG = Logger.getLogger(CollectionExtractor.class.getName());

    static final String EMPTY_RANGE = "N/A (empty)";

    @Override
    public AnalysisResult extract(RaisedError error, CallFrame faultFrame, String faultLine) {
        List<String> notes = new ArrayList<>();
        if (faultLine.isEmpty()) {
            return AnalysisResult.none(notes);
        }
        ErrorCategory category = error.getCategory() == ErrorCategory.TYPE_MISMATCH
                ? ErrorCategory.TYPE_MISMATCH : ErrorCategory.INDEX_RANGE;
        for (Map.Entry<String, Object> binding : faultFrame.getBindings().entrySet()) {
            String name = binding.getKey();
            Object value = binding.getValue();
            if (!hasLength(value) || !faultLine.contains(name)) continue;
            try {
                int length = lengthOf(value);
                String validIndices = null;
                if (isOrderedSequence(value)) {
                    validIndices = length > 0 ? "0 to " + (length - 1) : EMPTY_RANGE;
                }
                CollectionDetail detail = new CollectionDetail(category, name, ValuePrinter.print(value),
                        length, validIndices, MessageParsers.attemptedIndex(faultLine, error.getMessage()));
                return AnalysisResult.of(detail, notes);
            } catch (Throwable e) {
                Failures.rethrowIfFatal(e);
                String note = "Error analyzing collection '" + name + "': " + e;
                LOG.fine(note);
                notes.add(note);
            }
        }
        return AnalysisResult.none(notes);
    }

    static boolean hasLength(Object value) {
        return value instanceof Collection
                || value instanceof Map
                || value instanceof CharSequence
                || (value != null && value.getClass().isArray());
    }

    static boolean isOrderedSequence(Object value) {
        return value instanceof List || (value != null && value.getClass().isArray());
    }

    static int lengthOf(Object value) {
        if (value instanceof Collection) return ((Collection<?>) value).size();
        if (value instanceof Map) return ((Map<?, ?>) value).size();
        if (value instanceof CharSequence) return ((CharSequence) value).length();
        return Array.getLength(value);
    }
}
