package debugpro.runtime.report.analysis;

import debugpro.runtime.ErrorCategory;
import debugpro.runtime.KeyLookupException;
import debugpro.runtime.UndefinedIdentifierException;

/**
 * 按异常类型归类。
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorCategory classify(Throwable t) {
        // NoSuchElementException 不携带键，属于 Other
        if (t instanceof KeyLookupException) {
            return ErrorCategory.KEY_LOOKUP;
        }
        if (t instanceof IndexOutOfBoundsException) {
            return ErrorCategory.INDEX_RANGE;
        }
        if (t instanceof ClassCastException || t instanceof ArrayStoreException) {
            return ErrorCategory.TYPE_MISMATCH;
        }
        if (t instanceof NoSuchMethodException || t instanceof NoSuchFieldException
                || t instanceof NoSuchMethodError || t instanceof NoSuchFieldError) {
            return ErrorCategory.MEMBER_NOT_FOUND;
        }
        if (t instanceof UndefinedIdentifierException || t instanceof ClassNotFoundException
                || t instanceof NoClassDefFoundError) {
            return ErrorCategory.UNDEFINED_IDENTIFIER;
        }
        return ErrorCategory.OTHER;
    }
}
