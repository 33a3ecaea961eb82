package debugpro.runtime.detail;

import debugpro.runtime.ErrorCategory;

/**
 * 越界或类型不匹配：涉及的集合、长度、合法下标范围和尝试的下标。
 *
 * <p>{@link ErrorCategory#INDEX_RANGE} 与 {@link ErrorCategory#TYPE_MISMATCH} 共用，
 * 仅标签不同。</p>
 */
public final class CollectionDetail extends DiagnosticDetail {

    public static final String UNPARSEABLE = "Unparseable";

    private final String collectionName;
    private final String collectionValue;
    private final int length;
    private final String validIndices;
    private final String attemptedIndex;

    public CollectionDetail(ErrorCategory category, String collectionName, String collectionValue,
                            int length, String validIndices, String attemptedIndex) {
        super(category);
        if (category != ErrorCategory.INDEX_RANGE && category != ErrorCategory.TYPE_MISMATCH) {
            throw new IllegalArgumentException("not a collection category: " + category);
        }
        this.collectionName = collectionName;
        this.collectionValue = collectionValue;
        this.length = length;
        this.validIndices = validIndices;
        this.attemptedIndex = attemptedIndex != null ? attemptedIndex : UNPARSEABLE;
    }

    public String getCollectionName() { return collectionName; }
    public String getCollectionValue() { return collectionValue; }
    public int getLength() { return length; }

    /** 有序序列的合法下标范围；非有序容器为 null */
    public String getValidIndices() { return validIndices; }

    public String getAttemptedIndex() { return attemptedIndex; }
}
