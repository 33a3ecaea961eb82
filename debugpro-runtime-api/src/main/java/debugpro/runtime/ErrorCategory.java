package debugpro.runtime;

/**
 * 错误类别：决定使用哪一个专用分析器。
 *
 * <p>封闭枚举，每个常量对应一个提取器；{@link #OTHER} 不产生结构化详情，
 * 交由默认错误输出处理。</p>
 */
public enum ErrorCategory {

    KEY_LOOKUP("KeyLookup"),
    INDEX_RANGE("IndexRange"),
    TYPE_MISMATCH("TypeMismatch"),
    MEMBER_NOT_FOUND("MemberNotFound"),
    UNDEFINED_IDENTIFIER("UndefinedIdentifier"),
    OTHER("Other");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    /** 报告中显示的类别名 */
    public String getLabel() {
        return label;
    }
}
