package debugpro.runtime;

/**
 * 被分析的错误：类别 + 消息 + 调用链。
 *
 * <p>调用链归错误传播机制所有，此处只读。链头为最外层调用者；
 * 链为空（{@code stackChain == null}）时不生成报告。</p>
 */
public final class RaisedError {

    private final ErrorCategory category;
    private final String message;
    private final CallFrame stackChain;
    private final Throwable throwable;

    public RaisedError(ErrorCategory category, String message, CallFrame stackChain, Throwable throwable) {
        this.category = category != null ? category : ErrorCategory.OTHER;
        this.message = message != null ? message : "";
        this.stackChain = stackChain;
        this.throwable = throwable;
    }

    public ErrorCategory getCategory() { return category; }
    public String getMessage() { return message; }
    public CallFrame getStackChain() { return stackChain; }
    public Throwable getThrowable() { return throwable; }

    /** 报告标题中使用的错误类型名 */
    public String getTypeName() {
        return throwable != null ? throwable.getClass().getSimpleName() : category.getLabel();
    }
}
