package debugpro.runtime;

/**
 * 映射中不存在请求的键。
 *
 * <p>消息为带引号的键（例如 {@code 'z'}），分析器据此解析缺失键。</p>
 */
public class KeyLookupException extends DebugProException {

    private final transient Object key;

    public KeyLookupException(Object key) {
        super("'" + key + "'");
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
