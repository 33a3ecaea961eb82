package debugpro.runtime;

/**
 * DebugPro 基础运行时异常。
 */
public class DebugProException extends RuntimeException {

    public DebugProException(String message) {
        super(message);
    }

    public DebugProException(String message, Throwable cause) {
        super(message, cause);
    }
}
