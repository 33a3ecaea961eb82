package debugpro.runtime;

/**
 * 按名称查找的绑定不存在。
 */
public class UndefinedIdentifierException extends DebugProException {

    private final String name;

    public UndefinedIdentifierException(String name) {
        super("name '" + name + "' is not defined");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
