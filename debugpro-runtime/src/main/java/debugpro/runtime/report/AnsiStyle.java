package debugpro.runtime.report;

/**
 * ANSI 转义序列；关闭颜色时所有序列为空串。
 */
final class AnsiStyle {

    static final AnsiStyle COLOR = new AnsiStyle(true);
    static final AnsiStyle PLAIN = new AnsiStyle(false);

    final String reset;
    final String bold;
    final String dim;
    final String red;
    final String yellow;
    final String cyan;

    private AnsiStyle(boolean enabled) {
        this.reset = enabled ? "\033[0m" : "";
        this.bold = enabled ? "\033[1m" : "";
        this.dim = enabled ? "\033[2m" : "";
        this.red = enabled ? "\033[31m" : "";
        this.yellow = enabled ? "\033[33m" : "";
        this.cyan = enabled ? "\033[36m" : "";
    }

    static AnsiStyle of(boolean color) {
        return color ? COLOR : PLAIN;
    }
}
