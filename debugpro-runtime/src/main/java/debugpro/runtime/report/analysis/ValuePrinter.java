package debugpro.runtime.report.analysis;

import java.util.Arrays;

/**
 * 值的打印形式：{@code String.valueOf}，数组使用 {@code Arrays.deepToString}。
 */
public final class ValuePrinter {

    private ValuePrinter() {}

    /**
     * 打印值；{@code toString} 抛出的异常原样传播。
     */
    public static String print(Object value) {
        if (value instanceof Object[]) return Arrays.deepToString((Object[]) value);
        if (value instanceof int[]) return Arrays.toString((int[]) value);
        if (value instanceof long[]) return Arrays.toString((long[]) value);
        if (value instanceof double[]) return Arrays.toString((double[]) value);
        if (value instanceof float[]) return Arrays.toString((float[]) value);
        if (value instanceof short[]) return Arrays.toString((short[]) value);
        if (value instanceof byte[]) return Arrays.toString((byte[]) value);
        if (value instanceof char[]) return Arrays.toString((char[]) value);
        if (value instanceof boolean[]) return Arrays.toString((boolean[]) value);
        return String.valueOf(value);
    }

    public static String unprintable(Throwable error) {
        return "<unprintable: " + error + ">";
    }
}
