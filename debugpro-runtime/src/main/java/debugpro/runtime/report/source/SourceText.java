package debugpro.runtime.report.source;

import java.util.Collections;
import java.util.List;

/**
 * 一个源码文件的全部行；文件缺失或不可读时为 {@link #MISSING}。
 */
final class SourceText {

    static final SourceText MISSING = new SourceText(Collections.<String>emptyList());

    private final List<String> lines;

    SourceText(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /** 1 起始；越界返回 null */
    String line(int number) {
        if (number < 1 || number > lines.size()) return null;
        return lines.get(number - 1);
    }
}
