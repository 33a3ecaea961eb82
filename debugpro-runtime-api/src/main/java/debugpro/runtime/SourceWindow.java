package debugpro.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 源码上下文窗口：故障行前后各 {@value #RADIUS} 行。
 *
 * <p>不变式：{@code startLine <= centerLine <= endLine}，且范围裁剪到 {@code [1, totalLines]}。
 * 文件缺失或行不可读时为空窗口。</p>
 */
public final class SourceWindow {

    public static final int RADIUS = 3;

    /** 窗口中的一行 */
    public static final class Line {
        private final int number;
        private final String text;

        public Line(int number, String text) {
            this.number = number;
            this.text = text;
        }

        public int getNumber() { return number; }
        public String getText() { return text; }
    }

    private final String file;
    private final int centerLine;
    private final int startLine;
    private final int endLine;
    private final int totalLines;
    private final List<Line> lines;

    public SourceWindow(String file, int centerLine, int startLine, int endLine, int totalLines, List<Line> lines) {
        if (startLine > centerLine || centerLine > endLine) {
            throw new IllegalArgumentException("window " + startLine + ".." + endLine + " does not contain line " + centerLine);
        }
        this.file = file;
        this.centerLine = centerLine;
        this.startLine = startLine;
        this.endLine = endLine;
        this.totalLines = totalLines;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static SourceWindow empty(String file, int centerLine) {
        int line = Math.max(1, centerLine);
        return new SourceWindow(file, line, line, line, 0, Collections.<Line>emptyList());
    }

    public String getFile() { return file; }
    public int getCenterLine() { return centerLine; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public int getTotalLines() { return totalLines; }
    public List<Line> getLines() { return lines; }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /** 窗口上方还有未显示的行 */
    public boolean isTruncatedAbove() {
        return !isEmpty() && startLine > 1;
    }

    /** 窗口下方还有未显示的行 */
    public boolean isTruncatedBelow() {
        return !isEmpty() && endLine < totalLines;
    }

    public int getLinesBelow() {
        return isTruncatedBelow() ? totalLines - endLine : 0;
    }
}
