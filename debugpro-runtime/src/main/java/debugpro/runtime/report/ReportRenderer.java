package debugpro.runtime.report;

import debugpro.runtime.RaisedError;
import debugpro.runtime.SourceWindow;
import debugpro.runtime.detail.CollectionDetail;
import debugpro.runtime.detail.DiagnosticDetail;
import debugpro.runtime.detail.KeyLookupDetail;
import debugpro.runtime.detail.MemberDetail;
import debugpro.runtime.detail.UndefinedNameDetail;
import debugpro.runtime.report.analysis.AnalysisResult;

import java.io.File;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 报告渲染：按固定顺序组装各面板。
 *
 * <ol>
 *   <li>标题（类别名 + 消息）</li>
 *   <li>帧状态（模块名、可调用名、系统信息、类路径、变量）</li>
 *   <li>位置</li>
 *   <li>调用栈</li>
 *   <li>源码上下文</li>
 *   <li>类别详情（仅当提取到详情时）</li>
 * </ol>
 */
public final class ReportRenderer {

    /** 变量打印形式的最大长度 */
    public static final int MAX_VALUE_LENGTH = 500;

    private static final String RULE = repeat("=", 60);

    private final AnsiStyle s;

    public ReportRenderer(boolean color) {
        this.s = AnsiStyle.of(color);
    }

    public String render(RaisedError error, StackWalk walk, FrameState state,
                         SourceWindow window, AnalysisResult analysis) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, error);
        appendFrameState(sb, state);
        appendLocation(sb, walk);
        appendStackTrace(sb, walk);
        appendCodeContext(sb, window);
        if (analysis.hasDetail()) {
            appendDetail(sb, analysis.getDetail(), analysis.getNotes());
        } else if (!analysis.getNotes().isEmpty()) {
            label(sb, "Analysis Notes");
            appendNotes(sb, analysis.getNotes());
        }
        return sb.toString();
    }

    // ============ 1. 标题 ============

    private void appendHeader(StringBuilder sb, RaisedError error) {
        String message = error.getMessage();
        sb.append("\n").append(s.bold).append(s.red).append(RULE).append(s.reset).append("\n");
        sb.append(s.bold).append(s.red).append("ERROR: ").append(error.getTypeName())
          .append(" [").append(error.getCategory().getLabel()).append("]");
        if (!message.isEmpty()) {
            sb.append(": ").append(message);
        }
        sb.append(s.reset).append("\n");
        sb.append(s.bold).append(s.red).append(RULE).append(s.reset).append("\n");
    }

    // ============ 2. 帧状态 ============

    private void appendFrameState(StringBuilder sb, FrameState state) {
        label(sb, "Modules");
        appendNames(sb, state.getModules());

        label(sb, "Functions");
        appendNames(sb, state.getCallables());

        label(sb, "System Info");
        sb.append("Java version: ").append(System.getProperty("java.version", "unknown")).append("\n");
        sb.append("Platform: ").append(System.getProperty("os.name", "unknown")).append(" ")
          .append(System.getProperty("os.version", "")).append(" (")
          .append(System.getProperty("os.arch", "unknown")).append(")\n");
        sb.append("Current working directory: ")
          .append(Paths.get("").toAbsolutePath()).append("\n");

        label(sb, "Class Path");
        String classPath = System.getProperty("java.class.path", "");
        int i = 1;
        for (String entry : classPath.split(File.pathSeparator)) {
            if (entry.isEmpty()) continue;
            sb.append("  ").append(i++).append(". ").append(entry).append("\n");
        }

        label(sb, "Variables");
        if (state.getValues().isEmpty()) {
            sb.append("  None\n");
        } else {
            for (Map.Entry<String, String> value : new TreeMap<>(state.getValues()).entrySet()) {
                sb.append(value.getKey()).append(" = ").append(truncate(value.getValue())).append("\n");
            }
        }
    }

    private static void appendNames(StringBuilder sb, Map<String, String> bucket) {
        if (bucket.isEmpty()) {
            sb.append("  None\n");
            return;
        }
        for (String name : bucket.keySet()) {
            sb.append(name).append("\n");
        }
    }

    static String truncate(String value) {
        return value.length() > MAX_VALUE_LENGTH ? value.substring(0, MAX_VALUE_LENGTH) : value;
    }

    // ============ 3. 位置 ============

    private void appendLocation(StringBuilder sb, StackWalk walk) {
        sb.append("\n").append(s.yellow).append("Location: ").append(s.cyan)
          .append(shortenPath(walk.getFaultFrame().getSourceFile())).append(s.reset)
          .append(", line ").append(s.bold).append(walk.getFaultFrame().getSourceLine())
          .append(s.reset).append("\n");
    }

    /**
     * 只保留最后两段路径，更深时加 {@code ...} 前缀。
     */
    static String shortenPath(String file) {
        List<String> parts = new ArrayList<>();
        for (String part : file.split("[/\\\\]")) {
            if (!part.isEmpty()) parts.add(part);
        }
        if (parts.size() <= 2) {
            return file;
        }
        return "..." + File.separator + parts.get(parts.size() - 2) + File.separator + parts.get(parts.size() - 1);
    }

    // ============ 4. 调用栈 ============

    private void appendStackTrace(StringBuilder sb, StackWalk walk) {
        label(sb, "Stack Trace");
        int i = 1;
        for (StackWalk.Entry entry : walk.getEntries()) {
            sb.append(i++).append(". ").append(s.cyan).append(entry.getFrame().getCallableName()).append(s.reset)
              .append(" in ").append(shortenPath(entry.getFrame().getSourceFile()))
              .append(":").append(entry.getLineNumber()).append("\n");
        }
    }

    // ============ 5. 源码上下文 ============

    private void appendCodeContext(StringBuilder sb, SourceWindow window) {
        label(sb, "Code Context");
        if (window.isEmpty()) {
            sb.append("  ").append(s.dim).append("<source not available: ")
              .append(shortenPath(window.getFile())).append(">").append(s.reset).append("\n");
            return;
        }
        if (window.getStartLine() <= 1) {
            sb.append("   -- start of file --\n");
        }
        for (SourceWindow.Line line : window.getLines()) {
            if (line.getNumber() == window.getCenterLine()) {
                sb.append("→ ").append(line.getNumber()).append(": ")
                  .append(s.red).append(line.getText()).append(s.reset).append("\n");
            } else {
                sb.append("  ").append(line.getNumber()).append(": ").append(line.getText()).append("\n");
            }
        }
        if (window.isTruncatedBelow()) {
            sb.append("   ... (").append(window.getLinesBelow()).append(" more lines below)\n");
        } else {
            sb.append("  --- End of file ---\n");
        }
    }

    // ============ 6. 类别详情 ============

    private void appendDetail(StringBuilder sb, DiagnosticDetail detail, List<String> notes) {
        sb.append("\n").append(s.bold).append(s.red).append("------ ").append(detail.getLabel())
          .append(" Details ------").append(s.reset).append("\n");

        if (detail instanceof KeyLookupDetail) {
            KeyLookupDetail d = (KeyLookupDetail) detail;
            field(sb, "Dictionary:", d.getContainerName() + " = " + d.getContainerValue());
            field(sb, "Missing key:", d.getMissingKey());
            field(sb, "Available keys:", d.getAvailableKeys().toString());
            if (!d.getSimilarKeys().isEmpty()) {
                field(sb, "Possible similar keys:", d.getSimilarKeys().toString());
            }
        } else if (detail instanceof CollectionDetail) {
            CollectionDetail d = (CollectionDetail) detail;
            field(sb, "Collection:", d.getCollectionName() + " = " + d.getCollectionValue());
            field(sb, "Length:", String.valueOf(d.getLength()));
            if (d.getValidIndices() != null) {
                field(sb, "Valid indices:", d.getValidIndices());
            }
            field(sb, "Invalid index:", d.getAttemptedIndex());
        } else if (detail instanceof MemberDetail) {
            MemberDetail d = (MemberDetail) detail;
            field(sb, "Object:", d.getObjectName() + " = " + d.getObjectValue());
            field(sb, "Type:", d.getTypeName());
            if (!d.getMembers().isEmpty()) {
                field(sb, "Available attributes:", join(d.getMembers()));
                if (d.getHiddenMemberCount() > 0) {
                    sb.append("  ... and ").append(d.getHiddenMemberCount()).append(" more\n");
                }
            }
            if (!d.getSimilarMembers().isEmpty()) {
                field(sb, "Possible similar attributes:", d.getSimilarMembers().toString());
            }
            field(sb, "Missing Attribute:", d.getMissingMember());
        } else if (detail instanceof UndefinedNameDetail) {
            UndefinedNameDetail d = (UndefinedNameDetail) detail;
            field(sb, "Undefined variable:", "'" + d.getName() + "'");
            if (!d.getSimilarNames().isEmpty()) {
                field(sb, "Similar variable names:", d.getSimilarNames().toString());
            }
        }
        appendNotes(sb, notes);
    }

    private void appendNotes(StringBuilder sb, List<String> notes) {
        for (String note : notes) {
            sb.append("  ").append(s.dim).append("note: ").append(note).append(s.reset).append("\n");
        }
    }

    private void field(StringBuilder sb, String name, String value) {
        sb.append(s.yellow).append(name).append(s.reset).append(" ").append(value).append("\n");
    }

    private void label(StringBuilder sb, String title) {
        sb.append("\n").append(s.bold).append("------ ").append(title).append(" ------").append(s.reset).append("\n");
    }

    private static String join(List<String> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
        return sb.toString();
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
