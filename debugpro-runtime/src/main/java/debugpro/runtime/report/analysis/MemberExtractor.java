package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.RaisedError;
import debugpro.runtime.detail.MemberDetail;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 成员不存在：找出故障行中的对象，列出运行时类型的公开成员和相似成员。
 */
final class MemberExtractor implements DetailExtractor {

    private static final Logger LOG = Logger.getLogger(MemberExtractor.class.getName());

    /** java.lang.Object 的公开方法名，不计入成员列表 */
    private static final Set<String> OBJECT_MEMBERS = new HashSet<>();

    static {
        for (Method method : Object.class.getMethods()) {
            OBJECT_MEMBERS.add(method.getName());
        }
    }

    @Override
    public AnalysisResult extract(RaisedError error, CallFrame faultFrame, String faultLine) {
        List<String> notes = new ArrayList<>();
        String member = MessageParsers.memberName(error.getMessage());
        if (member == null) {
            notes.add("Could not parse the missing member from: " + error.getMessage());
            return AnalysisResult.none(notes);
        }
        if (faultLine.isEmpty()) {
            return AnalysisResult.none(notes);
        }
        for (Map.Entry<String, Object> binding : faultFrame.getBindings().entrySet()) {
            String name = binding.getKey();
            if (!faultLine.contains(name)) continue;
            Object value = binding.getValue();
            try {
                List<String> members = listMembers(value);
                MemberDetail detail = new MemberDetail(name, ValuePrinter.print(value), typeName(value),
                        member, members, members.size(), Similarity.suggest(member, members));
                return AnalysisResult.of(detail, notes);
            } catch (Throwable e) {
                Failures.rethrowIfFatal(e);
                String note = "Error analyzing object '" + name + "': " + e;
                LOG.fine(note);
                notes.add(note);
            }
        }
        return AnalysisResult.none(notes);
    }

    /**
     * 运行时类型的公开方法与字段名，去重排序；略去保留名、合成成员和 Object 自身的方法。
     */
    static List<String> listMembers(Object value) {
        if (value == null) return new ArrayList<>();
        Set<String> names = new TreeSet<>();
        Class<?> type = value.getClass();
        for (Method method : type.getMethods()) {
            if (method.isSynthetic() || method.isBridge()) continue;
            addMember(names, method.getName());
        }
        for (Field field : type.getFields()) {
            if (field.isSynthetic()) continue;
            addMember(names, field.getName());
        }
        return new ArrayList<>(names);
    }

    private static void addMember(Set<String> names, String name) {
        if (name.startsWith("__") || name.indexOf('$') >= 0 || OBJECT_MEMBERS.contains(name)) return;
        names.add(name);
    }

    private static String typeName(Object value) {
        if (value == null) return "null";
        String simple = value.getClass().getSimpleName();
        return simple.isEmpty() ? value.getClass().getName() : simple;
    }
}
