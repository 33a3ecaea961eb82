package debugpro.runtime.report.analysis;

import debugpro.runtime.detail.CollectionDetail;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从错误消息和故障行中解析名称、键与下标。
 */
public final class MessageParsers {

    private static final Pattern INDEX_IN_MESSAGE = Pattern.compile("(?i)\\bindex:?\\s*(-?\\d+)");

    private MessageParsers() {}

    /**
     * 第一对引号（单引号或双引号）之间的文本；没有成对引号时返回 null。
     */
    public static String quoted(String message) {
        if (message == null) return null;
        for (int i = 0; i < message.length(); i++) {
            char c = message.charAt(i);
            if (c == '\'' || c == '"') {
                int close = message.indexOf(c, i + 1);
                return close > i ? message.substring(i + 1, close) : null;
            }
        }
        return null;
    }

    /**
     * 缺失的键：去掉首尾空白和首尾的引号字符，键内部的引号保留（{@code 'it's'} → {@code it's}）。
     */
    public static String missingKey(String message) {
        if (message == null) return null;
        String key = stripQuotes(message.trim());
        return key.isEmpty() ? null : key;
    }

    /**
     * 缺失的成员名。支持 {@code 'name'}、JDK 反射消息 {@code pkg.Type.name(args)}
     * 以及 {@code 'void pkg.Type.name()'}。
     */
    public static String memberName(String message) {
        if (message == null) return null;
        String text = quoted(message);
        if (text == null) {
            text = message.trim();
            if (text.indexOf('(') < 0 && containsWhitespace(text)) {
                return null;
            }
        }
        int paren = text.indexOf('(');
        if (paren >= 0) {
            text = text.substring(0, paren);
            text = text.substring(Math.max(text.lastIndexOf('.'), text.lastIndexOf(' ')) + 1);
        }
        return text.isEmpty() ? null : text;
    }

    /**
     * 未定义的标识符：引号内文本，否则为不含空白的整条消息（如类名）。
     */
    public static String undefinedName(String message) {
        if (message == null) return null;
        String name = quoted(message);
        if (name == null) {
            name = message.trim();
            if (containsWhitespace(name)) return null;
        }
        return name.isEmpty() ? null : name;
    }

    /**
     * 尝试的下标：先取故障行第一个方括号表达式，再取 JDK 消息中的 {@code Index N}；
     * 都失败时为 {@value CollectionDetail#UNPARSEABLE}。
     */
    public static String attemptedIndex(String faultLine, String message) {
        if (faultLine != null) {
            int open = faultLine.indexOf('[');
            int close = open >= 0 ? faultLine.indexOf(']', open + 1) : -1;
            if (close > open + 1) {
                String inside = faultLine.substring(open + 1, close).trim();
                if (!inside.isEmpty()) return inside;
            }
        }
        if (message != null) {
            Matcher m = INDEX_IN_MESSAGE.matcher(message);
            if (m.find()) return m.group(1);
        }
        return CollectionDetail.UNPARSEABLE;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isQuote(s.charAt(start))) start++;
        while (end > start && isQuote(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean containsWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return true;
        }
        return false;
    }
}
