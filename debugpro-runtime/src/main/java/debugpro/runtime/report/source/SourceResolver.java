package debugpro.runtime.report.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 将栈帧的类名和文件名解析为源码根目录下的实际路径。
 *
 * <p>{@code com.acme.Foo} + {@code Foo.java} 依次尝试 {@code <root>/com/acme/Foo.java}
 * 与 {@code <root>/Foo.java}；都不存在时返回包相对路径，供报告显示。</p>
 */
public final class SourceResolver {

    private final List<Path> sourceRoots;

    public SourceResolver(List<Path> sourceRoots) {
        this.sourceRoots = sourceRoots;
    }

    public String resolve(String className, String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return "<unknown>";
        }
        String relative = packagePath(className) + fileName;
        for (Path root : sourceRoots) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate)) {
                return candidate.toAbsolutePath().normalize().toString();
            }
            Path flat = root.resolve(fileName);
            if (Files.isRegularFile(flat)) {
                return flat.toAbsolutePath().normalize().toString();
            }
        }
        return relative;
    }

    private static String packagePath(String className) {
        if (className == null) return "";
        int lastDot = className.lastIndexOf('.');
        if (lastDot < 0) return "";
        return className.substring(0, lastDot).replace('.', '/') + "/";
    }
}
