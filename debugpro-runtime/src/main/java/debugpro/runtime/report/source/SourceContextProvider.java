package debugpro.runtime.report.source;

import debugpro.runtime.SourceWindow;
import debugpro.runtime.report.cache.BoundedCache;
import debugpro.runtime.report.cache.CacheStats;
import debugpro.runtime.report.cache.CaffeineCache;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 源码上下文：读取并缓存源码文件，计算故障行周围的窗口。
 *
 * <p>缓存按文件路径为键，运行期间不失效。文件缺失或不可读时返回空窗口，从不抛出。</p>
 *
 * <p>报告流水线使用 {@link #shared(long)} 返回的进程级实例，重复安装或多次渲染共用同一缓存。</p>
 */
public final class SourceContextProvider {

    private static final Logger LOG = Logger.getLogger(SourceContextProvider.class.getName());

    private static volatile SourceContextProvider shared;

    private final BoundedCache<String, SourceText> cache;

    public SourceContextProvider(long cacheSize) {
        this.cache = new CaffeineCache<>(cacheSize);
    }

    /**
     * 进程级共享实例。首次调用时按 {@code cacheSize} 创建，之后的调用忽略该参数。
     */
    public static SourceContextProvider shared(long cacheSize) {
        SourceContextProvider provider = shared;
        if (provider == null) {
            synchronized (SourceContextProvider.class) {
                provider = shared;
                if (provider == null) {
                    provider = new SourceContextProvider(cacheSize);
                    shared = provider;
                    LOG.fine("Created shared source cache (maximum " + cacheSize + " files)");
                }
            }
        }
        return provider;
    }

    /**
     * 读取单行（去掉行尾空白）；不可读时返回空串。
     */
    public String getLine(String file, int lineNumber) {
        String line = load(file).line(lineNumber);
        return line != null ? stripTrailing(line) : "";
    }

    /**
     * 计算以 {@code target} 为中心、半径 {@value SourceWindow#RADIUS} 的窗口。
     */
    public SourceWindow window(String file, int target) {
        SourceText text = load(file);
        int total = countLines(text);
        if (total == 0 || target < 1 || target > total) {
            return SourceWindow.empty(file, target);
        }
        int start = Math.max(1, target - SourceWindow.RADIUS);
        int end = Math.min(total, target + SourceWindow.RADIUS);
        List<SourceWindow.Line> lines = new ArrayList<>(end - start + 1);
        for (int i = start; i <= end; i++) {
            lines.add(new SourceWindow.Line(i, stripTrailing(text.line(i))));
        }
        return new SourceWindow(file, target, start, end, total, lines);
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    /** 逐行查找计数，直到第一个不存在的行 */
    private static int countLines(SourceText text) {
        int count = 0;
        while (text.line(count + 1) != null) {
            count++;
        }
        return count;
    }

    private SourceText load(String file) {
        if (file == null || file.isEmpty()) {
            return SourceText.MISSING;
        }
        return cache.computeIfAbsent(file, SourceContextProvider::read);
    }

    private static SourceText read(String file) {
        Path path;
        try {
            path = Paths.get(file);
        } catch (RuntimeException e) {
            LOG.fine("Invalid source path: " + file);
            return SourceText.MISSING;
        }
        if (!Files.isRegularFile(path)) {
            LOG.fine("Source file not found: " + file);
            return SourceText.MISSING;
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(path),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            LOG.fine("Failed to read source file: " + file + " (" + e.getMessage() + ")");
            return SourceText.MISSING;
        }
        return new SourceText(lines);
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
