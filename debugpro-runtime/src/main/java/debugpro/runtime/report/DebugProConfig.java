package debugpro.runtime.report;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 报告引擎配置。
 *
 * <p>使用示例：</p>
 * <pre>
 * // 从系统属性 / 环境变量读取
 * DebugPro.install(DebugProConfig.fromSystemProperties());
 *
 * // 自定义
 * DebugProConfig config = DebugProConfig.builder()
 *     .sourceRoot(Paths.get("app/src/main/java"))
 *     .color(false)
 *     .build();
 * </pre>
 *
 * <table>
 *   <caption>系统属性</caption>
 *   <tr><td>{@code debugpro.source.roots}</td><td>源码根目录（路径分隔符分隔），环境变量 {@code DEBUGPRO_SOURCE_ROOTS}</td></tr>
 *   <tr><td>{@code debugpro.color}</td><td>ANSI 颜色，设置 {@code NO_COLOR} 环境变量时默认关闭</td></tr>
 *   <tr><td>{@code debugpro.cache.size}</td><td>源码缓存的最大文件数</td></tr>
 *   <tr><td>{@code debugpro.exclude.packages}</td><td>额外略去的包前缀（逗号分隔）</td></tr>
 * </table>
 */
public final class DebugProConfig {

    public static final String PROP_SOURCE_ROOTS = "debugpro.source.roots";
    public static final String PROP_COLOR = "debugpro.color";
    public static final String PROP_CACHE_SIZE = "debugpro.cache.size";
    public static final String PROP_EXCLUDE_PACKAGES = "debugpro.exclude.packages";
    public static final String ENV_SOURCE_ROOTS = "DEBUGPRO_SOURCE_ROOTS";
    public static final String ENV_NO_COLOR = "NO_COLOR";

    static final long DEFAULT_CACHE_SIZE = 256;

    /** 始终略去的平台包前缀 */
    static final List<String> PLATFORM_PACKAGES = Collections.unmodifiableList(
            Arrays.asList("java.", "javax.", "jdk.", "sun.", "com.sun."));

    private final List<Path> sourceRoots;
    private final boolean color;
    private final long cacheSize;
    private final List<String> excludedPackages;

    private DebugProConfig(Builder builder) {
        this.sourceRoots = Collections.unmodifiableList(new ArrayList<>(builder.sourceRoots));
        this.color = builder.color;
        this.cacheSize = builder.cacheSize;
        List<String> excluded = new ArrayList<>(PLATFORM_PACKAGES);
        excluded.addAll(builder.excludedPackages);
        this.excludedPackages = Collections.unmodifiableList(excluded);
    }

    public static DebugProConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从系统属性读取，属性缺失时回退到环境变量，再回退到默认值。
     */
    public static DebugProConfig fromSystemProperties() {
        Builder builder = builder();

        String roots = System.getProperty(PROP_SOURCE_ROOTS);
        if (roots == null) {
            roots = System.getenv(ENV_SOURCE_ROOTS);
        }
        if (roots != null && !roots.trim().isEmpty()) {
            builder.clearSourceRoots();
            for (String root : roots.split(File.pathSeparator)) {
                if (!root.trim().isEmpty()) {
                    builder.sourceRoot(Paths.get(root.trim()));
                }
            }
        }

        String color = System.getProperty(PROP_COLOR);
        if (color != null) {
            builder.color(Boolean.parseBoolean(color));
        } else if (System.getenv(ENV_NO_COLOR) != null) {
            builder.color(false);
        }

        String cacheSize = System.getProperty(PROP_CACHE_SIZE);
        if (cacheSize != null) {
            try {
                builder.cacheSize(Long.parseLong(cacheSize.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PROP_CACHE_SIZE + " is not a number: " + cacheSize, e);
            }
        }

        String excluded = System.getProperty(PROP_EXCLUDE_PACKAGES);
        if (excluded != null) {
            for (String prefix : excluded.split(",")) {
                if (!prefix.trim().isEmpty()) {
                    builder.excludePackage(prefix.trim());
                }
            }
        }
        return builder.build();
    }

    public List<Path> getSourceRoots() { return sourceRoots; }
    public boolean isColor() { return color; }
    public long getCacheSize() { return cacheSize; }
    public List<String> getExcludedPackages() { return excludedPackages; }

    /** 类是否属于被略去的包（平台包或配置的前缀） */
    public boolean isExcluded(String className) {
        for (String prefix : excludedPackages) {
            if (className.startsWith(prefix)) return true;
        }
        return false;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.sourceRoots.clear();
        builder.sourceRoots.addAll(sourceRoots);
        builder.color = color;
        builder.cacheSize = cacheSize;
        for (String prefix : excludedPackages) {
            if (!PLATFORM_PACKAGES.contains(prefix)) {
                builder.excludedPackages.add(prefix);
            }
        }
        return builder;
    }

    public static final class Builder {
        private final List<Path> sourceRoots = new ArrayList<>(Arrays.asList(
                Paths.get("src", "main", "java"), Paths.get("src", "test", "java"), Paths.get(".")));
        private boolean color = true;
        private long cacheSize = DEFAULT_CACHE_SIZE;
        private final List<String> excludedPackages = new ArrayList<>();

        private Builder() {}

        /** 追加源码根目录（按添加顺序查找） */
        public Builder sourceRoot(Path root) {
            sourceRoots.add(root);
            return this;
        }

        public Builder clearSourceRoots() {
            sourceRoots.clear();
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public Builder cacheSize(long cacheSize) {
            if (cacheSize <= 0) {
                throw new IllegalArgumentException("cache size must be positive: " + cacheSize);
            }
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder excludePackage(String prefix) {
            excludedPackages.add(prefix);
            return this;
        }

        public DebugProConfig build() {
            return new DebugProConfig(this);
        }
    }
}
