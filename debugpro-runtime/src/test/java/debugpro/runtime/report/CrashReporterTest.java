package debugpro.runtime.report;

import debugpro.runtime.ErrorCategory;
import debugpro.runtime.RaisedError;
import debugpro.runtime.SnapshotFrame;
import debugpro.runtime.report.cache.CacheStats;
import debugpro.runtime.report.source.SourceContextProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

/**
 * 报告流水线与共享源码缓存测试
 */
class CrashReporterTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("不同配置的报告器共用同一个源码缓存")
    void testSharedSources() {
        CrashReporter small = new CrashReporter(DebugProConfig.builder().cacheSize(1).color(false).build());
        CrashReporter large = new CrashReporter(DebugProConfig.builder().cacheSize(512).build());

        assertThat(small.getSources()).isSameAs(large.getSources());
        assertThat(SourceContextProvider.shared(7)).isSameAs(small.getSources());
    }

    @Test
    @DisplayName("同一文件在两个报告器中只读取一次")
    void testSourceReadOnce() throws IOException {
        Path file = dir.resolve("Billing.java");
        Files.write(file, "class Billing {\n    int total = charge(7);\n}\n".getBytes(StandardCharsets.UTF_8));
        RaisedError error = new RaisedError(ErrorCategory.OTHER, "card declined",
                new SnapshotFrame("charge", file.toString(), 2, Collections.singletonMap("amount", 7), null),
                new IllegalStateException("card declined"));

        CacheStats before = SourceContextProvider.shared(256).getCacheStats();
        Report first = new CrashReporter(DebugProConfig.builder().color(false).build()).report(error);
        CacheStats middle = SourceContextProvider.shared(256).getCacheStats();
        Report second = new CrashReporter(DebugProConfig.builder().color(false).build()).report(error);
        CacheStats after = SourceContextProvider.shared(256).getCacheStats();

        assertThat(middle.getLoadCount() - before.getLoadCount()).isEqualTo(1);
        assertThat(after.getLoadCount() - middle.getLoadCount()).isZero();
        assertThat(after.getHitCount() - middle.getHitCount()).isEqualTo(2);
        assertThat(second.getText()).isEqualTo(first.getText()).contains("int total = charge(7);");
    }
}
