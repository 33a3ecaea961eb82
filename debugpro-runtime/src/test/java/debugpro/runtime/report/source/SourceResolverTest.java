package debugpro.runtime.report.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SourceResolver 测试")
class SourceResolverTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("按包路径在源码根下查找")
    void testPackageLayout() throws IOException {
        Path file = root.resolve("com/acme/Foo.java");
        Files.createDirectories(file.getParent());
        Files.write(file, Collections.singletonList("class Foo {}"));

        SourceResolver resolver = new SourceResolver(Collections.singletonList(root));
        assertThat(resolver.resolve("com.acme.Foo", "Foo.java"))
                .isEqualTo(file.toAbsolutePath().normalize().toString());
    }

    @Test
    @DisplayName("内部类使用外部类的源码文件")
    void testNestedClass() throws IOException {
        Path file = root.resolve("com/acme/Foo.java");
        Files.createDirectories(file.getParent());
        Files.write(file, Collections.singletonList("class Foo {}"));

        SourceResolver resolver = new SourceResolver(Collections.singletonList(root));
        assertThat(resolver.resolve("com.acme.Foo$Inner", "Foo.java")).endsWith("Foo.java");
        assertThat(resolver.resolve("com.acme.Foo$Inner", "Foo.java")).isEqualTo(file.toAbsolutePath().normalize().toString());
    }

    @Test
    @DisplayName("平铺布局回退")
    void testFlatLayout() throws IOException {
        Path file = root.resolve("Script.java");
        Files.write(file, Collections.singletonList("class Script {}"));

        SourceResolver resolver = new SourceResolver(Collections.singletonList(root));
        assertThat(resolver.resolve("demo.Script", "Script.java"))
                .isEqualTo(file.toAbsolutePath().normalize().toString());
    }

    @Test
    @DisplayName("按根目录顺序查找")
    void testRootOrder(@TempDir Path other) throws IOException {
        Path second = other.resolve("Bar.java");
        Files.write(second, Collections.singletonList("class Bar {}"));

        SourceResolver resolver = new SourceResolver(Arrays.asList(root, other));
        assertThat(resolver.resolve("Bar", "Bar.java")).isEqualTo(second.toAbsolutePath().normalize().toString());
    }

    @Test
    @DisplayName("找不到时返回包相对路径")
    void testMissing() {
        SourceResolver resolver = new SourceResolver(Collections.singletonList(root));
        assertThat(resolver.resolve("com.acme.Missing", "Missing.java")).isEqualTo("com/acme/Missing.java");
    }

    @Test
    @DisplayName("没有文件名时为 <unknown>")
    void testNoFileName() {
        SourceResolver resolver = new SourceResolver(Collections.singletonList(root));
        assertThat(resolver.resolve("com.acme.Gen", null)).isEqualTo("<unknown>");
    }
}
