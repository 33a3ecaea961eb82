package debugpro.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Locals / Lookups 测试")
class LocalsTest {

    @Test
    @DisplayName("bind 原样返回值")
    void testBindReturnsValue() throws Exception {
        Frames.run("scope", locals -> {
            Map<String, Integer> map = locals.bind("map", new LinkedHashMap<String, Integer>());
            assertThat(locals.lookup("map")).isSameAs(map);
        });
    }

    @Test
    @DisplayName("lookup 向外层作用域查找")
    void testLookupOuterScope() throws Exception {
        Frames.run("outer", outer -> {
            outer.bind("shared", "value");
            Frames.run("inner", inner -> assertThat(inner.lookup("shared")).isEqualTo("value"));
        });
    }

    @Test
    @DisplayName("lookup 未绑定名称抛出 UndefinedIdentifierException")
    void testLookupUndefined() {
        Throwable error = catchThrowable(() -> Frames.run("scope", locals -> {
            locals.bind("counter", 1);
            locals.lookup("count");
        }));
        assertThat(error)
                .isInstanceOf(UndefinedIdentifierException.class)
                .hasMessage("name 'count' is not defined");
        assertThat(((UndefinedIdentifierException) error).getName()).isEqualTo("count");
    }

    @Test
    @DisplayName("绑定为 null 的名称视为已定义")
    void testNullBinding() throws Exception {
        Frames.run("scope", locals -> {
            locals.bind("nothing", null);
            assertThat(locals.isBound("nothing")).isTrue();
            assertThat(locals.lookup("nothing")).isNull();
        });
    }

    @Test
    @DisplayName("空名称被拒绝")
    void testEmptyName() {
        assertThatThrownBy(() -> Frames.run("scope", locals -> locals.bind("", 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Lookups.get 缺失键抛出带引号的消息")
    void testStrictGet() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", 1);
        assertThat(Lookups.get(map, "a")).isEqualTo(1);
        assertThatThrownBy(() -> Lookups.get(map, "z"))
                .isInstanceOf(KeyLookupException.class)
                .hasMessage("'z'");
    }

    @Test
    @DisplayName("Lookups.get 区分缺失键和 null 值")
    void testStrictGetNullValue() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", null);
        assertThat(Lookups.get(map, "a")).isNull();
    }
}
