package debugpro.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 显式帧捕获单元测试
 */
class FramesTest {

    // ============ 作用域栈 ============

    @Nested
    @DisplayName("作用域栈")
    class ScopeStackTests {

        @Test
        @DisplayName("正常返回后作用域出栈")
        void testScopePoppedOnReturn() throws Exception {
            assertEquals(0, Frames.depth());
            int inner = Frames.call("outer", outer ->
                    Frames.call("inner", in -> Frames.depth()));
            assertEquals(2, inner);
            assertEquals(0, Frames.depth());
        }

        @Test
        @DisplayName("异常逃出后作用域同样出栈")
        void testScopePoppedOnThrow() {
            assertThrows(IllegalStateException.class, () -> Frames.run("boom", locals -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals(0, Frames.depth());
        }

        @Test
        @DisplayName("call 返回调用体的值")
        void testCallReturnsValue() throws Exception {
            String value = Frames.call("greet", locals -> locals.bind("greeting", "hello"));
            assertEquals("hello", value);
        }
    }

    // ============ 异常快照 ============

    @Nested
    @DisplayName("异常快照")
    class CaptureTests {

        @Test
        @DisplayName("快照按外层在前的顺序保存所有作用域")
        void testSnapshotOuterFirst() {
            IllegalStateException error = assertThrows(IllegalStateException.class, () ->
                    Frames.run("outer", outer -> {
                        outer.bind("level", 1);
                        Frames.run("inner", inner -> {
                            inner.bind("level", 2);
                            inner.bind("name", "x");
                            throw new IllegalStateException("deep");
                        });
                    }));

            List<ScopeSnapshot> scopes = Frames.capturedScopes(error);
            assertEquals(2, scopes.size());
            assertEquals("outer", scopes.get(0).getName());
            assertEquals(1, scopes.get(0).getBindings().get("level"));
            assertEquals("inner", scopes.get(1).getName());
            assertEquals(2, scopes.get(1).getBindings().get("level"));
            assertEquals("x", scopes.get(1).getBindings().get("name"));
        }

        @Test
        @DisplayName("外层作用域不覆盖最内层快照")
        void testFirstCaptureWins() {
            RuntimeException error = assertThrows(RuntimeException.class, () ->
                    Frames.run("outer", outer -> {
                        Frames.run("inner", inner -> {
                            throw new RuntimeException("x");
                        });
                    }));
            List<ScopeSnapshot> scopes = Frames.capturedScopes(error);
            assertEquals(2, scopes.size());
            assertEquals("inner", scopes.get(1).getName());
        }

        @Test
        @DisplayName("快照是副本，之后的修改不影响")
        void testSnapshotIsCopy() {
            Map<String, Object> later = new HashMap<>();
            RuntimeException error = assertThrows(RuntimeException.class, () ->
                    Frames.run("scope", locals -> {
                        locals.bind("a", 1);
                        later.put("locals", locals);
                        throw new RuntimeException("x");
                    }));
            ((Locals) later.get("locals")).bind("b", 2);
            assertFalse(Frames.capturedScopes(error).get(0).getBindings().containsKey("b"));
        }

        @Test
        @DisplayName("作用域外抛出的异常没有快照")
        void testNoCapture() {
            assertEquals(Collections.emptyList(), Frames.capturedScopes(new RuntimeException()));
        }

        @Test
        @DisplayName("受检异常原样抛出")
        void testCheckedRethrown() {
            NoSuchMethodException error = assertThrows(NoSuchMethodException.class, () ->
                    Frames.run("reflect", locals ->
                            locals.bind("target", "text").getClass().getMethod("grab_item")));
            assertEquals(1, Frames.capturedScopes(error).size());
        }
    }

    // ============ 帧过滤 ============

    @Nested
    @DisplayName("捕获帧识别")
    class CaptureFrameTests {

        @Test
        @DisplayName("捕获机制自身的类")
        void testCaptureFrames() {
            assertTrue(Frames.isCaptureFrame("debugpro.runtime.Frames"));
            assertTrue(Frames.isCaptureFrame("debugpro.runtime.Frames$1"));
            assertTrue(Frames.isCaptureFrame("debugpro.runtime.Lookups"));
            assertTrue(Frames.isCaptureFrame("debugpro.runtime.Locals"));
            assertFalse(Frames.isCaptureFrame("debugpro.runtime.FramesTest"));
        }

        @Test
        @DisplayName("作用域入口")
        void testScopeEntry() {
            assertTrue(Frames.isScopeEntry("debugpro.runtime.Frames", "run"));
            assertTrue(Frames.isScopeEntry("debugpro.runtime.Frames", "call"));
            assertFalse(Frames.isScopeEntry("debugpro.runtime.Frames", "lambda$run$0"));
        }
    }
}
