package debugpro.runtime.report;

import debugpro.runtime.CallFrame;
import debugpro.runtime.SnapshotFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 调用栈遍历测试
 */
class CallStackWalkerTest {

    @Test
    @DisplayName("故障帧为链尾，显示列表故障帧在前")
    void testFaultFirst() {
        CallFrame inner = new SnapshotFrame("parse", "Parser.java", 30, null, null);
        CallFrame middle = new SnapshotFrame("load", "Loader.java", 20, null, inner);
        CallFrame outer = new SnapshotFrame(CallFrame.TOP_LEVEL, "App.java", 10, null, middle);

        StackWalk walk = CallStackWalker.walk(outer);

        assertSame(inner, walk.getFaultFrame());
        assertEquals(3, walk.getEntries().size());
        assertEquals("parse", walk.getEntries().get(0).getFrame().getCallableName());
        assertEquals(30, walk.getEntries().get(0).getLineNumber());
        assertEquals("load", walk.getEntries().get(1).getFrame().getCallableName());
        assertEquals(CallFrame.TOP_LEVEL, walk.getEntries().get(2).getFrame().getCallableName());
        assertEquals(10, walk.getEntries().get(2).getLineNumber());
    }

    @Test
    @DisplayName("单帧链")
    void testSingleFrame() {
        CallFrame only = new SnapshotFrame(null, "App.java", 3, null, null);

        StackWalk walk = CallStackWalker.walk(only);

        assertSame(only, walk.getFaultFrame());
        assertEquals(1, walk.getEntries().size());
        assertEquals(CallFrame.TOP_LEVEL, walk.getFaultFrame().getCallableName());
    }

    @Test
    @DisplayName("空链返回 null")
    void testEmptyChain() {
        assertNull(CallStackWalker.walk(null));
    }

    @Test
    @DisplayName("显示列表不可修改")
    void testEntriesUnmodifiable() {
        StackWalk walk = CallStackWalker.walk(new SnapshotFrame("f", "F.java", 1, null, null));
        assertThrows(UnsupportedOperationException.class, () -> walk.getEntries().clear());
    }
}
