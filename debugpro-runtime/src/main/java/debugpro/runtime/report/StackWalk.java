package debugpro.runtime.report;

import debugpro.runtime.CallFrame;

import java.util.Collections;
import java.util.List;

/**
 * 栈遍历结果：故障帧 + 故障帧在前的显示列表。
 */
public final class StackWalk {

    /** 显示列表中的一项 */
    public static final class Entry {
        private final CallFrame frame;
        private final int lineNumber;

        Entry(CallFrame frame, int lineNumber) {
            this.frame = frame;
            this.lineNumber = lineNumber;
        }

        public CallFrame getFrame() { return frame; }
        public int getLineNumber() { return lineNumber; }
    }

    private final CallFrame faultFrame;
    private final List<Entry> entries;

    StackWalk(CallFrame faultFrame, List<Entry> entries) {
        this.faultFrame = faultFrame;
        this.entries = Collections.unmodifiableList(entries);
    }

    public CallFrame getFaultFrame() { return faultFrame; }

    /** 故障帧在前，最外层调用者在后 */
    public List<Entry> getEntries() { return entries; }
}
