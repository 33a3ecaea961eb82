package debugpro.runtime.report;

import debugpro.runtime.CallFrame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用栈遍历：沿链走到尾部得到故障帧，同时收集显示列表。
 */
public final class CallStackWalker {

    private CallStackWalker() {}

    /**
     * @param head 链头（最外层调用者）
     * @return 遍历结果；空链返回 null
     */
    public static StackWalk walk(CallFrame head) {
        if (head == null) return null;
        List<StackWalk.Entry> entries = new ArrayList<>();
        CallFrame frame = head;
        while (true) {
            entries.add(new StackWalk.Entry(frame, frame.getSourceLine()));
            if (frame.getNext() == null) break;
            frame = frame.getNext();
        }
        Collections.reverse(entries);
        return new StackWalk(frame, entries);
    }
}
