package debugpro.runtime;

import java.util.Map;

/**
 * 调用帧：一次调用的只读快照（局部绑定 + 源码位置）。
 *
 * <p>帧之间构成单链表，从最外层调用者指向最内层故障点。
 * 报告引擎只读取这条链，从不修改。</p>
 */
public interface CallFrame {

    /** 顶层入口（{@code main}）使用的哨兵名 */
    String TOP_LEVEL = "__main__";

    /** 局部绑定：名称 → 值（顺序无意义） */
    Map<String, Object> getBindings();

    String getSourceFile();

    /** 1 起始的行号，始终 >= 1 */
    int getSourceLine();

    String getCallableName();

    /** 下一个（更内层的）帧，故障帧返回 null */
    CallFrame getNext();
}
