package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.RaisedError;

/**
 * 类别专属分析器。
 *
 * <p>实现必须尽力而为：单个绑定上的失败记为备注并继续，绝不向外抛出。</p>
 */
public interface DetailExtractor {

    /**
     * @param error      被分析的错误
     * @param faultFrame 故障帧
     * @param faultLine  故障行源码（去掉首尾空白；不可读时为空串）
     */
    AnalysisResult extract(RaisedError error, CallFrame faultFrame, String faultLine);
}
