package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.RaisedError;
import debugpro.runtime.detail.UndefinedNameDetail;

import java.util.ArrayList;
import java.util.List;

/**
 * 未定义标识符：从故障帧的其它绑定名中给出相似建议，不需要扫描容器。
 */
final class UndefinedNameExtractor implements DetailExtractor {

    @Override
    public AnalysisResult extract(RaisedError error, CallFrame faultFrame, String faultLine) {
        String name = MessageParsers.undefinedName(error.getMessage());
        if (name == null) {
            List<String> notes = new ArrayList<>();
            notes.add("Could not parse the undefined name from: " + error.getMessage());
            return AnalysisResult.none(notes);
        }
        List<String> siblings = new ArrayList<>();
        for (String binding : faultFrame.getBindings().keySet()) {
            if (!binding.startsWith("__")) {
                siblings.add(binding);
            }
        }
        return AnalysisResult.of(new UndefinedNameDetail(name, Similarity.suggest(name, siblings)),
                new ArrayList<String>());
    }
}
