package debugpro.runtime.report.analysis;

import debugpro.runtime.CallFrame;
import debugpro.runtime.DebugProException;
import debugpro.runtime.KeyLookupException;
import debugpro.runtime.RaisedError;
import debugpro.runtime.detail.KeyLookupDetail;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 键查找失败：在故障帧中找出出现在故障行里的映射，列出可用键和相似键。
 *
 * <p>字符串键统一加单引号显示（缺失键、可用键、相似键一致），相似度按未加引号的文本比较。</p>
 */
final class KeyLookupExtractor implements DetailExtractor {

    private static final Logger LOG = Logger.getLogger(KeyLookupExtractor.class.getName());

    @Override
    public AnalysisResult extract(RaisedError error, CallFrame faultFrame, String faultLine) {
        List<String> notes = new ArrayList<>();
        if (faultLine.isEmpty()) {
            return AnalysisResult.none(notes);
        }
        for (Map.Entry<String, Object> binding : faultFrame.getBindings().entrySet()) {
            String name = binding.getKey();
            Object value = binding.getValue();
            if (!(value instanceof Map) || !faultLine.contains(name)) continue;
            try {
                Object key = missingKey(error);
                String keyText = ValuePrinter.print(key);
                Map<?, ?> map = (Map<?, ?>) value;
                List<String> keys = new ArrayList<>(map.size());
                List<String> similar = new ArrayList<>();
                for (Object k : map.keySet()) {
                    String shown = quote(k);
                    keys.add(shown);
                    if (Similarity.isSimilar(keyText, ValuePrinter.print(k))) {
                        similar.add(shown);
                    }
                }
                KeyLookupDetail detail = new KeyLookupDetail(name, ValuePrinter.print(map),
                        quote(key), keys, similar);
                return AnalysisResult.of(detail, notes);
            } catch (Throwable e) {
                Failures.rethrowIfFatal(e);
                String note = "Error analyzing dictionary '" + name + "': " + e;
                LOG.fine(note);
                notes.add(note);
            }
        }
        return AnalysisResult.none(notes);
    }

    /**
     * 缺失的键：{@link KeyLookupException} 直接取原始键，否则从消息中解析。
     */
    static Object missingKey(RaisedError error) {
        if (error.getThrowable() instanceof KeyLookupException) {
            return ((KeyLookupException) error.getThrowable()).getKey();
        }
        String key = MessageParsers.missingKey(error.getMessage());
        if (key == null) {
            throw new DebugProException("cannot parse missing key from message: " + error.getMessage());
        }
        return key;
    }

    /** 字符串键加单引号，其它键使用打印形式 */
    static String quote(Object key) {
        String text = ValuePrinter.print(key);
        return key instanceof CharSequence ? "'" + text + "'" : text;
    }
}
