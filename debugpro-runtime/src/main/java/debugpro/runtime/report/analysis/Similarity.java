package debugpro.runtime.report.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * 相似名称建议：候选与目标互为子串即视为相似（区分大小写）。
 */
public final class Similarity {

    private Similarity() {}

    public static boolean isSimilar(String target, String candidate) {
        if (target == null || candidate == null || target.isEmpty() || candidate.isEmpty()) {
            return false;
        }
        return candidate.contains(target) || target.contains(candidate);
    }

    /**
     * @return 按候选原顺序排列的相似项；无匹配时为空列表
     */
    public static List<String> suggest(String target, Iterable<?> candidates) {
        List<String> similar = new ArrayList<>();
        for (Object candidate : candidates) {
            String text = String.valueOf(candidate);
            if (isSimilar(target, text)) {
                similar.add(text);
            }
        }
        return similar;
    }
}
