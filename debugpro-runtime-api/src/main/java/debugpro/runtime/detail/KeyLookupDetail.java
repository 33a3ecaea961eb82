package debugpro.runtime.detail;

import debugpro.runtime.ErrorCategory;

import java.util.Collections;
import java.util.List;

/**
 * 键查找失败：容器、缺失的键、可用键和相似键。
 */
public final class KeyLookupDetail extends DiagnosticDetail {

    private final String containerName;
    private final String containerValue;
    private final String missingKey;
    private final List<String> availableKeys;
    private final List<String> similarKeys;

    public KeyLookupDetail(String containerName, String containerValue, String missingKey,
                           List<String> availableKeys, List<String> similarKeys) {
        super(ErrorCategory.KEY_LOOKUP);
        this.containerName = containerName;
        this.containerValue = containerValue;
        this.missingKey = missingKey;
        this.availableKeys = Collections.unmodifiableList(availableKeys);
        this.similarKeys = Collections.unmodifiableList(similarKeys);
    }

    public String getContainerName() { return containerName; }
    public String getContainerValue() { return containerValue; }
    /** 带引号的缺失键，例如 {@code 'z'} */
    public String getMissingKey() { return missingKey; }
    public List<String> getAvailableKeys() { return availableKeys; }
    public List<String> getSimilarKeys() { return similarKeys; }
}
