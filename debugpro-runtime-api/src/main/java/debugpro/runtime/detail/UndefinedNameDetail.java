package debugpro.runtime.detail;

import debugpro.runtime.ErrorCategory;

import java.util.Collections;
import java.util.List;

/**
 * 未定义标识符：名称及相似的已绑定名称。
 */
public final class UndefinedNameDetail extends DiagnosticDetail {

    private final String name;
    private final List<String> similarNames;

    public UndefinedNameDetail(String name, List<String> similarNames) {
        super(ErrorCategory.UNDEFINED_IDENTIFIER);
        this.name = name;
        this.similarNames = Collections.unmodifiableList(similarNames);
    }

    public String getName() { return name; }
    public List<String> getSimilarNames() { return similarNames; }
}
