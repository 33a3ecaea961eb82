package debugpro.runtime.detail;

import debugpro.runtime.ErrorCategory;

/**
 * 类别专属的诊断详情（按类别区分的标签联合）。
 *
 * <p>每次错误新建，不做持久化。</p>
 */
public abstract class DiagnosticDetail {

    private final ErrorCategory category;

    protected DiagnosticDetail(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /** 详情面板标题使用的标签 */
    public String getLabel() {
        return category.getLabel();
    }
}
