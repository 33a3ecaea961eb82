package debugpro.runtime;

/**
 * 绑定分类，由值的打印形式推导。
 */
public enum BindingKind {
    MODULE,
    CALLABLE,
    VALUE
}
