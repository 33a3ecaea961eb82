package debugpro.runtime.report.analysis;

/**
 * 分析过程中的失败处理。
 *
 * <p>用户代码（{@code toString}、反射）可能抛出任何 {@link Throwable}，包括
 * {@link AssertionError} 和绕过编译检查的受检异常；除虚拟机错误外都只记为备注。
 * {@link StackOverflowError} 来自递归的 {@code toString}，同样可以恢复。</p>
 */
public final class Failures {

    private Failures() {}

    /**
     * 虚拟机已无法继续（内存耗尽、内部错误）时原样抛出，其余失败返回由调用方记录。
     */
    public static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }
}
