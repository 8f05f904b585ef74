package cn.hjw.dev.flowgraph.hook;

/**
 * 降级策略接口
 * 仅在节点重试耗尽后调用，返回值视为节点的正常结果
 * @param <I> 节点输入类型
 */
@FunctionalInterface
public interface FallbackStrategy<I> {

    /**
     * 执行降级逻辑
     * @param cause 最后一次失败的原因
     * @param input 节点的原始输入
     * @return 兜底结果
     */
    Object fallback(Throwable cause, I input) throws Exception;
}
