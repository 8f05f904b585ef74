package cn.hjw.dev.flowgraph.processor;

/**
 * 同步节点处理器接口
 * @param <I> 节点输入类型
 * @param <O> 节点输出类型
 */
@FunctionalInterface
public interface NodeProcessor<I, O> {

    /**
     * 执行节点逻辑
     * @param input    上游传入的值
     * @param listener 进度消息接收器 (可能为 null)
     * @return 节点计算结果，作为下游节点的输入
     * @throws Exception 执行异常，由框架按治理配置重试或降级
     */
    O process(I input, ProgressListener listener) throws Exception;
}
