package cn.hjw.dev.flowgraph.processor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 异步节点处理器接口
 * 返回的 CompletionStage 完成前，本次图执行不会调度其他节点
 * @param <I> 节点输入类型
 * @param <O> 节点输出类型
 */
@FunctionalInterface
public interface AsyncNodeProcessor<I, O> {

    /**
     * 执行节点逻辑
     * @param input    上游传入的值
     * @param listener 进度消息接收器 (可能为 null)
     * @return 节点计算结果的 Future，异常完成视为节点失败
     */
    CompletionStage<O> process(I input, ProgressListener listener);

    /**
     * 将同步处理器适配为异步处理器，同步抛出的异常转为异常完成的 Future
     */
    static <I, O> AsyncNodeProcessor<I, O> of(NodeProcessor<I, O> processor) {
        return (input, listener) -> {
            try {
                return CompletableFuture.completedFuture(processor.process(input, listener));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }
}
