package cn.hjw.dev.flowgraph;

import cn.hjw.dev.flowgraph.processor.ProgressListener;

import java.util.concurrent.CompletableFuture;

public interface ExecutableGraph<T, R> {

    /**
     * 异步执行图
     * @param request  初始输入，交给 START 之后的节点
     * @param listener 进度消息接收器，传给每个节点 (可为 null)
     * @return 最终结果；节点失败且无降级时异常完成 (FlowGraphException)
     */
    CompletableFuture<R> applyAsync(T request, ProgressListener listener);

    default CompletableFuture<R> applyAsync(T request) {
        return applyAsync(request, null);
    }

    /**
     * 执行图并等待结果，内部与 {@link #applyAsync} 走同一条执行路径
     * @param request 请求参数
     * @return 执行结果
     */
    R apply(T request, ProgressListener listener) throws InterruptedException;

    default R apply(T request) throws InterruptedException {
        return apply(request, null);
    }

    /**
     * 重新校验图结构 (可达性、类型标签)
     */
    void validate();

    /**
     * 生成 Mermaid 流程图
     */
    String toMermaid();
}
