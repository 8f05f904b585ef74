package cn.hjw.dev.flowgraph.processor;

import cn.hjw.dev.flowgraph.config.NodeGovernance;
import cn.hjw.dev.flowgraph.exception.ExceptionUnwrapper;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.hook.FallbackStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * 治理装饰器：重试 -> 降级 -> 成功回调
 * 重试等待通过 delayedExecutor 完成，不占用线程
 */
@Slf4j
@RequiredArgsConstructor
public class ResilientNodeProcessor implements AsyncNodeProcessor<Object, Object> {

    private final String nodeId;
    private final AsyncNodeProcessor<Object, Object> delegate;
    private final NodeGovernance governance;
    private final Executor resumeExecutor;

    @Override
    public CompletionStage<Object> process(Object input, ProgressListener listener) {
        return attempt(input, listener, 0);
    }

    private CompletableFuture<Object> attempt(Object input, ProgressListener listener, int failures) {
        return invokeOnce(input, listener)
                .handle((result, ex) -> {
                    if (ex == null) {
                        return CompletableFuture.completedFuture(result);
                    }
                    Throwable cause = ExceptionUnwrapper.extractRealCause(ex);
                    int attempts = failures + 1;
                    if (attempts <= governance.getMaxRetries()) {
                        log.warn("Node [{}] failed (attempt {}/{}), retrying in {} {}...", nodeId, attempts,
                                governance.getMaxRetries() + 1, governance.getRetryDelay(), governance.getTimeUnit());
                        // 固定间隔，不随尝试次数增长
                        Executor delayed = CompletableFuture.delayedExecutor(
                                governance.getRetryDelay(), governance.getTimeUnit(), resumeExecutor);
                        return CompletableFuture.runAsync(() -> { }, delayed)
                                .thenCompose(v -> attempt(input, listener, attempts));
                    }
                    return exhausted(input, cause, attempts);
                })
                .thenCompose(Function.identity());
    }

    private CompletableFuture<Object> invokeOnce(Object input, ProgressListener listener) {
        CompletableFuture<Object> future;
        try {
            future = delegate.process(input, listener).toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        // 回调异常同样视为本次尝试失败
        return future.thenApply(result -> {
            if (governance.getSuccessHook() != null) {
                governance.getSuccessHook().onProgress("Node " + nodeId + " executed successfully");
            }
            return result;
        });
    }

    @SuppressWarnings("unchecked")
    private CompletableFuture<Object> exhausted(Object input, Throwable cause, int attempts) {
        FallbackStrategy<Object> fallback = (FallbackStrategy<Object>) governance.getFallbackStrategy();
        if (fallback == null) {
            log.error("Node [{}] failed after {} attempts.", nodeId, attempts);
            return CompletableFuture.failedFuture(FlowGraphException.executionFailure(nodeId, attempts, cause));
        }
        log.warn("Node [{}] failed after {} attempts, triggering fallback. Cause: {}", nodeId, attempts,
                cause.getMessage());
        try {
            return CompletableFuture.completedFuture(fallback.fallback(cause, input));
        } catch (Exception fbEx) {
            log.error("Fallback of node [{}] failed.", nodeId, fbEx);
            return CompletableFuture.failedFuture(FlowGraphException.executionFailure(nodeId, attempts, fbEx));
        }
    }
}
