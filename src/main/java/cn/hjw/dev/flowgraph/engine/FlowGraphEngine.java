package cn.hjw.dev.flowgraph.engine;

import cn.hjw.dev.flowgraph.ExecutableGraph;
import cn.hjw.dev.flowgraph.compile.ExecutionPlan;
import cn.hjw.dev.flowgraph.compile.GraphCompiler;
import cn.hjw.dev.flowgraph.config.GraphConfig;
import cn.hjw.dev.flowgraph.exception.ErrorKind;
import cn.hjw.dev.flowgraph.exception.ExceptionUnwrapper;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.executor.GraphExecutor;
import cn.hjw.dev.flowgraph.processor.ProgressListener;
import cn.hjw.dev.flowgraph.render.MermaidRenderer;
import lombok.Getter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

public class FlowGraphEngine<T, R> implements ExecutableGraph<T, R> {

    @Getter
    private final ExecutionPlan plan;

    private final GraphExecutor executor;

    public FlowGraphEngine(GraphConfig<T, R> graphConfig) {
        // 编译 (含校验)
        this.plan = GraphCompiler.compile(graphConfig);
        // 创建执行器
        this.executor = new GraphExecutor(plan);
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<R> applyAsync(T request, ProgressListener listener) {
        return executor.execute(request, listener).thenApply(result -> (R) result);
    }

    @Override
    public R apply(T request, ProgressListener listener) throws InterruptedException {
        try {
            return applyAsync(request, listener).get();
        } catch (ExecutionException e) {
            Throwable rootCause = ExceptionUnwrapper.extractRealCause(e);
            if (rootCause instanceof RuntimeException) {
                throw (RuntimeException) rootCause;
            } else if (rootCause instanceof Error) {
                throw (Error) rootCause;
            }
            throw new FlowGraphException(ErrorKind.EXECUTION_FAILURE, "Graph execution failed", List.of(), 0, rootCause);
        } catch (InterruptedException e) {
            // 恢复中断标记后继续上抛
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    @Override
    public void validate() {
        GraphCompiler.validate(plan);
    }

    @Override
    public String toMermaid() {
        return MermaidRenderer.render(plan);
    }
}
