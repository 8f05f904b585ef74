package cn.hjw.dev.flowgraph.executor;

import cn.hjw.dev.flowgraph.compile.ExecutionPlan;
import cn.hjw.dev.flowgraph.condition.Branch;
import cn.hjw.dev.flowgraph.config.GraphConstants;
import cn.hjw.dev.flowgraph.exception.ErrorKind;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.processor.ProgressListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 图执行器
 * 每次执行独立分配队列、访问记录和累计值，执行计划只读，可被并发调用
 */
@Slf4j
@RequiredArgsConstructor
public class GraphExecutor {

    private final ExecutionPlan plan;

    public CompletableFuture<Object> execute(Object input, ProgressListener listener) {
        try {
            return new Traversal(input, listener).drain();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // 单次执行的状态，同一时刻只有一个节点在执行
    private final class Traversal {

        private final Queue<WorkItem> queue = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final ProgressListener listener;

        // 最近一个真实节点的结果
        private Object state;

        Traversal(Object input, ProgressListener listener) {
            this.listener = listener;
            this.state = input;
            queue.offer(new WorkItem(GraphConstants.START, input));
        }

        /**
         * 按 FIFO 顺序处理队列。节点同步完成时在循环内继续，异步时挂起到 Future 上
         */
        CompletableFuture<Object> drain() {
            while (!queue.isEmpty()) {
                WorkItem item = queue.poll();

                // 第一次到达 END 即结束，队列中剩余的任务丢弃
                if (GraphConstants.END.equals(item.nodeId)) {
                    log.debug("Reached END, {} queued entries discarded.", queue.size());
                    return CompletableFuture.completedFuture(state);
                }

                // 相同节点 + 相同输入只执行一次
                if (!visited.add(VisitKeys.of(item.nodeId, item.input))) {
                    log.debug("Node [{}] already visited with the same input, skipped.", item.nodeId);
                    continue;
                }

                CompletableFuture<Object> pending = invoke(item);
                if (pending.isDone() && !pending.isCompletedExceptionally()) {
                    advance(item, pending.join());
                    continue;
                }
                return pending.thenCompose(result -> {
                    advance(item, result);
                    return drain();
                });
            }
            log.debug("Queue exhausted without reaching END, returning last result.");
            return CompletableFuture.completedFuture(state);
        }

        private CompletableFuture<Object> invoke(WorkItem item) {
            if (GraphConstants.isSentinel(item.nodeId)) {
                return CompletableFuture.completedFuture(item.input);
            }
            log.debug("Executing node [{}].", item.nodeId);
            return plan.getProcessors().get(item.nodeId).process(item.input, listener).toCompletableFuture();
        }

        /**
         * 记录结果并入队后继节点。有分支的节点只走分支，忽略无条件边
         */
        private void advance(WorkItem item, Object result) {
            if (!GraphConstants.isSentinel(item.nodeId)) {
                state = result;
            }

            Map<String, Branch> branches = plan.branchesOf(item.nodeId);
            if (!branches.isEmpty()) {
                // 分支目标拿到的是节点的原始输入，不是节点结果
                branches.forEach((branchKey, branch) -> {
                    String key = resolve(item, branchKey, branch);
                    if (branch.getThen() != null) {
                        queue.offer(new WorkItem(branch.getThen(), item.input));
                    }
                    if (key != null && branch.getEnds().containsKey(key)) {
                        queue.offer(new WorkItem(branch.getEnds().get(key), item.input));
                    } else if (!branch.getEnds().isEmpty()) {
                        log.debug("Branch [{}] of node [{}] resolved to {}, no target matched.",
                                branchKey, item.nodeId, key);
                    }
                });
                return;
            }

            List<String> successors = plan.successors(item.nodeId);
            for (String next : successors) {
                queue.offer(new WorkItem(next, result));
            }
        }

        private String resolve(WorkItem item, String branchKey, Branch branch) {
            try {
                return branch.resolve(item.input);
            } catch (RuntimeException e) {
                throw new FlowGraphException(ErrorKind.EXECUTION_FAILURE,
                        "Branch [" + branchKey + "] of node \"" + item.nodeId + "\" failed: " + e.getMessage(),
                        List.of(item.nodeId), 0, e);
            }
        }
    }

    @RequiredArgsConstructor
    private static final class WorkItem {
        private final String nodeId;
        private final Object input;
    }
}
