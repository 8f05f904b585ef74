package cn.hjw.dev.flowgraph.config;

import cn.hjw.dev.flowgraph.hook.FallbackStrategy;
import cn.hjw.dev.flowgraph.processor.ProgressListener;
import lombok.Builder;
import lombok.Getter;

import java.util.concurrent.TimeUnit;

/**
 * 节点治理配置：
 * 1. 重试：首次失败后最多再尝试 maxRetries 次，每次重试前固定等待 retryDelay (不做指数退避)
 * 2. 降级：重试耗尽后调用 fallbackStrategy，返回值作为节点结果
 * 3. 回调：节点成功后通知 successHook
 */
@Getter
@Builder(toBuilder = true)
public class NodeGovernance {

    // --- 重试配置 ---
    @Builder.Default
    private int maxRetries = GraphConstants.DEFAULT_RETRY_COUNT;

    @Builder.Default
    private long retryDelay = GraphConstants.DEFAULT_RETRY_DELAY_MILLIS;

    @Builder.Default
    private TimeUnit timeUnit = TimeUnit.MILLISECONDS;

    // --- 降级配置 ---
    private FallbackStrategy<?> fallbackStrategy;

    // --- 成功回调 ---
    private ProgressListener successHook;

    public static NodeGovernance defaults() {
        return NodeGovernance.builder().build();
    }

    public void verify(String nodeId) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Node [" + nodeId + "] maxRetries must be >= 0, got " + maxRetries);
        }
        if (retryDelay <= 0) {
            throw new IllegalArgumentException("Node [" + nodeId + "] retryDelay must be > 0, got " + retryDelay);
        }
        if (timeUnit == null) {
            throw new IllegalArgumentException("Node [" + nodeId + "] timeUnit must not be null");
        }
    }
}
