package cn.hjw.dev.flowgraph.exception;

import lombok.Getter;

import java.util.List;

/**
 * 图的统一异常
 * 通过 {@link ErrorKind} 区分错误类型，并携带相关节点和尝试次数
 */
@Getter
public class FlowGraphException extends RuntimeException {

    private final ErrorKind kind;

    // 相关节点 (按发现顺序)
    private final List<String> nodeIds;

    // 节点总尝试次数，非节点执行错误时为 0
    private final int attempts;

    public FlowGraphException(ErrorKind kind, String message, List<String> nodeIds, int attempts, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.nodeIds = List.copyOf(nodeIds);
        this.attempts = attempts;
    }

    public static FlowGraphException invalidNodeName(String nodeId, String message) {
        return new FlowGraphException(ErrorKind.INVALID_NODE_NAME, message, List.of(nodeId), 0, null);
    }

    public static FlowGraphException duplicateNode(String nodeId) {
        return new FlowGraphException(ErrorKind.DUPLICATE_NODE,
                "Node \"" + nodeId + "\" already exists.", List.of(nodeId), 0, null);
    }

    public static FlowGraphException invalidEdge(String nodeId) {
        return new FlowGraphException(ErrorKind.INVALID_EDGE,
                "Node \"" + nodeId + "\" does not exist.", List.of(nodeId), 0, null);
    }

    public static FlowGraphException typeMismatch(String from, Object outputType, String to, Object inputType) {
        return new FlowGraphException(ErrorKind.TYPE_MISMATCH,
                "Type mismatch: " + from + " outputs " + outputType + ", but " + to + " expects " + inputType,
                List.of(from, to), 0, null);
    }

    public static FlowGraphException unreachable(List<String> nodeIds) {
        return new FlowGraphException(ErrorKind.UNREACHABLE_NODE,
                "Unreachable nodes detected: " + String.join(", ", nodeIds), nodeIds, 0, null);
    }

    public static FlowGraphException executionFailure(String nodeId, int attempts, Throwable cause) {
        return new FlowGraphException(ErrorKind.EXECUTION_FAILURE,
                "Node \"" + nodeId + "\" failed after " + attempts + " attempts: " + cause.getMessage(),
                List.of(nodeId), attempts, cause);
    }
}
