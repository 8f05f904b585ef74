package cn.hjw.dev.flowgraph.compile;

import cn.hjw.dev.flowgraph.condition.Branch;
import cn.hjw.dev.flowgraph.config.Edge;
import cn.hjw.dev.flowgraph.config.NodeSpec;
import cn.hjw.dev.flowgraph.processor.AsyncNodeProcessor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 执行计划：图配置的只读快照，执行期间不会被修改
 */
@Getter
@RequiredArgsConstructor
public class ExecutionPlan {

    // 节点表 (注册顺序)
    private final Map<String, NodeSpec> nodes;

    // 无条件边 (添加顺序)
    private final List<Edge> edges;

    // 邻接表: Key=源节点 (首次出现顺序), Value=下游节点 (添加顺序)
    private final Map<String, List<String>> adjacency;

    // 分支表: Key=源节点, Value=分支 key -> 分支
    private final Map<String, Map<String, Branch>> branches;

    // 经过治理包装后的处理器
    private final Map<String, AsyncNodeProcessor<Object, Object>> processors;

    public List<String> successors(String nodeId) {
        return adjacency.getOrDefault(nodeId, List.of());
    }

    public Map<String, Branch> branchesOf(String nodeId) {
        return branches.getOrDefault(nodeId, Map.of());
    }
}
