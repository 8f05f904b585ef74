package cn.hjw.dev.flowgraph.compile;

import cn.hjw.dev.flowgraph.condition.Branch;
import cn.hjw.dev.flowgraph.config.Edge;
import cn.hjw.dev.flowgraph.config.GraphConfig;
import cn.hjw.dev.flowgraph.config.GraphConstants;
import cn.hjw.dev.flowgraph.config.NodeGovernance;
import cn.hjw.dev.flowgraph.config.NodeSpec;
import cn.hjw.dev.flowgraph.config.ValueType;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.processor.AsyncNodeProcessor;
import cn.hjw.dev.flowgraph.processor.ResilientNodeProcessor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

@Slf4j
public class GraphCompiler {

    private GraphCompiler() {
    }

    /**
     * 编译图配置为执行计划 (含校验)
     * @param config 图配置
     * @return 执行计划
     * @throws FlowGraphException 结构错误 (端点不存在、类型不一致、不可达节点)
     */
    public static ExecutionPlan compile(GraphConfig<?, ?> config) {
        ExecutionPlan plan = plan(config);
        validate(plan);
        log.info("Graph compiled: {} nodes, {} edges, {} branching nodes.",
                plan.getNodes().size(), plan.getEdges().size(), plan.getBranches().size());
        return plan;
    }

    /**
     * 构建执行计划 (包装治理)，不做校验
     */
    public static ExecutionPlan plan(GraphConfig<?, ?> config) {
        // 包装处理器 (Governance Decorator)
        Executor resumeExecutor = config.getThreadPool() != null ? config.getThreadPool() : ForkJoinPool.commonPool();
        Map<String, AsyncNodeProcessor<Object, Object>> processors = new LinkedHashMap<>();
        config.getNodeSpecMap().forEach((id, spec) -> {
            NodeGovernance governance = spec.getGovernance() != null
                    ? spec.getGovernance() : config.getDefaultNodeGovernance();
            governance.verify(id);
            processors.put(id, new ResilientNodeProcessor(id, spec.getProcessor(), governance, resumeExecutor));
        });
        return tables(config, Collections.unmodifiableMap(processors));
    }

    /**
     * 只复制节点、边和分支表，不包装处理器也不检查治理配置 (供渲染使用)
     */
    public static ExecutionPlan snapshot(GraphConfig<?, ?> config) {
        return tables(config, Map.of());
    }

    private static ExecutionPlan tables(GraphConfig<?, ?> config,
                                        Map<String, AsyncNodeProcessor<Object, Object>> processors) {
        Map<String, NodeSpec> nodes = Collections.unmodifiableMap(new LinkedHashMap<>(config.getNodeSpecMap()));
        List<Edge> edges = List.copyOf(config.getEdges());

        // 1. 构建邻接表 (Parent -> Children)
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Edge edge : edges) {
            adjacency.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge.getTo());
        }
        adjacency.replaceAll((k, v) -> List.copyOf(v));

        // 2. 分支表快照
        Map<String, Map<String, Branch>> branches = new LinkedHashMap<>();
        config.getBranchTable().forEach((source, byKey) -> {
            if (!byKey.isEmpty()) {
                branches.put(source, Collections.unmodifiableMap(new LinkedHashMap<>(byKey)));
            }
        });

        return new ExecutionPlan(
                nodes,
                edges,
                Collections.unmodifiableMap(adjacency),
                Collections.unmodifiableMap(branches),
                processors
        );
    }

    /**
     * 结构校验，顺序：分支端点 -> 类型标签 -> 可达性
     */
    public static void validate(ExecutionPlan plan) {
        checkBranchEndpoints(plan);
        checkEdgeTypes(plan);
        checkReachability(plan);
    }

    private static void checkBranchEndpoints(ExecutionPlan plan) {
        Map<String, NodeSpec> nodes = plan.getNodes();
        plan.getBranches().forEach((source, byKey) -> {
            requireRegistered(nodes, source);
            byKey.values().forEach(branch -> branch.targets().forEach(target -> requireRegistered(nodes, target)));
        });
    }

    private static void requireRegistered(Map<String, NodeSpec> nodes, String nodeId) {
        if (!GraphConstants.isSentinel(nodeId) && !nodes.containsKey(nodeId)) {
            throw FlowGraphException.invalidEdge(nodeId);
        }
    }

    // 只检查两端都是已注册节点的无条件边，分支跳转不检查
    private static void checkEdgeTypes(ExecutionPlan plan) {
        Map<String, NodeSpec> nodes = plan.getNodes();
        for (Edge edge : plan.getEdges()) {
            NodeSpec from = nodes.get(edge.getFrom());
            NodeSpec to = nodes.get(edge.getTo());
            if (from == null || to == null) {
                continue;
            }
            ValueType outputType = from.getOptions().getOutputType();
            ValueType inputType = to.getOptions().getInputType();
            if (outputType != null && inputType != null && outputType != inputType) {
                throw FlowGraphException.typeMismatch(edge.getFrom(), outputType, edge.getTo(), inputType);
            }
        }
    }

    /**
     * 从 START 广度优先遍历：边和分支目标 (then 与 ends) 一视同仁
     */
    private static void checkReachability(ExecutionPlan plan) {
        if (plan.getNodes().isEmpty()) {
            return;
        }

        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.offer(GraphConstants.START);

        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (!visited.add(node)) {
                continue;
            }
            List<String> next = new ArrayList<>(plan.successors(node));
            plan.branchesOf(node).values().forEach(branch -> next.addAll(branch.targets()));
            for (String child : next) {
                if (!GraphConstants.END.equals(child)) {
                    queue.offer(child);
                }
            }
        }

        List<String> unreachable = plan.getNodes().keySet().stream()
                .filter(nodeId -> !visited.contains(nodeId))
                .collect(Collectors.toList());
        if (!unreachable.isEmpty()) {
            throw FlowGraphException.unreachable(unreachable);
        }
    }
}
