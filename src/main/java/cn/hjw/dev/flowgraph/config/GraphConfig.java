package cn.hjw.dev.flowgraph.config;

import cn.hjw.dev.flowgraph.compile.GraphCompiler;
import cn.hjw.dev.flowgraph.condition.Branch;
import cn.hjw.dev.flowgraph.condition.BranchCondition;
import cn.hjw.dev.flowgraph.condition.PathFunction;
import cn.hjw.dev.flowgraph.engine.FlowGraphEngine;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.processor.AsyncNodeProcessor;
import cn.hjw.dev.flowgraph.processor.NodeProcessor;
import cn.hjw.dev.flowgraph.render.MermaidRenderer;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * 图配置 (构建器)
 * 收集节点、无条件边和条件分支，{@link #compile()} 后得到可执行的图
 * @param <T> 图的输入类型
 * @param <R> 图的最终返回类型
 */
@Slf4j
@Getter
public class GraphConfig<T, R> {

    // 节点表 (保持注册顺序)
    private final Map<String, NodeSpec> nodeSpecMap = new LinkedHashMap<>();

    // 无条件边 (保持添加顺序，允许重复)
    private final List<Edge> edges = new ArrayList<>();

    // 分支表 (Key: 源节点, Value: 分支 key -> 分支)
    private final Map<String, Map<String, Branch>> branchTable = new LinkedHashMap<>();

    // 入口 / 出口节点
    private final Set<String> entryPoints = new LinkedHashSet<>();
    private final Set<String> finishPoints = new LinkedHashSet<>();

    // 未显式配置治理的节点使用此配置
    @Setter
    private NodeGovernance defaultNodeGovernance = NodeGovernance.defaults();

    // 重试等待结束后在此线程池上恢复执行，为 null 时使用公共 ForkJoinPool
    @Setter
    private ExecutorService threadPool;

    public GraphConfig() {
    }

    public GraphConfig(ExecutorService threadPool) {
        this.threadPool = threadPool;
    }

    public <I, O> GraphConfig<T, R> addNode(String nodeId, NodeProcessor<I, O> processor) {
        return addNode(nodeId, processor, null);
    }

    public <I, O> GraphConfig<T, R> addNode(String nodeId, NodeProcessor<I, O> processor, NodeGovernance governance) {
        return addNode(nodeId, processor, governance, NodeOptions.none());
    }

    //  全参数注册 (含类型标签)
    public <I, O> GraphConfig<T, R> addNode(String nodeId, NodeProcessor<I, O> processor,
                                            NodeGovernance governance, NodeOptions options) {
        if (processor == null) {
            throw new IllegalArgumentException("Node [" + nodeId + "] processor must not be null");
        }
        return register(nodeId, AsyncNodeProcessor.of(processor), governance, options);
    }

    public <I, O> GraphConfig<T, R> addAsyncNode(String nodeId, AsyncNodeProcessor<I, O> processor) {
        return addAsyncNode(nodeId, processor, null);
    }

    public <I, O> GraphConfig<T, R> addAsyncNode(String nodeId, AsyncNodeProcessor<I, O> processor,
                                                 NodeGovernance governance) {
        return addAsyncNode(nodeId, processor, governance, NodeOptions.none());
    }

    public <I, O> GraphConfig<T, R> addAsyncNode(String nodeId, AsyncNodeProcessor<I, O> processor,
                                                 NodeGovernance governance, NodeOptions options) {
        if (processor == null) {
            throw new IllegalArgumentException("Node [" + nodeId + "] processor must not be null");
        }
        return register(nodeId, processor, governance, options);
    }

    /**
     * 添加无条件边: fromNode -> toNode
     * 两端必须是哨兵或已注册的节点
     */
    public GraphConfig<T, R> addEdge(String fromNode, String toNode) {
        requireEndpoint(fromNode);
        requireEndpoint(toNode);
        edges.add(new Edge(fromNode, toNode));
        return this;
    }

    /**
     * 添加布尔条件分支，分支 key 为 "branch"
     */
    public <I> GraphConfig<T, R> addConditionalEdges(String fromNode, BranchCondition<I> condition,
                                                     Map<Boolean, String> pathMap) {
        return addConditionalEdges(fromNode, condition, pathMap, GraphConstants.DEFAULT_BRANCH_KEY);
    }

    public <I> GraphConfig<T, R> addConditionalEdges(String fromNode, BranchCondition<I> condition,
                                                     Map<Boolean, String> pathMap, String branchKey) {
        return addBranch(fromNode, branchKey, Branch.when(condition, pathMap));
    }

    /**
     * 添加枚举路由分支，分支 key 为 "branch"
     */
    public <I, E extends Enum<E>> GraphConfig<T, R> addRouteEdges(String fromNode, PathFunction<I, E> path,
                                                                  Map<E, String> pathMap) {
        return addRouteEdges(fromNode, path, pathMap, GraphConstants.DEFAULT_BRANCH_KEY);
    }

    public <I, E extends Enum<E>> GraphConfig<T, R> addRouteEdges(String fromNode, PathFunction<I, E> path,
                                                                  Map<E, String> pathMap, String branchKey) {
        return addBranch(fromNode, branchKey, Branch.route(path, pathMap));
    }

    /**
     * 挂载分支。同一节点上相同 key 的分支会被替换
     * 源节点与目标节点在编译时校验
     */
    public GraphConfig<T, R> addBranch(String fromNode, String branchKey, Branch branch) {
        if (fromNode == null || branchKey == null || branch == null) {
            throw new IllegalArgumentException("Source node, branch key and branch must not be null");
        }
        Branch previous = branchTable.computeIfAbsent(fromNode, k -> new LinkedHashMap<>()).put(branchKey, branch);
        if (previous != null) {
            log.warn("Branch [{}] on node [{}] replaced.", branchKey, fromNode);
        }
        return this;
    }

    public GraphConfig<T, R> setEntryPoint(String nodeId) {
        if (!nodeSpecMap.containsKey(nodeId)) {
            throw FlowGraphException.invalidNodeName(nodeId, "Entry node \"" + nodeId + "\" does not exist.");
        }
        entryPoints.add(nodeId);
        edges.add(new Edge(GraphConstants.START, nodeId));
        return this;
    }

    public GraphConfig<T, R> setFinishPoint(String nodeId) {
        if (!nodeSpecMap.containsKey(nodeId)) {
            throw FlowGraphException.invalidNodeName(nodeId, "Finish node \"" + nodeId + "\" does not exist.");
        }
        finishPoints.add(nodeId);
        edges.add(new Edge(nodeId, GraphConstants.END));
        return this;
    }

    /**
     * 校验并编译为可执行的图
     */
    public FlowGraphEngine<T, R> compile() {
        return new FlowGraphEngine<>(this);
    }

    /**
     * 直接渲染当前配置，不做校验
     */
    public String toMermaid() {
        return MermaidRenderer.render(GraphCompiler.snapshot(this));
    }

    @SuppressWarnings("unchecked")
    private GraphConfig<T, R> register(String nodeId, AsyncNodeProcessor<?, ?> processor,
                                       NodeGovernance governance, NodeOptions options) {
        if (nodeId == null || GraphConstants.isSentinel(nodeId)) {
            throw FlowGraphException.invalidNodeName(String.valueOf(nodeId), "\"" + nodeId + "\" is reserved.");
        }
        if (nodeSpecMap.containsKey(nodeId)) {
            throw FlowGraphException.duplicateNode(nodeId);
        }
        if (governance != null) {
            governance.verify(nodeId);
        }
        nodeSpecMap.put(nodeId, new NodeSpec(nodeId, (AsyncNodeProcessor<Object, Object>) processor, governance,
                options != null ? options.snapshot() : NodeOptions.none()));
        return this;
    }

    private void requireEndpoint(String nodeId) {
        if (!GraphConstants.isSentinel(nodeId) && !nodeSpecMap.containsKey(nodeId)) {
            throw FlowGraphException.invalidEdge(String.valueOf(nodeId));
        }
    }
}
