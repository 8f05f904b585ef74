package cn.hjw.dev.flowgraph.render;

import cn.hjw.dev.flowgraph.compile.ExecutionPlan;
import cn.hjw.dev.flowgraph.config.GraphConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Mermaid 流程图渲染
 * 只依赖执行计划中的表，与校验无关；同一张图多次渲染结果完全一致。
 * <pre>
 * ```mermaid
 * flowchart TD
 *     __START__["START"]
 *     node["node"]
 *     a --> b
 *     a -.-> c
 *     a -.|True|.-> d
 * ```
 * </pre>
 */
public final class MermaidRenderer {

    private static final String CODE_BLOCK_START = "```mermaid";
    private static final String CODE_BLOCK_END = "```";
    private static final String FLOWCHART_HEADER = "flowchart TD";
    private static final String INDENT = "    ";

    private MermaidRenderer() {
    }

    public static String render(ExecutionPlan plan) {
        List<String> lines = new ArrayList<>();
        lines.add(CODE_BLOCK_START);
        lines.add(FLOWCHART_HEADER);

        // 哨兵节点
        lines.add(INDENT + node(GraphConstants.START, "START"));
        lines.add(INDENT + node(GraphConstants.END, "END"));

        // 注册节点
        plan.getNodes().keySet().forEach(nodeId -> lines.add(INDENT + node(nodeId, nodeId)));

        // 无条件边 (按源节点分组)
        plan.getAdjacency().forEach((from, targets) ->
                targets.forEach(to -> lines.add(INDENT + from + " --> " + to)));

        // 条件边 (虚线)
        plan.getBranches().forEach((source, byKey) -> byKey.values().forEach(branch -> {
            if (branch.getThen() != null) {
                lines.add(INDENT + source + " -.-> " + branch.getThen());
            }
            branch.getEnds().forEach((key, target) ->
                    lines.add(INDENT + source + " -.|" + label(key) + "|.-> " + target));
        }));

        lines.add(CODE_BLOCK_END);
        return String.join("\n", lines);
    }

    private static String node(String id, String label) {
        return id + "[\"" + label + "\"]";
    }

    // 只有布尔 key 首字母大写，其余原样输出
    private static String label(String key) {
        if ("true".equals(key)) {
            return "True";
        }
        if ("false".equals(key)) {
            return "False";
        }
        return key;
    }
}
