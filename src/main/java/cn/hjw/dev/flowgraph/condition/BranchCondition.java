package cn.hjw.dev.flowgraph.condition;

/**
 * 布尔分支条件
 * 在节点的原始输入上求值，结果对应分支表中的 true / false
 * @param <I> 节点输入类型
 */
@FunctionalInterface
public interface BranchCondition<I> {

    boolean evaluate(I input);
}
