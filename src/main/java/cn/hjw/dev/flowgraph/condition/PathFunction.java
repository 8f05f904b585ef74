package cn.hjw.dev.flowgraph.condition;

/**
 * 枚举路由函数
 * 在节点的原始输入上求值，返回的枚举常量决定下一个节点
 * @param <I> 节点输入类型
 * @param <E> 路由枚举类型
 */
@FunctionalInterface
public interface PathFunction<I, E extends Enum<E>> {

    /**
     * @param input 节点的原始输入 (不是节点结果)
     * @return 路由值，返回 null 表示不匹配任何分支
     */
    E route(I input);
}
