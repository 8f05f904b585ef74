package cn.hjw.dev.flowgraph.exception;

/**
 * 图异常分类 (封闭集合)
 */
public enum ErrorKind {

    // 使用了保留的哨兵名，或入口/出口节点不存在
    INVALID_NODE_NAME,

    // 节点重复注册
    DUPLICATE_NODE,

    // 边或分支的端点未注册
    INVALID_EDGE,

    // 边两端声明的类型标签不一致
    TYPE_MISMATCH,

    // 存在从 START 不可达的节点
    UNREACHABLE_NODE,

    // 节点重试耗尽且没有降级策略
    EXECUTION_FAILURE
}
