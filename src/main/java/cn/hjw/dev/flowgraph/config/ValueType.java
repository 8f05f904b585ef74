package cn.hjw.dev.flowgraph.config;

/**
 * 节点输入/输出的类型标签
 * 只用于编译期检查无条件边两端是否一致，运行时不做校验
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    LIST,
    MAP,
    OBJECT
}
