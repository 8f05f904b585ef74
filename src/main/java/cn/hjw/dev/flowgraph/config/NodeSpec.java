package cn.hjw.dev.flowgraph.config;

import cn.hjw.dev.flowgraph.processor.AsyncNodeProcessor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 节点注册信息，注册后不可变
@Getter
@RequiredArgsConstructor
public class NodeSpec {
    private final String nodeId;
    private final AsyncNodeProcessor<Object, Object> processor;
    // 为 null 时编译阶段使用 GraphConfig 的默认治理
    private final NodeGovernance governance;
    private final NodeOptions options;
}
