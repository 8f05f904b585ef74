package cn.hjw.dev.flowgraph.config;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

// 无条件边，允许重复
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class Edge {
    private final String from;
    private final String to;
}
