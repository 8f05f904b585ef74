package cn.hjw.dev.flowgraph.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
public class NodeOptions {

    // --- 类型标签 (可选) ---
    private ValueType inputType;

    private ValueType outputType;

    // --- 附加信息，框架不解释 ---
    @Builder.Default
    private Map<String, Object> metadata = Map.of();

    public static NodeOptions none() {
        return NodeOptions.builder().build();
    }

    /**
     * 只读副本，注册后调用方再修改原 metadata 不会影响节点
     */
    NodeOptions snapshot() {
        Map<String, Object> copy = metadata == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        return NodeOptions.builder().inputType(inputType).outputType(outputType).metadata(copy).build();
    }
}
