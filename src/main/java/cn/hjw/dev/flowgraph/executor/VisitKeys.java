package cn.hjw.dev.flowgraph.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * 访问记录 key: nodeId + 输入的 JSON 序列化结果
 * 无法序列化的输入 (包括没有可见属性的对象，如 lambda 或只有私有字段的 POJO) 退化为对象身份，只与自身相等
 */
@Slf4j
final class VisitKeys {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            // 空 bean 会被序列化为 "{}"，不同实例会互相冲突，必须走身份 key
            .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private VisitKeys() {
    }

    static String of(String nodeId, Object input) {
        return nodeId + ":" + serialize(input);
    }

    static String serialize(Object input) {
        try {
            return MAPPER.writeValueAsString(input);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Input of type {} is not serializable, using identity key. Cause: {}",
                    input.getClass().getName(), e.getMessage());
            return "@" + input.getClass().getName() + "#" + Integer.toHexString(System.identityHashCode(input));
        }
    }
}
