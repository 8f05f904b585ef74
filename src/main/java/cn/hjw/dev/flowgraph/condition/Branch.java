package cn.hjw.dev.flowgraph.condition;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 条件分支 (不可变)
 * 判别函数在源节点的原始输入上求值，结果按字符串 key 匹配 ends；
 * then 为无条件跳转，与 ends 互相独立。
 * 判别值只允许布尔或枚举：布尔对应 "true" / "false"，枚举对应 {@link Enum#name()}。
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Branch {

    // 判别函数：原始输入 -> 分支 key (null 表示不匹配)
    @Getter(AccessLevel.NONE)
    private final Function<Object, String> discriminator;

    // 分支 key -> 目标节点 (布尔按 true、false 排序；枚举按声明顺序排序)
    private final Map<String, String> ends;

    // 无条件目标，可为 null
    private final String then;

    @SuppressWarnings("unchecked")
    public static <I> Branch when(BranchCondition<I> condition, Map<Boolean, String> ends) {
        Objects.requireNonNull(condition, "condition");
        Map<String, String> normalized = new LinkedHashMap<>();
        if (ends != null) {
            if (ends.containsKey(Boolean.TRUE)) {
                normalized.put(Boolean.TRUE.toString(), Objects.requireNonNull(ends.get(Boolean.TRUE), "true target"));
            }
            if (ends.containsKey(Boolean.FALSE)) {
                normalized.put(Boolean.FALSE.toString(), Objects.requireNonNull(ends.get(Boolean.FALSE), "false target"));
            }
        }
        return new Branch(input -> String.valueOf(condition.evaluate((I) input)),
                Collections.unmodifiableMap(normalized), null);
    }

    @SuppressWarnings("unchecked")
    public static <I, E extends Enum<E>> Branch route(PathFunction<I, E> path, Map<E, String> ends) {
        Objects.requireNonNull(path, "path");
        Map<String, String> normalized = new LinkedHashMap<>();
        if (ends != null) {
            new TreeMap<>(ends).forEach((key, target) ->
                    normalized.put(key.name(), Objects.requireNonNull(target, key.name() + " target")));
        }
        return new Branch(input -> {
            E value = path.route((I) input);
            return value == null ? null : value.name();
        }, Collections.unmodifiableMap(normalized), null);
    }

    /**
     * 仅包含无条件目标的分支
     */
    public static Branch then(String target) {
        return new Branch(input -> null, Map.of(), Objects.requireNonNull(target, "target"));
    }

    /**
     * 在当前分支上追加无条件目标，返回新分支
     */
    public Branch thenTo(String target) {
        return new Branch(discriminator, ends, Objects.requireNonNull(target, "target"));
    }

    /**
     * 计算分支 key
     */
    public String resolve(Object input) {
        return discriminator.apply(input);
    }

    /**
     * 所有可能的目标 (then 在前，ends 按顺序)
     */
    public List<String> targets() {
        List<String> targets = new ArrayList<>();
        if (then != null) {
            targets.add(then);
        }
        targets.addAll(ends.values());
        return targets;
    }
}
