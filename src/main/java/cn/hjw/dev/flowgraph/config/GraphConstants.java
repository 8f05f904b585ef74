package cn.hjw.dev.flowgraph.config;

public final class GraphConstants {

    // 哨兵节点
    public static final String START = "__START__";
    public static final String END = "__END__";

    // 默认重试配置
    public static final int DEFAULT_RETRY_COUNT = 0;
    public static final long DEFAULT_RETRY_DELAY_MILLIS = 100;

    // 未指定 key 时的分支名
    public static final String DEFAULT_BRANCH_KEY = "branch";

    private GraphConstants() {
    }

    public static boolean isSentinel(String nodeId) {
        return START.equals(nodeId) || END.equals(nodeId);
    }
}
