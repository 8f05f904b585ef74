package cn.hjw.dev.flowgraph.processor;

/**
 * 进度消息接收器
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(String message);
}
