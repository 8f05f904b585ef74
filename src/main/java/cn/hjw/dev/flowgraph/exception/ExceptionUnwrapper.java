package cn.hjw.dev.flowgraph.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ExceptionUnwrapper {

    private ExceptionUnwrapper() {
    }

    /**
     * 剥离 CompletableFuture 的包装异常，获取真实异常
     * FlowGraphException 本身不会被剥离
     */
    public static Throwable extractRealCause(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException || cause instanceof ExecutionException) {
            Throwable next = cause.getCause();
            if (next == null) {
                break;
            }
            cause = next;
        }
        return cause;
    }
}
