package com.edge.match.exception;

/**
 * 检测 / 跟踪 / 分类阶段的失败
 * <p>
 * 引擎内部不重试，retryable 仅供外部编排决定是否整体重跑
 */
public class DetectionException extends RuntimeException {

    public enum Stage {
        DETECTION,
        TRACKING,
        CLASSIFICATION
    }

    private final Stage stage;
    private final boolean retryable;

    public DetectionException(Stage stage, String message, boolean retryable) {
        super(message);
        this.stage = stage;
        this.retryable = retryable;
    }

    public DetectionException(Stage stage, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.retryable = retryable;
    }

    public Stage getStage() {
        return stage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return "DetectionException{stage=" + stage + ", retryable=" + retryable + ", message=" + getMessage() + "}";
    }
}
