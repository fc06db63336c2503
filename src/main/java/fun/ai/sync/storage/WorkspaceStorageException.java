package fun.ai.sync.storage;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 存储层统一异常，携带 {@link StorageErrorType} 供调用方决定是否重试/容忍。
 */
public class WorkspaceStorageException extends RuntimeException {
    private final StorageErrorType type;

    public WorkspaceStorageException(StorageErrorType type, String message) {
        super(message);
        this.type = type == null ? StorageErrorType.UNKNOWN : type;
    }

    public WorkspaceStorageException(StorageErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type == null ? StorageErrorType.UNKNOWN : type;
    }

    public StorageErrorType getType() {
        return type;
    }

    /**
     * 从 CompletableFuture 的包装异常中取出真实原因并归类。
     */
    public static WorkspaceStorageException unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        if (cur instanceof WorkspaceStorageException wse) {
            return wse;
        }
        String msg = cur == null ? "unknown storage error" : cur.getMessage();
        return new WorkspaceStorageException(StorageErrorType.UNKNOWN, msg, cur);
    }
}
