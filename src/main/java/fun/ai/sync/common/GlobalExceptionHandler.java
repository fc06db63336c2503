package fun.ai.sync.common;

import fun.ai.sync.storage.StorageErrorType;
import fun.ai.sync.storage.WorkspaceStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Result<?>> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Result.error(400, "缺少参数: " + e.getParameterName()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<?>> handleIllegalArgumentException(IllegalArgumentException e) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Result.error(400, e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Result<?>> handleIllegalStateException(IllegalStateException e) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Result.error(409, e.getMessage()));
    }

    /**
     * 存储错误：权限/配置类错误需要让调用方明确感知，不能被当成普通系统错误吞掉
     */
    @ExceptionHandler(WorkspaceStorageException.class)
    public ResponseEntity<Result<?>> handleStorageException(WorkspaceStorageException e) {
        StorageErrorType type = e.getType();
        int code = switch (type) {
            case NOT_FOUND -> 404;
            case PERMISSION_DENIED -> 403;
            case CONFIGURATION -> 500;
            case TRANSIENT -> 503;
            case UNKNOWN -> 500;
        };
        log.error("storage error surfaced to api: type={}, error={}", type, e.getMessage());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Result.error(code, "存储错误(" + type + ")：" + e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<?>> handleException(Exception e) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Result.error("系统错误：" + e.getMessage()));
    }
}
