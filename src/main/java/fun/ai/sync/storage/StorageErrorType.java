package fun.ai.sync.storage;

/**
 * 对象存储错误分类
 */
public enum StorageErrorType {
    /**
     * 对象/本地文件不存在（delete/exists 场景下不算错误）
     */
    NOT_FOUND,
    /**
     * 鉴权失败：必须立即暴露
     */
    PERMISSION_DENIED,
    /**
     * 配置错误（bucket 不存在、endpoint 不可解析等）：必须立即暴露
     */
    CONFIGURATION,
    /**
     * 网络抖动/5xx/限流：可安全重试
     */
    TRANSIENT,
    UNKNOWN;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }

    public boolean isFatal() {
        return this == PERMISSION_DENIED || this == CONFIGURATION;
    }
}
