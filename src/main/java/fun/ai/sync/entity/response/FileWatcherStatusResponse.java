package fun.ai.sync.entity.response;

import lombok.Data;

/**
 * 文件监听器运行状态
 */
@Data
public class FileWatcherStatusResponse {
    private boolean running;
    private String watchDirectory;
    /**
     * 当前跟踪的文件数
     */
    private Integer trackedFiles;
    /**
     * 待同步（已检测、未回调）的路径数
     */
    private Integer pendingChanges;
    private Long currentDebounceMs;
    private Integer changesPerSecond;
    private Long minDebounceMs;
    private Long maxDebounceMs;
    private Long lastSyncAtMs;
}
