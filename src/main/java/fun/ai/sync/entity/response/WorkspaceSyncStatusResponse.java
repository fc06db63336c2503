package fun.ai.sync.entity.response;

import lombok.Data;

/**
 * /api/fun-ai/workspace/sync/status 响应
 */
@Data
public class WorkspaceSyncStatusResponse {
    private String userId;
    private String conversationId;
    private String workspacePath;
    /**
     * UNINITIALIZED / INITIALIZING / RUNNING / SHUTTING_DOWN / STOPPED
     */
    private String state;
    /**
     * 远端 workspace 根前缀：conversations/{userId}/{conversationId}/workspace
     */
    private String remotePrefix;
    private String lastBackupKey;
    private Long lastBackupAtMs;
    private Long lastFullSyncAtMs;
    private FileWatcherStatusResponse watcher;
}
