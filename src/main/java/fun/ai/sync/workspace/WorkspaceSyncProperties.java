package fun.ai.sync.workspace;

import fun.ai.sync.watcher.FileWatcherProperties;
import fun.ai.sync.watcher.IgnorePatterns;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Workspace 同步配置
 */
@Component
@ConfigurationProperties(prefix = "funai.sync")
public class WorkspaceSyncProperties {

    /**
     * 是否启用同步节点
     */
    private boolean enabled = true;

    /**
     * 未显式指定 workspacePath 时的本地根目录：{hostRoot}/{userId}/{conversationId}
     */
    private String hostRoot = "/data/funai/workspaces";

    /**
     * 周期性压缩备份间隔（秒），<=0 关闭
     */
    private long backupIntervalSeconds = 300;

    /**
     * 关闭时最终同步的最长等待时间（秒）
     */
    private long finalSyncTimeoutSeconds = 30;

    /**
     * 单条 git 命令超时（秒）
     */
    private long gitTimeoutSeconds = 120;

    /**
     * 监听和压缩备份共用的忽略规则
     */
    private List<String> ignorePatterns = new ArrayList<>(IgnorePatterns.DEFAULTS);

    private FileWatcherProperties watcher = new FileWatcherProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHostRoot() {
        return hostRoot;
    }

    public void setHostRoot(String hostRoot) {
        this.hostRoot = hostRoot;
    }

    public long getBackupIntervalSeconds() {
        return backupIntervalSeconds;
    }

    public void setBackupIntervalSeconds(long backupIntervalSeconds) {
        this.backupIntervalSeconds = backupIntervalSeconds;
    }

    public long getFinalSyncTimeoutSeconds() {
        return finalSyncTimeoutSeconds;
    }

    public void setFinalSyncTimeoutSeconds(long finalSyncTimeoutSeconds) {
        this.finalSyncTimeoutSeconds = finalSyncTimeoutSeconds;
    }

    public long getGitTimeoutSeconds() {
        return gitTimeoutSeconds;
    }

    public void setGitTimeoutSeconds(long gitTimeoutSeconds) {
        this.gitTimeoutSeconds = gitTimeoutSeconds;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public void setIgnorePatterns(List<String> ignorePatterns) {
        this.ignorePatterns = ignorePatterns;
    }

    public FileWatcherProperties getWatcher() {
        return watcher;
    }

    public void setWatcher(FileWatcherProperties watcher) {
        this.watcher = watcher;
    }

    /**
     * {hostRoot}/{userId}/{conversationId}
     */
    public Path resolveWorkspaceDir(String userId, String conversationId) {
        if (!StringUtils.hasText(hostRoot)) {
            throw new IllegalStateException("funai.sync.host-root 未配置");
        }
        return Paths.get(hostRoot, userId, conversationId);
    }
}
