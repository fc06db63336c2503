package fun.ai.sync.service.impl;

import fun.ai.sync.entity.response.WorkspaceSyncStatusResponse;
import fun.ai.sync.service.FunAiWorkspaceSyncService;
import fun.ai.sync.storage.WorkspaceStorage;
import fun.ai.sync.workspace.CommandRunner;
import fun.ai.sync.workspace.WorkspaceManager;
import fun.ai.sync.workspace.WorkspaceRemotePaths;
import fun.ai.sync.workspace.WorkspaceState;
import fun.ai.sync.workspace.WorkspaceSyncProperties;
import fun.ai.sync.workspace.git.WorkspaceGitStateService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class FunAiWorkspaceSyncServiceImpl implements FunAiWorkspaceSyncService {
    private static final Logger log = LoggerFactory.getLogger(FunAiWorkspaceSyncServiceImpl.class);

    private final WorkspaceStorage storage;
    private final WorkspaceSyncProperties props;
    private final WorkspaceGitStateService gitStateService;

    // key: {userId}/{conversationId}
    private final Map<String, WorkspaceManager> managers = new ConcurrentHashMap<>();

    public FunAiWorkspaceSyncServiceImpl(ObjectProvider<WorkspaceStorage> storageProvider,
                                         WorkspaceSyncProperties props,
                                         CommandRunner commandRunner) {
        this.storage = storageProvider.getIfAvailable();
        this.props = props;
        this.gitStateService = new WorkspaceGitStateService(commandRunner, Duration.ofSeconds(props.getGitTimeoutSeconds()));
    }

    @Override
    public WorkspaceSyncStatusResponse initialize(String userId, String conversationId, String workspacePath) {
        assertEnabled();
        WorkspaceRemotePaths ids = new WorkspaceRemotePaths(userId, conversationId);
        String key = managerKey(ids);
        Path dir = StringUtils.hasText(workspacePath)
                ? Paths.get(workspacePath)
                : props.resolveWorkspaceDir(ids.getUserId(), ids.getConversationId());

        WorkspaceManager manager = managers.compute(key, (k, existing) -> {
            if (existing == null || existing.getState() == WorkspaceState.STOPPED) {
                return new WorkspaceManager(storage, ids.getConversationId(), ids.getUserId(), dir,
                        props, gitStateService, Clock.systemUTC());
            }
            if (!existing.getWorkspacePath().equals(dir.toAbsolutePath().normalize())) {
                log.warn("workspace already bound to another path, keep existing: key={}, existing={}, requested={}",
                        k, existing.getWorkspacePath(), dir);
            }
            return existing;
        });

        try {
            manager.initialize();
        } catch (IOException e) {
            managers.remove(key, manager);
            throw new IllegalStateException("初始化 workspace 失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            managers.remove(key, manager);
            throw e;
        }
        return manager.getStatus();
    }

    @Override
    public boolean manualSync(String userId, String conversationId) {
        return requireManager(userId, conversationId).manualSync();
    }

    @Override
    public boolean cleanup(String userId, String conversationId) {
        WorkspaceRemotePaths ids = new WorkspaceRemotePaths(userId, conversationId);
        String key = managerKey(ids);
        WorkspaceManager manager = managers.get(key);
        if (manager == null) {
            log.info("cleanup skipped, workspace not active: key={}", key);
            return true;
        }
        boolean ok = manager.cleanup();
        managers.remove(key, manager);
        log.info("workspace cleaned up: key={}, finalSyncOk={}", key, ok);
        return ok;
    }

    @Override
    public WorkspaceSyncStatusResponse getStatus(String userId, String conversationId) {
        return requireManager(userId, conversationId).getStatus();
    }

    @Override
    public List<WorkspaceSyncStatusResponse> listActive() {
        List<WorkspaceSyncStatusResponse> list = new ArrayList<>();
        for (WorkspaceManager m : managers.values()) {
            list.add(m.getStatus());
        }
        list.sort(Comparator.comparing(WorkspaceSyncStatusResponse::getUserId)
                .thenComparing(WorkspaceSyncStatusResponse::getConversationId));
        return list;
    }

    /**
     * 节点下线：并行对所有会话做带超时的最终同步
     */
    @PreDestroy
    public void shutdown() {
        if (managers.isEmpty()) return;
        Duration timeout = Duration.ofSeconds(props.getFinalSyncTimeoutSeconds());
        log.info("node shutting down, final sync for {} workspaces, timeoutMs={}", managers.size(), timeout.toMillis());
        List<Thread> workers = new ArrayList<>();
        for (WorkspaceManager m : managers.values()) {
            Thread t = new Thread(() -> {
                if (!m.finalSync(timeout)) {
                    log.error("final sync incomplete on shutdown: userId={}, conversationId={}",
                            m.getUserId(), m.getConversationId());
                }
            }, "ws-shutdown-" + m.getConversationId());
            t.setDaemon(true);
            t.start();
            workers.add(t);
        }
        long deadline = System.currentTimeMillis() + timeout.toMillis() + 1_000L;
        for (Thread t : workers) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) break;
            try {
                t.join(left);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        managers.clear();
    }

    private WorkspaceManager requireManager(String userId, String conversationId) {
        WorkspaceRemotePaths ids = new WorkspaceRemotePaths(userId, conversationId);
        WorkspaceManager manager = managers.get(managerKey(ids));
        if (manager == null) {
            throw new IllegalArgumentException("workspace 未初始化: userId=" + ids.getUserId()
                    + ", conversationId=" + ids.getConversationId());
        }
        return manager;
    }

    private void assertEnabled() {
        if (!props.isEnabled() || storage == null) {
            throw new IllegalStateException("workspace 同步未启用（funai.sync.enabled=false）");
        }
    }

    private static String managerKey(WorkspaceRemotePaths ids) {
        return ids.getUserId() + "/" + ids.getConversationId();
    }
}
