package fun.ai.sync.workspace;

import fun.ai.sync.entity.response.WorkspaceSyncStatusResponse;
import fun.ai.sync.storage.StorageErrorType;
import fun.ai.sync.storage.WorkspaceStorage;
import fun.ai.sync.storage.WorkspaceStorageException;
import fun.ai.sync.watcher.IgnorePatterns;
import fun.ai.sync.watcher.SmartFileWatcher;
import fun.ai.sync.workspace.git.WorkspaceGitStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个会话 workspace 的同步生命周期：
 * <ul>
 *     <li>initialize：从对象存储恢复文件与 git 状态，启动监听和周期备份</li>
 *     <li>运行中：增量同步（上传/删除变更路径）、手动全量同步、周期压缩备份</li>
 *     <li>finalSync：保存 git 状态、压缩备份、全量上传，失败时尝试一次紧急备份</li>
 * </ul>
 *
 * <p>所有对存储的写操作都在 {@code syncLock} 内执行，任意两次同步不会交叠。</p>
 */
public class WorkspaceManager {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final WorkspaceStorage storage;
    private final String conversationId;
    private final String userId;
    private final Path workspacePath;
    private final WorkspaceSyncProperties props;
    private final WorkspaceRemotePaths remotePaths;
    private final IgnorePatterns ignorePatterns;
    private final WorkspaceBackupArchiver archiver;
    private final WorkspaceGitStateService gitStateService;
    private final Clock clock;

    private final ReentrantLock syncLock = new ReentrantLock();
    private final Object lifecycleMonitor = new Object();
    private final AtomicReference<WorkspaceState> state = new AtomicReference<>(WorkspaceState.UNINITIALIZED);

    private volatile SmartFileWatcher fileWatcher;
    private volatile ScheduledThreadPoolExecutor backupScheduler;
    private volatile ScheduledFuture<?> backupTask;
    private volatile String lastBackupKey;
    private volatile long lastBackupAtMs;
    private volatile long lastFullSyncAtMs;
    private volatile boolean lastFinalSyncSucceeded;

    public WorkspaceManager(WorkspaceStorage storage, String conversationId, String userId, Path workspacePath) {
        this(storage, conversationId, userId, workspacePath, new WorkspaceSyncProperties(), null, Clock.systemUTC());
    }

    public WorkspaceManager(WorkspaceStorage storage,
                            String conversationId,
                            String userId,
                            Path workspacePath,
                            WorkspaceSyncProperties props,
                            WorkspaceGitStateService gitStateService,
                            Clock clock) {
        if (storage == null) throw new IllegalArgumentException("storage 不能为空");
        if (workspacePath == null) throw new IllegalArgumentException("workspacePath 不能为空");
        this.remotePaths = new WorkspaceRemotePaths(userId, conversationId);
        this.storage = storage;
        this.conversationId = remotePaths.getConversationId();
        this.userId = remotePaths.getUserId();
        this.workspacePath = workspacePath.toAbsolutePath().normalize();
        this.props = props == null ? new WorkspaceSyncProperties() : props;
        this.ignorePatterns = new IgnorePatterns(this.props.getIgnorePatterns());
        this.archiver = new WorkspaceBackupArchiver(ignorePatterns);
        this.gitStateService = gitStateService != null ? gitStateService
                : new WorkspaceGitStateService(null, Duration.ofSeconds(this.props.getGitTimeoutSeconds()));
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * 恢复远端状态并开始同步。重复调用只记日志，不会二次下载或启动第二个监听。
     *
     * @throws WorkspaceStorageException 存储权限/配置错误（不可继续）
     */
    public void initialize() throws IOException {
        synchronized (lifecycleMonitor) {
            if (!state.compareAndSet(WorkspaceState.UNINITIALIZED, WorkspaceState.INITIALIZING)) {
                log.warn("workspace already initialized: userId={}, conversationId={}, state={}",
                        userId, conversationId, state.get());
                return;
            }
            log.info("initializing workspace: userId={}, conversationId={}, path={}", userId, conversationId, workspacePath);
            try {
                Files.createDirectories(workspacePath);
                restoreFromRemote();

                SmartFileWatcher watcher = new SmartFileWatcher(workspacePath, this::onFilesChanged,
                        props.getWatcher(), ignorePatterns, conversationId);
                fileWatcher = watcher;
                watcher.start();
                startBackupLoop();

                state.set(WorkspaceState.RUNNING);
                log.info("workspace ready: userId={}, conversationId={}", userId, conversationId);
            } catch (IOException | RuntimeException e) {
                log.error("workspace initialize failed: userId={}, conversationId={}, error={}",
                        userId, conversationId, e.getMessage(), e);
                stopWatcher();
                stopBackupLoop();
                state.set(WorkspaceState.UNINITIALIZED);
                throw e;
            }
        }
    }

    /**
     * 立即同步：先把监听器里积压的变更推上去，再做一次全量目录上传。
     *
     * @return 全量上传成功返回 true；未运行或失败返回 false
     */
    public boolean manualSync() {
        if (state.get() != WorkspaceState.RUNNING) {
            log.warn("manual sync ignored, workspace not running: conversationId={}, state={}", conversationId, state.get());
            return false;
        }
        log.info("manual sync: userId={}, conversationId={}", userId, conversationId);
        SmartFileWatcher watcher = fileWatcher;
        if (watcher != null) {
            watcher.triggerImmediateSync();
        }
        syncLock.lock();
        try {
            if (state.get() != WorkspaceState.RUNNING) {
                return false;
            }
            await(storage.uploadDirectory(workspacePath, remotePaths.filesPrefix(), this::isSynced));
            lastFullSyncAtMs = clock.millis();
            return true;
        } catch (WorkspaceStorageException e) {
            log.error("manual sync failed: conversationId={}, type={}, error={}", conversationId, e.getType(), e.getMessage(), e);
            return false;
        } finally {
            syncLock.unlock();
        }
    }

    /**
     * 关闭前的最终同步。多次/并发调用只有第一次生效。
     */
    public void finalSync() {
        WorkspaceState current = state.get();
        if (current == WorkspaceState.SHUTTING_DOWN || current == WorkspaceState.STOPPED) {
            log.debug("final sync already done or in progress: conversationId={}, state={}", conversationId, current);
            return;
        }
        synchronized (lifecycleMonitor) {
            if (state.compareAndSet(WorkspaceState.UNINITIALIZED, WorkspaceState.STOPPED)) {
                log.info("workspace never initialized, nothing to sync: conversationId={}", conversationId);
                lastFinalSyncSucceeded = true;
                return;
            }
            if (!state.compareAndSet(WorkspaceState.RUNNING, WorkspaceState.SHUTTING_DOWN)) {
                return;
            }
            log.info("final sync started: userId={}, conversationId={}", userId, conversationId);
            long start = System.currentTimeMillis();
            try {
                SmartFileWatcher watcher = fileWatcher;
                stopWatcher();
                stopBackupLoop();

                syncLock.lock();
                try {
                    if (watcher != null) {
                        Set<String> remaining = watcher.drainRemainingChanges();
                        if (!remaining.isEmpty()) {
                            syncChangedPaths(remaining);
                        }
                    }
                    gitStateService.preserve(workspacePath, remotePaths.bundleKey(), storage);
                    createCompressedBackup();
                    await(storage.uploadDirectory(workspacePath, remotePaths.filesPrefix(), this::isSynced));
                    lastFullSyncAtMs = clock.millis();
                } finally {
                    syncLock.unlock();
                }
                lastFinalSyncSucceeded = true;
                log.info("final sync completed: conversationId={}, costMs={}", conversationId, System.currentTimeMillis() - start);
            } catch (Exception e) {
                lastFinalSyncSucceeded = false;
                log.error("final sync failed, trying emergency backup: conversationId={}, error={}",
                        conversationId, e.getMessage(), e);
                emergencyBackup();
            } finally {
                state.set(WorkspaceState.STOPPED);
            }
        }
    }

    /**
     * 带超时的最终同步，用于 JVM 关闭和节点下线。
     *
     * @return 在超时内完成且成功返回 true
     */
    public boolean finalSync(Duration timeout) {
        Thread worker = new Thread(this::finalSync, "ws-final-sync-" + conversationId);
        worker.setDaemon(true);
        worker.start();
        try {
            worker.join(Math.max(1L, timeout == null ? 0L : timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for final sync: conversationId={}", conversationId);
            return false;
        }
        if (worker.isAlive()) {
            log.error("final sync timed out after {}ms: conversationId={}", timeout == null ? 0 : timeout.toMillis(), conversationId);
            return false;
        }
        return lastFinalSyncSucceeded;
    }

    /**
     * 会话结束：按配置的超时执行最终同步
     */
    public boolean cleanup() {
        return finalSync(Duration.ofSeconds(props.getFinalSyncTimeoutSeconds()));
    }

    /**
     * 注册 JVM 关闭钩子，进程退出时执行一次带超时的最终同步
     */
    public WorkspaceShutdownHook registerShutdownHook(Duration timeout) {
        WorkspaceShutdownHook hook = new WorkspaceShutdownHook(this, timeout);
        hook.register();
        return hook;
    }

    public WorkspaceSyncStatusResponse getStatus() {
        WorkspaceSyncStatusResponse resp = new WorkspaceSyncStatusResponse();
        resp.setUserId(userId);
        resp.setConversationId(conversationId);
        resp.setWorkspacePath(workspacePath.toString());
        resp.setState(state.get().name());
        resp.setRemotePrefix(remotePaths.base());
        resp.setLastBackupKey(lastBackupKey);
        resp.setLastBackupAtMs(lastBackupAtMs > 0 ? lastBackupAtMs : null);
        resp.setLastFullSyncAtMs(lastFullSyncAtMs > 0 ? lastFullSyncAtMs : null);
        SmartFileWatcher watcher = fileWatcher;
        if (watcher != null) {
            resp.setWatcher(watcher.getStatus());
        }
        return resp;
    }

    public WorkspaceState getState() {
        return state.get();
    }

    public String getUserId() {
        return userId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public WorkspaceRemotePaths getRemotePaths() {
        return remotePaths;
    }

    WorkspaceGitStateService getGitStateService() {
        return gitStateService;
    }

    /**
     * 文件监听回调：按本地是否存在决定上传或删除远端对象。
     * 非 RUNNING 状态下不写存储，把路径放回监听器，留给最终同步处理。
     */
    void onFilesChanged(Set<String> changedPaths) {
        syncLock.lock();
        try {
            if (state.get() != WorkspaceState.RUNNING) {
                SmartFileWatcher watcher = fileWatcher;
                if (watcher != null) {
                    watcher.requeue(changedPaths);
                }
                log.debug("workspace not running, {} changes deferred: conversationId={}", changedPaths.size(), conversationId);
                return;
            }
            syncChangedPaths(changedPaths);
        } finally {
            syncLock.unlock();
        }
    }

    /**
     * 需持有 syncLock。单个路径失败不影响其他路径；瞬时错误的路径交回监听器稍后重试。
     */
    private void syncChangedPaths(Set<String> changedPaths) {
        Map<String, CompletableFuture<Void>> ops = new LinkedHashMap<>();
        Map<String, Boolean> isUpload = new LinkedHashMap<>();
        for (String rel : changedPaths) {
            String key;
            try {
                key = remotePaths.fileKey(rel);
            } catch (IllegalArgumentException e) {
                log.warn("skip illegal workspace path: {}, error={}", rel, e.getMessage());
                continue;
            }
            Path local = workspacePath.resolve(rel);
            boolean upload = Files.isRegularFile(local);
            isUpload.put(rel, upload);
            try {
                ops.put(rel, upload ? storage.uploadFile(local, key) : storage.deleteFile(key));
            } catch (RuntimeException e) {
                ops.put(rel, CompletableFuture.failedFuture(e));
            }
        }
        if (ops.isEmpty()) return;

        CompletableFuture.allOf(ops.values().toArray(new CompletableFuture[0]))
                .handle((v, t) -> null)
                .join();

        int uploaded = 0;
        int deleted = 0;
        Set<String> retry = new LinkedHashSet<>();
        for (Map.Entry<String, CompletableFuture<Void>> e : ops.entrySet()) {
            String rel = e.getKey();
            boolean upload = isUpload.get(rel);
            try {
                e.getValue().join();
                if (upload) uploaded++;
                else deleted++;
            } catch (Exception ex) {
                WorkspaceStorageException wse = WorkspaceStorageException.unwrap(ex);
                log.warn("sync {} failed: conversationId={}, path={}, type={}, error={}",
                        upload ? "upload" : "delete", conversationId, rel, wse.getType(), wse.getMessage());
                // 上传时文件刚被删掉（NOT_FOUND）也重试：下一轮会变成删除
                if (wse.getType().isRetryable() || (upload && wse.getType() == StorageErrorType.NOT_FOUND)) {
                    retry.add(rel);
                }
            }
        }
        int failed = ops.size() - uploaded - deleted;
        if (failed > 0) {
            log.error("incremental sync incomplete: conversationId={}, uploaded={}, deleted={}, failed={}, requeued={}",
                    conversationId, uploaded, deleted, failed, retry.size());
        } else {
            log.info("incremental sync: conversationId={}, uploaded={}, deleted={}", conversationId, uploaded, deleted);
        }

        SmartFileWatcher watcher = fileWatcher;
        if (!retry.isEmpty() && watcher != null) {
            watcher.requeue(retry);
        }
    }

    private void restoreFromRemote() {
        boolean remoteExists;
        try {
            remoteExists = Boolean.TRUE.equals(await(storage.exists(remotePaths.filesPrefix())));
        } catch (WorkspaceStorageException e) {
            if (e.getType().isFatal()) throw e;
            log.error("check remote workspace failed, starting with local files: conversationId={}, type={}, error={}",
                    conversationId, e.getType(), e.getMessage());
            return;
        }
        if (!remoteExists) {
            log.info("no remote workspace found, starting fresh: conversationId={}", conversationId);
            return;
        }
        try {
            await(storage.downloadDirectory(remotePaths.filesPrefix(), workspacePath));
            log.info("remote workspace restored: conversationId={}, path={}", conversationId, workspacePath);
        } catch (WorkspaceStorageException e) {
            if (e.getType().isFatal()) throw e;
            log.error("restore workspace files incomplete: conversationId={}, type={}, error={}",
                    conversationId, e.getType(), e.getMessage());
        }
        gitStateService.restore(workspacePath, remotePaths.bundleKey(), storage);
    }

    /**
     * 全量上传只包含监听器跟踪的路径；.git 走 bundle 通道
     */
    private boolean isSynced(String relativePath) {
        return !ignorePatterns.excludes(relativePath);
    }

    /**
     * 需持有 syncLock
     */
    private String createCompressedBackup() throws IOException {
        String key = remotePaths.backupKey(clock.instant());
        Path tmp = Files.createTempFile("workspace-backup-", ".tar.gz");
        try {
            int files = archiver.archive(workspacePath, tmp);
            await(storage.uploadFile(tmp, key));
            lastBackupKey = key;
            lastBackupAtMs = clock.millis();
            log.info("compressed backup uploaded: conversationId={}, key={}, files={}", conversationId, key, files);
            return key;
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("delete temp backup failed: {}, error={}", tmp, e.getMessage());
            }
        }
    }

    private void emergencyBackup() {
        syncLock.lock();
        try {
            String key = createCompressedBackup();
            log.warn("emergency backup created: conversationId={}, key={}", conversationId, key);
        } catch (Exception e) {
            log.error("emergency backup failed: conversationId={}, error={}", conversationId, e.getMessage(), e);
        } finally {
            syncLock.unlock();
        }
    }

    private void startBackupLoop() {
        long interval = props.getBackupIntervalSeconds();
        if (interval <= 0) {
            log.info("periodic backup disabled: conversationId={}", conversationId);
            return;
        }
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "ws-backup-" + conversationId);
            t.setDaemon(true);
            return t;
        });
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        backupScheduler = scheduler;
        backupTask = scheduler.scheduleWithFixedDelay(this::periodicBackup, interval, interval, TimeUnit.SECONDS);
    }

    private void periodicBackup() {
        if (state.get() != WorkspaceState.RUNNING) return;
        syncLock.lock();
        try {
            if (state.get() != WorkspaceState.RUNNING) return;
            createCompressedBackup();
        } catch (Exception e) {
            // 周期任务抛异常会被取消，下个周期继续
            log.error("periodic backup failed: conversationId={}, error={}", conversationId, e.getMessage(), e);
        } finally {
            syncLock.unlock();
        }
    }

    private void stopBackupLoop() {
        ScheduledFuture<?> task = backupTask;
        if (task != null) {
            task.cancel(false);
            backupTask = null;
        }
        ScheduledThreadPoolExecutor scheduler = backupScheduler;
        if (scheduler == null) return;
        backupScheduler = null;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(Math.max(1L, props.getFinalSyncTimeoutSeconds()), TimeUnit.SECONDS)) {
                log.warn("backup task did not finish in time: conversationId={}", conversationId);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void stopWatcher() {
        SmartFileWatcher watcher = fileWatcher;
        if (watcher != null) {
            watcher.stop();
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (Exception e) {
            throw WorkspaceStorageException.unwrap(e);
        }
    }
}
