package fun.ai.sync.watcher;

import fun.ai.sync.entity.response.FileWatcherStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 轮询式文件监听：定时扫描 workspace，按 mtime 比对出 创建/修改/删除，
 * 经自适应防抖后把一批变更交给 {@link ChangeCallback}。
 *
 * <p>线程模型：</p>
 * <ul>
 *     <li>fw-poll-*：扫描 + 防抖定时器</li>
 *     <li>fw-sync-*：执行回调（慢回调不会阻塞扫描）</li>
 * </ul>
 */
public class SmartFileWatcher {
    private static final Logger log = LoggerFactory.getLogger(SmartFileWatcher.class);

    private final Path watchDirectory;
    private final ChangeCallback callback;
    private final FileWatcherProperties props;
    private final IgnorePatterns ignorePatterns;
    private final String name;

    private final Object scanLock = new Object();
    // 取走 pending 到回调结束为止独占：立即同步会等进行中的防抖批次落地
    private final Object dispatchLock = new Object();
    private final FileState fileState = new FileState();
    private final PendingChanges pending = new PendingChanges();
    private final AdaptiveDebounce debounce;

    private volatile boolean running;
    private volatile long lastSyncAtMs;

    private ScheduledThreadPoolExecutor scheduler;
    private ExecutorService dispatcher;
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> syncTimer;

    public SmartFileWatcher(Path watchDirectory,
                            ChangeCallback callback,
                            FileWatcherProperties props,
                            IgnorePatterns ignorePatterns,
                            String name) {
        if (watchDirectory == null) throw new IllegalArgumentException("watchDirectory 不能为空");
        if (callback == null) throw new IllegalArgumentException("callback 不能为空");
        this.watchDirectory = watchDirectory.toAbsolutePath().normalize();
        this.callback = callback;
        this.props = props == null ? new FileWatcherProperties() : props;
        this.ignorePatterns = ignorePatterns == null ? IgnorePatterns.defaults() : ignorePatterns;
        this.name = (name == null || name.isBlank()) ? this.watchDirectory.getFileName().toString() : name;
        this.debounce = new AdaptiveDebounce(this.props, System.nanoTime());
    }

    /**
     * 建立基线并开始轮询；重复调用无副作用。
     */
    public synchronized void start() {
        if (running) {
            log.warn("file watcher already running: dir={}", watchDirectory);
            return;
        }
        int tracked;
        synchronized (scanLock) {
            scanChangesLocked();
            tracked = fileState.size();
        }

        scheduler = new ScheduledThreadPoolExecutor(1, daemonFactory("fw-poll-" + name));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonFactory("fw-sync-" + name));

        running = true;
        long interval = Math.max(10L, props.getPollIntervalMs());
        pollTask = scheduler.scheduleWithFixedDelay(this::pollSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("file watcher started: dir={}, trackedFiles={}, pollIntervalMs={}, debounce=[{}, {}]ms",
                watchDirectory, tracked, interval, debounce.getMinDebounceMs(), debounce.getMaxDebounceMs());
    }

    /**
     * 停止轮询并取消挂起的防抖定时器，等待进行中的回调结束；重复调用无副作用。
     * 未同步的变更保留在待同步集合中，可通过 {@link #drainRemainingChanges()} 取走。
     */
    public void stop() {
        ScheduledThreadPoolExecutor s;
        ExecutorService d;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            if (syncTimer != null) {
                syncTimer.cancel(false);
                syncTimer = null;
            }
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
            s = scheduler;
            d = dispatcher;
            scheduler = null;
            dispatcher = null;
        }
        // 在锁外等待，避免与回调线程里的 requeue/reschedule 互等
        shutdownAndAwait(s);
        shutdownAndAwait(d);
        log.info("file watcher stopped: dir={}, pending={}", watchDirectory, pending.size());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 立即同步：取消防抖定时器，补扫一次，并在调用线程上直接执行回调。
     *
     * @return 回调成功（或没有待同步变更）返回 true
     */
    public boolean triggerImmediateSync() {
        if (!running) {
            log.debug("file watcher not running, skip immediate sync: dir={}", watchDirectory);
            return false;
        }
        cancelSyncTimer();
        synchronized (dispatchLock) {
            Set<String> batch;
            synchronized (scanLock) {
                pending.addAll(scanChangesLocked());
                batch = pending.drain();
            }
            if (batch.isEmpty()) {
                return true;
            }
            log.info("immediate sync triggered: dir={}, changes={}", watchDirectory, batch.size());
            try {
                callback.onChanges(batch);
                lastSyncAtMs = System.currentTimeMillis();
                debounce.reset();
                return true;
            } catch (Exception e) {
                pending.addAll(batch);
                log.error("immediate sync callback failed, {} changes re-queued: dir={}, error={}",
                        batch.size(), watchDirectory, e.getMessage(), e);
                return false;
            }
        }
    }

    /**
     * 补扫一次并取走所有未同步的变更（用于关闭前的最终同步，stop 之后也可调用）。
     */
    public Set<String> drainRemainingChanges() {
        synchronized (scanLock) {
            pending.addAll(scanChangesLocked());
            return pending.drain();
        }
    }

    /**
     * 放回同步失败的路径；监听仍在运行时按当前防抖时间重新排期。
     */
    public void requeue(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) return;
        pending.addAll(paths);
        rescheduleSync(debounce.getCurrentDebounceMs());
    }

    public FileWatcherStatusResponse getStatus() {
        FileWatcherStatusResponse resp = new FileWatcherStatusResponse();
        resp.setRunning(running);
        resp.setWatchDirectory(watchDirectory.toString());
        synchronized (scanLock) {
            resp.setTrackedFiles(fileState.size());
        }
        resp.setPendingChanges(pending.size());
        resp.setCurrentDebounceMs(debounce.getCurrentDebounceMs());
        resp.setChangesPerSecond(debounce.getChangesPerSecond());
        resp.setMinDebounceMs(debounce.getMinDebounceMs());
        resp.setMaxDebounceMs(debounce.getMaxDebounceMs());
        resp.setLastSyncAtMs(lastSyncAtMs > 0 ? lastSyncAtMs : null);
        return resp;
    }

    public Path getWatchDirectory() {
        return watchDirectory;
    }

    long getCurrentDebounceMs() {
        return debounce.getCurrentDebounceMs();
    }

    int getPendingCount() {
        return pending.size();
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Throwable t) {
            // 周期任务抛异常会被取消，这里必须兜住
            log.error("file watcher poll failed: dir={}, error={}", watchDirectory, t.getMessage(), t);
        }
    }

    void pollOnce() {
        if (!running) return;
        Set<String> changes;
        // 扫描和并入 pending 在同一把锁内完成，立即同步看到的 pending 总包含已扫描到的变更
        synchronized (scanLock) {
            changes = scanChangesLocked();
            pending.addAll(changes);
        }
        if (changes.isEmpty()) return;
        long delayMs = debounce.record(changes.size(), System.nanoTime());
        log.debug("detected {} changes, sync scheduled in {}ms: dir={}", changes.size(), delayMs, watchDirectory);
        rescheduleSync(delayMs);
    }

    private synchronized void rescheduleSync(long delayMs) {
        if (!running || scheduler == null) return;
        if (syncTimer != null) {
            syncTimer.cancel(false);
        }
        try {
            syncTimer = scheduler.schedule(this::fireDebounced, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("file watcher is stopping, sync not scheduled: dir={}", watchDirectory);
        }
    }

    private synchronized void cancelSyncTimer() {
        if (syncTimer != null) {
            syncTimer.cancel(false);
            syncTimer = null;
        }
    }

    private void fireDebounced() {
        ExecutorService d;
        synchronized (this) {
            syncTimer = null;
            if (!running) return;
            d = dispatcher;
        }
        try {
            d.execute(this::dispatchPending);
        } catch (RejectedExecutionException e) {
            log.debug("file watcher is stopping, pending changes kept: dir={}", watchDirectory);
        }
    }

    private void dispatchPending() {
        if (!running) return;
        synchronized (dispatchLock) {
            Set<String> batch = pending.drain();
            if (batch.isEmpty()) return;
            log.info("debounced sync: dir={}, changes={}, debounceMs={}",
                    watchDirectory, batch.size(), debounce.getCurrentDebounceMs());
            try {
                callback.onChanges(batch);
                lastSyncAtMs = System.currentTimeMillis();
            } catch (Exception e) {
                pending.addAll(batch);
                log.error("sync callback failed, {} changes re-queued: dir={}, error={}",
                        batch.size(), watchDirectory, e.getMessage(), e);
            }
        }
    }

    private Set<String> scanChangesLocked() {
        if (!Files.isDirectory(watchDirectory)) {
            log.warn("watch directory missing, scan skipped: dir={}", watchDirectory);
            return Collections.emptySet();
        }
        Map<String, Long> snapshot = new HashMap<>();
        Set<String> unreadable = new HashSet<>();
        try {
            Files.walkFileTree(watchDirectory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(watchDirectory)) return FileVisitResult.CONTINUE;
                    String rel = relativize(dir);
                    if (isSkipped(rel)) return FileVisitResult.SKIP_SUBTREE;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                    String rel = relativize(file);
                    if (isSkipped(rel)) return FileVisitResult.CONTINUE;
                    snapshot.put(rel, attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (!(exc instanceof NoSuchFileException)) {
                        unreadable.add(relativize(file));
                        log.debug("scan skipped unreadable path: {}, error={}", file, exc.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("workspace scan failed, keep previous state: dir={}, error={}", watchDirectory, e.getMessage());
            return Collections.emptySet();
        }
        return fileState.apply(snapshot, unreadable);
    }

    private boolean isSkipped(String rel) {
        return ignorePatterns.excludes(rel);
    }

    private String relativize(Path p) {
        return watchDirectory.relativize(p).toString().replace('\\', '/');
    }

    private void shutdownAndAwait(ExecutorService executor) {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(props.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("file watcher threads did not stop in time, interrupting: dir={}", watchDirectory);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonFactory(String threadName) {
        return r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        };
    }
}
