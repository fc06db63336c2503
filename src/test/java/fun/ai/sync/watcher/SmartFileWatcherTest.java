package fun.ai.sync.watcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SmartFileWatcher 测试（真实临时目录）
 */
class SmartFileWatcherTest {

    @TempDir
    Path dir;

    private SmartFileWatcher watcher;

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop();
        }
    }

    /**
     * 轮询间隔足够长，只通过 triggerImmediateSync 驱动，避免后台扫描抢走变更
     */
    private static FileWatcherProperties manualProps() {
        FileWatcherProperties p = new FileWatcherProperties();
        p.setPollIntervalMs(60_000);
        p.setMinDebounceMs(50);
        p.setMaxDebounceMs(200);
        p.setStopTimeoutMs(5_000);
        return p;
    }

    private static FileWatcherProperties fastProps() {
        FileWatcherProperties p = new FileWatcherProperties();
        p.setPollIntervalMs(20);
        p.setMinDebounceMs(50);
        p.setMaxDebounceMs(200);
        p.setStopTimeoutMs(5_000);
        return p;
    }

    @Test
    void testDetectsCreateModifyDelete() throws Exception {
        Files.writeString(dir.resolve("main.py"), "print(1)");
        List<Set<String>> batches = new CopyOnWriteArrayList<>();
        watcher = new SmartFileWatcher(dir, batches::add, manualProps(), IgnorePatterns.defaults(), "t1");
        watcher.start();

        // 基线不触发回调
        assertTrue(watcher.triggerImmediateSync());
        assertTrue(batches.isEmpty());

        Files.createDirectories(dir.resolve("pkg"));
        Files.writeString(dir.resolve("pkg/util.py"), "x = 1");
        assertTrue(watcher.triggerImmediateSync());
        assertEquals(Set.of("pkg/util.py"), batches.get(0));

        Files.writeString(dir.resolve("main.py"), "print(2)");
        Files.setLastModifiedTime(dir.resolve("main.py"), FileTime.from(Instant.now().plusSeconds(10)));
        Files.delete(dir.resolve("pkg/util.py"));
        assertTrue(watcher.triggerImmediateSync());
        assertEquals(Set.of("main.py", "pkg/util.py"), batches.get(1));
        assertEquals(2, batches.size());
    }

    @Test
    void testIgnoredAndHiddenPathsAreNotReported() throws Exception {
        List<Set<String>> batches = new CopyOnWriteArrayList<>();
        watcher = new SmartFileWatcher(dir, batches::add, manualProps(), IgnorePatterns.defaults(), "t2");
        watcher.start();

        Files.createDirectories(dir.resolve("node_modules/react"));
        Files.writeString(dir.resolve("node_modules/react/index.js"), "x");
        Files.createDirectories(dir.resolve(".cache"));
        Files.writeString(dir.resolve(".cache/blob"), "x");
        Files.writeString(dir.resolve("module.pyc"), "x");
        Files.writeString(dir.resolve("app.py"), "x");

        watcher.triggerImmediateSync();

        assertEquals(1, batches.size());
        assertEquals(Set.of("app.py"), batches.get(0));
    }

    @Test
    void testFailedCallbackRequeuesChanges() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Set<String>> delivered = new CopyOnWriteArrayList<>();
        watcher = new SmartFileWatcher(dir, changed -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("storage down");
            }
            delivered.add(changed);
        }, manualProps(), IgnorePatterns.defaults(), "t3");
        watcher.start();

        Files.writeString(dir.resolve("a.txt"), "a");
        assertFalse(watcher.triggerImmediateSync());
        assertEquals(1, watcher.getPendingCount());
        assertTrue(watcher.isRunning());

        assertTrue(watcher.triggerImmediateSync());
        assertEquals(List.of(Set.of("a.txt")), delivered);
        assertEquals(0, watcher.getPendingCount());
    }

    @Test
    void testDebouncedSyncFiresAfterPolling() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        Set<String> seen = new HashSet<>();
        watcher = new SmartFileWatcher(dir, changed -> {
            synchronized (seen) {
                seen.addAll(changed);
                if (seen.contains("b.txt")) {
                    latch.countDown();
                }
            }
        }, fastProps(), IgnorePatterns.defaults(), "t4");
        watcher.start();

        Files.writeString(dir.resolve("b.txt"), "b");

        assertTrue(latch.await(5, TimeUnit.SECONDS), "debounced sync not triggered");
    }

    /**
     * 轮询与立即同步并发：立即同步返回时，写入在它之前的文件一定已交给回调，不会滞留在 pending 里等下一次防抖。
     */
    @Test
    void testConcurrentPollNeverStrandsChangesOutsideImmediateSync() throws Exception {
        FileWatcherProperties p = manualProps();
        // 防抖定时器在断言前不会触发
        p.setMinDebounceMs(10_000);
        p.setMaxDebounceMs(20_000);
        Set<String> delivered = ConcurrentHashMap.newKeySet();
        watcher = new SmartFileWatcher(dir, delivered::addAll, p, IgnorePatterns.defaults(), "t8");
        watcher.start();

        ExecutorService poller = Executors.newSingleThreadExecutor();
        try {
            for (int i = 0; i < 200; i++) {
                String name = "f" + i + ".txt";
                Files.writeString(dir.resolve(name), "x");
                CountDownLatch go = new CountDownLatch(1);
                Future<?> poll = poller.submit(() -> {
                    go.await();
                    watcher.pollOnce();
                    return null;
                });
                go.countDown();
                assertTrue(watcher.triggerImmediateSync());
                poll.get(5, TimeUnit.SECONDS);

                assertTrue(delivered.contains(name), "iteration " + i);
                assertEquals(0, watcher.getPendingCount(), "iteration " + i);
            }
        } finally {
            poller.shutdownNow();
        }
    }

    @Test
    void testStopIsIdempotentAndKeepsRemainingChanges() throws Exception {
        List<Set<String>> batches = new CopyOnWriteArrayList<>();
        watcher = new SmartFileWatcher(dir, batches::add, manualProps(), IgnorePatterns.defaults(), "t5");
        watcher.start();
        watcher.start();
        assertTrue(watcher.isRunning());

        watcher.stop();
        watcher.stop();
        assertFalse(watcher.isRunning());
        assertFalse(watcher.triggerImmediateSync());

        Files.writeString(dir.resolve("late.txt"), "late");
        assertEquals(Set.of("late.txt"), watcher.drainRemainingChanges());
        assertTrue(batches.isEmpty());
    }

    @Test
    void testRequeueWhileStoppedOnlyAccumulates() {
        watcher = new SmartFileWatcher(dir, changed -> { }, manualProps(), IgnorePatterns.defaults(), "t6");
        watcher.requeue(Set.of("x.txt"));
        assertEquals(1, watcher.getPendingCount());
        assertEquals(Set.of("x.txt"), watcher.drainRemainingChanges());
    }

    @Test
    void testStatus() throws Exception {
        Files.writeString(dir.resolve("a.txt"), "a");
        watcher = new SmartFileWatcher(dir, changed -> { }, manualProps(), IgnorePatterns.defaults(), "t7");
        watcher.start();

        var status = watcher.getStatus();
        assertTrue(status.isRunning());
        assertEquals(1, status.getTrackedFiles());
        assertEquals(0, status.getPendingChanges());
        assertEquals(50L, status.getCurrentDebounceMs());
        assertEquals(200L, status.getMaxDebounceMs());
    }
}
