package fun.ai.sync.watcher;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdaptiveDebounce 单元测试
 */
class AdaptiveDebounceTest {
    private static final long SECOND = 1_000_000_000L;

    private static FileWatcherProperties props() {
        FileWatcherProperties p = new FileWatcherProperties();
        p.setMinDebounceMs(100);
        p.setMaxDebounceMs(1000);
        p.setBurstThreshold(10);
        return p;
    }

    @Test
    void testQuietChangesStayAtMinimum() {
        AdaptiveDebounce d = new AdaptiveDebounce(props(), 0L);
        assertEquals(100, d.record(3, 5 * SECOND));
        assertEquals(100, d.record(2, 7 * SECOND));
    }

    @Test
    void testBurstGrowsWithinOneSecondWindow() {
        AdaptiveDebounce d = new AdaptiveDebounce(props(), 0L);
        long t = 10 * SECOND;
        assertEquals(150, d.record(20, t));
        // 同一秒内累加：40 > 10
        assertEquals(225, d.record(20, t + SECOND / 2));
        assertEquals(40, d.getChangesPerSecond());

        // 超过 1 秒后计数重置，收缩
        assertEquals(203, d.record(1, t + 3 * SECOND));
        assertEquals(1, d.getChangesPerSecond());
    }

    @Test
    void testSmallChangesAccumulateIntoBurst() {
        AdaptiveDebounce d = new AdaptiveDebounce(props(), 0L);
        long t = 10 * SECOND;
        for (int i = 0; i < 10; i++) {
            d.record(1, t + i * 10_000_000L);
        }
        assertEquals(100, d.getCurrentDebounceMs());
        // 第 11 个变更越过阈值
        assertEquals(150, d.record(1, t + 200_000_000L));
    }

    @Test
    void testClampedToMaximumAndReset() {
        AdaptiveDebounce d = new AdaptiveDebounce(props(), 0L);
        long t = 10 * SECOND;
        for (int i = 0; i < 50; i++) {
            d.record(100, t + i);
        }
        assertEquals(1000, d.getCurrentDebounceMs());

        d.reset();
        assertEquals(100, d.getCurrentDebounceMs());
    }

    @Test
    void testAlwaysWithinBounds() {
        AdaptiveDebounce d = new AdaptiveDebounce(props(), 0L);
        Random random = new Random(42);
        long t = 0;
        for (int i = 0; i < 10_000; i++) {
            t += (long) (random.nextDouble() * 2 * SECOND);
            long v = d.record(random.nextInt(50), t);
            assertTrue(v >= 100 && v <= 1000, "debounce out of range: " + v);
        }
    }
}
