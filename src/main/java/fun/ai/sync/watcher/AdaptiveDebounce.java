package fun.ai.sync.watcher;

/**
 * 自适应防抖：按变更速率在 [min, max] 区间内放大/收缩防抖时间。
 *
 * <p>速率统计采用“1 秒内累加、超过 1 秒重置”的计数方式。</p>
 */
public class AdaptiveDebounce {
    private static final long ONE_SECOND_NS = 1_000_000_000L;

    private final long minDebounceMs;
    private final long maxDebounceMs;
    private final int burstThreshold;
    private final double growthFactor;
    private final double shrinkFactor;

    private double currentDebounceMs;
    private int changesPerSecond;
    private long lastChangeNs;

    public AdaptiveDebounce(FileWatcherProperties props, long startNs) {
        long min = Math.max(0L, props.getMinDebounceMs());
        this.minDebounceMs = min;
        this.maxDebounceMs = Math.max(min, props.getMaxDebounceMs());
        this.burstThreshold = props.getBurstThreshold();
        this.growthFactor = Math.max(1.0d, props.getGrowthFactor());
        this.shrinkFactor = Math.min(1.0d, Math.max(0.0d, props.getShrinkFactor()));
        this.currentDebounceMs = min;
        this.lastChangeNs = startNs;
    }

    /**
     * 记录一次扫描发现的变更数，返回调整后的防抖时间（毫秒）。
     */
    public synchronized long record(int numChanges, long nowNs) {
        if (nowNs - lastChangeNs < ONE_SECOND_NS) {
            changesPerSecond += numChanges;
        } else {
            changesPerSecond = numChanges;
        }
        lastChangeNs = nowNs;

        if (changesPerSecond > burstThreshold) {
            currentDebounceMs = Math.min(currentDebounceMs * growthFactor, maxDebounceMs);
        } else {
            currentDebounceMs = Math.max(currentDebounceMs * shrinkFactor, minDebounceMs);
        }
        return getCurrentDebounceMs();
    }

    public synchronized void reset() {
        currentDebounceMs = minDebounceMs;
    }

    public synchronized long getCurrentDebounceMs() {
        return Math.round(Math.max(minDebounceMs, Math.min(maxDebounceMs, currentDebounceMs)));
    }

    public synchronized int getChangesPerSecond() {
        return changesPerSecond;
    }

    public synchronized long getLastChangeNs() {
        return lastChangeNs;
    }

    public long getMinDebounceMs() {
        return minDebounceMs;
    }

    public long getMaxDebounceMs() {
        return maxDebounceMs;
    }
}
