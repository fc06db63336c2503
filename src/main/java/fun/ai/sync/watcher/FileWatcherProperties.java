package fun.ai.sync.watcher;

/**
 * 文件监听参数（funai.sync.watcher.*）
 */
public class FileWatcherProperties {

    /**
     * 最小防抖时间：空闲时变更最快多久同步一次
     */
    private long minDebounceMs = 2_000L;

    /**
     * 最大防抖时间：突发写入时最多推迟多久同步
     */
    private long maxDebounceMs = 30_000L;

    /**
     * 每秒变更数超过该阈值即视为突发（agent 批量改文件）
     */
    private int burstThreshold = 10;

    /**
     * 轮询间隔
     */
    private long pollIntervalMs = 500L;

    /**
     * 突发时防抖时间的放大倍数
     */
    private double growthFactor = 1.5d;

    /**
     * 空闲时防抖时间的收缩倍数
     */
    private double shrinkFactor = 0.9d;

    /**
     * stop() 等待轮询/同步线程退出的最长时间
     */
    private long stopTimeoutMs = 30_000L;

    public long getMinDebounceMs() {
        return minDebounceMs;
    }

    public void setMinDebounceMs(long minDebounceMs) {
        this.minDebounceMs = minDebounceMs;
    }

    public long getMaxDebounceMs() {
        return maxDebounceMs;
    }

    public void setMaxDebounceMs(long maxDebounceMs) {
        this.maxDebounceMs = maxDebounceMs;
    }

    public int getBurstThreshold() {
        return burstThreshold;
    }

    public void setBurstThreshold(int burstThreshold) {
        this.burstThreshold = burstThreshold;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public double getGrowthFactor() {
        return growthFactor;
    }

    public void setGrowthFactor(double growthFactor) {
        this.growthFactor = growthFactor;
    }

    public double getShrinkFactor() {
        return shrinkFactor;
    }

    public void setShrinkFactor(double shrinkFactor) {
        this.shrinkFactor = shrinkFactor;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }
}
