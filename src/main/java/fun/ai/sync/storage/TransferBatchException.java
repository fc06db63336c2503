package fun.ai.sync.storage;

import java.util.List;

/**
 * 目录级传输的聚合错误：部分文件失败时抛出，已成功的传输保持原样不回滚。
 * 每个失败原因以 suppressed 形式挂在本异常上。
 */
public class TransferBatchException extends WorkspaceStorageException {
    private final List<String> failedKeys;
    private final int totalCount;

    public TransferBatchException(String operation, List<String> failedKeys, int totalCount, List<Throwable> causes) {
        super(resolveType(causes),
                operation + " failed for " + failedKeys.size() + "/" + totalCount + " files: " + preview(failedKeys));
        this.failedKeys = List.copyOf(failedKeys);
        this.totalCount = totalCount;
        for (Throwable c : causes) {
            addSuppressed(c);
        }
    }

    public List<String> getFailedKeys() {
        return failedKeys;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public int getSucceededCount() {
        return totalCount - failedKeys.size();
    }

    // 所有失败同类时沿用该类型，否则按最严重的处理
    private static StorageErrorType resolveType(List<Throwable> causes) {
        StorageErrorType common = null;
        for (Throwable c : causes) {
            StorageErrorType t = WorkspaceStorageException.unwrap(c).getType();
            if (t.isFatal()) {
                return t;
            }
            if (common == null) {
                common = t;
            } else if (common != t) {
                common = StorageErrorType.UNKNOWN;
            }
        }
        return common == null ? StorageErrorType.UNKNOWN : common;
    }

    private static String preview(List<String> keys) {
        if (keys.size() <= 5) return keys.toString();
        return keys.subList(0, 5) + "...";
    }
}
