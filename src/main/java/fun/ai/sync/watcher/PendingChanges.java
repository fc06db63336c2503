package fun.ai.sync.watcher;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 两次同步之间累积的变更路径。drain() 原子地整体取走，回调失败时由调用方 addAll 放回。
 */
public class PendingChanges {
    private Set<String> paths = new LinkedHashSet<>();

    public synchronized void addAll(Collection<String> changed) {
        if (changed == null || changed.isEmpty()) return;
        paths.addAll(changed);
    }

    public synchronized Set<String> drain() {
        Set<String> out = paths;
        paths = new LinkedHashSet<>();
        return out;
    }

    public synchronized int size() {
        return paths.size();
    }

    public synchronized boolean isEmpty() {
        return paths.isEmpty();
    }
}
