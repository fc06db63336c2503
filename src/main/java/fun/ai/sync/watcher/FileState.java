package fun.ai.sync.watcher;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 已跟踪文件的 mtime 表（相对路径 -> 修改时间），仅由一个 watcher 持有，非线程安全。
 */
public class FileState {
    private final Map<String, Long> modifiedTimes = new HashMap<>();

    /**
     * 用一次扫描快照更新状态，并返回变化的路径：
     * 新出现的（创建）、mtime 变化的（修改）、快照中缺失的（删除）。
     *
     * @param snapshot   本次扫描到的 路径 -> mtime
     * @param unreadable 本次无法读取但仍存在的路径，保持原状态，不视为删除
     */
    public Set<String> apply(Map<String, Long> snapshot, Set<String> unreadable) {
        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, Long> e : snapshot.entrySet()) {
            Long previous = modifiedTimes.put(e.getKey(), e.getValue());
            if (previous == null || !previous.equals(e.getValue())) {
                changed.add(e.getKey());
            }
        }
        var it = modifiedTimes.keySet().iterator();
        while (it.hasNext()) {
            String path = it.next();
            if (snapshot.containsKey(path)) continue;
            if (unreadable != null && unreadable.contains(path)) continue;
            it.remove();
            changed.add(path);
        }
        return changed;
    }

    public Set<String> apply(Map<String, Long> snapshot) {
        return apply(snapshot, Collections.emptySet());
    }

    public boolean isTracked(String path) {
        return modifiedTimes.containsKey(path);
    }

    public Long getModifiedTime(String path) {
        return modifiedTimes.get(path);
    }

    public int size() {
        return modifiedTimes.size();
    }
}
