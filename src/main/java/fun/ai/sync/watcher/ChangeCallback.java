package fun.ai.sync.watcher;

import java.util.Set;

/**
 * 一批变更稳定后的回调；抛出异常时这批路径会被放回待同步集合。
 */
@FunctionalInterface
public interface ChangeCallback {

    void onChanges(Set<String> changedPaths) throws Exception;
}
