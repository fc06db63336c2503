package fun.ai.sync.workspace;

/**
 * WorkspaceManager 生命周期：
 * UNINITIALIZED -> INITIALIZING -> RUNNING -> SHUTTING_DOWN -> STOPPED
 */
public enum WorkspaceState {
    UNINITIALIZED,
    INITIALIZING,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
