package fun.ai.sync.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JVM 关闭钩子：进程退出（SIGTERM / SIGINT / 正常退出）时对一个 workspace 做带超时的最终同步。
 */
public class WorkspaceShutdownHook {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceShutdownHook.class);

    private final WorkspaceManager manager;
    private final Duration timeout;
    private final Thread hookThread;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    public WorkspaceShutdownHook(WorkspaceManager manager, Duration timeout) {
        if (manager == null) throw new IllegalArgumentException("manager 不能为空");
        this.manager = manager;
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.hookThread = new Thread(this::run, "ws-shutdown-" + manager.getConversationId());
    }

    public void register() {
        if (!registered.compareAndSet(false, true)) return;
        Runtime.getRuntime().addShutdownHook(hookThread);
        log.debug("shutdown hook registered: conversationId={}", manager.getConversationId());
    }

    /**
     * 会话正常结束后移除钩子
     *
     * @return 成功移除返回 true；JVM 已在关闭中时返回 false
     */
    public boolean unregister() {
        if (!registered.compareAndSet(true, false)) return false;
        try {
            return Runtime.getRuntime().removeShutdownHook(hookThread);
        } catch (IllegalStateException e) {
            log.debug("jvm already shutting down, hook stays: conversationId={}", manager.getConversationId());
            return false;
        }
    }

    public boolean isRegistered() {
        return registered.get();
    }

    void run() {
        log.info("shutdown signal received, final sync: conversationId={}, timeoutMs={}",
                manager.getConversationId(), timeout.toMillis());
        boolean ok = manager.finalSync(timeout);
        if (!ok) {
            log.error("final sync on shutdown did not complete: conversationId={}", manager.getConversationId());
        }
    }
}
