package fun.ai.sync.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 轻量命令执行器（用于调用 git 等外部命令）
 */
@Component
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    // Small, shared pool for reading process output without blocking caller threads.
    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cmd-io");
        t.setDaemon(true);
        return t;
    });

    public CommandResult run(Duration timeout, Path workDir, String... args) {
        return run(timeout, workDir, Arrays.asList(args), Map.of());
    }

    /**
     * @param workDir 工作目录，为 null 时继承当前进程
     * @param env     额外环境变量
     */
    public CommandResult run(Duration timeout, Path workDir, List<String> command, Map<String, String> env) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command 不能为空");
        }
        List<String> cmd = new ArrayList<>(command);
        try {
            ProcessBuilder pb = new ProcessBuilder(cmd);
            if (workDir != null) {
                pb.directory(workDir.toFile());
            }
            if (env != null && !env.isEmpty()) {
                pb.environment().putAll(env);
            }
            pb.redirectErrorStream(true);
            Process p = pb.start();
            p.getOutputStream().close();

            StringBuilder out = new StringBuilder();
            CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
                try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = r.readLine()) != null) {
                        // Hard cap to keep payloads bounded (we only need last error context).
                        synchronized (out) {
                            if (out.length() < 32_000) {
                                out.append(line).append('\n');
                            }
                        }
                    }
                } catch (Exception e) {
                    log.debug("read command output interrupted: cmd={}, error={}", cmd, e.getMessage());
                }
            }, ioPool);

            long ms = timeout == null ? 0 : timeout.toMillis();
            boolean finished;
            if (ms <= 0) {
                p.waitFor();
                finished = true;
            } else {
                finished = p.waitFor(ms, TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                p.destroyForcibly();
                p.waitFor(200, TimeUnit.MILLISECONDS);
                awaitReader(reader, 200, cmd);
                log.warn("command timeout: cmd={}, timeoutMs={}", cmd, ms);
                return new CommandResult(CommandResult.TIMEOUT_EXIT_CODE, snapshot(out) + "\n[timeout]");
            }

            // Give the reader a short window to finish draining output after process exit.
            awaitReader(reader, 500, cmd);
            return new CommandResult(p.exitValue(), snapshot(out));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("run command interrupted: cmd={}", cmd);
            return new CommandResult(1, "run command interrupted");
        } catch (Exception e) {
            log.error("run command failed: cmd={}, error={}", cmd, e.getMessage(), e);
            return new CommandResult(1, "run command failed: " + e.getMessage());
        }
    }

    private static void awaitReader(CompletableFuture<Void> reader, long ms, List<String> cmd) {
        try {
            reader.get(ms, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.debug("command output not fully drained: cmd={}, error={}", cmd, e.toString());
        }
    }

    private static String snapshot(StringBuilder out) {
        synchronized (out) {
            return out.toString();
        }
    }
}
