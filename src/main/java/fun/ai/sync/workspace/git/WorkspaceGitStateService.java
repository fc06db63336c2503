package fun.ai.sync.workspace.git;

import fun.ai.sync.storage.WorkspaceStorage;
import fun.ai.sync.storage.WorkspaceStorageException;
import fun.ai.sync.workspace.CommandResult;
import fun.ai.sync.workspace.CommandRunner;
import fun.ai.sync.workspace.WorkspaceFileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Workspace 版本库状态的保存/恢复（调用系统 git 命令）。
 *
 * <p>保存：{@code git bundle create --all} 打成单个 bundle 上传；
 * 恢复：下载 bundle，init + fetch 全部 refs，指回原 HEAD 分支，再 {@code reset --mixed}
 * 让索引对齐 HEAD，工作区文件保持为已下载的版本。</p>
 *
 * <p>两个操作都是尽力而为：失败只记日志并返回 false，不影响同步主流程。</p>
 */
public class WorkspaceGitStateService {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceGitStateService.class);

    // 未注入时所有实例共用一个执行器
    private static final CommandRunner SHARED_RUNNER = new CommandRunner();

    private final CommandRunner commandRunner;
    private final Duration gitTimeout;

    /**
     * @param commandRunner 为 null 时使用进程内共享的执行器
     */
    public WorkspaceGitStateService(CommandRunner commandRunner, Duration gitTimeout) {
        this.commandRunner = commandRunner == null ? SHARED_RUNNER : commandRunner;
        this.gitTimeout = gitTimeout == null ? Duration.ofSeconds(120) : gitTimeout;
    }

    public CommandRunner getCommandRunner() {
        return commandRunner;
    }

    public static boolean isGitRepo(Path workspace) {
        return workspace != null && Files.isDirectory(workspace.resolve(".git"));
    }

    /**
     * 打包并上传版本库状态
     *
     * @return 已上传返回 true；非 git 仓库或失败返回 false
     */
    public boolean preserve(Path workspace, String bundleKey, WorkspaceStorage storage) {
        if (!isGitRepo(workspace)) {
            log.debug("not a git repo, skip preserve: {}", workspace);
            return false;
        }
        Path tmpDir = null;
        try {
            tmpDir = Files.createTempDirectory("workspace-git-");
            Path bundle = tmpDir.resolve("workspace.bundle");
            CommandResult res = runGit(workspace, "bundle", "create", bundle.toString(), "--all");
            if (!res.isSuccess() || !Files.isRegularFile(bundle)) {
                // 空仓库（没有任何提交）时 bundle create 也会失败
                log.warn("git bundle create failed: dir={}, exit={}, output={}",
                        workspace, res.getExitCode(), res.getOutput().trim());
                return false;
            }
            storage.uploadFile(bundle, bundleKey).join();
            log.info("git state preserved: dir={}, key={}", workspace, bundleKey);
            return true;
        } catch (Exception e) {
            WorkspaceStorageException wse = WorkspaceStorageException.unwrap(e);
            log.warn("preserve git state failed: dir={}, type={}, error={}", workspace, wse.getType(), wse.getMessage());
            return false;
        } finally {
            deleteQuietly(tmpDir);
        }
    }

    /**
     * 从远端 bundle 恢复版本库状态（本地已有 .git 时不覆盖）
     *
     * @return 已恢复返回 true
     */
    public boolean restore(Path workspace, String bundleKey, WorkspaceStorage storage) {
        if (isGitRepo(workspace)) {
            log.debug("git repo already present, skip restore: {}", workspace);
            return false;
        }
        Path tmpDir = null;
        try {
            Boolean exists = storage.exists(bundleKey).join();
            if (!Boolean.TRUE.equals(exists)) {
                log.debug("no git bundle stored: key={}", bundleKey);
                return false;
            }
            tmpDir = Files.createTempDirectory("workspace-git-");
            Path bundle = tmpDir.resolve("workspace.bundle");
            storage.downloadFile(bundleKey, bundle).join();

            CommandResult heads = runGit(workspace, "bundle", "list-heads", bundle.toString());
            if (!heads.isSuccess()) {
                log.warn("git bundle unreadable: key={}, output={}", bundleKey, heads.getOutput().trim());
                return false;
            }
            String headBranch = resolveHeadBranch(heads.getOutput());

            if (!runStep(workspace, "init", "-q")) return false;
            if (!runStep(workspace, "fetch", "-q", "--update-head-ok", bundle.toString(),
                    "+refs/heads/*:refs/heads/*", "+refs/tags/*:refs/tags/*")) {
                return false;
            }
            if (headBranch != null && !runStep(workspace, "symbolic-ref", "HEAD", headBranch)) {
                return false;
            }
            if (!runStep(workspace, "reset", "-q", "--mixed")) return false;

            log.info("git state restored: dir={}, head={}", workspace, headBranch);
            return true;
        } catch (Exception e) {
            WorkspaceStorageException wse = WorkspaceStorageException.unwrap(e);
            log.warn("restore git state failed: dir={}, type={}, error={}", workspace, wse.getType(), wse.getMessage());
            return false;
        } finally {
            deleteQuietly(tmpDir);
        }
    }

    /**
     * 从 {@code git bundle list-heads} 输出中找出 HEAD 指向的分支。
     * 多个分支同 sha 时优先 main / master；没有 HEAD 行时取第一个分支。
     */
    static String resolveHeadBranch(String listHeadsOutput) {
        if (listHeadsOutput == null) return null;
        String headSha = null;
        List<String[]> branches = new ArrayList<>();
        for (String line : listHeadsOutput.split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length != 2) continue;
            if ("HEAD".equals(parts[1])) {
                headSha = parts[0];
            } else if (parts[1].startsWith("refs/heads/")) {
                branches.add(parts);
            }
        }
        if (branches.isEmpty()) return null;
        if (headSha == null) return branches.get(0)[1];

        String match = null;
        for (String[] b : branches) {
            if (!b[0].equals(headSha)) continue;
            if (b[1].equals("refs/heads/main") || b[1].equals("refs/heads/master")) {
                return b[1];
            }
            if (match == null) match = b[1];
        }
        return match;
    }

    private boolean runStep(Path workDir, String... args) {
        CommandResult res = runGit(workDir, args);
        if (!res.isSuccess()) {
            log.warn("git {} failed: dir={}, exit={}, output={}", args[0], workDir, res.getExitCode(), res.getOutput().trim());
            return false;
        }
        return true;
    }

    private CommandResult runGit(Path workDir, String... args) {
        List<String> cmd = new ArrayList<>();
        cmd.add("git");
        for (String a : args) cmd.add(a);
        // 恢复时不能弹出交互式提示
        return commandRunner.run(gitTimeout, workDir, cmd, Map.of("GIT_TERMINAL_PROMPT", "0"));
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) return;
        try {
            WorkspaceFileUtils.deleteDirectoryRecursively(dir);
        } catch (IOException e) {
            log.warn("cleanup temp dir failed: {}, error={}", dir, e.getMessage());
        }
    }
}
