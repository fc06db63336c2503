package fun.ai.sync.workspace.git;

import fun.ai.sync.storage.StorageErrorType;
import fun.ai.sync.storage.WorkspaceStorage;
import fun.ai.sync.storage.WorkspaceStorageException;
import fun.ai.sync.workspace.CommandResult;
import fun.ai.sync.workspace.CommandRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * WorkspaceGitStateService 测试：解析逻辑为纯单元测试，bundle 往返依赖本机 git
 */
class WorkspaceGitStateServiceTest {

    @TempDir
    Path tmp;

    private final CommandRunner runner = new CommandRunner();
    private final WorkspaceGitStateService service = new WorkspaceGitStateService(runner, Duration.ofSeconds(60));

    @Test
    void testResolveHeadBranch() {
        String out = "1111 refs/heads/feature\n2222 refs/heads/main\n2222 refs/heads/other\n2222 HEAD\n";
        assertEquals("refs/heads/main", WorkspaceGitStateService.resolveHeadBranch(out));

        out = "1111 refs/heads/feature\n3333 refs/heads/dev\n3333 HEAD\n";
        assertEquals("refs/heads/dev", WorkspaceGitStateService.resolveHeadBranch(out));

        out = "1111 refs/heads/feature\n";
        assertEquals("refs/heads/feature", WorkspaceGitStateService.resolveHeadBranch(out));

        assertNull(WorkspaceGitStateService.resolveHeadBranch("4444 refs/tags/v1\n"));
        assertNull(WorkspaceGitStateService.resolveHeadBranch(null));
    }

    @Test
    void testPreserveSkipsNonRepository() {
        WorkspaceStorage storage = mock(WorkspaceStorage.class);
        assertFalse(service.preserve(tmp, "k/workspace.bundle", storage));
        verifyNoInteractions(storage);
    }

    @Test
    void testRestoreWithoutBundleDoesNothing() {
        WorkspaceStorage storage = mock(WorkspaceStorage.class);
        when(storage.exists(anyString())).thenReturn(CompletableFuture.completedFuture(false));

        assertFalse(service.restore(tmp, "k/workspace.bundle", storage));
        assertFalse(Files.exists(tmp.resolve(".git")));
        verify(storage, never()).downloadFile(anyString(), any(Path.class));
    }

    @Test
    void testRestoreStorageFailureIsNotFatal() {
        WorkspaceStorage storage = mock(WorkspaceStorage.class);
        when(storage.exists(anyString())).thenReturn(CompletableFuture.failedFuture(
                new WorkspaceStorageException(StorageErrorType.TRANSIENT, "down")));

        assertFalse(service.restore(tmp, "k/workspace.bundle", storage));
    }

    @Test
    void testBundleRoundTripRestoresHistoryAndKeepsWorkingTree() throws Exception {
        assumeTrue(gitAvailable(), "git not installed");
        Path src = Files.createDirectories(tmp.resolve("src"));
        git(src, "init", "-q");
        git(src, "symbolic-ref", "HEAD", "refs/heads/work");
        Files.writeString(src.resolve("main.py"), "print(1)");
        git(src, "add", "main.py");
        git(src, "-c", "user.name=t", "-c", "user.email=t@example.com", "commit", "-q", "-m", "first");

        Map<String, Path> objects = new ConcurrentHashMap<>();
        WorkspaceStorage storage = fileBackedStorage(objects);

        assertTrue(service.preserve(src, "k/workspace.bundle", storage));
        assertTrue(objects.containsKey("k/workspace.bundle"));

        // 新环境：文件已经由文件同步恢复，且包含未提交的修改
        Path dst = Files.createDirectories(tmp.resolve("dst"));
        Files.writeString(dst.resolve("main.py"), "print(2)");

        assertTrue(service.restore(dst, "k/workspace.bundle", storage));

        assertEquals("work", git(dst, "rev-parse", "--abbrev-ref", "HEAD").getOutput().trim());
        assertEquals("first", git(dst, "log", "-1", "--format=%s").getOutput().trim());
        assertEquals("print(2)", Files.readString(dst.resolve("main.py")));
        assertTrue(git(dst, "status", "--porcelain").getOutput().contains("main.py"));

        // 已是仓库时不覆盖
        assertFalse(service.restore(dst, "k/workspace.bundle", storage));
    }

    private WorkspaceStorage fileBackedStorage(Map<String, Path> objects) throws Exception {
        Path store = Files.createDirectories(tmp.resolve("store"));
        WorkspaceStorage storage = mock(WorkspaceStorage.class);
        when(storage.uploadFile(any(Path.class), anyString())).thenAnswer(inv -> {
            Path local = inv.getArgument(0);
            String key = inv.getArgument(1);
            Path copy = store.resolve(key.replace('/', '_'));
            Files.copy(local, copy);
            objects.put(key, copy);
            return CompletableFuture.completedFuture(null);
        });
        when(storage.exists(anyString())).thenAnswer(inv ->
                CompletableFuture.completedFuture(objects.containsKey(inv.<String>getArgument(0))));
        when(storage.downloadFile(anyString(), any(Path.class))).thenAnswer(inv -> {
            Path target = inv.getArgument(1);
            Files.copy(objects.get(inv.<String>getArgument(0)), target);
            return CompletableFuture.completedFuture(null);
        });
        return storage;
    }

    private boolean gitAvailable() {
        return runner.run(Duration.ofSeconds(10), tmp, "git", "--version").isSuccess();
    }

    private CommandResult git(Path dir, String... args) {
        String[] cmd = new String[args.length + 1];
        cmd[0] = "git";
        System.arraycopy(args, 0, cmd, 1, args.length);
        CommandResult res = runner.run(Duration.ofSeconds(60), dir, cmd);
        assertTrue(res.isSuccess(), "git " + String.join(" ", args) + " failed: " + res.getOutput());
        return res;
    }
}
