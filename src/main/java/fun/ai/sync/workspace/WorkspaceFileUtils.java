package fun.ai.sync.workspace;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 本地目录工具
 */
public final class WorkspaceFileUtils {
    private WorkspaceFileUtils() {}

    public static void deleteDirectoryRecursively(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir)) return;
        // 不吞异常：删除失败必须显式暴露；不跟随软链
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.deleteIfExists(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * 相对路径统一为 "/" 分隔
     */
    public static String toRelativeKey(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }
}
