package fun.ai.sync.workspace;

import fun.ai.sync.watcher.IgnorePatterns;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 将 workspace 打包为 tar.gz 快照（相对路径写入；不跟随软链；跳过忽略规则命中的路径）。
 */
public class WorkspaceBackupArchiver {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceBackupArchiver.class);

    private final IgnorePatterns ignorePatterns;

    public WorkspaceBackupArchiver(IgnorePatterns ignorePatterns) {
        this.ignorePatterns = ignorePatterns == null ? IgnorePatterns.defaults() : ignorePatterns;
    }

    /**
     * @return 写入的文件条目数
     */
    public int archive(Path sourceDir, Path targetFile) throws IOException {
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new IOException("sourceDir 不存在或不是目录: " + sourceDir);
        }
        if (targetFile == null) {
            throw new IllegalArgumentException("targetFile 不能为空");
        }
        Path root = sourceDir.toAbsolutePath().normalize();
        Path target = targetFile.toAbsolutePath().normalize();
        int[] files = {0};
        try (OutputStream fo = Files.newOutputStream(target);
             BufferedOutputStream bo = new BufferedOutputStream(fo);
             GzipCompressorOutputStream gz = new GzipCompressorOutputStream(bo);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(gz)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    if (dir.equals(root)) return FileVisitResult.CONTINUE;
                    String rel = WorkspaceFileUtils.toRelativeKey(root, dir);
                    if (ignorePatterns.matches(rel)) return FileVisitResult.SKIP_SUBTREE;
                    TarArchiveEntry entry = new TarArchiveEntry(dir.toFile(), rel + "/");
                    tar.putArchiveEntry(entry);
                    tar.closeArchiveEntry();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    // 不跟随软链，避免越界
                    if (attrs.isSymbolicLink() || !attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                    if (file.equals(target)) return FileVisitResult.CONTINUE;
                    String rel = WorkspaceFileUtils.toRelativeKey(root, file);
                    if (ignorePatterns.matches(rel)) return FileVisitResult.CONTINUE;
                    TarArchiveEntry entry = new TarArchiveEntry(file.toFile(), rel);
                    tar.putArchiveEntry(entry);
                    Files.copy(file, tar);
                    tar.closeArchiveEntry();
                    files[0]++;
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("backup skipped unreadable path: {}, error={}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
            tar.finish();
        }
        return files[0];
    }
}
