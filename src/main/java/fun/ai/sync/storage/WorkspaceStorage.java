package fun.ai.sync.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * 远端对象存储能力契约（S3/MinIO 等）。
 *
 * <p>所有操作均为异步：返回的 future 以 {@link WorkspaceStorageException} 异常完成表示失败。</p>
 * <ul>
 *     <li>远端路径为不带 bucket 的 key，以 "/" 分隔</li>
 *     <li>delete 幂等：目标不存在不算错误</li>
 *     <li>exists 把 "key/" 前缀下存在对象的情况视为虚拟目录存在</li>
 * </ul>
 */
public interface WorkspaceStorage {

    /**
     * 上传单个文件；本地文件不存在时以 NOT_FOUND 失败。
     */
    CompletableFuture<Void> uploadFile(Path localPath, String remotePath);

    /**
     * 下载单个文件，自动创建父目录；远端不存在以 NOT_FOUND 失败，鉴权失败以 PERMISSION_DENIED 失败。
     */
    CompletableFuture<Void> downloadFile(String remotePath, Path localPath);

    /**
     * 递归上传目录下所有文件。
     */
    default CompletableFuture<Void> uploadDirectory(Path localDir, String remoteDir) {
        return uploadDirectory(localDir, remoteDir, rel -> true);
    }

    /**
     * 递归上传目录；部分失败时以 {@link TransferBatchException} 失败，已成功的文件保留。
     * 遍历期间消失或不可读的本地路径跳过，不算失败。
     *
     * @param include 相对 localDir 的路径（"/" 分隔）过滤；目录不通过时整棵子树跳过
     */
    CompletableFuture<Void> uploadDirectory(Path localDir, String remoteDir, Predicate<String> include);

    /**
     * 递归下载目录；部分失败时以 {@link TransferBatchException} 失败，已成功的文件保留。
     */
    CompletableFuture<Void> downloadDirectory(String remoteDir, Path localDir);

    CompletableFuture<Void> deleteFile(String remotePath);

    CompletableFuture<Void> deleteDirectory(String remoteDir);

    /**
     * 列出前缀下所有 key（透明分页）。
     */
    CompletableFuture<List<String>> listFiles(String prefix);

    CompletableFuture<Boolean> exists(String remotePath);

    /**
     * @return 文件字节数；不存在时为 empty
     */
    CompletableFuture<Optional<Long>> getFileSize(String remotePath);

    /**
     * 确保本地文件的父目录存在。
     */
    default void ensureLocalDirectory(Path localPath) throws IOException {
        Path parent = localPath == null ? null : localPath.toAbsolutePath().getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
