package fun.ai.sync.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * 基于 S3（兼容 MinIO）的 workspace 存储实现。
 *
 * <p>S3Client 为阻塞 SDK：所有调用都派发到固定大小的传输线程池执行，
 * 线程池大小即最大并发传输数，大目录也不会打满连接。</p>
 */
public class S3WorkspaceStorage implements WorkspaceStorage, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(S3WorkspaceStorage.class);

    private static final Set<String> PERMISSION_CODES = Set.of(
            "AccessDenied", "InvalidAccessKeyId", "SignatureDoesNotMatch", "AllAccessDisabled");
    private static final Set<String> TRANSIENT_CODES = Set.of(
            "SlowDown", "RequestTimeout", "InternalError", "ServiceUnavailable", "RequestTimeTooSkewed");
    private static final Set<String> CONFIGURATION_CODES = Set.of(
            "NoSuchBucket", "PermanentRedirect", "AuthorizationHeaderMalformed", "InvalidBucketName");

    private final S3Client client;
    private final String bucket;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final int deleteBatchSize;
    private final ExecutorService transferPool;

    public S3WorkspaceStorage(S3Client client, S3StorageProperties props) {
        if (client == null) {
            throw new IllegalArgumentException("client 不能为空");
        }
        if (props == null || !StringUtils.hasText(props.getBucket())) {
            throw new WorkspaceStorageException(StorageErrorType.CONFIGURATION,
                    "S3 bucket 未配置（funai.sync.storage.bucket）");
        }
        this.client = client;
        this.bucket = props.getBucket();
        this.maxAttempts = Math.max(1, props.getMaxAttempts());
        this.retryBackoffMs = Math.max(0, props.getRetryBackoffMs());
        this.deleteBatchSize = Math.min(1000, Math.max(1, props.getDeleteBatchSize()));
        int poolSize = Math.max(1, props.getMaxConcurrentTransfers());
        AtomicInteger seq = new AtomicInteger();
        this.transferPool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "s3-transfer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String getBucket() {
        return bucket;
    }

    @Override
    public CompletableFuture<Void> uploadFile(Path localPath, String remotePath) {
        if (localPath == null || !Files.isRegularFile(localPath)) {
            return CompletableFuture.failedFuture(new WorkspaceStorageException(StorageErrorType.NOT_FOUND,
                    "本地文件不存在: " + localPath));
        }
        return submit("upload", remotePath, () -> {
            client.putObject(PutObjectRequest.builder().bucket(bucket).key(remotePath).build(),
                    RequestBody.fromFile(localPath));
            log.debug("uploaded file: local={}, key=s3://{}/{}", localPath, bucket, remotePath);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> downloadFile(String remotePath, Path localPath) {
        return submit("download", remotePath, () -> {
            ensureLocalDirectory(localPath);
            GetObjectRequest req = GetObjectRequest.builder().bucket(bucket).key(remotePath).build();
            try (ResponseInputStream<GetObjectResponse> in = client.getObject(req)) {
                Files.copy(in, localPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("downloaded file: key=s3://{}/{}, local={}", bucket, remotePath, localPath);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> uploadDirectory(Path localDir, String remoteDir, Predicate<String> include) {
        if (localDir == null || !Files.isDirectory(localDir)) {
            return CompletableFuture.failedFuture(new WorkspaceStorageException(StorageErrorType.NOT_FOUND,
                    "本地目录不存在: " + localDir));
        }
        Predicate<String> filter = include == null ? rel -> true : include;
        List<Path> files;
        try {
            files = collectFiles(localDir, filter);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new WorkspaceStorageException(StorageErrorType.UNKNOWN,
                    "遍历本地目录失败: " + localDir + ": " + e.getMessage(), e));
        }
        String base = trimTrailingSlash(remoteDir);
        AtomicInteger skipped = new AtomicInteger();
        Map<String, CompletableFuture<Void>> transfers = new LinkedHashMap<>();
        for (Path file : files) {
            String rel = relativeKey(localDir, file);
            String key = base.isEmpty() ? rel : base + "/" + rel;
            transfers.put(key, skipIfVanished(uploadFile(file, key), file, skipped));
        }
        return awaitAll("upload directory " + localDir, transfers)
                .thenRun(() -> log.info("uploaded directory: local={}, key=s3://{}/{}, files={}, vanished={}",
                        localDir, bucket, base, transfers.size() - skipped.get(), skipped.get()));
    }

    @Override
    public CompletableFuture<Void> downloadDirectory(String remoteDir, Path localDir) {
        try {
            Files.createDirectories(localDir);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new WorkspaceStorageException(StorageErrorType.UNKNOWN,
                    "创建本地目录失败: " + localDir + ": " + e.getMessage(), e));
        }
        String prefix = directoryPrefix(remoteDir);
        Path root = localDir.toAbsolutePath().normalize();
        return listFiles(remoteDir).thenCompose(keys -> {
            Map<String, CompletableFuture<Void>> transfers = new LinkedHashMap<>();
            for (String key : keys) {
                if (key.endsWith("/") || !key.startsWith(prefix)) {
                    continue;
                }
                Path target = root.resolve(key.substring(prefix.length())).normalize();
                // 防路径穿越：key 中带 ../ 时不允许写出目标目录
                if (!target.startsWith(root)) {
                    log.warn("skip remote key escaping local dir: key={}, localDir={}", key, root);
                    continue;
                }
                transfers.put(key, downloadFile(key, target));
            }
            if (transfers.isEmpty()) {
                log.debug("no files under s3://{}/{}", bucket, prefix);
            }
            return awaitAll("download directory " + remoteDir, transfers)
                    .thenRun(() -> log.info("downloaded directory: key=s3://{}/{}, local={}, files={}",
                            bucket, prefix, root, transfers.size()));
        });
    }

    @Override
    public CompletableFuture<Void> deleteFile(String remotePath) {
        CompletableFuture<Void> f = submit("delete", remotePath, () -> {
            client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(remotePath).build());
            log.debug("deleted file: key=s3://{}/{}", bucket, remotePath);
            return null;
        });
        return ignoreNotFound(f);
    }

    @Override
    public CompletableFuture<Void> deleteDirectory(String remoteDir) {
        return listFiles(remoteDir).thenCompose(keys -> {
            if (keys.isEmpty()) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            Map<String, CompletableFuture<List<String>>> batches = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i += deleteBatchSize) {
                List<String> batch = keys.subList(i, Math.min(keys.size(), i + deleteBatchSize));
                batches.put(batch.get(0), submit("delete batch", batch.get(0), () -> deleteBatch(batch)));
            }
            return CompletableFuture.allOf(batches.values().toArray(new CompletableFuture[0]))
                    .<Void>handle((ignored, ignoredError) -> {
                        List<String> failedKeys = new ArrayList<>();
                        List<Throwable> causes = new ArrayList<>();
                        for (var e : batches.entrySet()) {
                            CompletableFuture<List<String>> bf = e.getValue();
                            if (bf.isCompletedExceptionally()) {
                                failedKeys.add(e.getKey());
                                causes.add(causeOf(bf));
                            } else {
                                failedKeys.addAll(bf.join());
                            }
                        }
                        if (!failedKeys.isEmpty()) {
                            if (causes.isEmpty()) {
                                causes.add(new WorkspaceStorageException(StorageErrorType.UNKNOWN,
                                        "DeleteObjects reported per-key errors"));
                            }
                            throw new TransferBatchException("delete directory " + remoteDir,
                                    failedKeys, keys.size(), causes);
                        }
                        log.info("deleted directory: key=s3://{}/{}, files={}", bucket, remoteDir, keys.size());
                        return null;
                    });
        });
    }

    @Override
    public CompletableFuture<List<String>> listFiles(String prefix) {
        String normalized = directoryPrefix(prefix);
        return submit("list", normalized, () -> listAll(normalized));
    }

    @Override
    public CompletableFuture<Boolean> exists(String remotePath) {
        return submit("exists", remotePath, () -> {
            if (StringUtils.hasText(remotePath) && !remotePath.endsWith("/")) {
                try {
                    client.headObject(HeadObjectRequest.builder().bucket(bucket).key(remotePath).build());
                    return true;
                } catch (Exception e) {
                    WorkspaceStorageException wse = classify("exists", remotePath, e);
                    if (wse.getType() != StorageErrorType.NOT_FOUND) {
                        throw wse;
                    }
                }
            }
            // 虚拟目录：只要前缀下有任意对象即视为存在
            ListObjectsV2Response resp = client.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(directoryPrefix(remotePath))
                    .maxKeys(1)
                    .build());
            return !resp.contents().isEmpty();
        });
    }

    @Override
    public CompletableFuture<Optional<Long>> getFileSize(String remotePath) {
        CompletableFuture<Optional<Long>> f = submit("size", remotePath, () -> {
            HeadObjectResponse head = client.headObject(HeadObjectRequest.builder().bucket(bucket).key(remotePath).build());
            return Optional.ofNullable(head.contentLength());
        });
        return f.exceptionally(t -> {
            WorkspaceStorageException wse = WorkspaceStorageException.unwrap(t);
            if (wse.getType() == StorageErrorType.NOT_FOUND) {
                return Optional.empty();
            }
            throw wse;
        });
    }

    @Override
    public void close() {
        transferPool.shutdown();
        try {
            if (!transferPool.awaitTermination(10, TimeUnit.SECONDS)) {
                transferPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transferPool.shutdownNow();
        }
    }

    private List<String> listAll(String prefix) {
        List<String> keys = new ArrayList<>();
        String token = null;
        do {
            ListObjectsV2Request.Builder req = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
            if (token != null) {
                req.continuationToken(token);
            }
            ListObjectsV2Response resp = client.listObjectsV2(req.build());
            for (S3Object o : resp.contents()) {
                keys.add(o.key());
            }
            token = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken() : null;
        } while (token != null);
        return keys;
    }

    /**
     * @return DeleteObjects 响应中报告失败的 key
     */
    private List<String> deleteBatch(List<String> keys) {
        List<ObjectIdentifier> ids = new ArrayList<>(keys.size());
        for (String k : keys) {
            ids.add(ObjectIdentifier.builder().key(k).build());
        }
        DeleteObjectsResponse resp = client.deleteObjects(DeleteObjectsRequest.builder()
                .bucket(bucket)
                .delete(Delete.builder().objects(ids).quiet(true).build())
                .build());
        List<String> failed = new ArrayList<>();
        for (S3Error err : resp.errors()) {
            // 并发删除时对象已不存在不算失败
            if ("NoSuchKey".equals(err.code())) continue;
            log.warn("batch delete error: key={}, code={}, message={}", err.key(), err.code(), err.message());
            failed.add(err.key());
        }
        return failed;
    }

    private <T> CompletableFuture<T> submit(String op, String key, Callable<T> call) {
        try {
            return CompletableFuture.supplyAsync(() -> callWithRetry(op, key, call), transferPool);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new WorkspaceStorageException(StorageErrorType.CONFIGURATION,
                    "storage already closed: " + op + " " + key, e));
        }
    }

    private <T> T callWithRetry(String op, String key, Callable<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (Exception e) {
                WorkspaceStorageException wse = classify(op, key, e);
                if (!wse.getType().isRetryable() || attempt >= maxAttempts) {
                    throw wse;
                }
                log.warn("transient storage error, retrying: op={}, key={}, attempt={}/{}, error={}",
                        op, key, attempt, maxAttempts, e.getMessage());
                try {
                    Thread.sleep(retryBackoffMs * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw wse;
                }
            }
        }
    }

    /**
     * 将 SDK/IO 异常归类为 {@link StorageErrorType}。
     */
    static WorkspaceStorageException classify(String op, String key, Throwable e) {
        if (e instanceof WorkspaceStorageException wse) {
            return wse;
        }
        String what = op + " " + key;
        if (e instanceof NoSuchKeyException) {
            return new WorkspaceStorageException(StorageErrorType.NOT_FOUND, "对象不存在: " + key, e);
        }
        if (e instanceof NoSuchBucketException) {
            return new WorkspaceStorageException(StorageErrorType.CONFIGURATION, "bucket 不存在: " + what, e);
        }
        if (e instanceof S3Exception s3e) {
            int status = s3e.statusCode();
            AwsErrorDetails details = s3e.awsErrorDetails();
            String code = details == null ? null : details.errorCode();
            if (code != null && CONFIGURATION_CODES.contains(code)) {
                return new WorkspaceStorageException(StorageErrorType.CONFIGURATION, code + ": " + what, e);
            }
            if (status == 404 || "NoSuchKey".equals(code)) {
                return new WorkspaceStorageException(StorageErrorType.NOT_FOUND, "对象不存在: " + key, e);
            }
            if (status == 403 || (code != null && PERMISSION_CODES.contains(code))) {
                return new WorkspaceStorageException(StorageErrorType.PERMISSION_DENIED, "无权限访问: " + what, e);
            }
            if (status == 429 || status >= 500 || (code != null && TRANSIENT_CODES.contains(code))) {
                return new WorkspaceStorageException(StorageErrorType.TRANSIENT,
                        "storage unavailable (" + status + "): " + what, e);
            }
            return new WorkspaceStorageException(StorageErrorType.UNKNOWN,
                    "storage error (" + status + ", " + code + "): " + what, e);
        }
        if (hasCause(e, NoSuchFileException.class)) {
            return new WorkspaceStorageException(StorageErrorType.NOT_FOUND, "本地文件不存在: " + what, e);
        }
        if (e instanceof SdkClientException) {
            String msg = String.valueOf(e.getMessage()).toLowerCase();
            if (msg.contains("credentials") || msg.contains("region")) {
                return new WorkspaceStorageException(StorageErrorType.CONFIGURATION, e.getMessage(), e);
            }
            return new WorkspaceStorageException(StorageErrorType.TRANSIENT, "network error: " + what, e);
        }
        return new WorkspaceStorageException(StorageErrorType.UNKNOWN, what + ": " + e.getMessage(), e);
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        Throwable cur = e;
        int depth = 0;
        while (cur != null && depth++ < 10) {
            if (type.isInstance(cur)) return true;
            cur = cur.getCause();
        }
        return false;
    }

    private static CompletableFuture<Void> ignoreNotFound(CompletableFuture<Void> f) {
        return f.exceptionally(t -> {
            WorkspaceStorageException wse = WorkspaceStorageException.unwrap(t);
            if (wse.getType() == StorageErrorType.NOT_FOUND) {
                return null;
            }
            throw wse;
        });
    }

    private static CompletableFuture<Void> awaitAll(String operation, Map<String, CompletableFuture<Void>> transfers) {
        if (transfers.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(transfers.values().toArray(new CompletableFuture[0]))
                .handle((ignored, ignoredError) -> {
                    List<String> failedKeys = new ArrayList<>();
                    List<Throwable> causes = new ArrayList<>();
                    for (var e : transfers.entrySet()) {
                        if (e.getValue().isCompletedExceptionally()) {
                            failedKeys.add(e.getKey());
                            causes.add(causeOf(e.getValue()));
                        }
                    }
                    if (!failedKeys.isEmpty()) {
                        throw new TransferBatchException(operation, failedKeys, transfers.size(), causes);
                    }
                    return null;
                });
    }

    private static Throwable causeOf(CompletableFuture<?> f) {
        try {
            f.join();
            return null;
        } catch (Exception e) {
            return WorkspaceStorageException.unwrap(e);
        }
    }

    /**
     * 不跟随软链；遍历中消失的路径直接忽略，不可读的路径记日志后跳过。
     */
    private static List<Path> collectFiles(Path localDir, Predicate<String> include) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(localDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(localDir) || include.test(relativeKey(localDir, dir))) {
                    return FileVisitResult.CONTINUE;
                }
                return FileVisitResult.SKIP_SUBTREE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && include.test(relativeKey(localDir, file))) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                if (!(exc instanceof NoSuchFileException)) {
                    log.warn("skip unreadable local path: {}, error={}", file, exc.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    /**
     * 目录上传中本地文件在遍历后被删除：视为跳过，下一轮增量同步会把它作为删除处理。
     */
    private static CompletableFuture<Void> skipIfVanished(CompletableFuture<Void> upload, Path file, AtomicInteger skipped) {
        return upload.handle((v, t) -> {
            if (t == null) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            if (Files.notExists(file)) {
                skipped.incrementAndGet();
                log.debug("local file vanished during directory upload, skipped: {}", file);
                return CompletableFuture.<Void>completedFuture(null);
            }
            return CompletableFuture.<Void>failedFuture(t);
        }).thenCompose(f -> f);
    }

    private static String relativeKey(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        String out = s;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static String directoryPrefix(String s) {
        String trimmed = trimTrailingSlash(s);
        return trimmed.isEmpty() ? "" : trimmed + "/";
    }
}
