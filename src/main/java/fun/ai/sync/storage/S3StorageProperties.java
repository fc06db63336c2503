package fun.ai.sync.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 对象存储（S3/MinIO）连接配置
 */
@Component
@ConfigurationProperties(prefix = "funai.sync.storage")
public class S3StorageProperties {

    /**
     * bucket 名称（必填）
     */
    private String bucket;

    /**
     * 自定义 endpoint（MinIO/兼容 S3 的存储），为空则使用 AWS 默认 endpoint
     */
    private String endpoint;

    private String region = "us-east-1";

    /**
     * 访问凭证；不配置则走 AWS 默认凭证链（环境变量/实例角色等）
     */
    private String accessKey;
    private String secretKey;

    /**
     * 是否使用 https 访问 endpoint
     */
    private boolean secure = true;

    /**
     * 是否校验证书（自签证书的 MinIO 可关闭）
     */
    private boolean verifySsl = true;

    /**
     * MinIO 通常需要 path-style 访问
     */
    private boolean pathStyleAccess = true;

    /**
     * 最大并发传输数：限制连接数，避免大目录打满连接池
     */
    private int maxConcurrentTransfers = 10;

    /**
     * TRANSIENT 错误的最大尝试次数（含首次）
     */
    private int maxAttempts = 3;

    private long retryBackoffMs = 200;

    /**
     * 批量删除每次请求的 key 数量（S3 上限 1000）
     */
    private int deleteBatchSize = 1000;

    /**
     * 按 secure 开关补全/纠正 endpoint 的 scheme。
     */
    public String resolveEndpoint() {
        if (!StringUtils.hasText(endpoint)) return null;
        String url = endpoint.trim();
        if (secure) {
            if (!url.startsWith("https://")) {
                url = "https://" + stripPrefix(url, "http://");
            }
        } else {
            if (!url.startsWith("http://")) {
                url = "http://" + stripPrefix(url, "https://");
            }
        }
        return url;
    }

    private static String stripPrefix(String s, String prefix) {
        return s.startsWith(prefix) ? s.substring(prefix.length()) : s;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public boolean isSecure() {
        return secure;
    }

    public void setSecure(boolean secure) {
        this.secure = secure;
    }

    public boolean isVerifySsl() {
        return verifySsl;
    }

    public void setVerifySsl(boolean verifySsl) {
        this.verifySsl = verifySsl;
    }

    public boolean isPathStyleAccess() {
        return pathStyleAccess;
    }

    public void setPathStyleAccess(boolean pathStyleAccess) {
        this.pathStyleAccess = pathStyleAccess;
    }

    public int getMaxConcurrentTransfers() {
        return maxConcurrentTransfers;
    }

    public void setMaxConcurrentTransfers(int maxConcurrentTransfers) {
        this.maxConcurrentTransfers = maxConcurrentTransfers;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }

    public int getDeleteBatchSize() {
        return deleteBatchSize;
    }

    public void setDeleteBatchSize(int deleteBatchSize) {
        this.deleteBatchSize = deleteBatchSize;
    }
}
