package fun.ai.sync.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.utils.AttributeMap;

import java.net.URI;

/**
 * 注册 S3 客户端与 workspace 存储实现。
 */
@Configuration
@ConditionalOnProperty(prefix = "funai.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class S3StorageConfig {
    private static final Logger log = LoggerFactory.getLogger(S3StorageConfig.class);

    @Bean(destroyMethod = "close")
    public S3Client workspaceS3Client(S3StorageProperties props) {
        // 连接池至少覆盖并发传输数，避免传输线程排队等连接
        int maxConnections = Math.max(50, props.getMaxConcurrentTransfers() * 2);
        AttributeMap.Builder httpOptions = AttributeMap.builder();
        if (!props.isVerifySsl()) {
            log.warn("s3 tls certificate verification disabled: endpoint={}", props.getEndpoint());
            httpOptions.put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, Boolean.TRUE);
        }
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(props.getRegion()))
                .credentialsProvider(credentials(props))
                .httpClient(ApacheHttpClient.builder()
                        .maxConnections(maxConnections)
                        .buildWithDefaults(httpOptions.build()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(props.isPathStyleAccess())
                        .build());
        String endpoint = props.resolveEndpoint();
        if (endpoint != null) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("s3 client created: bucket={}, region={}, endpoint={}, pathStyle={}",
                props.getBucket(), props.getRegion(), endpoint, props.isPathStyleAccess());
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3WorkspaceStorage workspaceStorage(S3Client workspaceS3Client, S3StorageProperties props) {
        return new S3WorkspaceStorage(workspaceS3Client, props);
    }

    private static AwsCredentialsProvider credentials(S3StorageProperties props) {
        if (StringUtils.hasText(props.getAccessKey()) && StringUtils.hasText(props.getSecretKey())) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(props.getAccessKey(), props.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
