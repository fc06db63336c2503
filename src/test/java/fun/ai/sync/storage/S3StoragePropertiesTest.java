package fun.ai.sync.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class S3StoragePropertiesTest {

    @Test
    void testResolveEndpointFollowsSecureFlag() {
        S3StorageProperties props = new S3StorageProperties();
        props.setEndpoint("minio.local:9000");
        assertEquals("https://minio.local:9000", props.resolveEndpoint());

        props.setSecure(false);
        assertEquals("http://minio.local:9000", props.resolveEndpoint());

        props.setEndpoint("https://minio.local:9000");
        assertEquals("http://minio.local:9000", props.resolveEndpoint());
    }

    @Test
    void testBlankEndpointMeansDefaultAws() {
        S3StorageProperties props = new S3StorageProperties();
        assertNull(props.resolveEndpoint());
        props.setEndpoint("  ");
        assertNull(props.resolveEndpoint());
    }
}
