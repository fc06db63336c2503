package fun.ai.sync.storage;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class TransferBatchExceptionTest {

    @Test
    void testFatalCauseWins() {
        TransferBatchException e = new TransferBatchException("upload", List.of("a", "b"), 5, List.of(
                new WorkspaceStorageException(StorageErrorType.TRANSIENT, "slow"),
                new WorkspaceStorageException(StorageErrorType.PERMISSION_DENIED, "denied")));
        assertEquals(StorageErrorType.PERMISSION_DENIED, e.getType());
        assertEquals(3, e.getSucceededCount());
        assertEquals(2, e.getSuppressed().length);
    }

    @Test
    void testSameTypeIsKeptMixedIsUnknown() {
        TransferBatchException same = new TransferBatchException("upload", List.of("a", "b"), 2, List.of(
                new WorkspaceStorageException(StorageErrorType.TRANSIENT, "1"),
                new WorkspaceStorageException(StorageErrorType.TRANSIENT, "2")));
        assertEquals(StorageErrorType.TRANSIENT, same.getType());
        assertTrue(same.getType().isRetryable());

        TransferBatchException mixed = new TransferBatchException("upload", List.of("a", "b"), 2, List.of(
                new WorkspaceStorageException(StorageErrorType.TRANSIENT, "1"),
                new WorkspaceStorageException(StorageErrorType.NOT_FOUND, "2")));
        assertEquals(StorageErrorType.UNKNOWN, mixed.getType());
    }

    @Test
    void testUnwrapStripsCompletionWrappers() {
        WorkspaceStorageException inner = new WorkspaceStorageException(StorageErrorType.NOT_FOUND, "x");
        assertSame(inner, WorkspaceStorageException.unwrap(new CompletionException(inner)));
        assertEquals(StorageErrorType.UNKNOWN,
                WorkspaceStorageException.unwrap(new CompletionException(new IllegalStateException("boom"))).getType());
    }
}
