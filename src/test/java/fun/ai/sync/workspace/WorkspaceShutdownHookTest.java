package fun.ai.sync.workspace;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkspaceShutdownHookTest {

    @Test
    void testRunDelegatesToBoundedFinalSync() {
        WorkspaceManager manager = mock(WorkspaceManager.class);
        when(manager.getConversationId()).thenReturn("c1");
        when(manager.finalSync(any(Duration.class))).thenReturn(true);

        WorkspaceShutdownHook hook = new WorkspaceShutdownHook(manager, Duration.ofSeconds(7));
        hook.run();

        verify(manager).finalSync(Duration.ofSeconds(7));
    }

    @Test
    void testRegisterIsIdempotent() {
        WorkspaceManager manager = new WorkspaceManager(new InMemoryWorkspaceStorage(), "c1", "u1", Path.of("unused"));
        WorkspaceShutdownHook hook = new WorkspaceShutdownHook(manager, null);

        assertFalse(hook.unregister());
        hook.register();
        hook.register();
        assertTrue(hook.isRegistered());
        assertTrue(hook.unregister());
        assertFalse(hook.isRegistered());
    }
}
