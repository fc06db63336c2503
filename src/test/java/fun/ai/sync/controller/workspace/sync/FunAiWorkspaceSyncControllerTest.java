package fun.ai.sync.controller.workspace.sync;

import fun.ai.sync.common.GlobalExceptionHandler;
import fun.ai.sync.entity.response.WorkspaceSyncStatusResponse;
import fun.ai.sync.service.FunAiWorkspaceSyncService;
import fun.ai.sync.storage.StorageErrorType;
import fun.ai.sync.storage.WorkspaceStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * FunAiWorkspaceSyncController 测试（standalone MockMvc）
 */
class FunAiWorkspaceSyncControllerTest {

    private FunAiWorkspaceSyncService syncService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        syncService = mock(FunAiWorkspaceSyncService.class);
        mvc = MockMvcBuilders.standaloneSetup(new FunAiWorkspaceSyncController(syncService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testInitialize() throws Exception {
        WorkspaceSyncStatusResponse resp = new WorkspaceSyncStatusResponse();
        resp.setUserId("7");
        resp.setConversationId("c1");
        resp.setState("RUNNING");
        when(syncService.initialize(eq("7"), eq("c1"), isNull())).thenReturn(resp);

        mvc.perform(post("/api/fun-ai/workspace/sync/initialize").param("userId", "7").param("conversationId", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.state").value("RUNNING"))
                .andExpect(jsonPath("$.data.conversationId").value("c1"));
    }

    @Test
    void testManualSyncFailureIsReported() throws Exception {
        when(syncService.manualSync("7", "c1")).thenReturn(false);

        mvc.perform(post("/api/fun-ai/workspace/sync/manual-sync").param("userId", "7").param("conversationId", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(500));
    }

    @Test
    void testCleanup() throws Exception {
        when(syncService.cleanup("7", "c1")).thenReturn(true);

        mvc.perform(post("/api/fun-ai/workspace/sync/cleanup").param("userId", "7").param("conversationId", "c1"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    void testMissingParameter() throws Exception {
        mvc.perform(get("/api/fun-ai/workspace/sync/status").param("userId", "7"))
                .andExpect(jsonPath("$.code").value(400));
        verifyNoInteractions(syncService);
    }

    @Test
    void testUnknownWorkspace() throws Exception {
        when(syncService.getStatus("7", "c9")).thenThrow(new IllegalArgumentException("workspace 未初始化"));

        mvc.perform(get("/api/fun-ai/workspace/sync/status").param("userId", "7").param("conversationId", "c9"))
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("workspace 未初始化"));
    }

    @Test
    void testStorageErrorMapsToCode() throws Exception {
        when(syncService.initialize(eq("7"), eq("c1"), isNull()))
                .thenThrow(new WorkspaceStorageException(StorageErrorType.PERMISSION_DENIED, "denied"));

        mvc.perform(post("/api/fun-ai/workspace/sync/initialize").param("userId", "7").param("conversationId", "c1"))
                .andExpect(jsonPath("$.code").value(403));
    }

    @Test
    void testActive() throws Exception {
        WorkspaceSyncStatusResponse a = new WorkspaceSyncStatusResponse();
        a.setConversationId("c1");
        when(syncService.listActive()).thenReturn(List.of(a));

        mvc.perform(get("/api/fun-ai/workspace/sync/active"))
                .andExpect(jsonPath("$.data[0].conversationId").value("c1"));
    }
}
