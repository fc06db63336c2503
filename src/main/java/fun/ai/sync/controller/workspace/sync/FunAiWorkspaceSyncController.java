package fun.ai.sync.controller.workspace.sync;

import fun.ai.sync.common.Result;
import fun.ai.sync.entity.response.WorkspaceSyncStatusResponse;
import fun.ai.sync.service.FunAiWorkspaceSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Workspace 同步接口：会话开始/结束、手动同步、状态查询
 */
@RestController
@RequestMapping("/api/fun-ai/workspace/sync")
@Tag(name = "Fun AI Workspace 同步", description = "会话 workspace 与对象存储之间的同步：initialize/manual-sync/cleanup/status")
public class FunAiWorkspaceSyncController {
    private static final Logger log = LoggerFactory.getLogger(FunAiWorkspaceSyncController.class);

    private final FunAiWorkspaceSyncService syncService;

    public FunAiWorkspaceSyncController(FunAiWorkspaceSyncService syncService) {
        this.syncService = syncService;
    }

    @PostMapping("/initialize")
    @Operation(summary = "初始化会话 workspace", description = "从对象存储恢复文件和 git 状态，并开始监听同步；重复调用不会重复下载")
    public Result<WorkspaceSyncStatusResponse> initialize(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "会话ID", required = true) @RequestParam String conversationId,
            @Parameter(description = "本地目录（可选，默认 {hostRoot}/{userId}/{conversationId}）") @RequestParam(required = false) String workspacePath
    ) {
        log.info("initialize workspace sync: userId={}, conversationId={}", userId, conversationId);
        return Result.success(syncService.initialize(userId, conversationId, workspacePath));
    }

    @PostMapping("/manual-sync")
    @Operation(summary = "立即同步", description = "先推送积压的增量变更，再全量上传 workspace 目录")
    public Result<Boolean> manualSync(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "会话ID", required = true) @RequestParam String conversationId
    ) {
        boolean ok = syncService.manualSync(userId, conversationId);
        return ok ? Result.success(true) : Result.error("同步失败或 workspace 未在运行");
    }

    @PostMapping("/cleanup")
    @Operation(summary = "结束会话", description = "保存 git 状态、压缩备份、全量上传后停止监听")
    public Result<Boolean> cleanup(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "会话ID", required = true) @RequestParam String conversationId
    ) {
        boolean ok = syncService.cleanup(userId, conversationId);
        return ok ? Result.success(true) : Result.error("最终同步未完成，已尝试紧急备份");
    }

    @GetMapping("/status")
    @Operation(summary = "查询同步状态", description = "状态值：UNINITIALIZED / INITIALIZING / RUNNING / SHUTTING_DOWN / STOPPED")
    public Result<WorkspaceSyncStatusResponse> status(
            @Parameter(description = "用户ID", required = true) @RequestParam String userId,
            @Parameter(description = "会话ID", required = true) @RequestParam String conversationId
    ) {
        return Result.success(syncService.getStatus(userId, conversationId));
    }

    @GetMapping("/active")
    @Operation(summary = "当前节点上的活跃会话")
    public Result<List<WorkspaceSyncStatusResponse>> active() {
        return Result.success(syncService.listActive());
    }
}
