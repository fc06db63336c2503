package fun.ai.sync.service;

import fun.ai.sync.entity.response.WorkspaceSyncStatusResponse;

import java.util.List;

public interface FunAiWorkspaceSyncService {

    /**
     * 初始化会话 workspace：从对象存储恢复并开始同步。
     *
     * @param workspacePath 本地目录，为空时使用 {hostRoot}/{userId}/{conversationId}
     */
    WorkspaceSyncStatusResponse initialize(String userId, String conversationId, String workspacePath);

    /**
     * 立即同步（积压变更 + 全量上传）
     */
    boolean manualSync(String userId, String conversationId);

    /**
     * 会话结束：最终同步并释放监听资源
     */
    boolean cleanup(String userId, String conversationId);

    WorkspaceSyncStatusResponse getStatus(String userId, String conversationId);

    /**
     * 当前节点上所有会话的同步状态
     */
    List<WorkspaceSyncStatusResponse> listActive();
}
