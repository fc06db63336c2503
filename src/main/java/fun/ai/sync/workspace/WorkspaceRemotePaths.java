package fun.ai.sync.workspace;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 远端对象 key 布局（每个会话独立前缀）：
 * <pre>
 * conversations/{userId}/{conversationId}/workspace/
 *   files/...                         工作区文件镜像
 *   compressed/backup-{ts}.tar.gz     压缩快照（UTC，yyyyMMdd_HHmmss）
 *   git/workspace.bundle              git 历史
 * </pre>
 */
public final class WorkspaceRemotePaths {
    public static final String ROOT = "conversations";
    public static final String BUNDLE_NAME = "workspace.bundle";

    private static final DateTimeFormatter BACKUP_TS =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final String userId;
    private final String conversationId;
    private final String base;

    public WorkspaceRemotePaths(String userId, String conversationId) {
        this.userId = validateId("userId", userId);
        this.conversationId = validateId("conversationId", conversationId);
        this.base = ROOT + "/" + this.userId + "/" + this.conversationId + "/workspace";
    }

    public String getUserId() {
        return userId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String base() {
        return base;
    }

    public String filesPrefix() {
        return base + "/files";
    }

    public String compressedPrefix() {
        return base + "/compressed";
    }

    public String gitPrefix() {
        return base + "/git";
    }

    public String bundleKey() {
        return gitPrefix() + "/" + BUNDLE_NAME;
    }

    public String backupKey(Instant at) {
        return compressedPrefix() + "/backup-" + BACKUP_TS.format(at) + ".tar.gz";
    }

    /**
     * 工作区相对路径 -> 文件对象 key
     */
    public String fileKey(String relativePath) {
        return filesPrefix() + "/" + normalizeRelativePath(relativePath);
    }

    /**
     * key 是否落在本会话前缀下
     */
    public boolean owns(String key) {
        return key != null && key.startsWith(base + "/");
    }

    /**
     * userId/conversationId 校验：非空，不含路径分隔符，不含 ".."
     */
    public static String validateId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " 不能为空");
        }
        String v = value.trim();
        if (v.contains("/") || v.contains("\\") || v.contains("..")) {
            throw new IllegalArgumentException(field + " 非法: " + value);
        }
        return v;
    }

    /**
     * 规范化相对路径（"/" 分隔），拒绝绝对路径和越界的 ".."
     */
    public static String normalizeRelativePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        String p = relativePath.replace('\\', '/');
        if (p.startsWith("/")) {
            throw new IllegalArgumentException("path 必须是相对路径: " + relativePath);
        }
        List<String> parts = new ArrayList<>();
        for (String seg : p.split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                throw new IllegalArgumentException("path 不能包含 ..: " + relativePath);
            }
            parts.add(seg);
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        return String.join("/", parts);
    }
}
