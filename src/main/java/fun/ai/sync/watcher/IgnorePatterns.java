package fun.ai.sync.watcher;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 忽略规则：同时用于文件监听和压缩备份。
 *
 * <p>规则写法（相对路径统一用 "/" 分隔）：</p>
 * <ul>
 *     <li>{@code *.pyc} / {@code *~}：文件名后缀匹配</li>
 *     <li>{@code .~lock.*}：文件名前缀匹配</li>
 *     <li>{@code .git/objects}：含 "/" 时按连续路径段匹配（任意深度）</li>
 *     <li>{@code node_modules}：任一路径段等于该名字即命中</li>
 * </ul>
 */
public final class IgnorePatterns {

    public static final List<String> DEFAULTS = List.of(
            "node_modules",
            "__pycache__",
            ".pytest_cache",
            ".git/objects",
            ".git/refs",
            ".git/logs",
            ".git/index.lock",
            ".vscode",
            ".idea",
            ".DS_Store",
            ".~lock.*",
            "*.pyc",
            "*.pyo",
            "*.tmp",
            "*.swp",
            "*.swo",
            "*~"
    );

    private final List<String> patterns;

    public IgnorePatterns(Collection<String> patterns) {
        List<String> cleaned = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                if (p == null || p.isBlank()) continue;
                cleaned.add(trimSlashes(p.trim().replace('\\', '/')));
            }
        }
        this.patterns = List.copyOf(cleaned);
    }

    public static IgnorePatterns defaults() {
        return new IgnorePatterns(DEFAULTS);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * @param relativePath 相对 workspace 根目录的路径（"/" 分隔）
     */
    public boolean matches(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) return false;
        String rel = trimSlashes(relativePath.replace('\\', '/'));
        String name = fileName(rel);
        String wrapped = "/" + rel + "/";
        for (String p : patterns) {
            if (p.startsWith("*")) {
                if (name.endsWith(p.substring(1))) return true;
            } else if (p.endsWith("*")) {
                if (name.startsWith(p.substring(0, p.length() - 1))) return true;
            } else if (p.contains("/")) {
                if (wrapped.contains("/" + p + "/")) return true;
            } else {
                for (String seg : rel.split("/")) {
                    if (seg.equals(p)) return true;
                }
            }
        }
        return false;
    }

    /**
     * 是否排除在同步之外：隐藏路径或命中忽略规则。监听和全量上传共用这一判断。
     */
    public boolean excludes(String relativePath) {
        return isHidden(relativePath) || matches(relativePath);
    }

    /**
     * 任一路径段以 "." 开头（隐藏文件/目录）。
     */
    public static boolean isHidden(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) return false;
        for (String seg : relativePath.replace('\\', '/').split("/")) {
            if (seg.startsWith(".") && !seg.equals(".") && !seg.equals("..")) return true;
        }
        return false;
    }

    private static String fileName(String rel) {
        int idx = rel.lastIndexOf('/');
        return idx < 0 ? rel : rel.substring(idx + 1);
    }

    private static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }
}
