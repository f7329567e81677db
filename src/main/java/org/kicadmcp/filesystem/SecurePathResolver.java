package org.kicadmcp.filesystem;

import org.kicadmcp.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把工具调用传入的路径解析为根目录白名单内的绝对路径（只读场景）。
 * <p>
 * 校验内容：
 * <ul>
 *   <li>路径必须位于 {@code app.kicad.roots} 之一内，{@code ../} 穿越会被拒绝。</li>
 *   <li>默认禁止符号链接；允许时仍要求 realPath 落在根目录内（Windows junction 同理）。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final SchematicServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(SchematicServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    /**
     * 解析已存在的文件路径。
     *
     * @param rootId    根目录标识；为空时绝对路径自动匹配最具体的 root，相对路径使用 root0
     * @param inputPath 相对 root 的路径或绝对路径
     */
    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.kicad.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }

        Path raw = Path.of(inputPath);
        boolean noRootId = rootId == null || rootId.isBlank();
        Root root;
        Path absolute;
        if (raw.isAbsolute()) {
            absolute = raw.toAbsolutePath().normalize();
            root = noRootId ? bestRootFor(absolute) : rootById(rootId);
        } else {
            root = noRootId ? roots.get(0) : rootById(rootId);
            absolute = root.path().resolve(raw).normalize();
        }

        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        checkNoEscape(root, absolute);

        return new ResolvedPath(root.id(), absolute, root.path().relativize(absolute).toString().replace('\\', '/'));
    }

    private void checkNoEscape(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.path().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.path(), e);
        }

        // 逐级检查 root -> 目标 的每一段，中间任意一级是链接都可能把后续路径带出根目录
        Path current = root.path();
        for (Path segment : root.path().relativize(absolute)) {
            current = current.resolve(segment);
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            Path real;
            try {
                real = current.toRealPath();
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
            if (!real.startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接逃逸出根目录：" + current);
            }
        }
    }

    private Root rootById(String rootId) {
        return roots.stream()
                .filter(r -> r.id().equals(rootId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
    }

    private Root bestRootFor(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.kicad.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return List.copyOf(result);
    }

    private record Root(String id, Path path) {
    }

    /**
     * @param rootId       命中的根目录标识
     * @param absolutePath 规范化后的绝对路径
     * @param displayPath  相对根目录的路径（统一使用 '/'）
     */
    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
