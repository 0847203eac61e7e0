package org.geoloader.filesystem;

import org.geoloader.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把调用方传入的 DXF 路径解析成根目录白名单内的绝对路径。
 * <p>
 * 校验内容：
 * <ul>
 *   <li>只允许 {@code app.geo.roots} 内的文件。</li>
 *   <li>阻止 {@code ../} 之类的路径穿越。</li>
 *   <li>默认禁止符号链接；逐级用 realPath 校验，防止中间某一级 junction 逃逸出根目录。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(GeoImportProperties properties) {
        this.allowSymlink = properties.isAllowSymlink();
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析一个必须已存在的普通文件。
     *
     * @param rootId    根目录标识；为空时绝对路径自动匹配最长的 root，相对路径使用 root0
     * @param inputPath 绝对路径或相对 root 的路径
     */
    public ResolvedPath resolveExistingFile(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.geo.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }

        Path rawPath = Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        validateWithinRoot(selectedRoot, absolute);
        if (!Files.isRegularFile(absolute)) {
            throw new IllegalArgumentException("不是普通文件：" + inputPath);
        }
        return new ResolvedPath(selectedRoot.id(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("文件不存在：" + absolute);
        }

        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.geo.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
