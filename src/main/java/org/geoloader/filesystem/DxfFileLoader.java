package org.geoloader.filesystem;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.dxf.DxfParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 读取白名单内的 DXF 文本文件。
 * <p>
 * 规则：
 * <ul>
 *   <li>扩展名必须是 {@code .dxf}（大小写不敏感）。</li>
 *   <li>超过 {@code app.geo.read-max-bytes} 直接拒绝。</li>
 *   <li>二进制 DXF（以 {@code AutoCAD Binary DXF} 开头）不支持。</li>
 *   <li>优先按 UTF-8 严格解码；失败时按 Windows-1252 解码（旧版 AutoCAD 常用的 ANSI 代码页）并给出告警。</li>
 * </ul>
 */
public class DxfFileLoader {

    private static final Logger log = LoggerFactory.getLogger(DxfFileLoader.class);

    private static final byte[] BINARY_SENTINEL = "AutoCAD Binary DXF".getBytes(StandardCharsets.US_ASCII);
    private static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");

    private final SecurePathResolver resolver;
    private final long maxBytes;

    public DxfFileLoader(SecurePathResolver resolver, long maxBytes) {
        this.resolver = resolver;
        this.maxBytes = maxBytes;
    }

    /**
     * @param content   文本内容
     * @param path      相对 root 的显示路径
     * @param rootId    根目录标识
     * @param sizeBytes 文件字节数
     * @param charset   实际使用的字符集
     * @param warnings  非致命告警
     */
    public record LoadedDxf(String content, String path, String rootId, long sizeBytes, String charset, List<String> warnings) {
    }

    public LoadedDxf load(String rootId, String path) {
        SecurePathResolver.ResolvedPath resolved = resolver.resolveExistingFile(rootId, path);
        Path file = resolved.absolutePath();
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".dxf")) {
            throw new IllegalArgumentException("仅支持 .dxf 文件：" + resolved.displayPath());
        }

        long size;
        byte[] bytes;
        try {
            size = Files.size(file);
            if (size > maxBytes) {
                throw new IllegalArgumentException("文件过大：" + size + " 字节（上限 " + maxBytes + "）");
            }
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + resolved.displayPath(), e);
        }

        if (startsWith(bytes, BINARY_SENTINEL)) {
            throw new DxfParseException(DiagnosticCode.BINARY_DXF, "不支持二进制 DXF（binary DXF）：" + resolved.displayPath());
        }

        List<String> warnings = new ArrayList<>();
        String content;
        String charset;
        try {
            content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            charset = StandardCharsets.UTF_8.name();
        } catch (CharacterCodingException e) {
            content = new String(bytes, FALLBACK_CHARSET);
            charset = FALLBACK_CHARSET.name();
            warnings.add("文件不是合法的 UTF-8，已按 " + charset + " 解码，非 ASCII 文字可能不准确。");
            log.debug("UTF-8 解码失败，改用 {}: {}", charset, resolved.displayPath());
        }
        return new LoadedDxf(content, resolved.displayPath(), resolved.rootId(), size, charset, warnings);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
