package org.geoloader.dxf;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ASCII DXF 组码扫描器：原始文本 -> 有序的 (code, value) 对 -> 命名段。
 * <p>
 * 容错策略：
 * <ul>
 *   <li>兼容 CRLF/LF/CR 三种换行，忽略开头的 BOM。</li>
 *   <li>组码 999 是注释，直接跳过。</li>
 *   <li>组码行不是整数、或末尾只有组码没有值：记录 {@code INVALID_GROUP_CODE} 警告后继续扫描。</li>
 *   <li>一对有效组码都没有恢复出来：致命错误（{@code MALFORMED_DXF}）。</li>
 * </ul>
 */
public final class DxfGroupCodeScanner {

    private DxfGroupCodeScanner() {
    }

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    static final String BINARY_SENTINEL = "AutoCAD Binary DXF";

    private static final int COMMENT = 999;

    public static List<GroupCode> tokenize(String content, DiagnosticsReporter reporter) {
        if (content == null || content.isBlank()) {
            reporter.error(DiagnosticCode.EMPTY_CONTENT, "DXF 内容为空");
            throw new DxfParseException(DiagnosticCode.EMPTY_CONTENT, "DXF 内容为空（empty content）");
        }
        if (content.startsWith(BINARY_SENTINEL)) {
            reporter.error(DiagnosticCode.BINARY_DXF, "不支持二进制 DXF");
            throw new DxfParseException(DiagnosticCode.BINARY_DXF, "不支持二进制 DXF（binary DXF）");
        }

        String text = content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
        String[] lines = LINE_BREAK.split(text, -1);
        // split(-1) 会保留末尾换行产生的空串，去掉它避免误报“缺少值”
        int lineCount = lines.length;
        while (lineCount > 0 && lines[lineCount - 1].isBlank()) {
            lineCount--;
        }

        List<GroupCode> pairs = new ArrayList<>(lineCount / 2 + 1);
        int invalid = 0;
        int i = 0;
        while (i < lineCount) {
            String codeLine = lines[i].trim();
            int lineNo = i + 1;
            if (i + 1 >= lineCount) {
                invalid++;
                reporter.warning(DiagnosticCode.INVALID_GROUP_CODE, "末尾组码缺少值",
                        DiagnosticsReporter.context("line", lineNo, "code", codeLine));
                break;
            }
            int code;
            try {
                code = Integer.parseInt(codeLine);
            } catch (NumberFormatException e) {
                invalid++;
                reporter.warning(DiagnosticCode.INVALID_GROUP_CODE, "组码不是整数，已跳过该组",
                        DiagnosticsReporter.context("line", lineNo, "code", abbreviate(codeLine)));
                i += 2;
                continue;
            }
            String rawValue = lines[i + 1];
            i += 2;
            if (code == COMMENT) {
                continue;
            }
            pairs.add(new GroupCode(code, normalizeValue(code, rawValue), lineNo));
        }

        if (pairs.isEmpty()) {
            reporter.error(DiagnosticCode.MALFORMED_DXF, "未能解析出任何有效组码",
                    DiagnosticsReporter.context("invalidPairs", invalid));
            throw new DxfParseException(DiagnosticCode.MALFORMED_DXF, "无法识别的 DXF 内容（malformed DXF）");
        }
        return pairs;
    }

    /**
     * 按 {@code (0,SECTION)(2,NAME) ... (0,ENDSEC)} 切分段；一个段标记都没有时为致命错误。
     */
    public static List<DxfSection> sections(List<GroupCode> pairs, DiagnosticsReporter reporter) {
        List<DxfSection> sections = new ArrayList<>();
        int i = 0;
        while (i < pairs.size()) {
            GroupCode gc = pairs.get(i);
            if (!gc.is(0, "SECTION")) {
                i++;
                continue;
            }
            String name = "";
            int start = i + 1;
            if (start < pairs.size() && pairs.get(start).code() == 2) {
                name = pairs.get(start).value().trim().toUpperCase(Locale.ROOT);
                start++;
            } else {
                reporter.warning(DiagnosticCode.MALFORMED_DXF, "SECTION 后缺少段名",
                        DiagnosticsReporter.context("line", gc.line()));
            }

            int end = start;
            while (end < pairs.size() && !pairs.get(end).is(0, "ENDSEC") && !pairs.get(end).is(0, "SECTION")) {
                end++;
            }
            boolean terminated = end < pairs.size() && pairs.get(end).is(0, "ENDSEC");
            if (!terminated) {
                reporter.warning(DiagnosticCode.UNTERMINATED_SECTION, "段缺少 ENDSEC，已截止到下一段或文件末尾",
                        DiagnosticsReporter.context("section", name, "line", gc.line()));
            }
            sections.add(new DxfSection(name, pairs.subList(start, end), terminated));
            i = terminated ? end + 1 : end;
        }

        if (sections.isEmpty()) {
            reporter.error(DiagnosticCode.MISSING_SECTIONS, "未找到任何 SECTION 标记");
            throw new DxfParseException(DiagnosticCode.MISSING_SECTIONS, "DXF 缺少段标记（no sections）");
        }
        return sections;
    }

    private static String normalizeValue(int code, String raw) {
        // 文本值（1/3）的前导空格有意义，其余组码按惯例两端去空白
        if (code == 1 || code == 3) {
            return raw.stripTrailing();
        }
        return raw.strip();
    }

    private static String abbreviate(String s) {
        return s.length() <= 40 ? s : s.substring(0, 40) + "...";
    }
}
