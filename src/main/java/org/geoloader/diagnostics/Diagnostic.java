package org.geoloader.diagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单条诊断记录。
 *
 * @param severity 严重级别
 * @param code     类型码
 * @param message  可读描述
 * @param context  附加上下文（实体句柄、图块路径、坐标等；不为 null，值可能为 null）
 */
public record Diagnostic(
        Severity severity,
        DiagnosticCode code,
        String message,
        Map<String, Object> context
) {
    public Diagnostic {
        context = (context == null || context.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
