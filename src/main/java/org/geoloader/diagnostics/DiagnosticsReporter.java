package org.geoloader.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断收集器：贯穿扫描、解码、图块展开、几何转换与坐标转换的“旁路通道”。
 * <p>
 * 约定：
 * <ul>
 *   <li>本类自身从不抛异常；是否致命由调用方决定（文档结构错误、坐标系自检失败会以异常抛出）。</li>
 *   <li>每条记录同时输出到 {@code org.geoloader.diagnostics} 日志（ERROR/WARNING 用 warn，INFO 用 debug）。</li>
 *   <li>保留的记录条数有上限，超出部分只计数（{@link #suppressedCount()}），避免异常文件产生海量告警撑爆响应体。</li>
 * </ul>
 * <p>
 * 线程安全：所有方法同步，单次导入内通常只有一个线程写入。
 */
public class DiagnosticsReporter {

    private static final Logger log = LoggerFactory.getLogger("org.geoloader.diagnostics");

    public static final int DEFAULT_MAX_RECORDS = 1_000;

    private final int maxRecords;
    private final List<Diagnostic> records = new ArrayList<>();
    private final Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
    private int suppressed = 0;

    public DiagnosticsReporter() {
        this(DEFAULT_MAX_RECORDS);
    }

    public DiagnosticsReporter(int maxRecords) {
        this.maxRecords = Math.max(1, maxRecords);
    }

    public void error(DiagnosticCode code, String message) {
        report(new Diagnostic(Severity.ERROR, code, message, null));
    }

    public void error(DiagnosticCode code, String message, Map<String, Object> context) {
        report(new Diagnostic(Severity.ERROR, code, message, context));
    }

    public void warning(DiagnosticCode code, String message) {
        report(new Diagnostic(Severity.WARNING, code, message, null));
    }

    public void warning(DiagnosticCode code, String message, Map<String, Object> context) {
        report(new Diagnostic(Severity.WARNING, code, message, context));
    }

    public void info(DiagnosticCode code, String message, Map<String, Object> context) {
        report(new Diagnostic(Severity.INFO, code, message, context));
    }

    public synchronized void report(Diagnostic diagnostic) {
        if (diagnostic == null) {
            return;
        }
        counts.merge(diagnostic.severity(), 1, Integer::sum);
        if (records.size() < maxRecords) {
            records.add(diagnostic);
        } else {
            suppressed++;
        }
        if (diagnostic.severity() == Severity.INFO) {
            log.debug("[{}] {} {}", diagnostic.code(), diagnostic.message(), diagnostic.context());
        } else {
            log.warn("[{}] {} {}", diagnostic.code(), diagnostic.message(), diagnostic.context());
        }
    }

    public synchronized List<Diagnostic> list() {
        return List.copyOf(records);
    }

    public synchronized int count(Severity severity) {
        return counts.getOrDefault(severity, 0);
    }

    public synchronized boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public synchronized boolean contains(DiagnosticCode code) {
        for (Diagnostic d : records) {
            if (d.code() == code) {
                return true;
            }
        }
        return false;
    }

    /**
     * 因超出 {@code maxRecords} 而未保留的记录条数（计数仍计入 {@link #count(Severity)}）。
     */
    public synchronized int suppressedCount() {
        return suppressed;
    }

    /**
     * 构造上下文 Map 的小工具：按 key/value 交替传参，null 值会被保留。
     */
    public static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (keyValues == null) {
            return map;
        }
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }
}
