package org.geoloader.diagnostics;

/**
 * 诊断记录的严重级别。
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
