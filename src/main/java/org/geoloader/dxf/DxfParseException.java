package org.geoloader.dxf;

import org.geoloader.diagnostics.DiagnosticCode;

/**
 * 文档结构级的致命错误（空内容、无法识别的组码流、缺少段标记、二进制 DXF）。
 * <p>
 * 实体级问题不会走到这里，只记录诊断并丢弃该实体。
 */
public class DxfParseException extends RuntimeException {

    private final DiagnosticCode code;

    public DxfParseException(DiagnosticCode code, String message) {
        super(message);
        this.code = code;
    }

    public DiagnosticCode getCode() {
        return code;
    }
}
