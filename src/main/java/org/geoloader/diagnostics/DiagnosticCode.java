package org.geoloader.diagnostics;

/**
 * 诊断类型码（对外输出时使用 {@link #name()}，例如 {@code CIRCULAR_REFERENCE}）。
 * <p>
 * 分组说明：
 * <ul>
 *   <li>文档结构级：{@link #EMPTY_CONTENT}/{@link #MALFORMED_DXF}/{@link #MISSING_SECTIONS} 属于致命错误，会以异常形式抛出，同时也会记录一条诊断。</li>
 *   <li>实体级：解码/校验失败，仅丢弃该实体。</li>
 *   <li>引用级：图块缺失/循环引用，仅跳过该分支。</li>
 *   <li>转换级：几何转换或坐标转换失败，仅丢弃该要素。</li>
 * </ul>
 */
public enum DiagnosticCode {

    EMPTY_CONTENT,
    MALFORMED_DXF,
    MISSING_SECTIONS,
    INVALID_GROUP_CODE,
    UNTERMINATED_SECTION,
    BINARY_DXF,

    UNSUPPORTED_ENTITY,
    INVALID_POSITION,
    INVALID_VERTICES,
    INVALID_RADIUS,
    INVALID_ANGLES,
    INVALID_ELLIPSE,
    INVALID_INSERT,
    INVALID_TEXT,
    INVALID_HATCH,

    MISSING_BLOCK,
    CIRCULAR_REFERENCE,
    TRANSFORM_POINT_FAILED,

    LAYER_HIDDEN,
    CONVERSION_ERROR,
    TRANSFORM_ERROR,
    CRS_DETECTION
}
