package org.geoloader.dxf.model;

/**
 * 实体种类（标签联合的“标签”）。同一种类下可能对应多个 DXF 类型名，例如 POLYLINE/LWPOLYLINE。
 */
public enum EntityType {
    POINT,
    LINE,
    POLYLINE,
    CIRCLE,
    ARC,
    ELLIPSE,
    SPLINE,
    INSERT,
    TEXT,
    HATCH,
    FACE,
    DIMENSION,
    LEADER,
    RAY
}
