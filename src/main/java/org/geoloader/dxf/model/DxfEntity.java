package org.geoloader.dxf.model;

/**
 * 已解码、已校验的 DXF 实体（封闭的标签联合）。
 * <p>
 * 每个实现都是不可变 record；下游按 {@link #type()} 分派，不再对原始组码做“鸭子类型”判断。
 */
public sealed interface DxfEntity permits
        PointEntity,
        LineEntity,
        PolylineEntity,
        CircleEntity,
        ArcEntity,
        EllipseEntity,
        SplineEntity,
        InsertEntity,
        TextEntity,
        HatchEntity,
        FaceEntity,
        DimensionEntity,
        LeaderEntity,
        RayEntity {

    EntityType type();

    /**
     * 原始 DXF 类型名（例如 LWPOLYLINE、MTEXT、3DFACE）。
     */
    String dxfType();

    EntityAttributes attributes();
}
