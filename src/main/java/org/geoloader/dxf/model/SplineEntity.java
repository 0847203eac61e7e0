package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.List;

/**
 * SPLINE：只保留控制点/拟合点，转换时按控制点折线化（不做真正的 B 样条求值）。
 */
public record SplineEntity(
        EntityAttributes attributes,
        List<Vector3> controlPoints,
        List<Vector3> fitPoints,
        int degree,
        boolean closed
) implements DxfEntity {

    public SplineEntity {
        controlPoints = List.copyOf(controlPoints);
        fitPoints = (fitPoints == null) ? List.of() : List.copyOf(fitPoints);
    }

    @Override
    public EntityType type() {
        return EntityType.SPLINE;
    }

    @Override
    public String dxfType() {
        return "SPLINE";
    }
}
