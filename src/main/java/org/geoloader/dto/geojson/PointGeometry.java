package org.geoloader.dto.geojson;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

public record PointGeometry(double[] coordinates) implements GeoJsonGeometry {

    public static PointGeometry of(double x, double y) {
        return new PointGeometry(new double[]{x, y});
    }

    @Override
    public String type() {
        return "Point";
    }

    @Override
    public void forEachPosition(Consumer<double[]> action) {
        action.accept(coordinates);
    }

    @Override
    public PointGeometry mapPositions(UnaryOperator<double[]> mapper) {
        return new PointGeometry(mapper.apply(coordinates));
    }
}
