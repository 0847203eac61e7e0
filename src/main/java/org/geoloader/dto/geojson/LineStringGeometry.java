package org.geoloader.dto.geojson;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

public record LineStringGeometry(List<double[]> coordinates) implements GeoJsonGeometry {

    public LineStringGeometry {
        coordinates = List.copyOf(coordinates);
    }

    @Override
    public String type() {
        return "LineString";
    }

    @Override
    public void forEachPosition(Consumer<double[]> action) {
        coordinates.forEach(action);
    }

    @Override
    public LineStringGeometry mapPositions(UnaryOperator<double[]> mapper) {
        return new LineStringGeometry(coordinates.stream().map(mapper).toList());
    }
}
