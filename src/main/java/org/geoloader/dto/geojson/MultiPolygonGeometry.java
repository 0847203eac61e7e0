package org.geoloader.dto.geojson;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

public record MultiPolygonGeometry(List<List<List<double[]>>> coordinates) implements GeoJsonGeometry {

    public MultiPolygonGeometry {
        coordinates = coordinates.stream()
                .map(polygon -> polygon.stream().map(List::copyOf).toList())
                .toList();
    }

    @Override
    public String type() {
        return "MultiPolygon";
    }

    @Override
    public void forEachPosition(Consumer<double[]> action) {
        coordinates.forEach(polygon -> polygon.forEach(ring -> ring.forEach(action)));
    }

    @Override
    public MultiPolygonGeometry mapPositions(UnaryOperator<double[]> mapper) {
        return new MultiPolygonGeometry(coordinates.stream()
                .map(polygon -> polygon.stream()
                        .map(ring -> ring.stream().map(mapper).toList())
                        .toList())
                .toList());
    }
}
