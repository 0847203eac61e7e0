package org.geoloader.dto.geojson;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * @param coordinates 环列表；每个环首尾坐标相同
 */
public record PolygonGeometry(List<List<double[]>> coordinates) implements GeoJsonGeometry {

    public PolygonGeometry {
        coordinates = coordinates.stream().map(List::copyOf).toList();
    }

    @Override
    public String type() {
        return "Polygon";
    }

    @Override
    public void forEachPosition(Consumer<double[]> action) {
        coordinates.forEach(ring -> ring.forEach(action));
    }

    @Override
    public PolygonGeometry mapPositions(UnaryOperator<double[]> mapper) {
        return new PolygonGeometry(coordinates.stream()
                .map(ring -> ring.stream().map(mapper).toList())
                .toList());
    }
}
