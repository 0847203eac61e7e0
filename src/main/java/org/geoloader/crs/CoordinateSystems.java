package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;

import java.util.List;

/**
 * 内置坐标系。
 * <p>
 * 瑞士 LV95/LV03 与 CH1903+ 地理坐标共用 Bessel 椭球和同一组 3 参数 towgs84 平移；
 * 因此 LV95 -> EPSG:4150 不涉及基准面转换，LV95 -> EPSG:4326 会有约百米量级的基准面偏移。
 */
public final class CoordinateSystems {

    private CoordinateSystems() {
    }

    public static final String WGS84 = "EPSG:4326";
    public static final String LV95 = "EPSG:2056";
    public static final String LV03 = "EPSG:21781";
    public static final String CH1903_PLUS_GEOGRAPHIC = "EPSG:4150";

    public static final String METERS = "meters";
    public static final String DEGREES = "degrees";

    private static final String SWISS_DATUM = "+ellps=bessel +towgs84=674.374,15.056,405.346,0,0,0,0";

    public static final CoordinateSystemDefinition WGS84_DEFINITION = new CoordinateSystemDefinition(
            WGS84,
            "+proj=longlat +datum=WGS84 +no_defs",
            new Bounds(-180, -90, 180, 90),
            DEGREES,
            "WGS 84");

    public static final CoordinateSystemDefinition LV95_DEFINITION = new CoordinateSystemDefinition(
            LV95,
            "+proj=somerc +lat_0=46.95240555555556 +lon_0=7.439583333333333 +k_0=1 "
                    + "+x_0=2600000 +y_0=1200000 " + SWISS_DATUM + " +units=m +no_defs",
            new Bounds(2_485_000, 1_075_000, 2_835_000, 1_295_000),
            METERS,
            "CH1903+ / LV95");

    public static final CoordinateSystemDefinition LV03_DEFINITION = new CoordinateSystemDefinition(
            LV03,
            "+proj=somerc +lat_0=46.95240555555556 +lon_0=7.439583333333333 +k_0=1 "
                    + "+x_0=600000 +y_0=200000 " + SWISS_DATUM + " +units=m +no_defs",
            new Bounds(485_000, 75_000, 835_000, 295_000),
            METERS,
            "CH1903 / LV03");

    public static final CoordinateSystemDefinition CH1903_PLUS_GEOGRAPHIC_DEFINITION = new CoordinateSystemDefinition(
            CH1903_PLUS_GEOGRAPHIC,
            "+proj=longlat " + SWISS_DATUM + " +no_defs",
            new Bounds(5.96, 45.82, 10.49, 47.81),
            DEGREES,
            "CH1903+ 地理坐标");

    public static List<CoordinateSystemDefinition> builtIns() {
        return List.of(WGS84_DEFINITION, LV95_DEFINITION, LV03_DEFINITION, CH1903_PLUS_GEOGRAPHIC_DEFINITION);
    }
}
