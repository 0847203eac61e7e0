package org.geoloader.crs;

/**
 * 单点坐标转换失败，携带输入点与源/目标坐标系。
 */
public class CoordinateTransformationException extends RuntimeException {

    private final CoordinatePoint point;
    private final String fromSystem;
    private final String toSystem;

    public CoordinateTransformationException(String message, CoordinatePoint point, String fromSystem, String toSystem) {
        this(message, point, fromSystem, toSystem, null);
    }

    public CoordinateTransformationException(String message, CoordinatePoint point, String fromSystem, String toSystem,
                                             Throwable cause) {
        super(message + " (" + fromSystem + " -> " + toSystem + ", point=" + point + ")", cause);
        this.point = point;
        this.fromSystem = fromSystem;
        this.toSystem = toSystem;
    }

    public CoordinatePoint getPoint() {
        return point;
    }

    public String getFromSystem() {
        return fromSystem;
    }

    public String getToSystem() {
        return toSystem;
    }
}
