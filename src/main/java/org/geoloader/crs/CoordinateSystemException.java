package org.geoloader.crs;

/**
 * 坐标系注册/初始化/自检失败。启动阶段出现时是致命错误。
 */
public class CoordinateSystemException extends RuntimeException {

    public CoordinateSystemException(String message) {
        super(message);
    }

    public CoordinateSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
