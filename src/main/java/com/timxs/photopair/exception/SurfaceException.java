package com.timxs.photopair.exception;

/**
 * 无法创建绘制画布
 */
public class SurfaceException extends CompositeException {

    public SurfaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
