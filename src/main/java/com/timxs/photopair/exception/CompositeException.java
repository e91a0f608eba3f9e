package com.timxs.photopair.exception;

/**
 * 合成过程中的异常基类
 */
public class CompositeException extends RuntimeException {

    public CompositeException(String message) {
        super(message);
    }

    public CompositeException(String message, Throwable cause) {
        super(message, cause);
    }
}
