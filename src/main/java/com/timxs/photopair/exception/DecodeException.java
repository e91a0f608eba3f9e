package com.timxs.photopair.exception;

import com.timxs.photopair.model.PhotoSide;
import lombok.Getter;

/**
 * 源照片解码失败
 * 记录失败的一侧和文件名
 */
@Getter
public class DecodeException extends CompositeException {

    private final PhotoSide side;

    private final String filename;

    public DecodeException(PhotoSide side, String filename, String reason) {
        super(String.format("Failed to load %s image: %s (%s)", side.getLabel(), filename, reason));
        this.side = side;
        this.filename = filename;
    }

    public DecodeException(PhotoSide side, String filename, Throwable cause) {
        super(String.format("Failed to load %s image: %s (%s)", side.getLabel(), filename, cause.getMessage()), cause);
        this.side = side;
        this.filename = filename;
    }
}
