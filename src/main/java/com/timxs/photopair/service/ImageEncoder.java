package com.timxs.photopair.service;

import java.awt.image.BufferedImage;

/**
 * 图片编码器
 */
public interface ImageEncoder {

    /**
     * 编码为 JPEG
     *
     * @param image   画布
     * @param quality 输出质量（0.0-1.0）
     * @return JPEG 数据
     */
    byte[] encodeJpeg(BufferedImage image, float quality);
}
