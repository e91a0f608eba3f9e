package com.timxs.photopair.service;

import java.awt.image.BufferedImage;

/**
 * 画布工厂
 */
public interface RenderSurfaceFactory {

    /**
     * 创建 1920x1080 的空白画布
     *
     * @return 新画布
     * @throws com.timxs.photopair.exception.SurfaceException 无法创建时抛出
     */
    BufferedImage create();
}
