package com.timxs.photopair.service.impl;

import com.timxs.photopair.exception.SurfaceException;
import com.timxs.photopair.service.HalfPlaneLayout;
import com.timxs.photopair.service.RenderSurfaceFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.*;
import java.awt.image.BufferedImage;

/**
 * 画布工厂实现
 * JPEG 不支持 Alpha 通道，画布直接使用 RGB 格式并以白色填充
 */
@Slf4j
@Component
public class RenderSurfaceFactoryImpl implements RenderSurfaceFactory {

    @Override
    public BufferedImage create() {
        try {
            BufferedImage surface = new BufferedImage(
                HalfPlaneLayout.CANVAS_WIDTH, HalfPlaneLayout.CANVAS_HEIGHT, BufferedImage.TYPE_INT_RGB);
            Graphics2D g2d = surface.createGraphics();
            try {
                g2d.setColor(Color.WHITE);
                g2d.fillRect(0, 0, surface.getWidth(), surface.getHeight());
            } finally {
                g2d.dispose();
            }
            return surface;
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            log.error("无法创建画布: {}", e.getMessage());
            throw new SurfaceException("Could not create render surface", e);
        }
    }
}
