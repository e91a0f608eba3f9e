package com.timxs.photopair.service.impl;

import com.timxs.photopair.model.DrawSpec;
import com.timxs.photopair.model.PhotoSide;
import com.timxs.photopair.model.Transform;
import com.timxs.photopair.service.HalfPlaneLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;

/**
 * 半幅布局引擎实现
 * 纯计算，不接触画布
 */
@Slf4j
@Service
public class HalfPlaneLayoutImpl implements HalfPlaneLayout {

    /**
     * 半幅宽高比 960 / 1080
     */
    private static final double HALF_ASPECT_RATIO = (double) HALF_WIDTH / CANVAS_HEIGHT;

    @Override
    public DrawSpec layout(int imageWidth, int imageHeight, PhotoSide side, Transform transform) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException(
                String.format("Image size must be positive: %dx%d", imageWidth, imageHeight));
        }
        if (side == null || transform == null) {
            throw new IllegalArgumentException("Side and transform cannot be null");
        }

        double originX = side.getHalfIndex() * (double) HALF_WIDTH;
        double centerX = originX + HALF_WIDTH / 2.0;
        double centerY = CANVAS_HEIGHT / 2.0;

        // 中心 -> 旋转 -> 缩放 -> 偏移 -> 撤销中心
        AffineTransform matrix = new AffineTransform();
        matrix.translate(centerX, centerY);
        matrix.rotate(Math.toRadians(transform.rotationDegrees()));
        matrix.scale(transform.scale(), transform.scale());
        matrix.translate(transform.offsetX(), transform.offsetY());
        matrix.translate(-centerX, -centerY);

        // cover：较宽的图片固定高度，较窄的图片固定宽度
        double imageRatio = (double) imageWidth / imageHeight;
        double drawWidth = HALF_WIDTH;
        double drawHeight = CANVAS_HEIGHT;
        if (imageRatio > HALF_ASPECT_RATIO) {
            drawWidth = drawHeight * imageRatio;
        } else {
            drawHeight = drawWidth / imageRatio;
        }

        double drawX = originX + (HALF_WIDTH - drawWidth) / 2;
        double drawY = (CANVAS_HEIGHT - drawHeight) / 2;
        Rectangle2D destination = new Rectangle2D.Double(drawX, drawY, drawWidth, drawHeight);

        log.debug("{} 半幅布局: 原图 {}x{}, 目标矩形 ({}, {}, {}, {}), 调整 {}",
            side.getLabel(), imageWidth, imageHeight, drawX, drawY, drawWidth, drawHeight, transform);
        return new DrawSpec(matrix, destination);
    }
}
