package com.timxs.photopair.model;

import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;

/**
 * 单张照片的绘制参数
 * destination 是变换前的目标矩形（画布坐标），transform 是作用于该矩形的仿射矩阵
 *
 * @param transform   仿射矩阵
 * @param destination 目标矩形
 */
public record DrawSpec(
    AffineTransform transform,
    Rectangle2D destination
) {
    public DrawSpec {
        transform = new AffineTransform(transform);
        destination = (Rectangle2D) destination.clone();
    }

    @Override
    public AffineTransform transform() {
        return new AffineTransform(transform);
    }

    @Override
    public Rectangle2D destination() {
        return (Rectangle2D) destination.clone();
    }

    /**
     * 图片像素坐标到画布坐标的完整矩阵
     * 即 transform · translate(x, y) · scale(w / imageWidth, h / imageHeight)
     *
     * @param imageWidth  图片原始宽度
     * @param imageHeight 图片原始高度
     * @return 可直接用于 drawImage 的矩阵
     */
    public AffineTransform imageTransform(int imageWidth, int imageHeight) {
        AffineTransform result = new AffineTransform(transform);
        result.translate(destination.getX(), destination.getY());
        result.scale(destination.getWidth() / imageWidth, destination.getHeight() / imageHeight);
        return result;
    }

    /**
     * 照片在画布上实际覆盖区域的外接矩形
     */
    public Rectangle2D canvasBounds() {
        return transform.createTransformedShape(destination).getBounds2D();
    }
}
