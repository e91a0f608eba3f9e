package com.timxs.photopair.model;

/**
 * 单张照片的仿射调整
 * 偏移量位于半幅中心的局部坐标系中，在旋转和缩放之后生效
 *
 * @param rotationDegrees 旋转角度（度）
 * @param scale           均匀缩放比例，必须大于 0
 * @param offsetX         X 偏移
 * @param offsetY         Y 偏移
 */
public record Transform(
    double rotationDegrees,
    double scale,
    double offsetX,
    double offsetY
) {
    /**
     * 恒等变换：不旋转、不缩放、不偏移
     */
    public static final Transform IDENTITY = new Transform(0, 1, 0, 0);

    public static Transform of(double rotationDegrees, double scale, double offsetX, double offsetY) {
        return new Transform(rotationDegrees, scale, offsetX, offsetY);
    }

    public Transform withScale(double newScale) {
        return new Transform(rotationDegrees, newScale, offsetX, offsetY);
    }

    public boolean isIdentity() {
        return IDENTITY.equals(this);
    }
}
