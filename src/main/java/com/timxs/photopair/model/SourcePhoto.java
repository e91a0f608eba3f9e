package com.timxs.photopair.model;

/**
 * 源照片
 * 交给流水线后不再修改；图片数据在合成时才解码
 *
 * @param name      文件名
 * @param data      原始图片数据
 * @param transform 仿射调整，为空表示恒等变换
 */
public record SourcePhoto(
    String name,
    byte[] data,
    Transform transform
) {
    public SourcePhoto {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Photo name cannot be empty");
        }
        if (data == null) {
            throw new IllegalArgumentException("Photo data cannot be null: " + name);
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * 创建不带仿射调整的照片
     */
    public static SourcePhoto of(String name, byte[] data) {
        return new SourcePhoto(name, data, null);
    }

    public SourcePhoto withTransform(Transform newTransform) {
        return new SourcePhoto(name, data, newTransform);
    }
}
