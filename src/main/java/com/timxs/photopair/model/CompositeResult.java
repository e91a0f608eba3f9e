package com.timxs.photopair.model;

import com.timxs.photopair.config.TextOptions;

/**
 * 单个配对的合成结果
 *
 * @param encodedImage       编码后的 JPEG 数据
 * @param name               结果名称（配对的显示名称）
 * @param leftSource         左侧源照片文件名
 * @param rightSource        右侧源照片文件名
 * @param appliedTextOptions 实际使用的文字配置
 * @param appliedTransforms  实际使用的左右仿射调整
 */
public record CompositeResult(
    byte[] encodedImage,
    String name,
    String leftSource,
    String rightSource,
    TextOptions appliedTextOptions,
    AppliedTransforms appliedTransforms
) {
    public CompositeResult {
        if (encodedImage == null) {
            throw new IllegalArgumentException("Encoded image cannot be null: " + name);
        }
        encodedImage = encodedImage.clone();
    }

    /**
     * 返回编码数据的副本
     */
    @Override
    public byte[] encodedImage() {
        return encodedImage.clone();
    }

    /**
     * 压缩包条目默认后缀
     */
    public static final String ENTRY_SUFFIX = "_combined.jpg";

    /**
     * 压缩包内的条目名称（默认后缀）
     */
    public String entryName() {
        return entryName(ENTRY_SUFFIX);
    }

    /**
     * 压缩包内的条目名称
     *
     * @param suffix 条目后缀
     * @return 结果名称 + 后缀
     */
    public String entryName(String suffix) {
        return name + suffix;
    }

    /**
     * 左右两侧实际使用的仿射调整
     */
    public record AppliedTransforms(Transform left, Transform right) {
    }
}
