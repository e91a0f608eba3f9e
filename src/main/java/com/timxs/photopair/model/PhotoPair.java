package com.timxs.photopair.model;

/**
 * 配对结果
 *
 * @param index       配对序号（从 0 开始）
 * @param left        左侧照片
 * @param right       右侧照片
 * @param displayName 显示名称
 * @param nameDerived 显示名称是否由文件名解析得到；为 false 时使用的是文件名兜底
 */
public record PhotoPair(
    int index,
    SourcePhoto left,
    SourcePhoto right,
    String displayName,
    boolean nameDerived
) {
}
