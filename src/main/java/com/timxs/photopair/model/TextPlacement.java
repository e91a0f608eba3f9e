package com.timxs.photopair.model;

/**
 * 文字锚点
 * 坐标是文字基线的起点
 *
 * @param x              X 坐标
 * @param y              Y 坐标（基线）
 * @param textWidth      文字测量宽度
 * @param fontDescriptor 字体描述，如 "bold italic 48px SansSerif"
 */
public record TextPlacement(
    double x,
    double y,
    double textWidth,
    String fontDescriptor
) {
}
