package com.timxs.photopair.service;

import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.model.TextPlacement;

import java.awt.Font;
import java.awt.Graphics2D;

/**
 * 文字标签服务
 * 计算文字位置并在画布上绘制
 */
public interface TextOverlayService {

    /**
     * 文字与画布边缘的距离（像素）
     */
    double MARGIN = 20;

    /**
     * 计算文字锚点
     *
     * @param options      文字配置（text 已解析）
     * @param canvasWidth  画布宽度
     * @param canvasHeight 画布高度
     * @param textWidth    文字测量宽度
     * @return 锚点
     */
    TextPlacement place(TextOptions options, int canvasWidth, int canvasHeight, double textWidth);

    /**
     * 根据配置创建字体
     *
     * @param options 文字配置
     * @return 字体
     */
    Font resolveFont(TextOptions options);

    /**
     * 在画布上绘制文字，描边（如启用）先于填充
     *
     * @param g2d          画布
     * @param options      文字配置（text 已解析）
     * @param canvasWidth  画布宽度
     * @param canvasHeight 画布高度
     * @return 实际使用的锚点
     */
    TextPlacement draw(Graphics2D g2d, TextOptions options, int canvasWidth, int canvasHeight);
}
