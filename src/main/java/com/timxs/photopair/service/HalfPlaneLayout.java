package com.timxs.photopair.service;

import com.timxs.photopair.model.DrawSpec;
import com.timxs.photopair.model.PhotoSide;
import com.timxs.photopair.model.Transform;

/**
 * 半幅布局引擎
 * <p>
 * 画布固定为 1920x1080，左右各 960x1080。每张照片的矩阵按以下固定顺序组合，顺序变化会改变输出结果：
 * <ol>
 *     <li>平移到半幅中心 (originX + 480, 540)</li>
 *     <li>旋转 rotationDegrees</li>
 *     <li>均匀缩放 scale</li>
 *     <li>在旋转缩放后的坐标系中平移 (offsetX, offsetY)</li>
 *     <li>撤销第 1 步的平移</li>
 * </ol>
 * 目标矩形按 cover 方式铺满半幅并居中，不设置裁剪区域，超出部分会延伸到半幅之外。
 */
public interface HalfPlaneLayout {

    int CANVAS_WIDTH = 1920;

    int CANVAS_HEIGHT = 1080;

    int HALF_WIDTH = CANVAS_WIDTH / 2;

    /**
     * 计算照片的绘制参数
     *
     * @param imageWidth  图片原始宽度
     * @param imageHeight 图片原始高度
     * @param side        所在半幅
     * @param transform   已解析的仿射调整
     * @return 绘制参数
     */
    DrawSpec layout(int imageWidth, int imageHeight, PhotoSide side, Transform transform);
}
