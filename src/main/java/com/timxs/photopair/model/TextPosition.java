package com.timxs.photopair.model;

import com.timxs.photopair.exception.ConfigurationException;

/**
 * 文字位置枚举
 * 定义画布四个角的锚点，用于指定合成图上文字标签的位置
 */
public enum TextPosition {

    /**
     * 左上角
     */
    TOP_LEFT("top-left"),

    /**
     * 右上角
     */
    TOP_RIGHT("top-right"),

    /**
     * 左下角
     */
    BOTTOM_LEFT("bottom-left"),

    /**
     * 右下角
     */
    BOTTOM_RIGHT("bottom-right");

    /**
     * 配置文件中使用的取值
     */
    private final String value;

    TextPosition(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 计算文字基线起点的 X 坐标
     *
     * @param canvasWidth 画布宽度
     * @param textWidth   文字测量宽度
     * @param margin      边距
     * @return X 坐标
     */
    public double calculateX(int canvasWidth, double textWidth, double margin) {
        return switch (this) {
            case TOP_LEFT, BOTTOM_LEFT -> margin;
            case TOP_RIGHT, BOTTOM_RIGHT -> canvasWidth - textWidth - margin;
        };
    }

    /**
     * 计算文字基线的 Y 坐标
     * 顶部位置以字号近似文字高度
     *
     * @param canvasHeight 画布高度
     * @param sizePx       字号（像素）
     * @param margin       边距
     * @return Y 坐标
     */
    public double calculateY(int canvasHeight, double sizePx, double margin) {
        return switch (this) {
            case TOP_LEFT, TOP_RIGHT -> sizePx + margin;
            case BOTTOM_LEFT, BOTTOM_RIGHT -> canvasHeight - margin;
        };
    }

    /**
     * 解析位置取值
     * 同时接受 "bottom-right" 和 "BOTTOM_RIGHT" 两种写法
     *
     * @param value 位置字符串
     * @return 对应的位置
     * @throws ConfigurationException 无法识别时抛出
     */
    public static TextPosition fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Text position must not be empty");
        }
        String normalized = value.trim();
        for (TextPosition position : values()) {
            if (position.value.equalsIgnoreCase(normalized) || position.name().equalsIgnoreCase(normalized)) {
                return position;
            }
        }
        throw new ConfigurationException("Unknown text position: " + value);
    }
}
