package com.timxs.photopair.config;

import com.timxs.photopair.model.TextPosition;

/**
 * 文字标签配置 record
 * enabled 为 false 时无论其他字段如何都不绘制文字
 *
 * @param enabled       是否绘制文字
 * @param text          文字内容，为空时由配对的显示名称代替
 * @param font          字体名称
 * @param sizePx        字体大小（像素）
 * @param bold          是否加粗
 * @param italic        是否斜体
 * @param color         填充颜色（十六进制），为空时为黑色
 * @param position      位置
 * @param stroke        是否描边
 * @param strokeColor   描边颜色，为空时为白色
 * @param strokeWidthPx 描边宽度，为空时为 2
 */
public record TextOptions(
    boolean enabled,
    String text,
    String font,
    double sizePx,
    boolean bold,
    boolean italic,
    String color,
    TextPosition position,
    boolean stroke,
    String strokeColor,
    Double strokeWidthPx
) {
    public static final String DEFAULT_COLOR = "#000000";

    public static final String DEFAULT_STROKE_COLOR = "#FFFFFF";

    public static final double DEFAULT_STROKE_WIDTH = 2;

    /**
     * 从 TextOverlayConfig 创建 TextOptions
     */
    public static TextOptions from(TextOverlayConfig config) {
        return new TextOptions(
            config.isEnabled(),
            config.getText(),
            config.getFont(),
            config.getSize(),
            config.isBold(),
            config.isItalic(),
            config.getColor(),
            config.getPosition(),
            config.isStroke(),
            config.getStrokeColor(),
            config.getStrokeWidth()
        );
    }

    /**
     * 关闭文字绘制的默认配置
     */
    public static TextOptions disabled() {
        return from(new TextOverlayConfig());
    }

    /**
     * 是否设置了显式文字
     */
    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public TextOptions withText(String newText) {
        return new TextOptions(enabled, newText, font, sizePx, bold, italic, color,
            position, stroke, strokeColor, strokeWidthPx);
    }

    public TextOptions withColor(String newColor) {
        return new TextOptions(enabled, text, font, sizePx, bold, italic, newColor,
            position, stroke, strokeColor, strokeWidthPx);
    }

    public String resolvedColor() {
        return color == null || color.isBlank() ? DEFAULT_COLOR : color;
    }

    public String resolvedStrokeColor() {
        return strokeColor == null || strokeColor.isBlank() ? DEFAULT_STROKE_COLOR : strokeColor;
    }

    public double resolvedStrokeWidth() {
        return strokeWidthPx == null ? DEFAULT_STROKE_WIDTH : strokeWidthPx;
    }
}
