package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.model.TextPlacement;
import com.timxs.photopair.model.TextPosition;
import com.timxs.photopair.service.TextOverlayService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.util.ArrayList;
import java.util.List;

/**
 * 文字标签服务实现
 * 使用 Java 2D Graphics API 绘制文字，描边通过字形轮廓实现
 */
@Slf4j
@Service
public class TextOverlayServiceImpl implements TextOverlayService {

    private static final String DEFAULT_FONT = "SansSerif";

    /**
     * 计算文字锚点
     *
     * @param options      文字配置
     * @param canvasWidth  画布宽度
     * @param canvasHeight 画布高度
     * @param textWidth    文字测量宽度
     * @return 锚点
     */
    @Override
    public TextPlacement place(TextOptions options, int canvasWidth, int canvasHeight, double textWidth) {
        if (options == null) {
            throw new IllegalArgumentException("Text options cannot be null");
        }
        TextPosition position = options.position() != null ? options.position() : TextPosition.BOTTOM_RIGHT;
        double x = position.calculateX(canvasWidth, textWidth, MARGIN);
        double y = position.calculateY(canvasHeight, options.sizePx(), MARGIN);
        return new TextPlacement(x, y, textWidth, describeFont(options));
    }

    /**
     * 根据加粗、斜体、字号和字体名称创建字体
     *
     * @param options 文字配置
     * @return 字体
     * @throws ConfigurationException 字号不为正数时抛出
     */
    @Override
    public Font resolveFont(TextOptions options) {
        if (!(options.sizePx() > 0)) {
            throw new ConfigurationException("Text size must be greater than 0, got " + options.sizePx());
        }
        int style = Font.PLAIN;
        if (options.bold()) {
            style |= Font.BOLD;
        }
        if (options.italic()) {
            style |= Font.ITALIC;
        }
        return new Font(fontFamily(options), style, 1).deriveFont(style, (float) options.sizePx());
    }

    /**
     * 绘制文字
     * 启用描边时先画轮廓再填充，填充覆盖在轮廓之上
     *
     * @param g2d          画布
     * @param options      文字配置
     * @param canvasWidth  画布宽度
     * @param canvasHeight 画布高度
     * @return 实际使用的锚点
     */
    @Override
    public TextPlacement draw(Graphics2D g2d, TextOptions options, int canvasWidth, int canvasHeight) {
        if (g2d == null) {
            throw new IllegalArgumentException("Graphics cannot be null");
        }
        if (options == null || !options.hasText()) {
            throw new ConfigurationException("Text rendering requires a non-empty text");
        }

        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);

        Font font = resolveFont(options);
        g2d.setFont(font);
        FontMetrics metrics = g2d.getFontMetrics(font);
        String text = options.text();
        int textWidth = metrics.stringWidth(text);

        TextPlacement placement = place(options, canvasWidth, canvasHeight, textWidth);
        log.debug("文字标签 '{}' 字体: {}, 宽度: {}, 锚点: ({}, {})",
            text, placement.fontDescriptor(), textWidth, placement.x(), placement.y());

        if (options.stroke()) {
            Shape outline = font.createGlyphVector(g2d.getFontRenderContext(), text)
                .getOutline((float) placement.x(), (float) placement.y());
            g2d.setColor(parseColor(options.resolvedStrokeColor(), Color.WHITE));
            g2d.setStroke(new BasicStroke((float) options.resolvedStrokeWidth()));
            g2d.draw(outline);
        }

        g2d.setColor(parseColor(options.resolvedColor(), Color.BLACK));
        g2d.drawString(text, (float) placement.x(), (float) placement.y());
        return placement;
    }

    /**
     * 字体描述，如 "bold italic 48px SansSerif"
     */
    String describeFont(TextOptions options) {
        List<String> parts = new ArrayList<>();
        if (options.bold()) {
            parts.add("bold");
        }
        if (options.italic()) {
            parts.add("italic");
        }
        parts.add(formatSize(options.sizePx()) + "px");
        parts.add(fontFamily(options));
        return String.join(" ", parts);
    }

    private String fontFamily(TextOptions options) {
        return options.font() == null || options.font().isBlank() ? DEFAULT_FONT : options.font();
    }

    private String formatSize(double size) {
        return size == Math.rint(size) ? String.valueOf((long) size) : String.valueOf(size);
    }

    /**
     * 解析颜色字符串
     * 支持十六进制格式（如 #FFFFFF、FFFFFF 或 #FFF）
     *
     * @param colorStr     颜色字符串
     * @param defaultColor 解析失败时使用的颜色
     * @return Color 对象
     */
    Color parseColor(String colorStr, Color defaultColor) {
        if (colorStr == null || colorStr.isBlank()) {
            return defaultColor;
        }

        // 去掉 # 前缀
        String hex = colorStr.trim();
        hex = hex.startsWith("#") ? hex.substring(1) : hex;
        // 三位简写展开为六位
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        if (hex.length() != 6) {
            log.warn("Invalid color format: {}, using default", colorStr);
            return defaultColor;
        }
        try {
            return new Color(Integer.parseInt(hex, 16));
        } catch (NumberFormatException e) {
            log.warn("Invalid color format: {}, using default", colorStr);
            return defaultColor;
        }
    }
}
