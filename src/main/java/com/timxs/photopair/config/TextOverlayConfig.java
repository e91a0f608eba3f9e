package com.timxs.photopair.config;

import com.timxs.photopair.model.TextPosition;
import lombok.Data;

/**
 * 文字标签配置
 * 全局生效，每个配对在此基础上代入自己的显示名称
 */
@Data
public class TextOverlayConfig {

    /**
     * 是否绘制文字
     */
    private boolean enabled = false;

    /**
     * 显式文字，为空时使用配对的显示名称
     */
    private String text = "";

    /**
     * 字体名称
     */
    private String font = "SansSerif";

    /**
     * 字体大小（像素）
     */
    private double size = 48;

    private boolean bold = false;

    private boolean italic = false;

    /**
     * 颜色（十六进制，如 #000000）
     */
    private String color = TextOptions.DEFAULT_COLOR;

    /**
     * 文字位置（四角）
     */
    private TextPosition position = TextPosition.BOTTOM_RIGHT;

    /**
     * 是否描边
     */
    private boolean stroke = false;

    private String strokeColor = TextOptions.DEFAULT_STROKE_COLOR;

    /**
     * 描边宽度（像素）
     */
    private Double strokeWidth = TextOptions.DEFAULT_STROKE_WIDTH;
}
