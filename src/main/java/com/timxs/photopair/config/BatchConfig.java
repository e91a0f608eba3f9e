package com.timxs.photopair.config;

import lombok.Data;

import java.util.List;

/**
 * 批处理配置
 */
@Data
public class BatchConfig {

    /**
     * 每张合成图完成后的让出间隔（毫秒），0 表示不等待
     */
    private long yieldMillis = 50;

    /**
     * 文件名排序使用的语言环境（BCP 47 标签）
     */
    private String sortLocale = "en";

    /**
     * 读取目录时允许的扩展名
     */
    private List<String> allowedExtensions = List.of("jpg", "jpeg", "png", "gif", "bmp");
}
