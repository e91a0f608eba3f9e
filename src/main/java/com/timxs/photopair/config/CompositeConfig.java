package com.timxs.photopair.config;

import com.timxs.photopair.model.Transform;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 合成配置
 * 包含文字标签、输出、批处理设置以及按文件名指定的照片调整
 */
@Data
public class CompositeConfig {

    // ========== 文字标签 ==========

    private TextOverlayConfig text = new TextOverlayConfig();

    // ========== 输出 ==========

    private OutputConfig output = new OutputConfig();

    // ========== 批处理 ==========

    private BatchConfig batch = new BatchConfig();

    // ========== 照片调整 ==========

    /**
     * 文件名 -> 仿射调整，未列出的照片使用恒等变换
     */
    private Map<String, Transform> transforms = new LinkedHashMap<>();
}
