package com.timxs.photopair.config;

import com.timxs.photopair.model.CompositeResult;
import lombok.Data;

/**
 * 输出配置
 * 控制合成图编码和压缩包命名
 */
@Data
public class OutputConfig {

    /**
     * JPEG 输出质量（0-100）
     */
    private int quality = 90;

    /**
     * 压缩包文件名
     */
    private String archiveName = "processed_images.zip";

    /**
     * 压缩包内条目的后缀，拼接在合成结果名称之后
     */
    private String entrySuffix = CompositeResult.ENTRY_SUFFIX;
}
