package com.timxs.photopair.service;

import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.model.CompositeResult;
import com.timxs.photopair.model.SourcePhoto;
import reactor.core.publisher.Mono;

/**
 * 合成器
 * 把一对照片绘制到同一张画布上并编码
 */
public interface Compositor {

    /**
     * 合成一对照片
     * 两张照片并行解码，任一失败则整个合成失败，不会产生占位图
     *
     * @param left        左侧照片
     * @param right       右侧照片
     * @param name        结果名称
     * @param textOptions 文字配置（text 已解析）
     * @return 合成结果（异步）
     */
    Mono<CompositeResult> compose(SourcePhoto left, SourcePhoto right, String name, TextOptions textOptions);
}
