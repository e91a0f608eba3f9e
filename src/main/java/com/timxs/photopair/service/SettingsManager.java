package com.timxs.photopair.service;

import com.timxs.photopair.config.CompositeConfig;
import reactor.core.publisher.Mono;

/**
 * 配置管理器接口
 * 从 JSON 设置文件中读取配置
 */
public interface SettingsManager {

    /**
     * 获取当前配置
     *
     * @return 合成配置
     */
    Mono<CompositeConfig> getConfig();
}
