package com.timxs.photopair;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.service.SettingsManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Spring 配置
 * 扫描所有服务，并在启动时读取一次合成配置
 */
@Configuration
@ComponentScan(basePackageClasses = PhotoPairConfiguration.class)
public class PhotoPairConfiguration {

    @Bean
    public CompositeConfig compositeConfig(SettingsManager settingsManager) {
        return settingsManager.getConfig().block();
    }
}
