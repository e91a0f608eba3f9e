package com.timxs.photopair.service.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.config.TextOverlayConfig;
import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.model.TextPosition;
import com.timxs.photopair.model.Transform;
import com.timxs.photopair.service.SettingsManager;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * 配置管理器实现
 * 从 JSON 设置文件读取配置，转换为 CompositeConfig 对象
 * 文件位置：系统属性 photopair.settings 指定的路径，否则为类路径下的 photopair-settings.json
 */
@Slf4j
@Service
public class SettingsManagerImpl implements SettingsManager {

    /**
     * 指定设置文件路径的系统属性
     */
    public static final String SETTINGS_PROPERTY = "photopair.settings";

    /**
     * 类路径下的默认设置文件
     */
    public static final String DEFAULT_RESOURCE = "photopair-settings.json";

    /**
     * JSON 解析器
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path settingsPath;

    /**
     * 按系统属性定位设置文件
     */
    public SettingsManagerImpl() {
        String property = System.getProperty(SETTINGS_PROPERTY);
        this.settingsPath = property == null || property.isBlank() ? null : Path.of(property);
    }

    /**
     * 使用指定的设置文件
     *
     * @param settingsPath 设置文件路径，为 null 时读取类路径默认文件
     */
    public SettingsManagerImpl(Path settingsPath) {
        this.settingsPath = settingsPath;
    }

    /**
     * 获取当前配置
     * 读取或解析失败时使用默认配置
     *
     * @return 合成配置
     */
    @Override
    public Mono<CompositeConfig> getConfig() {
        return Mono.fromCallable(() -> buildConfig(readSettings()))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Failed to load settings, using defaults: {}", e.getMessage());
                return Mono.just(new CompositeConfig());
            });
    }

    /**
     * 读取设置文件
     *
     * @return 根节点，没有设置文件时为 null
     */
    private JsonNode readSettings() throws IOException {
        if (settingsPath != null) {
            log.info("读取设置文件: {}", settingsPath);
            try (InputStream in = Files.newInputStream(settingsPath)) {
                return OBJECT_MAPPER.readTree(in);
            }
        }
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("未找到 {}，使用默认配置", DEFAULT_RESOURCE);
                return null;
            }
            return OBJECT_MAPPER.readTree(in);
        }
    }

    /**
     * 构建配置对象
     * 各组设置直接绑定到对应的配置类，缺失的字段保留默认值
     *
     * @param root 根节点
     * @return 配置对象
     * @throws IOException 字段类型无法转换时抛出
     */
    CompositeConfig buildConfig(JsonNode root) throws IOException {
        CompositeConfig config = new CompositeConfig();
        if (root == null || !root.isObject()) {
            return config;
        }
        readTextSettings(root.get("text"), config.getText());
        bind(root.get("output"), config.getOutput());
        // 质量是百分比（0-100）
        config.getOutput().setQuality(Math.max(0, Math.min(100, config.getOutput().getQuality())));
        bind(root.get("batch"), config.getBatch());
        readTransforms(root.get("transforms"), config.getTransforms());
        return config;
    }

    /**
     * 文字位置单独解析，无法识别时回退到右下角
     */
    private void readTextSettings(JsonNode node, TextOverlayConfig text) throws IOException {
        if (node == null || !node.isObject()) {
            return;
        }
        ObjectNode fields = node.deepCopy();
        JsonNode position = fields.remove("position");
        bind(fields, text);
        if (position != null && position.isTextual()) {
            try {
                text.setPosition(TextPosition.fromValue(position.asText()));
            } catch (ConfigurationException e) {
                log.warn("未知的文字位置 {}，使用右下角", position.asText());
                text.setPosition(TextPosition.BOTTOM_RIGHT);
            }
        }
        log.debug("读取文字配置 - enabled: {}, text: '{}', position: {}",
            text.isEnabled(), text.getText(), text.getPosition());
    }

    /**
     * 读取按文件名指定的仿射调整
     * 缩放比例的合法性在合成时校验
     */
    private void readTransforms(JsonNode node, Map<String, Transform> transforms) throws IOException {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            TransformSettings settings = OBJECT_MAPPER.treeToValue(field.getValue(), TransformSettings.class);
            transforms.put(field.getKey(), settings.toTransform());
        }
        log.debug("读取照片调整 {} 项", transforms.size());
    }

    private void bind(JsonNode node, Object target) throws IOException {
        if (node != null && node.isObject()) {
            OBJECT_MAPPER.readerForUpdating(target).readValue(node);
        }
    }

    /**
     * 设置文件中单张照片调整的写法
     */
    @Data
    static class TransformSettings {

        private double rotation = 0;

        private double scale = 1;

        private double x = 0;

        private double y = 0;

        Transform toTransform() {
            return Transform.of(rotation, scale, x, y);
        }
    }
}
