package com.timxs.photopair.exception;

/**
 * 配置错误
 * 如缩放比例不为正数，或启用了文字却既没有显式文字也无法解析出显示名称
 * 在绘制该配对之前抛出
 */
public class ConfigurationException extends CompositeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
