package com.timxs.photopair.service;

import com.timxs.photopair.model.Transform;

/**
 * 仿射调整解析器
 */
public interface TransformResolver {

    /**
     * 规范化仿射调整
     *
     * @param transform 可为空，为空时返回恒等变换
     * @return 校验过的仿射调整
     * @throws com.timxs.photopair.exception.ConfigurationException 缩放比例不为正数或存在非有限值时抛出
     */
    Transform resolve(Transform transform);
}
