package com.timxs.photopair.service.impl;

import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.model.Transform;
import com.timxs.photopair.service.TransformResolver;
import org.springframework.stereotype.Service;

/**
 * 仿射调整解析器实现
 * 旋转角度不限范围；缩放比例必须为正数
 */
@Service
public class TransformResolverImpl implements TransformResolver {

    @Override
    public Transform resolve(Transform transform) {
        if (transform == null) {
            return Transform.IDENTITY;
        }
        if (!Double.isFinite(transform.rotationDegrees())
            || !Double.isFinite(transform.offsetX())
            || !Double.isFinite(transform.offsetY())) {
            throw new ConfigurationException("Transform values must be finite: " + transform);
        }
        if (!Double.isFinite(transform.scale()) || transform.scale() <= 0) {
            throw new ConfigurationException("Transform scale must be greater than 0, got " + transform.scale());
        }
        return transform;
    }
}
