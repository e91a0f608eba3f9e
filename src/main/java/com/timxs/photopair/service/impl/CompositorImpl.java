package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.exception.DecodeException;
import com.timxs.photopair.model.CompositeResult;
import com.timxs.photopair.model.DrawSpec;
import com.timxs.photopair.model.PhotoSide;
import com.timxs.photopair.model.SourcePhoto;
import com.timxs.photopair.model.Transform;
import com.timxs.photopair.service.Compositor;
import com.timxs.photopair.service.HalfPlaneLayout;
import com.timxs.photopair.service.ImageEncoder;
import com.timxs.photopair.service.RenderSurfaceFactory;
import com.timxs.photopair.service.TextOverlayService;
import com.timxs.photopair.service.TransformResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;

/**
 * 合成器实现
 * 处理顺序：解析配置 -> 创建画布 -> 并行解码 -> 左右绘制 -> 文字 -> 编码
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompositorImpl implements Compositor {

    private final TransformResolver transformResolver;

    private final HalfPlaneLayout halfPlaneLayout;

    private final TextOverlayService textOverlayService;

    private final RenderSurfaceFactory surfaceFactory;

    private final ImageEncoder imageEncoder;

    private final CompositeConfig config;

    /**
     * 合成一对照片
     * 配置错误在绘制前抛出；解码在弹性线程池中执行，两侧都完成后才开始绘制
     *
     * @param left        左侧照片
     * @param right       右侧照片
     * @param name        结果名称
     * @param textOptions 文字配置
     * @return 合成结果（异步）
     */
    @Override
    public Mono<CompositeResult> compose(SourcePhoto left, SourcePhoto right, String name,
                                         TextOptions textOptions) {
        if (left == null || right == null) {
            return Mono.error(new IllegalArgumentException("Both photos are required"));
        }
        return Mono.defer(() -> {
            Transform leftTransform = transformResolver.resolve(left.transform());
            Transform rightTransform = transformResolver.resolve(right.transform());
            TextOptions text = resolveText(textOptions, name);

            BufferedImage surface = surfaceFactory.create();

            return Mono.zip(decode(left, PhotoSide.LEFT), decode(right, PhotoSide.RIGHT))
                .publishOn(Schedulers.boundedElastic())
                .map(images -> {
                    render(surface, images.getT1(), leftTransform, images.getT2(), rightTransform, text);
                    byte[] encoded = imageEncoder.encodeJpeg(surface, config.getOutput().getQuality() / 100f);
                    log.debug("合成完成: {} ({} + {}), {} bytes", name, left.name(), right.name(), encoded.length);
                    return new CompositeResult(encoded, name, left.name(), right.name(), text,
                        new CompositeResult.AppliedTransforms(leftTransform, rightTransform));
                });
        });
    }

    /**
     * 解析文字配置
     * 未提供配置时视为不绘制文字，仅记录名称
     */
    private TextOptions resolveText(TextOptions textOptions, String name) {
        if (textOptions == null) {
            return TextOptions.disabled().withText(name);
        }
        if (textOptions.hasText()) {
            return textOptions;
        }
        // 没有显式文字时使用配对的显示名称
        if (name == null || name.isBlank()) {
            if (textOptions.enabled()) {
                throw new ConfigurationException("Text rendering is enabled but neither text nor a name is available");
            }
            return textOptions;
        }
        return textOptions.withText(name);
    }

    /**
     * 解码源照片
     * ImageIO 无法识别时返回 null，同样视为解码失败
     *
     * @param photo 源照片
     * @param side  所在半幅
     * @return 解码后的图片（异步）
     */
    private Mono<BufferedImage> decode(SourcePhoto photo, PhotoSide side) {
        return Mono.fromCallable(() -> {
                BufferedImage image = ImageIO.read(new ByteArrayInputStream(photo.data()));
                if (image == null) {
                    throw new DecodeException(side, photo.name(), "unsupported or corrupt image data");
                }
                log.debug("{} 照片解码成功: {} {}x{}", side.getLabel(), photo.name(),
                    image.getWidth(), image.getHeight());
                return image;
            })
            .onErrorMap(e -> !(e instanceof DecodeException), e -> new DecodeException(side, photo.name(), e))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 在画布上绘制左右照片和文字
     * 每侧只有一次 drawImage 调用，画布不设置裁剪区域
     */
    private void render(BufferedImage surface, BufferedImage leftImage, Transform leftTransform,
                        BufferedImage rightImage, Transform rightTransform, TextOptions text) {
        Graphics2D g2d = surface.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            drawPhoto(g2d, leftImage, PhotoSide.LEFT, leftTransform);
            drawPhoto(g2d, rightImage, PhotoSide.RIGHT, rightTransform);

            if (text.enabled() && text.hasText()) {
                textOverlayService.draw(g2d, text, surface.getWidth(), surface.getHeight());
            }
        } finally {
            g2d.dispose();
        }
    }

    private void drawPhoto(Graphics2D g2d, BufferedImage image, PhotoSide side, Transform transform) {
        DrawSpec spec = halfPlaneLayout.layout(image.getWidth(), image.getHeight(), side, transform);
        g2d.drawImage(image, spec.imageTransform(image.getWidth(), image.getHeight()), null);
    }
}
