package com.timxs.photopair.service.impl;

import com.timxs.photopair.service.ImageEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * JPEG 编码器
 * 使用 ImageIO 的 ImageWriter 显式设置压缩质量
 */
@Slf4j
@Service
public class JpegImageEncoder implements ImageEncoder {

    private static final String FORMAT_NAME = "jpg";

    /**
     * 编码为 JPEG
     *
     * @param image   画布
     * @param quality 输出质量（0.0-1.0）
     * @return JPEG 数据
     * @throws IllegalArgumentException 图片为空或质量越界时抛出
     * @throws UncheckedIOException     写入失败时抛出
     */
    @Override
    public byte[] encodeJpeg(BufferedImage image, float quality) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        if (quality < 0f || quality > 1f) {
            throw new IllegalArgumentException("Quality must be between 0.0 and 1.0, got " + quality);
        }

        // JPEG 不支持 Alpha 通道，需要转换为 RGB
        BufferedImage rgbImage = convertToRGB(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT_NAME);
        if (!writers.hasNext()) {
            throw new IllegalStateException("No appropriate writer found for format: " + FORMAT_NAME);
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);

            writer.write(null, new IIOImage(rgbImage, null, null), param);
            ios.flush();
        } catch (IOException e) {
            log.error("JPEG 编码失败: {}", e.getMessage(), e);
            throw new UncheckedIOException("Failed to encode image as JPEG", e);
        } finally {
            writer.dispose();
        }

        byte[] data = outputStream.toByteArray();
        log.debug("JPEG 编码完成，尺寸: {}x{}, 质量: {}, 大小: {} bytes",
            rgbImage.getWidth(), rgbImage.getHeight(), quality, data.length);
        return data;
    }

    /**
     * 将任意类型的 BufferedImage 转换为 TYPE_INT_RGB
     * 透明区域填充为白色
     *
     * @param src 源图片
     * @return RGB 格式的图片
     */
    private BufferedImage convertToRGB(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        log.debug("将图片从类型 {} 转换为 RGB", src.getType());
        BufferedImage rgb = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, src.getWidth(), src.getHeight());
        g.drawImage(src, 0, 0, null);
        g.dispose();
        return rgb;
    }
}
