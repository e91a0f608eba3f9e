package com.timxs.photopair;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.service.ArchiveWriter;
import com.timxs.photopair.service.BatchPipeline;
import com.timxs.photopair.service.PhotoSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

/**
 * 成对照片合成的完整流程
 * 读取两个目录 -> 批量合成 -> 写入压缩包
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PhotoPairRunner {

    private final PhotoSource photoSource;

    private final BatchPipeline batchPipeline;

    private final ArchiveWriter archiveWriter;

    private final CompositeConfig config;

    /**
     * 执行合成
     *
     * @param leftDirectory   左侧照片目录
     * @param rightDirectory  右侧照片目录
     * @param outputDirectory 压缩包输出目录
     * @return 压缩包路径（异步）
     */
    public Mono<Path> run(Path leftDirectory, Path rightDirectory, Path outputDirectory) {
        TextOptions textOptions = TextOptions.from(config.getText());
        return Mono.zip(photoSource.load(leftDirectory), photoSource.load(rightDirectory))
            .flatMap(photos -> batchPipeline.processAll(photos.getT1(), photos.getT2(),
                this::logProgress, textOptions))
            .flatMap(results -> Mono.fromCallable(() -> archiveWriter.writeTo(results, outputDirectory))
                .subscribeOn(Schedulers.boundedElastic()));
    }

    private void logProgress(double percent) {
        log.info("合成进度: {}%", String.format("%.1f", percent));
    }
}
