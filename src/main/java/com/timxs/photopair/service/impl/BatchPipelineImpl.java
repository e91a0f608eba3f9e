package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.exception.BatchProcessingException;
import com.timxs.photopair.exception.ConfigurationException;
import com.timxs.photopair.model.CompositeResult;
import com.timxs.photopair.model.PhotoPair;
import com.timxs.photopair.model.SourcePhoto;
import com.timxs.photopair.service.BatchPipeline;
import com.timxs.photopair.service.Compositor;
import com.timxs.photopair.service.PhotoPairer;
import com.timxs.photopair.service.ProgressListener;
import com.timxs.photopair.service.RenderSurfaceFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * 批处理流水线实现
 * 使用 concatMap 保证同一时间只有一张合成图在处理
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchPipelineImpl implements BatchPipeline {

    private final PhotoPairer photoPairer;

    private final Compositor compositor;

    private final RenderSurfaceFactory surfaceFactory;

    private final CompositeConfig config;

    @Override
    public Mono<List<CompositeResult>> processAll(List<SourcePhoto> left, List<SourcePhoto> right,
                                                  ProgressListener onProgress, TextOptions globalTextOptions) {
        return Mono.fromCallable(() -> photoPairer.pair(left, right))
            .flatMap(pairs -> processAll(pairs, onProgress, globalTextOptions));
    }

    /**
     * 处理已配对的照片
     * 开始前先试建一次画布，画布不可用时在处理任何配对之前失败
     *
     * @param pairs             配对列表
     * @param onProgress        进度回调
     * @param globalTextOptions 全局文字配置
     * @return 合成结果
     */
    @Override
    public Mono<List<CompositeResult>> processAll(List<PhotoPair> pairs, ProgressListener onProgress,
                                                  TextOptions globalTextOptions) {
        if (pairs == null) {
            return Mono.error(new IllegalArgumentException("Pairs cannot be null"));
        }
        if (pairs.isEmpty()) {
            log.info("没有可处理的配对");
            return Mono.just(List.of());
        }

        ProgressListener listener = onProgress != null ? onProgress : ProgressListener.noop();
        TextOptions globalText = globalTextOptions != null ? globalTextOptions : TextOptions.disabled();
        int total = pairs.size();
        Duration yieldInterval = Duration.ofMillis(Math.max(0, config.getBatch().getYieldMillis()));

        return Mono.fromRunnable(surfaceFactory::create)
            .onErrorMap(e -> new BatchProcessingException(0, null, e))
            .thenMany(Flux.range(0, total)
                .concatMap(i -> processPair(i, pairs.get(i), total, listener, globalText, yieldInterval)))
            .collectList()
            .doOnSubscribe(s -> log.info("开始批处理，共 {} 对照片", total))
            .doOnSuccess(results -> log.info("批处理完成，生成 {} 张合成图", results.size()))
            .doOnError(e -> log.error("批处理中止: {}", e.getMessage()));
    }

    /**
     * 处理单个配对
     * 完成后报告进度，再让出一小段时间
     */
    private Mono<CompositeResult> processPair(int index, PhotoPair pair, int total, ProgressListener listener,
                                              TextOptions globalText, Duration yieldInterval) {
        Mono<CompositeResult> composite = Mono.defer(() ->
                compositor.compose(pair.left(), pair.right(), pair.displayName(), textFor(pair, globalText)))
            .onErrorMap(e -> new BatchProcessingException(index, pair.displayName(), e))
            .doOnNext(result -> {
                double percent = (index + 1) / (double) total * 100;
                log.debug("合成进度 {}/{}: {}", index + 1, total, result.name());
                listener.onProgress(percent);
            });
        if (yieldInterval.isZero()) {
            return composite;
        }
        return composite.delayElement(yieldInterval);
    }

    /**
     * 计算单个配对的文字配置
     * 启用时优先使用显式文字，否则使用显示名称；未启用时仍把显示名称记录在 text 中
     *
     * @throws ConfigurationException 启用文字但既无显式文字也无法解析显示名称时抛出
     */
    TextOptions textFor(PhotoPair pair, TextOptions globalText) {
        String text;
        if (globalText.enabled() && globalText.hasText()) {
            text = globalText.text();
        } else if (globalText.enabled()) {
            if (!pair.nameDerived()) {
                throw new ConfigurationException(
                    "Text is enabled without explicit text and no name can be derived from " + pair.left().name());
            }
            text = pair.displayName();
        } else {
            text = pair.displayName();
        }
        return globalText.withText(text).withColor(globalText.resolvedColor());
    }
}
