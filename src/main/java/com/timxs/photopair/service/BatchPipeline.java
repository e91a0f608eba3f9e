package com.timxs.photopair.service;

import com.timxs.photopair.config.TextOptions;
import com.timxs.photopair.model.CompositeResult;
import com.timxs.photopair.model.PhotoPair;
import com.timxs.photopair.model.SourcePhoto;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 批处理流水线
 * 逐个合成所有配对，上一张完成之后才开始下一张
 */
public interface BatchPipeline {

    /**
     * 处理已配对的照片
     * 任一配对失败时以 {@link com.timxs.photopair.exception.BatchProcessingException} 结束，不返回部分结果
     *
     * @param pairs             配对列表
     * @param onProgress        进度回调
     * @param globalTextOptions 全局文字配置
     * @return 按配对顺序排列的合成结果
     */
    Mono<List<CompositeResult>> processAll(List<PhotoPair> pairs, ProgressListener onProgress,
                                           TextOptions globalTextOptions);

    /**
     * 先配对再处理
     *
     * @param left              左侧照片
     * @param right             右侧照片
     * @param onProgress        进度回调
     * @param globalTextOptions 全局文字配置
     * @return 按配对顺序排列的合成结果
     */
    Mono<List<CompositeResult>> processAll(List<SourcePhoto> left, List<SourcePhoto> right,
                                           ProgressListener onProgress, TextOptions globalTextOptions);
}
