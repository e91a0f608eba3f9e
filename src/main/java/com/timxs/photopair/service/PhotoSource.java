package com.timxs.photopair.service;

import com.timxs.photopair.model.SourcePhoto;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * 照片来源
 */
public interface PhotoSource {

    /**
     * 读取目录下的图片文件
     * 配置中按文件名指定的仿射调整会附加到对应照片上
     *
     * @param directory 目录
     * @return 照片列表（未排序）
     */
    Mono<List<SourcePhoto>> load(Path directory);
}
