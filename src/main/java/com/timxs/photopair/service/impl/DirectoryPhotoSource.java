package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.model.SourcePhoto;
import com.timxs.photopair.service.PhotoSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * 目录照片来源
 * 只读取目录第一层中扩展名在允许列表内的文件
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectoryPhotoSource implements PhotoSource {

    private final CompositeConfig config;

    @Override
    public Mono<List<SourcePhoto>> load(Path directory) {
        return Mono.fromCallable(() -> readDirectory(directory))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private List<SourcePhoto> readDirectory(Path directory) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(this::isAllowedExtension)
                .toList();
        }

        List<SourcePhoto> photos = new ArrayList<>(files.size());
        for (Path file : files) {
            String name = file.getFileName().toString();
            photos.add(new SourcePhoto(name, Files.readAllBytes(file), config.getTransforms().get(name)));
        }
        log.info("从 {} 读取 {} 张照片", directory, photos.size());
        return photos;
    }

    /**
     * 检查文件扩展名是否在允许列表中
     */
    private boolean isAllowedExtension(Path file) {
        String name = file.getFileName().toString();
        int lastDotIndex = name.lastIndexOf('.');
        if (lastDotIndex <= 0) {
            return false;
        }
        String extension = name.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
        List<String> allowed = config.getBatch().getAllowedExtensions();
        return allowed != null && allowed.stream()
            .anyMatch(item -> item.trim().toLowerCase(Locale.ROOT).replace(".", "").equals(extension));
    }
}
