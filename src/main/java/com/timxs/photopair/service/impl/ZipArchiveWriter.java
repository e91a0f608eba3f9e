package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.model.CompositeResult;
import com.timxs.photopair.service.ArchiveWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * ZIP 压缩包写入器
 * 条目按结果顺序写入，名称为 结果名称 + 后缀；重名时追加 " (n)"
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZipArchiveWriter implements ArchiveWriter {

    private final CompositeConfig config;

    @Override
    public void write(List<CompositeResult> results, OutputStream out) throws IOException {
        if (results == null || out == null) {
            throw new IllegalArgumentException("Results and output stream cannot be null");
        }
        ZipOutputStream zip = new ZipOutputStream(out);
        Set<String> usedNames = new HashSet<>();
        for (CompositeResult result : results) {
            String entryName = uniqueEntryName(result, usedNames);
            byte[] data = result.encodedImage();
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(data);
            zip.closeEntry();
            log.debug("写入条目 {} ({} bytes)", entryName, data.length);
        }
        // 只结束 ZIP 结构，输出流由调用方关闭
        zip.finish();
    }

    @Override
    public Path writeTo(List<CompositeResult> results, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(config.getOutput().getArchiveName());
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
            write(results, out);
        }
        log.info("已生成压缩包 {}，共 {} 个条目", target, results.size());
        return target;
    }

    private String uniqueEntryName(CompositeResult result, Set<String> usedNames) {
        String name = result.name();
        String suffix = config.getOutput().getEntrySuffix();
        String candidate = result.entryName(suffix);
        int counter = 2;
        while (!usedNames.add(candidate)) {
            candidate = name + " (" + counter++ + ")" + suffix;
        }
        if (counter > 2) {
            log.warn("条目名称重复: {}，改为 {}", result.entryName(suffix), candidate);
        }
        return candidate;
    }
}
