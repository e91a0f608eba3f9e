package com.timxs.photopair.service;

import com.timxs.photopair.model.CompositeResult;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * 压缩包写入器
 * 每个合成结果一个条目，内容为原样的 JPEG 数据
 */
public interface ArchiveWriter {

    /**
     * 写入到输出流
     *
     * @param results 合成结果
     * @param out     输出流（不会被关闭）
     * @throws IOException 写入失败时抛出
     */
    void write(List<CompositeResult> results, OutputStream out) throws IOException;

    /**
     * 在目录下创建压缩包
     *
     * @param results   合成结果
     * @param directory 输出目录
     * @return 压缩包路径
     * @throws IOException 写入失败时抛出
     */
    Path writeTo(List<CompositeResult> results, Path directory) throws IOException;
}
