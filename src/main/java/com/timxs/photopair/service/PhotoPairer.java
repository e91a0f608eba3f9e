package com.timxs.photopair.service;

import com.timxs.photopair.model.PhotoPair;
import com.timxs.photopair.model.SourcePhoto;

import java.util.List;
import java.util.Optional;

/**
 * 照片配对器
 * 两组照片各自按文件名排序后按位置配对，配对不依据文件名是否相同
 */
public interface PhotoPairer {

    /**
     * 配对两组照片
     * 结果长度为两组中较短的一组，较长一组多出的照片被丢弃
     *
     * @param left  左侧照片
     * @param right 右侧照片
     * @return 按排序后位置配对的结果
     */
    List<PhotoPair> pair(List<SourcePhoto> left, List<SourcePhoto> right);

    /**
     * 从文件名解析显示名称
     * 例如 Smith_John_01.jpg -> John Smith
     *
     * @param filename 文件名
     * @return 显示名称；文件名不含 "_01" 或不足两段时为空
     */
    Optional<String> deriveDisplayName(String filename);
}
