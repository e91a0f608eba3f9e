package com.timxs.photopair.service.impl;

import com.timxs.photopair.config.CompositeConfig;
import com.timxs.photopair.model.PhotoPair;
import com.timxs.photopair.model.SourcePhoto;
import com.timxs.photopair.service.PhotoPairer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 照片配对器实现
 * 使用 Collator 按语言环境排序文件名
 */
@Slf4j
@Service
public class PhotoPairerImpl implements PhotoPairer {

    /**
     * 文件名中序号标记，显示名称取标记之前的部分
     */
    private static final String SEQUENCE_MARKER = "_01";

    private static final String NAME_SEPARATOR = "_";

    /**
     * 按配置语言环境创建的排序原型，Collator 非线程安全，使用时复制
     */
    private final Collator collator;

    public PhotoPairerImpl(CompositeConfig config) {
        this.collator = Collator.getInstance(Locale.forLanguageTag(config.getBatch().getSortLocale()));
    }

    @Override
    public List<PhotoPair> pair(List<SourcePhoto> left, List<SourcePhoto> right) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Photo collections cannot be null");
        }

        Comparator<SourcePhoto> byName = nameComparator();
        List<SourcePhoto> sortedLeft = left.stream().sorted(byName).toList();
        List<SourcePhoto> sortedRight = right.stream().sorted(byName).toList();

        int total = Math.min(sortedLeft.size(), sortedRight.size());
        if (sortedLeft.size() != sortedRight.size()) {
            log.debug("两组照片数量不一致（左 {} / 右 {}），按 {} 对处理，多余照片被丢弃",
                sortedLeft.size(), sortedRight.size(), total);
        }

        List<PhotoPair> pairs = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            SourcePhoto leftPhoto = sortedLeft.get(i);
            SourcePhoto rightPhoto = sortedRight.get(i);
            Optional<String> derived = deriveDisplayName(leftPhoto.name());
            if (derived.isEmpty()) {
                log.warn("无法从文件名解析显示名称，使用文件名代替: {}", leftPhoto.name());
            }
            String displayName = derived.orElseGet(() -> stripExtension(leftPhoto.name()));
            pairs.add(new PhotoPair(i, leftPhoto, rightPhoto, displayName, derived.isPresent()));
        }
        return pairs;
    }

    @Override
    public Optional<String> deriveDisplayName(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int markerIndex = filename.indexOf(SEQUENCE_MARKER);
        if (markerIndex < 0) {
            return Optional.empty();
        }
        // 第一段为姓，第二段为名，其余部分忽略
        String[] parts = filename.substring(0, markerIndex).split(NAME_SEPARATOR, -1);
        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return Optional.empty();
        }
        String lastName = parts[0];
        String firstName = parts[1];
        return Optional.of(firstName + " " + lastName);
    }

    /**
     * 文件名比较器，每次配对使用独立的 Collator 副本
     */
    private Comparator<SourcePhoto> nameComparator() {
        return Comparator.comparing(SourcePhoto::name, (Collator) collator.clone());
    }

    private String stripExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        return lastDotIndex > 0 ? filename.substring(0, lastDotIndex) : filename;
    }
}
