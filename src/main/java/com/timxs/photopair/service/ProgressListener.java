package com.timxs.photopair.service;

/**
 * 批处理进度回调
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 每完成一张合成图调用一次
     *
     * @param percent 完成百分比（0-100），最后一次恰好为 100
     */
    void onProgress(double percent);

    static ProgressListener noop() {
        return percent -> {
        };
    }
}
