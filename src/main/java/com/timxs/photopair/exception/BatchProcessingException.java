package com.timxs.photopair.exception;

import lombok.Getter;

/**
 * 批处理失败
 * 包装导致失败的原始异常，并记录出错配对的序号和名称
 */
@Getter
public class BatchProcessingException extends CompositeException {

    /**
     * 出错配对的序号（从 0 开始）
     */
    private final int pairIndex;

    /**
     * 出错配对的显示名称，画布预检失败时为 null
     */
    private final String pairName;

    public BatchProcessingException(int pairIndex, String pairName, Throwable cause) {
        super(String.format("Pair #%d%s failed: %s", pairIndex,
            pairName != null ? " (" + pairName + ")" : "", cause.getMessage()), cause);
        this.pairIndex = pairIndex;
        this.pairName = pairName;
    }
}
