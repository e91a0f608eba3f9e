package com.timxs.photopair.model;

/**
 * 照片所在半幅
 */
public enum PhotoSide {
    /**
     * 左半幅（索引 0）
     */
    LEFT(0, "left"),

    /**
     * 右半幅（索引 1）
     */
    RIGHT(1, "right");

    private final int halfIndex;

    private final String label;

    PhotoSide(int halfIndex, String label) {
        this.halfIndex = halfIndex;
        this.label = label;
    }

    public int getHalfIndex() {
        return halfIndex;
    }

    public String getLabel() {
        return label;
    }
}
