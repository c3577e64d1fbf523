package com.seqindex.storage;

import java.util.Locale;

/**
 * 源文件压缩类型。AUTO 仅用于打开文件时的探测请求，不会写入索引库。
 */
public enum CompressionKind {
    AUTO,
    NONE,
    BGZF;

    public static CompressionKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("压缩类型不能为空");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("未知压缩类型: " + value, exception);
        }
    }
}
