package com.seqindex.store;

import java.nio.file.Path;

/**
 * 构建索引库时声明的一个源文件及其格式。
 */
public record SourceSpec(Path path, String format) {

    public SourceSpec {
        if (path == null) {
            throw new IllegalArgumentException("源文件路径不能为空");
        }
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("源文件格式不能为空: " + path);
        }
    }
}
