package com.seqindex.store;

import com.seqindex.storage.CompressionKind;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 文件登记表中的一行：fileId 按登记顺序从 0 递增，在索引库生命周期内保持不变。
 */
public record SourceFile(
        int fileId,
        Path path,
        String format,
        CompressionKind compression,
        long sizeBytes,
        Instant mtime
) {

    public SourceSpec toSpec() {
        return new SourceSpec(path, format);
    }
}
