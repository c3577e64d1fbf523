package com.seqindex.store;

import java.time.Instant;
import java.util.List;

/**
 * 索引库统计信息，供命令行以文本或 JSON 输出。
 */
public record StoreStatus(
    String storePath,
    int schemaVersion,
    long recordCount,
    Instant createdAt,
    boolean relativePaths,
    List<FileStatus> files
) {

    /**
     * 单个源文件的登记信息与漂移检查结果。
     */
    public record FileStatus(
        int fileId,
        String path,
        String format,
        String compression,
        long sizeBytes,
        Instant mtime,
        boolean changed
    ) {
    }
}
