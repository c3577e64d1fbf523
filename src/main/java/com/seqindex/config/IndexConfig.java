package com.seqindex.config;

import com.seqindex.storage.CompressionKind;

/**
 * 索引运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class IndexConfig {
    private int readBufferSize = Constants.DEFAULT_READ_BUFFER_SIZE;
    private int insertBatchSize = Constants.DEFAULT_INSERT_BATCH_SIZE;
    private int keyPageSize = Constants.DEFAULT_KEY_PAGE_SIZE;
    private boolean relativePaths = true;
    private CompressionKind compression = CompressionKind.AUTO;

    public int getReadBufferSize() {
        return readBufferSize;
    }

    public void setReadBufferSize(int readBufferSize) {
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize 必须为正数: " + readBufferSize);
        }
        this.readBufferSize = readBufferSize;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public void setInsertBatchSize(int insertBatchSize) {
        if (insertBatchSize <= 0) {
            throw new IllegalArgumentException("insertBatchSize 必须为正数: " + insertBatchSize);
        }
        this.insertBatchSize = insertBatchSize;
    }

    public int getKeyPageSize() {
        return keyPageSize;
    }

    public void setKeyPageSize(int keyPageSize) {
        if (keyPageSize <= 0) {
            throw new IllegalArgumentException("keyPageSize 必须为正数: " + keyPageSize);
        }
        this.keyPageSize = keyPageSize;
    }

    /**
     * 是否以索引库所在目录为基准保存源文件相对路径
     */
    public boolean isRelativePaths() {
        return relativePaths;
    }

    public void setRelativePaths(boolean relativePaths) {
        this.relativePaths = relativePaths;
    }

    public CompressionKind getCompression() {
        return compression;
    }

    public void setCompression(CompressionKind compression) {
        if (compression == null) {
            throw new IllegalArgumentException("compression 不能为空");
        }
        this.compression = compression;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }
}
