package com.seqindex.storage;

import java.io.IOException;

/**
 * 压缩块校验失败（CRC32、ISIZE 或 BSIZE 不一致）或块被截断时抛出。
 */
public class CorruptContainerException extends IOException {
    private final long blockStart;

    public CorruptContainerException(String message, long blockStart) {
        super(message + ", blockStart=" + blockStart);
        this.blockStart = blockStart;
    }

    public CorruptContainerException(String message, long blockStart, Throwable cause) {
        super(message + ", blockStart=" + blockStart, cause);
        this.blockStart = blockStart;
    }

    public long getBlockStart() {
        return blockStart;
    }
}
