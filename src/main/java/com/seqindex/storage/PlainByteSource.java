package com.seqindex.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

/**
 * 未压缩文件的字节源，偏移即原始文件偏移。
 */
public final class PlainByteSource extends BufferedByteSource {
    private final int bufferSize;
    private long bufferStart;

    PlainByteSource(Path path, RandomAccessFile randomAccessFile, int bufferSize) {
        super(path, randomAccessFile);
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须为正数: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    @Override
    public CompressionKind compression() {
        return CompressionKind.NONE;
    }

    @Override
    public long tell() throws IOException {
        ensureOpen();
        return bufferStart + bufferPosition;
    }

    @Override
    public void seek(long offset) throws IOException {
        ensureOpen();
        if (offset < 0) {
            throw new IllegalArgumentException("偏移不能为负数: " + offset);
        }
        if (offset >= bufferStart && offset <= bufferStart + bufferLength) {
            bufferPosition = (int) (offset - bufferStart);
            return;
        }
        bufferStart = offset;
        bufferLength = 0;
        bufferPosition = 0;
    }

    @Override
    protected boolean nextBuffer() throws IOException {
        bufferStart += bufferLength;
        bufferLength = 0;
        bufferPosition = 0;
        if (buffer.length != bufferSize) {
            buffer = new byte[bufferSize];
        }
        randomAccessFile.seek(bufferStart);
        int readBytes = randomAccessFile.read(buffer, 0, bufferSize);
        if (readBytes <= 0) {
            return false;
        }
        bufferLength = readBytes;
        return true;
    }
}
