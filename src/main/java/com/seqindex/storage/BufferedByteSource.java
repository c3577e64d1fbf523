package com.seqindex.storage;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.function.IntPredicate;

/**
 * 基于单缓冲区的字节源骨架，子类负责按需装载下一段数据（文件分片或解压块）。
 */
abstract class BufferedByteSource implements ByteSource {
    protected final Path path;
    protected final RandomAccessFile randomAccessFile;
    protected byte[] buffer = new byte[0];
    protected int bufferLength;
    protected int bufferPosition;
    private boolean closed;

    protected BufferedByteSource(Path path, RandomAccessFile randomAccessFile) {
        this.path = path;
        this.randomAccessFile = randomAccessFile;
    }

    /**
     * 装载当前缓冲区之后的下一段数据，并把读位置置于其开头。
     *
     * @return 数据已结束时返回 false
     * @throws IOException 读取失败时抛出
     */
    protected abstract boolean nextBuffer() throws IOException;

    @Override
    public Path path() {
        return path;
    }

    @Override
    public byte[] readUntil(IntPredicate delimiter) throws IOException {
        ensureOpen();
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        while (true) {
            if (bufferPosition >= bufferLength && !nextBuffer()) {
                return collected.size() == 0 ? null : collected.toByteArray();
            }
            int start = bufferPosition;
            while (bufferPosition < bufferLength) {
                int value = buffer[bufferPosition++] & 0xFF;
                if (delimiter.test(value)) {
                    collected.write(buffer, start, bufferPosition - start);
                    return collected.toByteArray();
                }
            }
            collected.write(buffer, start, bufferLength - start);
        }
    }

    @Override
    public byte[] read(int length) throws IOException {
        ensureOpen();
        if (length < 0) {
            throw new IllegalArgumentException("读取长度不能为负数: " + length);
        }
        byte[] result = new byte[length];
        int filled = 0;
        while (filled < length) {
            if (bufferPosition >= bufferLength && !nextBuffer()) {
                throw new EOFException("数据不足: 需要 " + length + " 字节, 实际 " + filled + " 字节, file=" + path);
            }
            int chunk = Math.min(length - filled, bufferLength - bufferPosition);
            System.arraycopy(buffer, bufferPosition, result, filled, chunk);
            bufferPosition += chunk;
            filled += chunk;
        }
        return result;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        buffer = new byte[0];
        bufferLength = 0;
        bufferPosition = 0;
        randomAccessFile.close();
    }

    protected void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("字节源已关闭: " + path);
        }
    }
}
