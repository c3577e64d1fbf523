package com.seqindex.storage;

import com.seqindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * BGZF 压缩文件的字节源。
 *
 * <p>BGZF 由若干独立压缩的 gzip 成员（块）串联而成，每块的 FEXTRA 中带有 "BC" 子字段记录
 * 整块压缩长度，文件以 28 字节空块结尾。本类任一时刻只持有一个解压块，定位时按虚拟偏移
 * 直接解压目标块，顺序读取时按需解压下一块。
 */
public final class BgzfByteSource extends BufferedByteSource {
    private static final Logger logger = LoggerFactory.getLogger(BgzfByteSource.class);

    private static final int FIXED_HEADER_LENGTH = 12;

    private final Inflater inflater = new Inflater(true);
    private final CRC32 crc32 = new CRC32();
    private long blockStart;
    private int blockRawLength;
    private boolean blockLoaded;
    private boolean lastBlockEmpty;
    private boolean missingEofReported;

    BgzfByteSource(Path path, RandomAccessFile randomAccessFile) {
        super(path, randomAccessFile);
    }

    @Override
    public CompressionKind compression() {
        return CompressionKind.BGZF;
    }

    @Override
    public long tell() throws IOException {
        ensureOpen();
        if (bufferPosition >= bufferLength) {
            // 块已读完时报告下一块起点，块内偏移始终小于最大块大小
            return VirtualOffset.encode(blockStart + blockRawLength, 0);
        }
        return VirtualOffset.encode(blockStart, bufferPosition);
    }

    @Override
    public void seek(long offset) throws IOException {
        ensureOpen();
        long targetBlock = VirtualOffset.blockStart(offset);
        int within = VirtualOffset.withinBlock(offset);
        if (!blockLoaded || targetBlock != blockStart) {
            loadBlock(targetBlock);
        }
        if (within > bufferLength) {
            throw new EOFException("块内偏移超出块大小: within=" + within + ", blockSize=" + bufferLength
                + ", blockStart=" + targetBlock + ", file=" + path);
        }
        bufferPosition = within;
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            inflater.end();
        }
    }

    @Override
    protected boolean nextBuffer() throws IOException {
        long nextStart = blockLoaded ? blockStart + blockRawLength : blockStart;
        while (loadBlock(nextStart)) {
            if (bufferLength > 0) {
                return true;
            }
            nextStart = blockStart + blockRawLength;
        }
        return false;
    }

    /**
     * 读取并解压指定位置的单个块。
     *
     * @param start 块在文件中的起始位置
     * @return 位置已到文件末尾时返回 false
     * @throws IOException 读取失败或块损坏时抛出
     */
    private boolean loadBlock(long start) throws IOException {
        long fileLength = randomAccessFile.length();
        blockStart = start;
        blockRawLength = 0;
        bufferLength = 0;
        bufferPosition = 0;
        // 校验通过前不标记为已装载，损坏块在下次定位时重新校验
        blockLoaded = false;
        if (start >= fileLength) {
            blockLoaded = true;
            if (!lastBlockEmpty && !missingEofReported) {
                missingEofReported = true;
                logger.warn("BGZF 文件缺少结束标记块，可能已被截断: {}", path);
            }
            return false;
        }

        randomAccessFile.seek(start);
        byte[] fixedHeader = new byte[FIXED_HEADER_LENGTH];
        readBlockBytes(fixedHeader, start, "块头");
        if ((fixedHeader[0] & 0xFF) != Constants.GZIP_ID1
            || (fixedHeader[1] & 0xFF) != Constants.GZIP_ID2
            || (fixedHeader[2] & 0xFF) != Constants.GZIP_CM_DEFLATE
            || (fixedHeader[3] & Constants.GZIP_FLAG_EXTRA) == 0) {
            throw new CorruptContainerException("块头魔数不匹配", start);
        }
        int extraLength = readUnsignedShort(fixedHeader, 10);
        byte[] extra = new byte[extraLength];
        readBlockBytes(extra, start, "扩展字段");
        int totalBlockSize = findBlockSize(extra, start);
        int remaining = totalBlockSize - FIXED_HEADER_LENGTH - extraLength;
        if (remaining < Constants.BGZF_TRAILER_LENGTH) {
            throw new CorruptContainerException("BSIZE 与块头长度不一致: bsize=" + totalBlockSize, start);
        }

        byte[] payload = new byte[remaining];
        readBlockBytes(payload, start, "压缩数据");
        int compressedLength = remaining - Constants.BGZF_TRAILER_LENGTH;
        long expectedCrc32 = Integer.toUnsignedLong(readInt(payload, compressedLength));
        int declaredSize = readInt(payload, compressedLength + Integer.BYTES);
        if (declaredSize < 0 || declaredSize > Constants.BGZF_MAX_BLOCK_SIZE) {
            throw new CorruptContainerException("ISIZE 超出块大小上限: " + Integer.toUnsignedLong(declaredSize), start);
        }

        byte[] decompressed = inflate(payload, compressedLength, declaredSize, start);
        crc32.reset();
        crc32.update(decompressed, 0, declaredSize);
        if (crc32.getValue() != expectedCrc32) {
            throw new CorruptContainerException("CRC32 校验失败: expected=" + expectedCrc32 + ", actual=" + crc32.getValue(), start);
        }

        buffer = decompressed;
        bufferLength = declaredSize;
        blockRawLength = totalBlockSize;
        lastBlockEmpty = declaredSize == 0;
        blockLoaded = true;
        return true;
    }

    private byte[] inflate(byte[] payload, int compressedLength, int declaredSize, long start) throws IOException {
        // 多留一个字节，用于发现解压结果超出 ISIZE 的情况
        byte[] decompressed = new byte[declaredSize + 1];
        inflater.reset();
        inflater.setInput(payload, 0, compressedLength);
        int produced = 0;
        try {
            while (!inflater.finished()) {
                int count = inflater.inflate(decompressed, produced, decompressed.length - produced);
                produced += count;
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary() || produced == decompressed.length)) {
                    break;
                }
            }
        } catch (DataFormatException exception) {
            throw new CorruptContainerException("DEFLATE 数据损坏", start, exception);
        }
        if (!inflater.finished() || produced != declaredSize) {
            throw new CorruptContainerException("解压长度与 ISIZE 不一致: isize=" + declaredSize + ", actual=" + produced, start);
        }
        return decompressed;
    }

    private int findBlockSize(byte[] extra, long start) throws IOException {
        int position = 0;
        while (position + 4 <= extra.length) {
            int subfieldId1 = extra[position] & 0xFF;
            int subfieldId2 = extra[position + 1] & 0xFF;
            int subfieldLength = readUnsignedShort(extra, position + 2);
            if (subfieldId1 == Constants.BGZF_SUBFIELD_ID1 && subfieldId2 == Constants.BGZF_SUBFIELD_ID2) {
                if (subfieldLength != 2 || position + 6 > extra.length) {
                    throw new CorruptContainerException("BC 子字段长度非法: " + subfieldLength, start);
                }
                return readUnsignedShort(extra, position + 4) + 1;
            }
            position += 4 + subfieldLength;
        }
        throw new CorruptContainerException("块头缺少 BC 子字段", start);
    }

    private void readBlockBytes(byte[] target, long start, String part) throws IOException {
        int filled = 0;
        while (filled < target.length) {
            int count = randomAccessFile.read(target, filled, target.length - filled);
            if (count < 0) {
                throw new CorruptContainerException("块被截断，缺少" + part, start);
            }
            filled += count;
        }
    }

    /**
     * 判断文件头是否为 BGZF 块头。
     *
     * @param header 文件开头的字节
     * @param length 有效字节数
     * @return 含 gzip 魔数、FEXTRA 标志与首个 BC 子字段时返回 true
     */
    static boolean isBgzfHeader(byte[] header, int length) {
        if (length < Constants.BGZF_HEADER_LENGTH) {
            return false;
        }
        return (header[0] & 0xFF) == Constants.GZIP_ID1
            && (header[1] & 0xFF) == Constants.GZIP_ID2
            && (header[2] & 0xFF) == Constants.GZIP_CM_DEFLATE
            && (header[3] & Constants.GZIP_FLAG_EXTRA) != 0
            && readUnsignedShort(header, 10) >= 6
            && (header[12] & 0xFF) == Constants.BGZF_SUBFIELD_ID1
            && (header[13] & 0xFF) == Constants.BGZF_SUBFIELD_ID2
            && readUnsignedShort(header, 14) == 2;
    }

    private static int readUnsignedShort(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
    }

    private static int readInt(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF)
            | ((bytes[offset + 1] & 0xFF) << 8)
            | ((bytes[offset + 2] & 0xFF) << 16)
            | ((bytes[offset + 3] & 0xFF) << 24);
    }
}
