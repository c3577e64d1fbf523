package com.seqindex.storage;

import com.seqindex.config.Constants;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * 字节源工厂：按文件头魔数识别压缩类型，统一返回 {@link ByteSource}。
 */
public final class ByteSources {
    private ByteSources() {
    }

    public static ByteSource open(Path path) throws IOException {
        return open(path, CompressionKind.AUTO, Constants.DEFAULT_READ_BUFFER_SIZE);
    }

    public static ByteSource open(Path path, CompressionKind requested) throws IOException {
        return open(path, requested, Constants.DEFAULT_READ_BUFFER_SIZE);
    }

    /**
     * 打开源文件。
     *
     * @param path 源文件路径
     * @param requested 期望的压缩类型，AUTO 表示按魔数探测
     * @param bufferSize 普通文件的读缓冲区大小
     * @return 已定位到数据开头的字节源
     * @throws FormatException 要求 BGZF 但魔数缺失，或探测到不可随机访问的 gzip/bzip2 时抛出
     * @throws IOException 打开文件失败时抛出
     */
    public static ByteSource open(Path path, CompressionKind requested, int bufferSize) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("源文件路径不能为空");
        }
        if (requested == null) {
            throw new IllegalArgumentException("压缩类型不能为空");
        }
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "r");
        try {
            CompressionKind detected = detect(randomAccessFile, path, requested);
            randomAccessFile.seek(0L);
            if (detected == CompressionKind.BGZF) {
                return new BgzfByteSource(path, randomAccessFile);
            }
            return new PlainByteSource(path, randomAccessFile, bufferSize);
        } catch (IOException | RuntimeException exception) {
            try {
                randomAccessFile.close();
            } catch (IOException closeException) {
                exception.addSuppressed(closeException);
            }
            throw exception;
        }
    }

    /**
     * 按文件头探测压缩类型，不打开字节源。
     */
    public static CompressionKind detect(Path path) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "r")) {
            return detect(randomAccessFile, path, CompressionKind.AUTO);
        }
    }

    private static CompressionKind detect(RandomAccessFile randomAccessFile, Path path, CompressionKind requested)
        throws IOException {
        if (requested == CompressionKind.NONE) {
            return CompressionKind.NONE;
        }
        byte[] header = new byte[Constants.BGZF_HEADER_LENGTH];
        int length = 0;
        while (length < header.length) {
            int count = randomAccessFile.read(header, length, header.length - length);
            if (count < 0) {
                break;
            }
            length += count;
        }
        boolean bgzf = BgzfByteSource.isBgzfHeader(header, length);
        if (requested == CompressionKind.BGZF) {
            if (!bgzf) {
                throw new FormatException("未检测到 BGZF 魔数: " + path);
            }
            return CompressionKind.BGZF;
        }
        if (bgzf) {
            return CompressionKind.BGZF;
        }
        if (length >= 2 && (header[0] & 0xFF) == Constants.GZIP_ID1 && (header[1] & 0xFF) == Constants.GZIP_ID2) {
            throw new FormatException("普通 gzip 文件不支持随机访问，请使用 BGZF 压缩: " + path);
        }
        if (startsWith(header, length, Constants.BZIP2_MAGIC)) {
            throw new FormatException("bzip2 文件不支持随机访问: " + path);
        }
        return CompressionKind.NONE;
    }

    private static boolean startsWith(byte[] header, int length, byte[] magic) {
        if (length < magic.length) {
            return false;
        }
        for (int index = 0; index < magic.length; index++) {
            if (header[index] != magic[index]) {
                return false;
            }
        }
        return true;
    }
}
