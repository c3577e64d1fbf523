package com.seqindex.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.IntPredicate;

/**
 * 可定位字节源，统一普通文件与 BGZF 压缩文件的随机读取。
 *
 * <p>偏移的含义取决于 {@link #compression()}：普通文件为原始字节偏移，BGZF 文件为
 * {@link VirtualOffset} 编码的虚拟偏移。调用方只应使用 {@link #tell()} 返回的值做
 * {@link #seek(long)}。
 */
public interface ByteSource extends Closeable {

    Path path();

    CompressionKind compression();

    /**
     * 返回下一个待读字节的偏移。
     */
    long tell() throws IOException;

    /**
     * 定位到指定偏移，BGZF 源只解压偏移所在的单个块。
     *
     * @param offset 由 {@link #tell()} 得到的偏移
     * @throws IOException 偏移超出数据范围或块损坏时抛出
     */
    void seek(long offset) throws IOException;

    /**
     * 向前读取，直到某个字节满足分隔条件（包含该字节）或数据结束。
     *
     * @param delimiter 分隔条件，参数为无符号字节值
     * @return 读到的字节；已无数据时返回 null
     * @throws IOException 读取失败或块损坏时抛出
     */
    byte[] readUntil(IntPredicate delimiter) throws IOException;

    /**
     * 读取一行，包含行尾的换行符。
     *
     * @return 行字节；已无数据时返回 null
     * @throws IOException 读取失败时抛出
     */
    default byte[] readLine() throws IOException {
        return readUntil(value -> value == '\n');
    }

    /**
     * 精确读取指定长度的字节，可跨越块边界。
     *
     * @param length 字节数
     * @return 读到的字节
     * @throws java.io.EOFException 剩余数据不足时抛出
     * @throws IOException 读取失败或块损坏时抛出
     */
    byte[] read(int length) throws IOException;
}
