package com.seqindex.index;

import java.io.IOException;

/**
 * 按 key 惰性读取记录的只读索引。
 *
 * <p>除偏移表外不缓存任何内容，每次 {@link #get}/{@link #getRaw} 都重新从磁盘读取。
 * 实例非线程安全，关闭后所有读操作抛出 {@link ClosedIndexException}。
 *
 * @param <T> 解析回调产出的记录类型
 */
public interface RecordIndex<T> extends AutoCloseable {

    /**
     * 读取并解析一条记录。
     *
     * @throws RecordNotFoundException key 不存在时抛出
     * @throws IOException 读取源文件失败时抛出
     */
    T get(String key) throws IOException;

    /**
     * 读取一条记录的原始字节。
     *
     * @throws RecordNotFoundException key 不存在时抛出
     * @throws IOException 读取源文件失败时抛出
     */
    byte[] getRaw(String key) throws IOException;

    boolean containsKey(String key);

    /**
     * 惰性遍历全部 key。
     */
    Iterable<String> keys();

    long size();

    @Override
    void close() throws IOException;
}
