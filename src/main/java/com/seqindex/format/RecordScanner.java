package com.seqindex.format;

import com.seqindex.storage.ByteSource;

import java.io.IOException;
import java.util.function.UnaryOperator;

/**
 * 单一格式的记录边界扫描器。
 *
 * <p>扫描器只定位记录，不解释记录内容：{@link #scan} 产出 (key, offset, length)，
 * {@link #extractRaw} 按位置取回一条记录的原始字节。
 */
public interface RecordScanner {

    /**
     * 注册表中的格式名，同时作为解析回调收到的格式名。
     */
    String format();

    /**
     * 从数据开头扫描记录边界。
     *
     * @param source 已打开的字节源
     * @param keyFunction 可选的 key 变换，参数为格式默认规则得到的标识符；为 null 时直接使用默认标识符
     * @return 惰性的记录位置序列
     * @throws IOException 定位失败时抛出
     */
    RecordCursor scan(ByteSource source, UnaryOperator<String> keyFunction) throws IOException;

    /**
     * 取回一条记录的原始字节，不做任何换行或空白规范化。
     *
     * @param source 已打开的字节源
     * @param offset 记录起始偏移
     * @param length 记录字节长度
     * @return 记录原始字节
     * @throws IOException 读取失败、数据不足或块损坏时抛出
     */
    default byte[] extractRaw(ByteSource source, long offset, long length) throws IOException {
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("记录长度非法: " + length);
        }
        source.seek(offset);
        return source.read((int) length);
    }
}
