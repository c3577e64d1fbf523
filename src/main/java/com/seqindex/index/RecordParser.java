package com.seqindex.index;

/**
 * 外部提供的记录解析回调，把一条记录的原始字节转换为结构化对象。
 *
 * @param <T> 结构化记录类型
 */
@FunctionalInterface
public interface RecordParser<T> {

    T parse(byte[] raw, String format);
}
