package com.seqindex.format;

/**
 * 扫描得到的单条记录位置：key、起始偏移与原始字节长度。
 *
 * <p>BGZF 源的 offset 为虚拟偏移，length 始终按解压后的字节计。
 */
public record RecordLocation(String key, long offset, long length) {

    public RecordLocation {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("记录 key 不能为空");
        }
        if (length < 0) {
            throw new IllegalArgumentException("记录长度不能为负数: " + length);
        }
    }
}
