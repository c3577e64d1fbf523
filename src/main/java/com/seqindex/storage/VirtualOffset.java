package com.seqindex.storage;

import com.seqindex.config.Constants;

/**
 * BGZF 虚拟偏移编解码器
 *
 * 编码规则：高48位为压缩块在文件中的起始位置，低16位为解压后块内偏移
 * - 同一文件内虚拟偏移的大小顺序与数据顺序一致
 * - 不同文件的虚拟偏移不可比较
 */
public record VirtualOffset(long blockStart, int withinBlock) {
    private static final long MAX_BLOCK_START = 1L << Constants.VIRTUAL_OFFSET_BLOCK_BITS;
    private static final long WITHIN_BLOCK_MASK = (1L << Constants.VIRTUAL_OFFSET_WITHIN_BITS) - 1;

    public VirtualOffset {
        checkRange(blockStart, withinBlock);
    }

    /**
     * 将块起始位置与块内偏移编码为虚拟偏移
     *
     * @param blockStart 压缩块起始位置（非负且小于 2^48）
     * @param withinBlock 块内偏移（小于 BGZF 最大块大小）
     * @return 64 位虚拟偏移
     * @throws IllegalArgumentException 任一分量越界时抛出
     */
    public static long encode(long blockStart, int withinBlock) {
        checkRange(blockStart, withinBlock);
        return (blockStart << Constants.VIRTUAL_OFFSET_WITHIN_BITS) | withinBlock;
    }

    /**
     * 将虚拟偏移拆分为块起始位置与块内偏移
     *
     * @param virtualOffset 64 位虚拟偏移
     * @return 解码结果
     */
    public static VirtualOffset decode(long virtualOffset) {
        return new VirtualOffset(blockStart(virtualOffset), withinBlock(virtualOffset));
    }

    public static long blockStart(long virtualOffset) {
        return virtualOffset >>> Constants.VIRTUAL_OFFSET_WITHIN_BITS;
    }

    public static int withinBlock(long virtualOffset) {
        return (int) (virtualOffset & WITHIN_BLOCK_MASK);
    }

    public long encoded() {
        return encode(blockStart, withinBlock);
    }

    @Override
    public String toString() {
        return blockStart + ":" + withinBlock;
    }

    private static void checkRange(long blockStart, int withinBlock) {
        if (blockStart < 0 || blockStart >= MAX_BLOCK_START) {
            throw new IllegalArgumentException("块起始位置越界: " + blockStart);
        }
        if (withinBlock < 0 || withinBlock >= Constants.BGZF_MAX_BLOCK_SIZE) {
            throw new IllegalArgumentException("块内偏移越界: " + withinBlock);
        }
    }
}
