package com.seqindex.config;

/**
 * 全局常量定义
 *
 * 包含 BGZF 容器格式常量、虚拟偏移位宽、索引库 schema 参数与默认读写参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== BGZF 容器格式 ====================
    /** gzip 魔数第一字节 */
    public static final int GZIP_ID1 = 0x1F;
    /** gzip 魔数第二字节 */
    public static final int GZIP_ID2 = 0x8B;
    /** gzip 压缩方法：DEFLATE */
    public static final int GZIP_CM_DEFLATE = 8;
    /** gzip FLG 中的 FEXTRA 标志位 */
    public static final int GZIP_FLAG_EXTRA = 4;
    /** BGZF 扩展子字段标识 "BC" */
    public static final int BGZF_SUBFIELD_ID1 = 'B';
    public static final int BGZF_SUBFIELD_ID2 = 'C';
    /** BGZF 块头固定长度（含 BC 子字段） */
    public static final int BGZF_HEADER_LENGTH = 18;
    /** BGZF 块尾长度：CRC32 + ISIZE */
    public static final int BGZF_TRAILER_LENGTH = 8;
    /** 单个块解压后的最大字节数（64KB） */
    public static final int BGZF_MAX_BLOCK_SIZE = 65536;
    /** 流结束标记块（28 字节空块） */
    public static final byte[] BGZF_EOF_BLOCK = {
        0x1F, (byte) 0x8B, 0x08, 0x04, 0x00, 0x00, 0x00, 0x00, 0x00, (byte) 0xFF,
        0x06, 0x00, 0x42, 0x43, 0x02, 0x00, 0x1B, 0x00, 0x03, 0x00,
        0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00
    };
    /** bzip2 魔数 "BZh" */
    public static final byte[] BZIP2_MAGIC = {'B', 'Z', 'h'};

    // ==================== 虚拟偏移 ====================
    /** 块内偏移所占低位数 */
    public static final int VIRTUAL_OFFSET_WITHIN_BITS = 16;
    /** 块起始位置所占高位数 */
    public static final int VIRTUAL_OFFSET_BLOCK_BITS = 48;

    // ==================== 索引库 ====================
    /** 当前索引库 schema 版本 */
    public static final int SCHEMA_VERSION = 1;
    /** 构建期间临时文件后缀 */
    public static final String BUILDING_SUFFIX = ".building";

    // ==================== 默认参数 ====================
    /** 普通文件读缓冲区大小（8KB） */
    public static final int DEFAULT_READ_BUFFER_SIZE = 8 * 1024;
    /** 批量写入偏移记录的批大小 */
    public static final int DEFAULT_INSERT_BATCH_SIZE = 1000;
    /** 惰性遍历 key 时每页读取的条数 */
    public static final int DEFAULT_KEY_PAGE_SIZE = 500;
}
