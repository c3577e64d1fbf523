package com.seqindex.format;

import java.io.IOException;

/**
 * 单次、不可重启的记录位置序列。
 */
@FunctionalInterface
public interface RecordCursor {

    /**
     * 读取下一条记录的位置。
     *
     * @return 下一条记录；序列结束后始终返回 null
     * @throws IOException 读取失败或记录结构损坏时抛出
     */
    RecordLocation next() throws IOException;
}
