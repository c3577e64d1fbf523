package com.seqindex.store;

/**
 * 索引库中的一条记录定位信息。
 */
public record RecordLocator(String key, int fileId, long offset, long length) {
}
