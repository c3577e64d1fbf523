package com.seqindex.store;

/**
 * 索引库不是本程序可识别的版本或结构（schema 版本不符、缺表、非 SQLite 文件、计数不一致）时抛出。
 */
public class IncompatibleStoreException extends IllegalStateException {

    public IncompatibleStoreException(String message) {
        super(message);
    }

    public IncompatibleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
