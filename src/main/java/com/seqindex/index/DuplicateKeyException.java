package com.seqindex.index;

/**
 * 构建索引时出现重复 key 时抛出，构建随之整体失败。
 */
public class DuplicateKeyException extends IllegalStateException {
    private final String key;

    public DuplicateKeyException(String key) {
        super("重复的 key: " + key);
        this.key = key;
    }

    public DuplicateKeyException(String key, String detail) {
        super("重复的 key: " + key + " (" + detail + ")");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
