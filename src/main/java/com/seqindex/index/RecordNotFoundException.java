package com.seqindex.index;

import java.util.NoSuchElementException;

public class RecordNotFoundException extends NoSuchElementException {
    private final String key;

    public RecordNotFoundException(String key) {
        super("记录不存在: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
