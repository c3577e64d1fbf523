package com.seqindex.storage;

import java.io.IOException;

/**
 * 容器或记录格式无法识别、结构损坏时抛出。
 */
public class FormatException extends IOException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
