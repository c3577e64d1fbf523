package com.seqindex.format;

/**
 * 格式未注册，或其记录边界无法在有限前瞻内确定（如需要全局块数的比对格式）时抛出。
 */
public class UnsupportedFormatException extends IllegalArgumentException {
    private final String format;

    public UnsupportedFormatException(String format, String reason) {
        super("不支持索引的格式 '" + format + "': " + reason);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
