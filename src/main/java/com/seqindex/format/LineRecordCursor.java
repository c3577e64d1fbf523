package com.seqindex.format;

import com.seqindex.storage.ByteSource;
import com.seqindex.storage.FormatException;

import java.io.IOException;
import java.util.function.UnaryOperator;

/**
 * 按行推进的记录游标骨架，负责单次遍历语义与 key 派生。
 */
abstract class LineRecordCursor implements RecordCursor {
    protected final ByteSource source;
    private final UnaryOperator<String> keyFunction;
    private boolean finished;

    protected LineRecordCursor(ByteSource source, UnaryOperator<String> keyFunction) {
        this.source = source;
        this.keyFunction = keyFunction;
    }

    @Override
    public final RecordLocation next() throws IOException {
        if (finished) {
            return null;
        }
        RecordLocation location;
        try {
            location = advance();
        } catch (IOException | RuntimeException exception) {
            finished = true;
            throw exception;
        }
        if (location == null) {
            finished = true;
        }
        return location;
    }

    /**
     * 定位下一条记录。
     *
     * @return 没有更多记录时返回 null
     */
    protected abstract RecordLocation advance() throws IOException;

    /**
     * 由默认标识符派生最终 key，空 key 视为格式错误。
     */
    protected RecordLocation locate(String identifier, long offset, long length) throws FormatException {
        if (identifier == null || identifier.isEmpty()) {
            throw new FormatException("记录标识符为空, offset=" + offset + ", file=" + source.path());
        }
        String key = keyFunction == null ? identifier : keyFunction.apply(identifier);
        if (key == null || key.isEmpty()) {
            throw new FormatException("key 函数返回空 key, identifier=" + identifier + ", offset=" + offset);
        }
        return new RecordLocation(key, offset, length);
    }
}
