package com.seqindex.format;

import com.seqindex.storage.ByteSource;
import com.seqindex.storage.FormatException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.UnaryOperator;

/**
 * 制表符分隔格式扫描器：每个非空行是一条记录，key 为第一个制表符之前的文本。
 */
public final class TabScanner implements RecordScanner {
    private final String format;

    public TabScanner(String format) {
        this.format = format;
    }

    @Override
    public String format() {
        return format;
    }

    @Override
    public RecordCursor scan(ByteSource source, UnaryOperator<String> keyFunction) throws IOException {
        source.seek(0L);
        return new LineRecordCursor(source, keyFunction) {
            @Override
            protected RecordLocation advance() throws IOException {
                while (true) {
                    long offset = source.tell();
                    byte[] line = source.readLine();
                    if (line == null) {
                        return null;
                    }
                    if (Lines.isBlank(line)) {
                        continue;
                    }
                    String text = new String(line, StandardCharsets.UTF_8);
                    int tab = text.indexOf('\t');
                    if (tab < 0) {
                        throw new FormatException("tab 格式行缺少制表符, offset=" + offset + ", file=" + source.path());
                    }
                    return locate(text.substring(0, tab).strip(), offset, line.length);
                }
            }
        };
    }
}
