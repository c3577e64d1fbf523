package com.seqindex.format;

import com.seqindex.storage.ByteSource;
import com.seqindex.storage.FormatException;

import java.io.IOException;
import java.util.function.UnaryOperator;

/**
 * 以起始标记行划分记录的扫描器骨架。
 *
 * <p>一条记录从标记行开始，到下一个标记行之前（或数据结束）为止；第一个标记行之前的内容视为
 * 文件头并跳过。需要结束行的格式在记录末尾缺少 "//" 时报格式错误。
 */
abstract class MarkerRecordScanner implements RecordScanner {
    private static final String TERMINATOR = "//";

    private final String format;

    protected MarkerRecordScanner(String format) {
        this.format = format;
    }

    @Override
    public String format() {
        return format;
    }

    protected abstract boolean isRecordStart(byte[] line);

    /**
     * 为一条新记录创建标识符收集器。
     */
    protected abstract IdentifierCollector newCollector();

    protected boolean requiresTerminator() {
        return false;
    }

    @Override
    public RecordCursor scan(ByteSource source, UnaryOperator<String> keyFunction) throws IOException {
        source.seek(0L);
        return new MarkerCursor(source, keyFunction);
    }

    /**
     * 逐行收集一条记录的默认标识符。
     */
    protected interface IdentifierCollector {

        /**
         * @param line 记录中的一行（含换行符）
         * @param first 是否为记录的标记行
         */
        void accept(byte[] line, boolean first) throws FormatException;

        /**
         * @return 默认标识符，无法确定时返回 null
         */
        String identifier();
    }

    private final class MarkerCursor extends LineRecordCursor {
        private boolean started;
        private byte[] pendingLine;
        private long pendingOffset;

        MarkerCursor(ByteSource source, UnaryOperator<String> keyFunction) {
            super(source, keyFunction);
        }

        @Override
        protected RecordLocation advance() throws IOException {
            if (!started) {
                started = true;
                skipHeader();
            }
            if (pendingLine == null) {
                return null;
            }

            long startOffset = pendingOffset;
            byte[] line = pendingLine;
            long length = line.length;
            byte[] lastContentLine = line;
            IdentifierCollector collector = newCollector();
            collector.accept(line, true);
            while (true) {
                long lineOffset = source.tell();
                line = source.readLine();
                if (line == null || isRecordStart(line)) {
                    pendingLine = line;
                    pendingOffset = lineOffset;
                    break;
                }
                collector.accept(line, false);
                length += line.length;
                if (!Lines.isBlank(line)) {
                    lastContentLine = line;
                }
            }

            if (requiresTerminator() && !TERMINATOR.equals(Lines.text(lastContentLine))) {
                throw new FormatException("记录缺少 // 结束行, format=" + format + ", offset=" + startOffset
                    + ", file=" + source.path());
            }
            return locate(collector.identifier(), startOffset, length);
        }

        private void skipHeader() throws IOException {
            while (true) {
                long lineOffset = source.tell();
                byte[] line = source.readLine();
                if (line == null || isRecordStart(line)) {
                    pendingLine = line;
                    pendingOffset = lineOffset;
                    return;
                }
            }
        }
    }
}
