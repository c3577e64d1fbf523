package com.seqindex.format;

import com.seqindex.storage.ByteSource;
import com.seqindex.storage.FormatException;

import java.io.IOException;
import java.util.function.UnaryOperator;

/**
 * FASTQ 扫描器（含 sanger/solexa/illumina 变体）。
 *
 * <p>质量行可能以 '@' 或 '+' 开头，因此不能靠标记行切分：序列与质量都允许跨多行，
 * 以质量字符数追平序列长度作为记录结束。
 */
public final class FastqScanner implements RecordScanner {
    private final String format;

    public FastqScanner(String format) {
        this.format = format;
    }

    @Override
    public String format() {
        return format;
    }

    @Override
    public RecordCursor scan(ByteSource source, UnaryOperator<String> keyFunction) throws IOException {
        source.seek(0L);
        return new FastqCursor(source, keyFunction);
    }

    private final class FastqCursor extends LineRecordCursor {

        FastqCursor(ByteSource source, UnaryOperator<String> keyFunction) {
            super(source, keyFunction);
        }

        @Override
        protected RecordLocation advance() throws IOException {
            long startOffset;
            byte[] titleLine;
            do {
                startOffset = source.tell();
                titleLine = source.readLine();
                if (titleLine == null) {
                    return null;
                }
            } while (Lines.isBlank(titleLine));

            if (titleLine[0] != '@') {
                throw new FormatException("FASTQ 记录应以 '@' 开头, offset=" + startOffset + ", file=" + source.path());
            }
            String identifier = Lines.firstToken(Lines.text(titleLine).substring(1));
            long length = titleLine.length;

            int sequenceLength = 0;
            while (true) {
                byte[] line = source.readLine();
                if (line == null) {
                    throw new FormatException("FASTQ 记录在序列部分提前结束, key=" + identifier + ", offset=" + startOffset);
                }
                length += line.length;
                if (line[0] == '+') {
                    break;
                }
                sequenceLength += Lines.residueCount(line);
            }

            int qualityLength = 0;
            if (sequenceLength == 0) {
                // 空序列对应一行空质量
                byte[] line = source.readLine();
                if (line != null) {
                    if (!Lines.isBlank(line)) {
                        throw new FormatException("FASTQ 空序列记录的质量行非空, key=" + identifier + ", offset=" + startOffset);
                    }
                    length += line.length;
                }
            }
            while (qualityLength < sequenceLength) {
                byte[] line = source.readLine();
                if (line == null) {
                    throw new FormatException("FASTQ 记录质量长度不足: 序列 " + sequenceLength + ", 质量 " + qualityLength
                        + ", key=" + identifier + ", offset=" + startOffset);
                }
                length += line.length;
                qualityLength += Lines.residueCount(line);
            }
            if (qualityLength != sequenceLength) {
                throw new FormatException("FASTQ 记录质量长度与序列长度不一致: 序列 " + sequenceLength + ", 质量 " + qualityLength
                    + ", key=" + identifier + ", offset=" + startOffset);
            }
            return locate(identifier, startOffset, length);
        }
    }
}
