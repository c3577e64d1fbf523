package com.seqindex.format;

/**
 * FASTA 与 QUAL 扫描器：记录以 '>' 标题行开始，key 为标题行的第一个词。
 */
public final class FastaScanner extends MarkerRecordScanner {

    public FastaScanner(String format) {
        super(format);
    }

    @Override
    protected boolean isRecordStart(byte[] line) {
        return line.length > 0 && line[0] == '>';
    }

    @Override
    protected IdentifierCollector newCollector() {
        return new IdentifierCollector() {
            private String identifier;

            @Override
            public void accept(byte[] line, boolean first) {
                if (first) {
                    identifier = Lines.firstToken(Lines.text(line).substring(1));
                }
            }

            @Override
            public String identifier() {
                return identifier;
            }
        };
    }
}
