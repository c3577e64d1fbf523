package com.seqindex.format;

/**
 * PIR/NBRF 扫描器：记录以 "&gt;P1;" 这类四字符前缀开始，key 为前缀后的第一个词。
 */
public final class PirScanner extends MarkerRecordScanner {
    private static final int PREFIX_LENGTH = 4;

    public PirScanner(String format) {
        super(format);
    }

    @Override
    protected boolean isRecordStart(byte[] line) {
        return line.length >= PREFIX_LENGTH && line[0] == '>' && line[3] == ';';
    }

    @Override
    protected IdentifierCollector newCollector() {
        return new IdentifierCollector() {
            private String identifier;

            @Override
            public void accept(byte[] line, boolean first) {
                if (first) {
                    String text = Lines.text(line);
                    identifier = text.length() > PREFIX_LENGTH ? Lines.firstToken(text.substring(PREFIX_LENGTH)) : null;
                }
            }

            @Override
            public String identifier() {
                return identifier;
            }
        };
    }
}
