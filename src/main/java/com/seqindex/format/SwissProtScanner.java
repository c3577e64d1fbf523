package com.seqindex.format;

/**
 * Swiss-Prot 扫描器：记录以 "ID   " 开始、以 "//" 结束，key 为第一条 AC 行的首个登录号。
 */
public final class SwissProtScanner extends MarkerRecordScanner {

    public SwissProtScanner(String format) {
        super(format);
    }

    @Override
    protected boolean isRecordStart(byte[] line) {
        return Lines.startsWith(line, "ID   ");
    }

    @Override
    protected boolean requiresTerminator() {
        return true;
    }

    @Override
    protected IdentifierCollector newCollector() {
        return new IdentifierCollector() {
            private String accession;

            @Override
            public void accept(byte[] line, boolean first) {
                if (!first && accession == null && Lines.startsWith(line, "AC   ")) {
                    String firstAccession = Lines.text(line).substring(2).split(";", 2)[0].strip();
                    accession = firstAccession.isEmpty() ? null : firstAccession;
                }
            }

            @Override
            public String identifier() {
                return accession;
            }
        };
    }
}
