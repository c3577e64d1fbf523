package com.seqindex.format;

/**
 * GenBank 扫描器：记录以 "LOCUS " 开始、以 "//" 结束。
 *
 * <p>key 依次取带版本号的 VERSION（恰含一个点且后缀为数字）、ACCESSION 的第一个号，
 * 两者都缺失时退回 LOCUS 名称。
 */
public final class GenBankScanner extends MarkerRecordScanner {

    public GenBankScanner(String format) {
        super(format);
    }

    @Override
    protected boolean isRecordStart(byte[] line) {
        return Lines.startsWith(line, "LOCUS ");
    }

    @Override
    protected boolean requiresTerminator() {
        return true;
    }

    @Override
    protected IdentifierCollector newCollector() {
        return new IdentifierCollector() {
            private String locusName;
            private String accession;
            private String version;

            @Override
            public void accept(byte[] line, boolean first) {
                if (first) {
                    locusName = Lines.firstToken(Lines.text(line).substring("LOCUS".length()));
                } else if (accession == null && Lines.startsWith(line, "ACCESSION ")) {
                    accession = Lines.secondToken(Lines.text(line));
                } else if (version == null && Lines.startsWith(line, "VERSION ")) {
                    String candidate = Lines.secondToken(Lines.text(line));
                    if (isVersioned(candidate)) {
                        version = candidate;
                    }
                }
            }

            @Override
            public String identifier() {
                if (version != null) {
                    return version;
                }
                return accession != null ? accession : locusName;
            }
        };
    }

    private static boolean isVersioned(String candidate) {
        if (candidate == null) {
            return false;
        }
        int dot = candidate.indexOf('.');
        if (dot <= 0 || dot != candidate.lastIndexOf('.') || dot == candidate.length() - 1) {
            return false;
        }
        return candidate.substring(dot + 1).chars().allMatch(Character::isDigit);
    }
}
