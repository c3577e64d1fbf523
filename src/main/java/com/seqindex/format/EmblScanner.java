package com.seqindex.format;

import com.seqindex.storage.FormatException;

/**
 * EMBL 与 IMGT 扫描器：记录以 "ID   " 开始、以 "//" 结束。
 *
 * <p>新式 ID 行（"X56734; SV 1; linear; ..."）直接给出 "X56734.1"；旧式 ID 行给出条目名。
 * 之后第一条 AC 行的首个登录号会替换未带版本的 key，SV 行则给出最终的带版本 key。
 */
public final class EmblScanner extends MarkerRecordScanner {

    public EmblScanner(String format) {
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
            private String identifier;
            private boolean setByVersion;
            private boolean accessionSeen;

            @Override
            public void accept(byte[] line, boolean first) throws FormatException {
                if (first) {
                    parseIdLine(Lines.text(line));
                } else if (Lines.startsWith(line, "AC ") && !accessionSeen) {
                    accessionSeen = true;
                    if (!setByVersion) {
                        identifier = stripSemicolon(Lines.secondToken(Lines.text(line)));
                    }
                } else if (Lines.startsWith(line, "SV ")) {
                    identifier = Lines.secondToken(Lines.text(line));
                    setByVersion = true;
                }
            }

            @Override
            public String identifier() {
                return identifier;
            }

            private void parseIdLine(String text) throws FormatException {
                String body = text.substring(2);
                long semicolons = body.chars().filter(ch -> ch == ';').count();
                if (semicolons == 5 || semicolons == 6) {
                    String[] parts = text.substring(3).strip().split(";");
                    String versionPart = parts[1].strip();
                    if (versionPart.startsWith("SV ")) {
                        identifier = parts[0].strip() + "." + Lines.secondToken(versionPart);
                        setByVersion = true;
                    } else {
                        identifier = parts[0].strip();
                    }
                } else if (semicolons == 2 || semicolons == 3) {
                    identifier = stripSemicolon(Lines.firstToken(text.substring(3)));
                } else {
                    throw new FormatException("无法识别的 ID 行: " + text);
                }
            }
        };
    }

    private static String stripSemicolon(String token) {
        if (token != null && token.endsWith(";")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
