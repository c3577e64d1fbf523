package com.seqindex.format;

import java.nio.charset.StandardCharsets;

/**
 * 按行扫描时使用的字节行工具方法。
 */
final class Lines {
    private Lines() {
    }

    static boolean startsWith(byte[] line, String prefix) {
        if (line == null || line.length < prefix.length()) {
            return false;
        }
        for (int index = 0; index < prefix.length(); index++) {
            if (line[index] != (byte) prefix.charAt(index)) {
                return false;
            }
        }
        return true;
    }

    static boolean isBlank(byte[] line) {
        for (byte value : line) {
            if (!Character.isWhitespace(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 去掉首尾空白（含 \r\n）后的文本。
     */
    static String text(byte[] line) {
        return new String(line, StandardCharsets.UTF_8).strip();
    }

    /**
     * 不计空白的字符数，用于 FASTQ 序列与质量长度比较。
     */
    static int residueCount(byte[] line) {
        int count = 0;
        for (byte value : line) {
            if (!Character.isWhitespace(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 返回第一个空白分隔的词，没有时返回 null。
     */
    static String firstToken(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return null;
        }
        String[] tokens = stripped.split("\\s+", 2);
        return tokens[0];
    }

    /**
     * 返回第二个空白分隔的词（跳过行标识），没有时返回 null。
     */
    static String secondToken(String text) {
        String[] tokens = text.strip().split("\\s+");
        return tokens.length > 1 ? tokens[1] : null;
    }
}
