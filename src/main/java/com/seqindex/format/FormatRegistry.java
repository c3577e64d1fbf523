package com.seqindex.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 进程级只读格式注册表，类加载时一次性构建。
 */
public final class FormatRegistry {
    private static final Map<String, RecordScanner> SCANNERS = buildScanners();

    /** 记录边界依赖全局信息（块数、交错排布）的比对格式 */
    private static final Set<String> ALIGNMENT_FORMATS = Set.of(
        "stockholm", "clustal", "phylip", "phylip-relaxed", "phylip-sequential",
        "nexus", "emboss", "maf", "msf", "fasta-m10", "mauve"
    );

    private FormatRegistry() {
    }

    /**
     * 按格式名查找扫描器（不区分大小写）。
     *
     * @param format 格式名
     * @return 对应扫描器
     * @throws UnsupportedFormatException 格式未注册或无法按局部边界扫描时抛出
     */
    public static RecordScanner lookup(String format) {
        if (format == null || format.isBlank()) {
            throw new UnsupportedFormatException(String.valueOf(format), "格式名不能为空");
        }
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        RecordScanner scanner = SCANNERS.get(normalized);
        if (scanner != null) {
            return scanner;
        }
        if (ALIGNMENT_FORMATS.contains(normalized)) {
            throw new UnsupportedFormatException(normalized, "比对格式的记录边界无法在有限前瞻内确定");
        }
        throw new UnsupportedFormatException(normalized, "未注册的格式，可用格式: " + formats());
    }

    public static boolean isSupported(String format) {
        return format != null && SCANNERS.containsKey(format.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 返回全部可索引格式名（按字典序）。
     */
    public static Set<String> formats() {
        return Collections.unmodifiableSet(new TreeSet<>(SCANNERS.keySet()));
    }

    private static Map<String, RecordScanner> buildScanners() {
        Map<String, RecordScanner> scanners = new LinkedHashMap<>();
        register(scanners, new FastaScanner("fasta"));
        register(scanners, new FastaScanner("qual"));
        register(scanners, new FastqScanner("fastq"));
        register(scanners, new FastqScanner("fastq-sanger"));
        register(scanners, new FastqScanner("fastq-solexa"));
        register(scanners, new FastqScanner("fastq-illumina"));
        register(scanners, new GenBankScanner("genbank"));
        register(scanners, new GenBankScanner("gb"));
        register(scanners, new EmblScanner("embl"));
        register(scanners, new EmblScanner("imgt"));
        register(scanners, new SwissProtScanner("swiss"));
        register(scanners, new PirScanner("pir"));
        register(scanners, new TabScanner("tab"));
        return Collections.unmodifiableMap(scanners);
    }

    private static void register(Map<String, RecordScanner> scanners, RecordScanner scanner) {
        if (scanners.putIfAbsent(scanner.format(), scanner) != null) {
            throw new IllegalStateException("重复注册格式: " + scanner.format());
        }
    }
}
