package com.seqindex.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 字节源测试，覆盖普通文件与 BGZF 文件的定位、按行读取与跨块读取。
 */
class ByteSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testPlainReadLineAndTell() throws IOException {
        Path file = tempDir.resolve("plain.txt");
        Files.writeString(file, "alpha\nbeta\r\ngamma");

        try (ByteSource source = ByteSources.open(file, CompressionKind.AUTO, 4)) {
            assertEquals(CompressionKind.NONE, source.compression());
            assertEquals(0L, source.tell());
            assertEquals("alpha\n", text(source.readLine()));
            assertEquals(6L, source.tell());
            assertEquals("beta\r\n", text(source.readLine()));
            assertEquals(12L, source.tell());
            assertEquals("gamma", text(source.readLine()));
            assertNull(source.readLine());

            source.seek(6L);
            assertEquals("beta", text(source.read(4)));
            source.seek(0L);
            assertEquals("alph", text(source.readUntil(value -> value == 'h')));
            assertEquals(4L, source.tell());
        }
    }

    @Test
    void testPlainReadPastEndThrowsEof() throws IOException {
        Path file = tempDir.resolve("short.txt");
        Files.writeString(file, "abc");

        try (ByteSource source = ByteSources.open(file)) {
            source.seek(1L);
            assertThrows(EOFException.class, () -> source.read(5));
        }
    }

    @Test
    void testClosedSourceRejectsReads() throws IOException {
        Path file = tempDir.resolve("closed.txt");
        Files.writeString(file, "abc\n");

        ByteSource source = ByteSources.open(file);
        source.close();
        source.close();
        assertThrows(IOException.class, source::readLine);
        assertThrows(IOException.class, source::tell);
    }

    @Test
    @DisplayName("BGZF 顺序读取跨越多个块且不丢失、不重复字节")
    void testBgzfSequentialAcrossBlocks() throws IOException {
        Path file = tempDir.resolve("multi.bgz");
        byte[] data = buildLines(200).getBytes(StandardCharsets.US_ASCII);
        List<Long> blockStarts = BgzfTestWriter.write(file, data, 100);
        assertTrue(blockStarts.size() > 5);

        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        try (ByteSource source = ByteSources.open(file)) {
            assertEquals(CompressionKind.BGZF, source.compression());
            byte[] line;
            while ((line = source.readLine()) != null) {
                collected.write(line);
            }
        }
        assertArrayEquals(data, collected.toByteArray());
    }

    @Test
    @DisplayName("BGZF 按 tell 记录的虚拟偏移回跳读取")
    void testBgzfSeekToRecordedOffsets() throws IOException {
        Path file = tempDir.resolve("seek.bgz");
        String content = buildLines(120);
        BgzfTestWriter.write(file, content.getBytes(StandardCharsets.US_ASCII), 64);

        List<Long> offsets = new ArrayList<>();
        List<String> lines = new ArrayList<>();
        try (ByteSource source = ByteSources.open(file)) {
            while (true) {
                long offset = source.tell();
                byte[] line = source.readLine();
                if (line == null) {
                    break;
                }
                offsets.add(offset);
                lines.add(text(line));
            }
        }

        try (ByteSource source = ByteSources.open(file)) {
            for (int index = lines.size() - 1; index >= 0; index -= 7) {
                source.seek(offsets.get(index));
                assertEquals(lines.get(index), text(source.readLine()));
            }
        }
    }

    @Test
    @DisplayName("块读完时 tell 报告下一块起点")
    void testBgzfTellAtBlockEnd() throws IOException {
        Path file = tempDir.resolve("boundary.bgz");
        List<Long> blockStarts = BgzfTestWriter.writeBlocks(file,
            List.of(bytes("abc\n"), bytes("def\n")), true);

        try (ByteSource source = ByteSources.open(file)) {
            assertEquals("abc\n", text(source.readLine()));
            assertEquals(VirtualOffset.encode(blockStarts.get(1), 0), source.tell());
            assertEquals("def\n", text(source.readLine()));
            assertNull(source.readLine());
        }
    }

    @Test
    @DisplayName("跨块精确读取指定长度")
    void testBgzfReadSpanningBlocks() throws IOException {
        Path file = tempDir.resolve("span.bgz");
        List<Long> blockStarts = BgzfTestWriter.writeBlocks(file,
            List.of(bytes(">A1\nACGT\n>A2\nGG"), bytes("CC\nTT\n>A3\nAAA\n")), true);

        try (ByteSource source = ByteSources.open(file)) {
            source.seek(VirtualOffset.encode(blockStarts.get(0), 10));
            assertEquals(">A2\nGGCC\nTT\n", text(source.read(12)));
        }
    }

    @Test
    void testBgzfSeekBeyondBlockThrows() throws IOException {
        Path file = tempDir.resolve("beyond.bgz");
        BgzfTestWriter.writeBlocks(file, List.of(bytes("abc\n")), true);

        try (ByteSource source = ByteSources.open(file)) {
            assertThrows(EOFException.class, () -> source.seek(VirtualOffset.encode(0, 10)));
        }
    }

    @Test
    @DisplayName("CRC32 不匹配时报告块损坏")
    void testBgzfCorruptCrcDetected() throws IOException {
        Path file = tempDir.resolve("corrupt.bgz");
        BgzfTestWriter.writeBlocks(file, List.of(bytes(">A1\nACGT\n")), true);
        byte[] raw = Files.readAllBytes(file);
        int blockLength = BgzfTestWriter.block(bytes(">A1\nACGT\n")).length;
        raw[blockLength - 8] ^= 0x5A;
        Files.write(file, raw);

        try (ByteSource source = ByteSources.open(file)) {
            CorruptContainerException exception = assertThrows(CorruptContainerException.class, source::readLine);
            assertEquals(0L, exception.getBlockStart());
        }
    }

    @Test
    @DisplayName("损坏块被再次定位时仍报告块损坏")
    void testBgzfCorruptBlockReportedOnEverySeek() throws IOException {
        Path file = tempDir.resolve("corrupt-second.bgz");
        byte[] first = bytes(">A1\nACGT\n");
        byte[] second = bytes(">A2\nGGCC\n");
        List<Long> blockStarts = BgzfTestWriter.writeBlocks(file, List.of(first, second), true);
        byte[] raw = Files.readAllBytes(file);
        int secondEnd = (int) (long) blockStarts.get(1) + BgzfTestWriter.block(second).length;
        raw[secondEnd - 8] ^= 0x5A;
        Files.write(file, raw);

        long target = VirtualOffset.encode(blockStarts.get(1), 2);
        try (ByteSource source = ByteSources.open(file)) {
            for (int attempt = 0; attempt < 2; attempt++) {
                CorruptContainerException exception = assertThrows(CorruptContainerException.class, () -> source.seek(target));
                assertEquals(blockStarts.get(1).longValue(), exception.getBlockStart());
            }
            source.seek(VirtualOffset.encode(blockStarts.get(0), 0));
            assertEquals(">A1\n", text(source.readLine()));
            assertEquals("ACGT\n", text(source.readLine()));
            assertThrows(CorruptContainerException.class, source::readLine);
            assertThrows(CorruptContainerException.class, source::readLine);
        }
    }

    @Test
    void testBgzfTruncatedBlockDetected() throws IOException {
        Path file = tempDir.resolve("truncated.bgz");
        BgzfTestWriter.writeBlocks(file, List.of(bytes(">A1\nACGTACGT\n")), false);
        byte[] raw = Files.readAllBytes(file);
        byte[] truncated = new byte[raw.length - 5];
        System.arraycopy(raw, 0, truncated, 0, truncated.length);
        Files.write(file, truncated);

        try (ByteSource source = ByteSources.open(file)) {
            assertThrows(CorruptContainerException.class, source::readLine);
        }
    }

    @Test
    @DisplayName("缺少结束标记块时仍可读出已有数据")
    void testBgzfWithoutEofMarkerStillReadable() throws IOException {
        Path file = tempDir.resolve("no-eof.bgz");
        BgzfTestWriter.writeBlocks(file, List.of(bytes("abc\n"), bytes("def\n")), false);

        try (ByteSource source = ByteSources.open(file)) {
            assertEquals("abc\n", text(source.readLine()));
            assertEquals("def\n", text(source.readLine()));
            assertNull(source.readLine());
        }
    }

    @Test
    @DisplayName("普通 gzip 与缺失魔数的 BGZF 请求被拒绝")
    void testRejectsNonSeekableContainers() throws IOException {
        Path gzipFile = tempDir.resolve("plain.gz");
        try (OutputStream output = new GZIPOutputStream(Files.newOutputStream(gzipFile))) {
            output.write(bytes(">A1\nACGT\n"));
        }
        assertThrows(FormatException.class, () -> ByteSources.open(gzipFile));

        Path bzip2File = tempDir.resolve("plain.bz2");
        Files.write(bzip2File, new byte[] {'B', 'Z', 'h', '9', 0x31, 0x41});
        assertThrows(FormatException.class, () -> ByteSources.open(bzip2File));

        Path textFile = tempDir.resolve("plain.fa");
        Files.writeString(textFile, ">A1\nACGT\n");
        assertThrows(FormatException.class, () -> ByteSources.open(textFile, CompressionKind.BGZF));
        assertEquals(CompressionKind.NONE, ByteSources.detect(textFile));

        try (ByteSource source = ByteSources.open(gzipFile, CompressionKind.NONE)) {
            assertEquals(CompressionKind.NONE, source.compression());
        }
    }

    private static String buildLines(int count) {
        StringBuilder builder = new StringBuilder();
        for (int index = 0; index < count; index++) {
            builder.append("line-").append(index).append(" ACGTACGTAC\n");
        }
        return builder.toString();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.US_ASCII);
    }
}
