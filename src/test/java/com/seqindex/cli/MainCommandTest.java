package com.seqindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.seqindex.config.Constants;
import com.seqindex.config.IndexConfig;
import com.seqindex.storage.CompressionKind;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallPrintsUsageHint() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--store", "x.db", "--compression", "BGZF", "index",
            "-f", "fasta", "a.fa", "b.fa");

        assertNotNull(parseResult.subcommand());
        assertEquals("index", parseResult.subcommand().commandSpec().name());
        assertEquals("fasta", parseResult.subcommand().matchedOptionValue("-f", ""));
        assertEquals(Path.of("x.db"), parseResult.matchedOptionValue("--store", Path.of("")));
    }

    @Test
    void testBuildConfigFromOptions() throws Exception {
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "compression", CompressionKind.BGZF);
        setField(mainCommand, "absolutePaths", true);
        setField(mainCommand, "batchSize", 50);

        IndexConfig config = mainCommand.buildConfig();
        assertEquals(CompressionKind.BGZF, config.getCompression());
        assertFalse(config.isRelativePaths());
        assertEquals(50, config.getInsertBatchSize());

        setField(mainCommand, "batchSize", 0);
        assertEquals(Constants.DEFAULT_INSERT_BATCH_SIZE, mainCommand.buildConfig().getInsertBatchSize());
    }

    @Test
    void testKeyFunction() {
        assertNull(MainCommand.keyFunction(null, 0));
        assertNull(MainCommand.keyFunction("", 3));

        UnaryOperator<String> second = MainCommand.keyFunction("|", 1);
        assertEquals("101", second.apply("gi|101|ref|NM_1|"));
        assertEquals("", MainCommand.keyFunction("|", 9).apply("gi|101"));
        assertThrows(IllegalArgumentException.class, () -> MainCommand.keyFunction("|", -1));
    }

    @Test
    void testRebuildSubcommandWithoutConfirmReturnsOne() {
        MainCommand.RebuildSubcommand rebuildSubcommand = new MainCommand.RebuildSubcommand();
        assertEquals(1, rebuildSubcommand.call());
    }

    @Test
    void testStatusSubcommandFormatBytesBranches() throws Exception {
        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        Method formatBytesMethod = MainCommand.StatusSubcommand.class.getDeclaredMethod("formatBytes", long.class);
        formatBytesMethod.setAccessible(true);

        assertEquals("512 B", formatBytesMethod.invoke(statusSubcommand, 512L));
        assertEquals("2.00 KB", formatBytesMethod.invoke(statusSubcommand, 2048L));
        assertEquals("3.00 MB", formatBytesMethod.invoke(statusSubcommand, 3L * 1024 * 1024));
        assertEquals("4.00 GB", formatBytesMethod.invoke(statusSubcommand, 4L * 1024 * 1024 * 1024));
    }

    @Test
    void testFormatsSubcommandListsRegistry() {
        String output = captureOut(() -> new MainCommand.FormatsSubcommand().call());
        assertTrue(output.contains("fasta"));
        assertTrue(output.contains("genbank"));
        assertFalse(output.contains("stockholm"));
    }

    @Test
    void testSubcommandsHappyPath() throws Exception {
        Path source = tempDir.resolve("reads.fa");
        Files.writeString(source, ">gi|101|x\nACGT\n>gi|102|y\nGG\n");
        Path storePath = tempDir.resolve("cli.db");

        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "storePath", storePath);
        setField(mainCommand, "compression", CompressionKind.AUTO);
        setField(mainCommand, "batchSize", 10);

        MainCommand.IndexSubcommand indexSubcommand = new MainCommand.IndexSubcommand();
        setField(indexSubcommand, "main", mainCommand);
        setField(indexSubcommand, "sourcePaths", List.of(source));
        setField(indexSubcommand, "format", "fasta");
        setField(indexSubcommand, "keySeparator", "|");
        setField(indexSubcommand, "keyField", 1);
        assertEquals(0, indexSubcommand.call());
        assertTrue(Files.isRegularFile(storePath));

        // 已存在的索引库不会被覆盖
        assertEquals(1, indexSubcommand.call());

        MainCommand.GetSubcommand getSubcommand = new MainCommand.GetSubcommand();
        setField(getSubcommand, "main", mainCommand);
        setField(getSubcommand, "keys", List.of("102"));
        assertEquals(">gi|102|y\nGG\n", captureOut(getSubcommand));

        setField(getSubcommand, "keys", List.of("999"));
        assertEquals(1, getSubcommand.call());

        MainCommand.KeysSubcommand keysSubcommand = new MainCommand.KeysSubcommand();
        setField(keysSubcommand, "main", mainCommand);
        String keysOutput = captureOut(keysSubcommand);
        assertEquals(List.of("101", "102"), keysOutput.lines().toList());

        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        setField(statusSubcommand, "main", mainCommand);
        setField(statusSubcommand, "format", "text");
        assertTrue(captureOut(statusSubcommand).contains("记录总数: 2"));

        setField(statusSubcommand, "format", "json");
        String json = captureOut(statusSubcommand);
        assertTrue(json.contains("\"recordCount\" : 2"));
        assertTrue(json.contains("\"createdAt\""));

        MainCommand.RebuildSubcommand rebuildSubcommand = new MainCommand.RebuildSubcommand();
        setField(rebuildSubcommand, "main", mainCommand);
        setField(rebuildSubcommand, "confirmed", true);
        setField(rebuildSubcommand, "keySeparator", "|");
        setField(rebuildSubcommand, "keyField", 1);
        assertEquals(0, rebuildSubcommand.call());
    }

    @Test
    void testGetWithMissingStoreReturnsOne() throws Exception {
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "storePath", tempDir.resolve("absent.db"));

        MainCommand.GetSubcommand getSubcommand = new MainCommand.GetSubcommand();
        setField(getSubcommand, "main", mainCommand);
        setField(getSubcommand, "keys", List.of("A1"));
        assertEquals(1, getSubcommand.call());
    }

    private static String captureOut(Callable<Integer> command) {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            command.call();
        } catch (Exception exception) {
            throw new IllegalStateException(exception);
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
