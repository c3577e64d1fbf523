package com.seqindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seqindex.config.Constants;
import com.seqindex.config.IndexConfig;
import com.seqindex.format.FormatRegistry;
import com.seqindex.index.RecordNotFoundException;
import com.seqindex.index.RecordParser;
import com.seqindex.storage.CompressionKind;
import com.seqindex.store.PersistentRecordIndex;
import com.seqindex.store.SourceSpec;
import com.seqindex.store.StoreStatus;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

@Command(
    name = "seqindex",
    description = "🧬 序列文件按 key 随机读取索引工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.GetSubcommand.class,
        MainCommand.KeysSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.RebuildSubcommand.class,
        MainCommand.FormatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    /** 命令行只输出原始字节，不做结构化解析 */
    static final RecordParser<byte[]> RAW_PARSER = (raw, format) -> raw;

    @Option(names = {"-s", "--store"}, description = "索引库文件路径", defaultValue = "./seqindex.db")
    private Path storePath;

    @Option(names = {"--compression"}, description = "源文件压缩类型 (AUTO|NONE|BGZF)", defaultValue = "AUTO")
    private CompressionKind compression;

    @Option(names = {"--absolute-paths"}, description = "在索引库中保存源文件绝对路径")
    private boolean absolutePaths;

    @Option(names = {"--batch-size"}, description = "批量写入定位记录的条数", defaultValue = "1000")
    private int batchSize;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧬 序列文件按 key 随机读取索引工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    IndexConfig buildConfig() {
        IndexConfig config = IndexConfig.defaults();
        config.setCompression(compression == null ? CompressionKind.AUTO : compression);
        config.setRelativePaths(!absolutePaths);
        if (batchSize <= 0) {
            System.err.printf("⚠️ 非法批大小 %d，已回退为默认值 %d%n", batchSize, Constants.DEFAULT_INSERT_BATCH_SIZE);
        } else {
            config.setInsertBatchSize(batchSize);
        }
        return config;
    }

    /**
     * 按分隔符切分默认标识符并取指定字段作为 key；未指定分隔符时返回 null。
     */
    static UnaryOperator<String> keyFunction(String separator, int field) {
        if (separator == null || separator.isEmpty()) {
            return null;
        }
        if (field < 0) {
            throw new IllegalArgumentException("key 字段序号不能为负数: " + field);
        }
        Pattern pattern = Pattern.compile(Pattern.quote(separator));
        return identifier -> {
            String[] fields = pattern.split(identifier, -1);
            return field < fields.length ? fields[field] : "";
        };
    }

    @Command(name = "index", description = "📂 扫描源文件并构建索引库")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的源文件", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"-f", "--format"}, description = "源文件格式", required = true)
        private String format;

        @Option(names = {"--key-separator"}, description = "把标识符按此分隔符切分后取字段作为 key")
        private String keySeparator;

        @Option(names = {"--key-field"}, description = "切分后作为 key 的字段序号（从 0 开始）", defaultValue = "0")
        private int keyField;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            System.out.println("🚀 开始构建索引库...");
            System.out.println("📁 索引库: " + main.storePath);
            System.out.println("📂 源文件: " + sourcePaths);
            List<SourceSpec> sources = sourcePaths.stream().map(path -> new SourceSpec(path, format)).toList();
            long start = System.currentTimeMillis();
            try (PersistentRecordIndex<byte[]> index = PersistentRecordIndex.build(
                    main.storePath, sources, RAW_PARSER, keyFunction(keySeparator, keyField), main.buildConfig())) {
                long elapsed = System.currentTimeMillis() - start;
                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   文件数: " + index.sourceFiles().size());
                System.out.println("   记录数: " + index.size());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "get", description = "🔎 按 key 输出记录原始内容")
    static class GetSubcommand implements Callable<Integer> {

        @Parameters(description = "记录 key", arity = "1..*")
        private List<String> keys;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (PersistentRecordIndex<byte[]> index = PersistentRecordIndex.open(main.storePath, RAW_PARSER, main.buildConfig())) {
                for (String key : keys) {
                    byte[] raw = index.getRaw(key);
                    System.out.write(raw, 0, raw.length);
                }
                System.out.flush();
                return 0;
            } catch (RecordNotFoundException exception) {
                System.out.flush();
                System.err.println("❌ 未找到记录: " + exception.getKey());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 读取失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "keys", description = "📜 列出索引库中的全部 key")
    static class KeysSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (PersistentRecordIndex<byte[]> index = PersistentRecordIndex.open(main.storePath, RAW_PARSER, main.buildConfig())) {
                for (String key : index.keys()) {
                    System.out.println(key);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取 key 失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引库统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Option(names = {"--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (PersistentRecordIndex<byte[]> index = PersistentRecordIndex.open(main.storePath, RAW_PARSER, main.buildConfig())) {
                StoreStatus status = index.status();
                if ("json".equalsIgnoreCase(format)) {
                    printJsonStatus(status);
                } else {
                    printTextStatus(status);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextStatus(StoreStatus status) {
            System.out.println("📊 索引库状态");
            System.out.println("═══════════");
            System.out.println("📁 索引库: " + status.storePath());
            System.out.println("🔖 schema 版本: " + status.schemaVersion());
            System.out.println("📄 记录总数: " + status.recordCount());
            System.out.println("🕒 构建时间: " + status.createdAt());
            for (StoreStatus.FileStatus file : status.files()) {
                System.out.printf("   [%d] %s (%s, %s, %s)%s%n",
                    file.fileId(), file.path(), file.format(), file.compression(), formatBytes(file.sizeBytes()),
                    file.changed() ? " ⚠️ 建库后已变化" : "");
            }
        }

        private void printJsonStatus(StoreStatus status) throws IOException {
            ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(status));
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    @Command(name = "rebuild", description = "🔄 按登记的源文件从头重建索引库")
    static class RebuildSubcommand implements Callable<Integer> {

        @Option(names = {"--yes"}, description = "确认重建", defaultValue = "false")
        private boolean confirmed;

        @Option(names = {"--key-separator"}, description = "把标识符按此分隔符切分后取字段作为 key")
        private String keySeparator;

        @Option(names = {"--key-field"}, description = "切分后作为 key 的字段序号（从 0 开始）", defaultValue = "0")
        private int keyField;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (!confirmed) {
                System.out.println("⚠️ 警告: 这将按登记的源文件重新扫描并替换现有索引库");
                System.out.println("使用 --yes 确认");
                return 1;
            }
            System.out.println("🔄 开始重建索引库...");
            long start = System.currentTimeMillis();
            try (PersistentRecordIndex<byte[]> index = PersistentRecordIndex.rebuild(
                    main.storePath, RAW_PARSER, keyFunction(keySeparator, keyField), main.buildConfig())) {
                long elapsed = System.currentTimeMillis() - start;
                System.out.println("✅ 重建完成！记录数 " + index.size() + "，用时 " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 重建失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "formats", description = "📋 列出支持索引的格式")
    static class FormatsSubcommand implements Callable<Integer> {

        @Override
        public Integer call() {
            FormatRegistry.formats().forEach(System.out::println);
            return 0;
        }
    }
}
