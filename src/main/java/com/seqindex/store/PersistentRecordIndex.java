package com.seqindex.store;

import com.seqindex.config.Constants;
import com.seqindex.config.IndexConfig;
import com.seqindex.format.FormatRegistry;
import com.seqindex.format.RecordCursor;
import com.seqindex.format.RecordLocation;
import com.seqindex.format.RecordScanner;
import com.seqindex.index.ClosedIndexException;
import com.seqindex.index.DuplicateKeyException;
import com.seqindex.index.RecordIndex;
import com.seqindex.index.RecordNotFoundException;
import com.seqindex.index.RecordParser;
import com.seqindex.storage.ByteSource;
import com.seqindex.storage.ByteSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 基于 SQLite 的持久化多文件索引。
 *
 * <p>索引库由一次完整扫描生成，之后只读；重建总是从头生成新库再整体替换。重新打开时信任库中的
 * 文件登记表，不校验源文件是否变化，需要时由调用方显式调用 {@link #changedSources()}。
 *
 * @param <T> 解析回调产出的记录类型
 */
public final class PersistentRecordIndex<T> implements RecordIndex<T> {
    private static final Logger logger = LoggerFactory.getLogger(PersistentRecordIndex.class);

    private final Path storePath;
    private final IndexStore store;
    private final Map<Integer, SourceFile> sourceFiles;
    private final RecordParser<T> parser;
    private final IndexConfig config;
    private final long recordCount;
    private boolean closed;

    private PersistentRecordIndex(Path storePath, IndexStore store, Map<Integer, SourceFile> sourceFiles,
                                  RecordParser<T> parser, IndexConfig config, long recordCount) {
        this.storePath = storePath;
        this.store = store;
        this.sourceFiles = sourceFiles;
        this.parser = parser;
        this.config = config;
        this.recordCount = recordCount;
    }

    public static <T> PersistentRecordIndex<T> build(Path storePath, List<SourceSpec> sources, RecordParser<T> parser)
        throws IOException {
        return build(storePath, sources, parser, null, IndexConfig.defaults());
    }

    /**
     * 扫描全部源文件并生成新的索引库。
     *
     * @param storePath 索引库路径，必须尚不存在
     * @param sources 源文件列表，fileId 按列表顺序分配
     * @param parser 解析回调
     * @param keyFunction 可选 key 变换
     * @param config 运行时配置
     * @return 打开的索引
     * @throws FileAlreadyExistsException 索引库已存在时抛出
     * @throws DuplicateKeyException 同一文件内或跨文件出现重复 key 时抛出，不留下可用的索引库
     * @throws IOException 扫描源文件失败时抛出，不留下可用的索引库
     */
    public static <T> PersistentRecordIndex<T> build(Path storePath, List<SourceSpec> sources, RecordParser<T> parser,
                                                     UnaryOperator<String> keyFunction, IndexConfig config)
        throws IOException {
        Path absoluteStore = storePath.toAbsolutePath().normalize();
        if (Files.exists(absoluteStore)) {
            throw new FileAlreadyExistsException(absoluteStore.toString(), null, "索引库已存在");
        }
        writeStore(absoluteStore, sources, keyFunction, config, false);
        return open(absoluteStore, parser, config);
    }

    public static <T> PersistentRecordIndex<T> open(Path storePath, RecordParser<T> parser) {
        return open(storePath, parser, IndexConfig.defaults());
    }

    /**
     * 打开已有索引库，不重新扫描源文件。
     *
     * @throws IncompatibleStoreException schema 不符或记录数与元数据不一致时抛出
     */
    public static <T> PersistentRecordIndex<T> open(Path storePath, RecordParser<T> parser, IndexConfig config) {
        if (parser == null) {
            throw new IllegalArgumentException("解析回调不能为空");
        }
        Path absoluteStore = storePath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absoluteStore)) {
            throw new IllegalArgumentException("索引库不存在: " + absoluteStore);
        }
        IndexStore store = IndexStore.openReadOnly(absoluteStore);
        try {
            String countText = store.getMeta(IndexStore.META_COUNT)
                .orElseThrow(() -> new IncompatibleStoreException("索引库缺少记录数: " + absoluteStore));
            long declaredCount;
            try {
                declaredCount = Long.parseLong(countText.trim());
            } catch (NumberFormatException exception) {
                throw new IncompatibleStoreException("索引库记录数无法解析: " + countText + ", store=" + absoluteStore, exception);
            }
            long actualCount = store.countLocators();
            if (declaredCount != actualCount) {
                throw new IncompatibleStoreException("索引库记录数不一致: 元数据 " + declaredCount + ", 实际 " + actualCount);
            }
            boolean relative = store.getMeta(IndexStore.META_RELATIVE_PATHS).map(Boolean::parseBoolean).orElse(false);
            Path baseDir = absoluteStore.getParent();
            Map<Integer, SourceFile> files = new LinkedHashMap<>();
            for (SourceFile file : store.listFiles()) {
                Path resolved = relative ? baseDir.resolve(file.path()).normalize() : file.path();
                files.put(file.fileId(), new SourceFile(file.fileId(), resolved, file.format(), file.compression(),
                    file.sizeBytes(), file.mtime()));
            }
            logger.debug("打开索引库: store={}, files={}, records={}", absoluteStore, files.size(), actualCount);
            return new PersistentRecordIndex<>(absoluteStore, store, files, parser, config, actualCount);
        } catch (RuntimeException exception) {
            try {
                store.close();
            } catch (RuntimeException closeException) {
                exception.addSuppressed(closeException);
            }
            throw exception;
        }
    }

    /**
     * 索引库存在时直接打开，否则构建。
     *
     * <p>打开已有库且给出了 sources 时，要求其与库中登记的文件（按顺序）一致。
     *
     * @throws IllegalArgumentException 已有库登记的文件与 sources 不一致时抛出
     */
    public static <T> PersistentRecordIndex<T> openOrBuild(Path storePath, List<SourceSpec> sources, RecordParser<T> parser,
                                                           UnaryOperator<String> keyFunction, IndexConfig config)
        throws IOException {
        if (!Files.exists(storePath)) {
            return build(storePath, sources, parser, keyFunction, config);
        }
        PersistentRecordIndex<T> index = open(storePath, parser, config);
        if (sources != null && !sources.isEmpty()) {
            List<SourceSpec> registered = index.sourceFiles().stream().map(SourceFile::toSpec).toList();
            List<SourceSpec> requested = sources.stream()
                .map(spec -> new SourceSpec(spec.path().toAbsolutePath().normalize(), FormatRegistry.lookup(spec.format()).format()))
                .toList();
            if (!registered.equals(requested)) {
                index.close();
                throw new IllegalArgumentException("索引库登记的源文件与请求不一致: 库中 " + registered + ", 请求 " + requested);
            }
        }
        return index;
    }

    /**
     * 按已有索引库登记的源文件与格式从头重建，新库生成成功后才替换旧库。
     */
    public static <T> PersistentRecordIndex<T> rebuild(Path storePath, RecordParser<T> parser,
                                                       UnaryOperator<String> keyFunction, IndexConfig config)
        throws IOException {
        Path absoluteStore = storePath.toAbsolutePath().normalize();
        List<SourceSpec> sources;
        try (PersistentRecordIndex<T> existing = open(absoluteStore, parser, config)) {
            sources = existing.sourceFiles().stream().map(SourceFile::toSpec).toList();
        }
        writeStore(absoluteStore, sources, keyFunction, config, true);
        return open(absoluteStore, parser, config);
    }

    @Override
    public T get(String key) throws IOException {
        ensureOpen();
        RecordLocator locator = store.findLocator(key).orElseThrow(() -> new RecordNotFoundException(key));
        SourceFile file = fileOf(locator);
        return parser.parse(readRaw(locator, file), file.format());
    }

    @Override
    public byte[] getRaw(String key) throws IOException {
        ensureOpen();
        RecordLocator locator = store.findLocator(key).orElseThrow(() -> new RecordNotFoundException(key));
        return readRaw(locator, fileOf(locator));
    }

    /**
     * 返回 key 的定位信息，不读取源文件。
     */
    public Optional<RecordLocator> locate(String key) {
        ensureOpen();
        return store.findLocator(key);
    }

    @Override
    public boolean containsKey(String key) {
        ensureOpen();
        return store.findLocator(key).isPresent();
    }

    /**
     * 按 key 字典序分页惰性遍历。
     */
    @Override
    public Iterable<String> keys() {
        ensureOpen();
        return () -> new Iterator<>() {
            private List<String> page = List.of();
            private int position;
            private String lastKey;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                ensureOpen();
                if (position < page.size()) {
                    return true;
                }
                if (exhausted) {
                    return false;
                }
                page = store.keysAfter(lastKey, config.getKeyPageSize());
                position = 0;
                if (page.size() < config.getKeyPageSize()) {
                    exhausted = true;
                }
                return !page.isEmpty();
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                lastKey = page.get(position++);
                return lastKey;
            }
        };
    }

    @Override
    public long size() {
        ensureOpen();
        return recordCount;
    }

    public Path storePath() {
        return storePath;
    }

    /**
     * 按登记顺序返回源文件（路径已解析为绝对路径）。
     */
    public List<SourceFile> sourceFiles() {
        ensureOpen();
        return List.copyOf(sourceFiles.values());
    }

    /**
     * 显式检查源文件是否在建库后被移动或改写（大小或修改时间不同）。
     */
    public List<SourceFile> changedSources() throws IOException {
        ensureOpen();
        List<SourceFile> changed = new ArrayList<>();
        for (SourceFile file : sourceFiles.values()) {
            if (isChanged(file)) {
                changed.add(file);
            }
        }
        return changed;
    }

    public StoreStatus status() throws IOException {
        ensureOpen();
        List<StoreStatus.FileStatus> files = new ArrayList<>();
        for (SourceFile file : sourceFiles.values()) {
            files.add(new StoreStatus.FileStatus(
                file.fileId(),
                file.path().toString(),
                file.format(),
                file.compression().name(),
                file.sizeBytes(),
                file.mtime(),
                isChanged(file)
            ));
        }
        Instant createdAt = store.getMeta(IndexStore.META_CREATED_AT).map(this::parseCreatedAt).orElse(null);
        boolean relative = store.getMeta(IndexStore.META_RELATIVE_PATHS).map(Boolean::parseBoolean).orElse(false);
        return new StoreStatus(storePath.toString(), Constants.SCHEMA_VERSION, recordCount, createdAt, relative, files);
    }

    /**
     * 读取全部定位记录（按文件与偏移排序）。
     */
    public List<RecordLocator> locators() {
        ensureOpen();
        return store.listLocators();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        store.close();
    }

    private byte[] readRaw(RecordLocator locator, SourceFile file) throws IOException {
        RecordScanner scanner = FormatRegistry.lookup(file.format());
        try (ByteSource source = ByteSources.open(file.path(), file.compression(), config.getReadBufferSize())) {
            return scanner.extractRaw(source, locator.offset(), locator.length());
        }
    }

    private Instant parseCreatedAt(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeException exception) {
            throw new IncompatibleStoreException("索引库构建时间无法解析: " + value + ", store=" + storePath, exception);
        }
    }

    private SourceFile fileOf(RecordLocator locator) {
        SourceFile file = sourceFiles.get(locator.fileId());
        if (file == null) {
            throw new IncompatibleStoreException("定位记录引用了未登记的文件: fileId=" + locator.fileId() + ", key=" + locator.key());
        }
        return file;
    }

    private void ensureOpen() {
        if (closed) {
            throw new ClosedIndexException("索引库已关闭: " + storePath);
        }
    }

    private static boolean isChanged(SourceFile file) throws IOException {
        if (!Files.isRegularFile(file.path())) {
            return true;
        }
        return Files.size(file.path()) != file.sizeBytes()
            || !Files.getLastModifiedTime(file.path()).toInstant().equals(file.mtime());
    }

    /**
     * 在同目录临时文件中完成整个构建，成功后整体移动到目标路径；任何失败都删除临时文件。
     */
    private static void writeStore(Path absoluteStore, List<SourceSpec> sources, UnaryOperator<String> keyFunction,
                                   IndexConfig config, boolean replaceExisting) throws IOException {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个源文件");
        }
        List<RecordScanner> scanners = new ArrayList<>(sources.size());
        for (SourceSpec spec : sources) {
            scanners.add(FormatRegistry.lookup(spec.format()));
        }

        Path baseDir = absoluteStore.getParent();
        Files.createDirectories(baseDir);
        Path buildPath = baseDir.resolve(absoluteStore.getFileName() + Constants.BUILDING_SUFFIX);
        if (Files.exists(buildPath)) {
            logger.warn("删除上次未完成构建留下的临时文件: {}", buildPath);
            deleteBuildFiles(buildPath);
        }

        long startNanos = System.nanoTime();
        logger.info("开始构建索引库: store={}, files={}", absoluteStore, sources.size());
        try {
            long totalRecords;
            try (IndexStore store = IndexStore.create(buildPath)) {
                totalRecords = 0;
                Set<String> formats = new LinkedHashSet<>();
                for (int fileId = 0; fileId < sources.size(); fileId++) {
                    RecordScanner scanner = scanners.get(fileId);
                    Path sourcePath = sources.get(fileId).path().toAbsolutePath().normalize();
                    totalRecords += scanFile(store, fileId, sourcePath, scanner, keyFunction, config, baseDir);
                    formats.add(scanner.format());
                }

                Optional<String> duplicate = store.findFirstDuplicateKey();
                if (duplicate.isPresent()) {
                    throw new DuplicateKeyException(duplicate.get(), "构建索引库 " + absoluteStore);
                }
                store.createKeyIndex();
                store.putMeta(IndexStore.META_SCHEMA_VERSION, String.valueOf(Constants.SCHEMA_VERSION));
                store.putMeta(IndexStore.META_COUNT, String.valueOf(totalRecords));
                store.putMeta(IndexStore.META_FORMAT, String.join(",", formats));
                store.putMeta(IndexStore.META_CREATED_AT, Instant.now().toString());
                store.putMeta(IndexStore.META_RELATIVE_PATHS, String.valueOf(config.isRelativePaths()));
                store.commit();
            }
            moveIntoPlace(buildPath, absoluteStore, replaceExisting);
            logger.info("索引库构建完成: store={}, records={}, elapsedMs={}",
                absoluteStore, totalRecords, (System.nanoTime() - startNanos) / 1_000_000);
        } catch (IOException | RuntimeException exception) {
            logger.error("索引库构建失败，已丢弃临时文件: store={}, reason={}", absoluteStore, exception.getMessage());
            try {
                deleteBuildFiles(buildPath);
            } catch (IOException deleteException) {
                exception.addSuppressed(deleteException);
            }
            throw exception;
        }
    }

    private static long scanFile(IndexStore store, int fileId, Path sourcePath, RecordScanner scanner,
                                 UnaryOperator<String> keyFunction, IndexConfig config, Path baseDir) throws IOException {
        try (ByteSource source = ByteSources.open(sourcePath, config.getCompression(), config.getReadBufferSize())) {
            SourceFile file = new SourceFile(
                fileId,
                sourcePath,
                scanner.format(),
                source.compression(),
                Files.size(sourcePath),
                Files.getLastModifiedTime(sourcePath).toInstant()
            );
            store.insertFile(file, storedName(baseDir, sourcePath, config.isRelativePaths()));

            long fileRecords = 0;
            RecordCursor cursor = scanner.scan(source, keyFunction);
            RecordLocation location;
            while ((location = cursor.next()) != null) {
                store.addLocator(new RecordLocator(location.key(), fileId, location.offset(), location.length()),
                    config.getInsertBatchSize());
                fileRecords++;
            }
            store.flushLocators();
            logger.debug("源文件扫描完成: fileId={}, file={}, format={}, compression={}, records={}",
                fileId, sourcePath, scanner.format(), source.compression(), fileRecords);
            return fileRecords;
        }
    }

    private static String storedName(Path baseDir, Path sourcePath, boolean relative) {
        Path stored = sourcePath;
        if (relative) {
            try {
                stored = baseDir.relativize(sourcePath);
            } catch (IllegalArgumentException exception) {
                // 不同根目录（如不同盘符）无法相对化，保存绝对路径
                stored = sourcePath;
            }
        }
        return stored.toString().replace('\\', '/');
    }

    private static void moveIntoPlace(Path buildPath, Path target, boolean replaceExisting) throws IOException {
        try {
            if (replaceExisting) {
                Files.move(buildPath, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(buildPath, target, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (AtomicMoveNotSupportedException exception) {
            if (replaceExisting) {
                Files.move(buildPath, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(buildPath, target);
            }
        }
    }

    private static void deleteBuildFiles(Path buildPath) throws IOException {
        Files.deleteIfExists(buildPath);
        for (String suffix : List.of("-journal", "-wal", "-shm")) {
            Files.deleteIfExists(buildPath.resolveSibling(buildPath.getFileName() + suffix));
        }
    }
}
