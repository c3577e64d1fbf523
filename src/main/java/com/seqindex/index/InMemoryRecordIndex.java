package com.seqindex.index;

import com.seqindex.config.IndexConfig;
import com.seqindex.format.FormatRegistry;
import com.seqindex.format.RecordCursor;
import com.seqindex.format.RecordLocation;
import com.seqindex.format.RecordScanner;
import com.seqindex.storage.ByteSource;
import com.seqindex.storage.ByteSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 单文件内存索引：偏移表常驻内存，记录内容按需从持有的字节源读取。
 *
 * @param <T> 解析回调产出的记录类型
 */
public final class InMemoryRecordIndex<T> implements RecordIndex<T> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryRecordIndex.class);

    private final ByteSource source;
    private final RecordScanner scanner;
    private final RecordParser<T> parser;
    private final Map<String, RecordLocation> locations;
    private boolean closed;

    private InMemoryRecordIndex(ByteSource source, RecordScanner scanner, RecordParser<T> parser,
                                Map<String, RecordLocation> locations) {
        this.source = source;
        this.scanner = scanner;
        this.parser = parser;
        this.locations = locations;
    }

    public static <T> InMemoryRecordIndex<T> build(Path path, String format, RecordParser<T> parser) throws IOException {
        return build(path, format, parser, null, IndexConfig.defaults());
    }

    public static <T> InMemoryRecordIndex<T> build(Path path, String format, RecordParser<T> parser,
                                                   UnaryOperator<String> keyFunction) throws IOException {
        return build(path, format, parser, keyFunction, IndexConfig.defaults());
    }

    /**
     * 扫描整个文件并建立内存偏移表。
     *
     * @param path 源文件
     * @param format 格式名
     * @param parser 解析回调
     * @param keyFunction 可选 key 变换
     * @param config 运行时配置
     * @return 处于打开状态的索引
     * @throws DuplicateKeyException 出现重复 key 时抛出
     * @throws IOException 读取失败或记录格式错误时抛出
     */
    public static <T> InMemoryRecordIndex<T> build(Path path, String format, RecordParser<T> parser,
                                                   UnaryOperator<String> keyFunction, IndexConfig config)
        throws IOException {
        if (parser == null) {
            throw new IllegalArgumentException("解析回调不能为空");
        }
        RecordScanner scanner = FormatRegistry.lookup(format);
        ByteSource source = ByteSources.open(path, config.getCompression(), config.getReadBufferSize());
        try {
            long startNanos = System.nanoTime();
            Map<String, RecordLocation> locations = new LinkedHashMap<>();
            RecordCursor cursor = scanner.scan(source, keyFunction);
            RecordLocation location;
            while ((location = cursor.next()) != null) {
                RecordLocation previous = locations.putIfAbsent(location.key(), location);
                if (previous != null) {
                    throw new DuplicateKeyException(location.key(),
                        "offset " + previous.offset() + " 与 " + location.offset() + ", file=" + path);
                }
            }
            logger.debug("内存索引构建完成: file={}, format={}, compression={}, records={}, elapsedMs={}",
                path, scanner.format(), source.compression(), locations.size(), (System.nanoTime() - startNanos) / 1_000_000);
            return new InMemoryRecordIndex<>(source, scanner, parser, locations);
        } catch (IOException | RuntimeException exception) {
            try {
                source.close();
            } catch (IOException closeException) {
                exception.addSuppressed(closeException);
            }
            throw exception;
        }
    }

    @Override
    public T get(String key) throws IOException {
        return parser.parse(getRaw(key), scanner.format());
    }

    @Override
    public byte[] getRaw(String key) throws IOException {
        ensureOpen();
        RecordLocation location = locations.get(key);
        if (location == null) {
            throw new RecordNotFoundException(key);
        }
        return scanner.extractRaw(source, location.offset(), location.length());
    }

    /**
     * 返回 key 对应的记录位置，不读取记录内容。
     */
    public RecordLocation locate(String key) {
        ensureOpen();
        RecordLocation location = locations.get(key);
        if (location == null) {
            throw new RecordNotFoundException(key);
        }
        return location;
    }

    @Override
    public boolean containsKey(String key) {
        ensureOpen();
        return locations.containsKey(key);
    }

    /**
     * 按构建时的记录顺序遍历 key，索引关闭后继续遍历会抛出 {@link ClosedIndexException}。
     */
    @Override
    public Iterable<String> keys() {
        ensureOpen();
        return () -> new Iterator<>() {
            private final Iterator<String> delegate = locations.keySet().iterator();

            @Override
            public boolean hasNext() {
                ensureOpen();
                return delegate.hasNext();
            }

            @Override
            public String next() {
                ensureOpen();
                return delegate.next();
            }
        };
    }

    @Override
    public long size() {
        ensureOpen();
        return locations.size();
    }

    public String format() {
        return scanner.format();
    }

    public Path path() {
        return source.path();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        source.close();
    }

    private void ensureOpen() {
        if (closed) {
            throw new ClosedIndexException("索引已关闭: " + source.path());
        }
    }
}
