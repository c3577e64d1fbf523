package com.seqindex.store;

import com.seqindex.config.Constants;
import com.seqindex.storage.CompressionKind;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 索引库的 SQLite 访问层：元数据、文件登记表与记录定位表。
 */
public final class IndexStore implements AutoCloseable {
    private static final String CREATE_META_TABLE_SQL = """
            CREATE TABLE meta_data (
                key   TEXT PRIMARY KEY,
                value TEXT NOT NULL
            )
            """;

    private static final String CREATE_FILE_TABLE_SQL = """
            CREATE TABLE file_data (
                file_number INTEGER PRIMARY KEY,
                name        TEXT NOT NULL,
                format      TEXT NOT NULL,
                compression TEXT NOT NULL,
                size_bytes  INTEGER NOT NULL,
                mtime       TEXT NOT NULL
            )
            """;

    private static final String CREATE_OFFSET_TABLE_SQL = """
            CREATE TABLE offset_data (
                key           TEXT NOT NULL,
                file_number   INTEGER NOT NULL,
                record_offset INTEGER NOT NULL,
                record_length INTEGER NOT NULL
            )
            """;

    private static final String CREATE_KEY_INDEX_SQL = "CREATE UNIQUE INDEX key_index ON offset_data(key)";
    private static final String INSERT_LOCATOR_SQL =
        "INSERT INTO offset_data(key, file_number, record_offset, record_length) VALUES (?, ?, ?, ?)";

    static final String META_SCHEMA_VERSION = "schema_version";
    static final String META_COUNT = "count";
    static final String META_FORMAT = "format";
    static final String META_CREATED_AT = "created_at";
    static final String META_RELATIVE_PATHS = "filenames_relative_to_index";

    private final Connection connection;
    private final Path dbPath;
    private PreparedStatement pendingInsert;
    private int pendingCount;

    private IndexStore(Path dbPath, Connection connection) {
        this.dbPath = dbPath;
        this.connection = connection;
    }

    /**
     * 在新文件中创建空索引库并开启构建事务。
     */
    public static IndexStore create(Path dbPath) {
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            IndexStore store = new IndexStore(dbPath, connection);
            store.initializeSchema();
            return store;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("创建索引库失败: " + dbPath, sqlException);
        }
    }

    /**
     * 以只读方式打开已有索引库并校验 schema。
     *
     * @throws IncompatibleStoreException 文件不是可识别的索引库时抛出
     */
    public static IndexStore openReadOnly(Path dbPath) {
        Connection connection;
        try {
            SQLiteConfig config = new SQLiteConfig();
            config.setReadOnly(true);
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath(), config.toProperties());
        } catch (SQLException sqlException) {
            throw new IncompatibleStoreException("无法打开索引库文件: " + dbPath, sqlException);
        }
        IndexStore store = new IndexStore(dbPath, connection);
        try {
            store.validateSchema();
            return store;
        } catch (RuntimeException exception) {
            try {
                connection.close();
            } catch (SQLException closeException) {
                exception.addSuppressed(closeException);
            }
            throw exception;
        }
    }

    /**
     * 登记一个源文件。
     *
     * @param file 登记信息
     * @param storedName 写入库中的路径文本（可能为相对路径）
     */
    public void insertFile(SourceFile file, String storedName) {
        String sql = """
                INSERT INTO file_data(file_number, name, format, compression, size_bytes, mtime)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, file.fileId());
            preparedStatement.setString(2, storedName);
            preparedStatement.setString(3, file.format());
            preparedStatement.setString(4, file.compression().name());
            preparedStatement.setLong(5, file.sizeBytes());
            preparedStatement.setString(6, file.mtime().toString());
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("登记源文件失败, fileId=" + file.fileId(), sqlException);
        }
    }

    /**
     * 追加一条定位记录，累计到批大小时写入。
     */
    public void addLocator(RecordLocator locator, int batchSize) {
        try {
            if (pendingInsert == null) {
                pendingInsert = connection.prepareStatement(INSERT_LOCATOR_SQL);
            }
            pendingInsert.setString(1, locator.key());
            pendingInsert.setInt(2, locator.fileId());
            pendingInsert.setLong(3, locator.offset());
            pendingInsert.setLong(4, locator.length());
            pendingInsert.addBatch();
            pendingCount++;
            if (pendingCount >= batchSize) {
                flushLocators();
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入定位记录失败, key=" + locator.key(), sqlException);
        }
    }

    /**
     * 写入尚未提交到库中的定位记录批次。
     */
    public void flushLocators() {
        if (pendingInsert == null || pendingCount == 0) {
            return;
        }
        try {
            pendingInsert.executeBatch();
            pendingCount = 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("批量写入定位记录失败", sqlException);
        }
    }

    /**
     * 查找第一个出现多次的 key（按首次写入顺序）。
     */
    public Optional<String> findFirstDuplicateKey() {
        String sql = """
                SELECT key
                FROM offset_data
                GROUP BY key
                HAVING COUNT(*) > 1
                ORDER BY MIN(rowid)
                LIMIT 1
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? Optional.of(resultSet.getString(1)) : Optional.empty();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("检查重复 key 失败", sqlException);
        }
    }

    public void createKeyIndex() {
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_KEY_INDEX_SQL);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("创建 key 索引失败", sqlException);
        }
    }

    public void putMeta(String key, String value) {
        String sql = "INSERT OR REPLACE INTO meta_data(key, value) VALUES (?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, key);
            preparedStatement.setString(2, value);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入元数据失败, key=" + key, sqlException);
        }
    }

    public Optional<String> getMeta(String key) {
        String sql = "SELECT value FROM meta_data WHERE key = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, key);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString(1)) : Optional.empty();
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取元数据失败, key=" + key, sqlException);
        }
    }

    /**
     * 提交构建事务。
     */
    public void commit() {
        flushLocators();
        try {
            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("提交索引库失败: " + dbPath, sqlException);
        }
    }

    /**
     * 按 key 查找定位记录。
     */
    public Optional<RecordLocator> findLocator(String key) {
        String sql = "SELECT key, file_number, record_offset, record_length FROM offset_data WHERE key = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, key);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new RecordLocator(
                        resultSet.getString("key"),
                        resultSet.getInt("file_number"),
                        resultSet.getLong("record_offset"),
                        resultSet.getLong("record_length")
                ));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按 key 查询失败, key=" + key, sqlException);
        }
    }

    /**
     * 按 key 字典序分页读取，afterKey 为空时从头开始。
     */
    public List<String> keysAfter(String afterKey, int limit) {
        String sql = afterKey == null
            ? "SELECT key FROM offset_data ORDER BY key LIMIT ?"
            : "SELECT key FROM offset_data WHERE key > ? ORDER BY key LIMIT ?";
        List<String> keys = new ArrayList<>(limit);
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            if (afterKey == null) {
                preparedStatement.setInt(1, limit);
            } else {
                preparedStatement.setString(1, afterKey);
                preparedStatement.setInt(2, limit);
            }
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    keys.add(resultSet.getString(1));
                }
            }
            return keys;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("分页读取 key 失败", sqlException);
        }
    }

    /**
     * 按文件序号读取全部定位记录，主要用于比较两次构建结果。
     */
    public List<RecordLocator> listLocators() {
        String sql = """
                SELECT key, file_number, record_offset, record_length
                FROM offset_data
                ORDER BY file_number, record_offset
                """;
        List<RecordLocator> locators = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                locators.add(new RecordLocator(
                        resultSet.getString(1),
                        resultSet.getInt(2),
                        resultSet.getLong(3),
                        resultSet.getLong(4)
                ));
            }
            return locators;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取定位记录失败", sqlException);
        }
    }

    public long countLocators() {
        String sql = "SELECT COUNT(*) FROM offset_data";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询记录总数失败", sqlException);
        }
    }

    /**
     * 按登记顺序读取文件登记表，路径为库中保存的原始文本。
     */
    public List<SourceFile> listFiles() {
        String sql = "SELECT file_number, name, format, compression, size_bytes, mtime FROM file_data ORDER BY file_number";
        List<SourceFile> files = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                int fileId = resultSet.getInt("file_number");
                try {
                    files.add(new SourceFile(
                            fileId,
                            Path.of(resultSet.getString("name")),
                            resultSet.getString("format"),
                            CompressionKind.valueOf(resultSet.getString("compression")),
                            resultSet.getLong("size_bytes"),
                            Instant.parse(resultSet.getString("mtime"))
                    ));
                } catch (IllegalArgumentException | DateTimeException exception) {
                    throw new IncompatibleStoreException("文件登记表内容损坏, fileId=" + fileId + ", store=" + dbPath, exception);
                }
            }
            return files;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取文件登记表失败", sqlException);
        }
    }

    @Override
    public void close() {
        try {
            if (pendingInsert != null) {
                pendingInsert.close();
            }
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_META_TABLE_SQL);
            statement.execute(CREATE_FILE_TABLE_SQL);
            statement.execute(CREATE_OFFSET_TABLE_SQL);
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        }
    }

    private void validateSchema() {
        String sql = """
                SELECT COUNT(*)
                FROM sqlite_master
                WHERE type = 'table' AND name IN ('meta_data', 'file_data', 'offset_data')
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            if (!resultSet.next() || resultSet.getInt(1) != 3) {
                throw new IncompatibleStoreException("索引库缺少必需的数据表: " + dbPath);
            }
        } catch (SQLException sqlException) {
            throw new IncompatibleStoreException("无法识别的索引库文件: " + dbPath, sqlException);
        }

        String version = getMeta(META_SCHEMA_VERSION)
            .orElseThrow(() -> new IncompatibleStoreException("索引库缺少 schema 版本: " + dbPath));
        if (!String.valueOf(Constants.SCHEMA_VERSION).equals(version)) {
            throw new IncompatibleStoreException("索引库 schema 版本不支持: " + version + ", 期望 " + Constants.SCHEMA_VERSION);
        }
    }
}
