package com.eventquery.event;

import com.eventquery.compile.SqlConditions;
import com.eventquery.config.Constants;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 SQLite 的事件表，实现 {@link EventStore}。
 */
public final class EventTable implements EventStore, AutoCloseable {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                timestamp   TEXT NOT NULL,
                message     TEXT,
                severity    TEXT,
                source      TEXT,
                device_id   TEXT,
                category    TEXT,
                metadata    TEXT
            )
            """;

    private static final String CREATE_INDEX_SQL = "CREATE INDEX IF NOT EXISTS idx_%1$s_%2$s ON %1$s(%2$s)";
    private static final List<String> INDEXED_COLUMNS = List.of("timestamp", "severity", "source");
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";

    private final Connection connection;
    private final String tableName;

    /**
     * 打开事件库，使用默认表名。
     */
    public EventTable(Path dbPath) {
        this(dbPath, Constants.EVENT_TABLE);
    }

    /**
     * 打开事件库，初始化指定表的结构并启用 WAL。
     */
    public EventTable(Path dbPath, String tableName) {
        this.tableName = SqlConditions.requireSafeIdentifier(tableName);
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化事件表失败: " + dbPath, sqlException);
        }
    }

    public String tableName() {
        return tableName;
    }

    /**
     * 插入一条事件并返回生成的 id。
     */
    public long insert(EventRecord event) {
        String sql = """
                INSERT INTO %s(timestamp, message, severity, source, device_id, category, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """.formatted(tableName);
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            preparedStatement.setString(1, Timestamps.format(event.timestamp()));
            preparedStatement.setString(2, event.message());
            preparedStatement.setString(3, event.severity());
            preparedStatement.setString(4, event.source());
            preparedStatement.setString(5, event.deviceId());
            preparedStatement.setString(6, event.category());
            preparedStatement.setString(7, event.metadata());
            preparedStatement.executeUpdate();
            try (ResultSet keys = preparedStatement.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        } catch (SQLException sqlException) {
            throw new EventStoreException("插入事件失败, source=" + event.source(), sql, sqlException);
        }
    }

    /**
     * 批量插入事件，单事务提交。
     */
    public void insertAll(List<EventRecord> events) {
        try {
            connection.setAutoCommit(false);
            for (EventRecord event : events) {
                insert(event);
            }
            connection.commit();
        } catch (SQLException sqlException) {
            rollbackAfterFailure(sqlException);
            throw new EventStoreException("批量插入事件失败", "INSERT INTO " + tableName, sqlException);
        } catch (RuntimeException runtimeException) {
            rollbackAfterFailure(runtimeException);
            throw runtimeException;
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public List<Map<String, Object>> query(String sql, List<Object> params) {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (PreparedStatement preparedStatement = prepare(sql, params);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                rows.add(readRow(resultSet));
            }
            return rows;
        } catch (SQLException sqlException) {
            throw new EventStoreException("查询事件失败", sql, sqlException);
        }
    }

    @Override
    public Optional<Map<String, Object>> get(String sql, List<Object> params) {
        try (PreparedStatement preparedStatement = prepare(sql, params);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            if (!resultSet.next()) {
                return Optional.empty();
            }
            return Optional.of(readRow(resultSet));
        } catch (SQLException sqlException) {
            throw new EventStoreException("查询单行失败", sql, sqlException);
        }
    }

    /**
     * 获取事件总数。
     */
    public int count() {
        String sql = "SELECT COUNT(*) FROM " + tableName;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException sqlException) {
            throw new EventStoreException("查询事件总数失败", sql, sqlException);
        }
    }

    public void clear() {
        String sql = "DELETE FROM " + tableName;
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate(sql);
        } catch (SQLException sqlException) {
            throw new EventStoreException("清空事件表失败", sql, sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    /**
     * 读取当前连接的 journal_mode。
     */
    String getJournalMode() {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA journal_mode")) {
            return resultSet.next() ? resultSet.getString(1) : "";
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取 journal_mode 失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
        }

        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE_SQL.formatted(tableName));
            for (String column : INDEXED_COLUMNS) {
                statement.execute(CREATE_INDEX_SQL.formatted(tableName, column));
            }
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private PreparedStatement prepare(String sql, List<Object> params) throws SQLException {
        PreparedStatement preparedStatement = connection.prepareStatement(sql);
        try {
            for (int index = 0; index < params.size(); index++) {
                preparedStatement.setObject(index + 1, params.get(index));
            }
            return preparedStatement;
        } catch (SQLException sqlException) {
            preparedStatement.close();
            throw sqlException;
        }
    }

    private Map<String, Object> readRow(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int column = 1; column <= metaData.getColumnCount(); column++) {
            row.put(metaData.getColumnLabel(column), resultSet.getObject(column));
        }
        return row;
    }

    private void rollbackAfterFailure(Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            failure.addSuppressed(rollbackException);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("恢复自动提交失败", sqlException);
        }
    }
}
