package io.github.yok.toch.db;

import io.github.yok.toch.exception.DestinationException;
import io.github.yok.toch.exception.RowRejectedException;
import io.github.yok.toch.exception.TableCreationException;
import io.github.yok.toch.schema.CoercedRow;
import io.github.yok.toch.schema.ColumnDefinition;
import io.github.yok.toch.schema.TableSchema;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableWriter} for ClickHouse over JDBC.
 *
 * <p>
 * <strong>Processing:</strong>
 * </p>
 * <ul>
 * <li>{@link #createTable(TableSchema)}: optional {@code DROP TABLE IF EXISTS}, then
 * {@code CREATE TABLE ... ENGINE = MergeTree() ORDER BY (key)}, then prepares the INSERT.</li>
 * <li>{@link #append(CoercedRow)}: binds the values and adds them to the JDBC batch. A binding
 * failure rejects the row only.</li>
 * <li>{@link #flush()}: executes the JDBC batch. ClickHouse inserts a batch atomically, so when
 * it is refused while the connection stays valid the pending rows are resent one at a time and
 * the first refused row is reported as {@link RowRejectedException}. A failure with an unusable
 * connection is fatal.</li>
 * </ul>
 *
 * <p>
 * Identifiers are back-quoted; a table name of the form {@code db.table} is quoted per part.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ClickHouseTableWriter implements TableWriter {

    // Seconds to wait for Connection.isValid after a failed insert
    private static final int VALIDATION_TIMEOUT_SECONDS = 10;

    // Open JDBC connection, owned by this writer
    private final Connection connection;

    // Destination table name as given by the caller
    private final String table;

    // Drop an existing table of the same name before creating
    private final boolean dropExisting;

    private TableSchema schema;
    private PreparedStatement insert;

    // Rows appended since the last successful flush, in order
    private final List<CoercedRow> pending = new ArrayList<>();

    // Set after a refused batch; pending rows are then sent one at a time
    private boolean resending;

    /**
     * Creates a writer over an open connection. The connection is closed by {@link #close()}.
     *
     * @param connection JDBC connection
     * @param table destination table name
     * @param dropExisting whether to drop an existing table first
     */
    public ClickHouseTableWriter(Connection connection, String table, boolean dropExisting) {
        this.connection = connection;
        this.table = table;
        this.dropExisting = dropExisting;
    }

    @Override
    public void createTable(TableSchema schema) {
        String ddl = createTableSql(table, schema);
        try (Statement statement = connection.createStatement()) {
            if (dropExisting) {
                String drop = "DROP TABLE IF EXISTS " + quoteTable(table);
                log.info("Executing: {}", drop);
                statement.execute(drop);
            }
            log.info("Executing: {}", ddl);
            statement.execute(ddl);
            insert = connection.prepareStatement(insertSql(table, schema));
        } catch (SQLException e) {
            throw new TableCreationException(
                    "Failed to create table " + table + ": " + e.getMessage(), e);
        }
        this.schema = schema;
    }

    @Override
    public void append(CoercedRow row) {
        if (insert == null) {
            throw new IllegalStateException("createTable() must be called before append()");
        }
        if (resending) {
            throw new IllegalStateException("flush() must complete before append()");
        }
        try {
            bindRow(row);
            insert.addBatch();
            pending.add(row);
        } catch (SQLException | ClassCastException | IndexOutOfBoundsException e) {
            throw reject(row, e);
        }
    }

    private void bindRow(CoercedRow row) throws SQLException {
        List<Object> values = row.getValues();
        for (int i = 0; i < schema.size(); i++) {
            bind(i + 1, schema.getColumn(i), values.get(i));
        }
    }

    private RowRejectedException reject(CoercedRow row, Exception e) {
        try {
            insert.clearParameters();
        } catch (SQLException ex) {
            e.addSuppressed(ex);
        }
        return new RowRejectedException(row.getRowNumber(), e.getMessage(), e);
    }

    private void bind(int index, ColumnDefinition column, Object value) throws SQLException {
        switch (column.getType()) {
            case INT64:
                insert.setLong(index, (Long) value);
                break;
            case FLOAT64:
                insert.setDouble(index, (Double) value);
                break;
            case DATE:
                insert.setObject(index, (LocalDate) value);
                break;
            default:
                insert.setString(index, (String) value);
                break;
        }
    }

    @Override
    public void flush() {
        if (insert == null || pending.isEmpty()) {
            return;
        }
        if (!resending) {
            int rows = pending.size();
            try {
                insert.executeBatch();
                pending.clear();
                log.debug("Inserted {} rows into {}", rows, table);
                return;
            } catch (SQLException e) {
                if (!isConnectionUsable(e)) {
                    pending.clear();
                    throw new DestinationException("Failed to insert " + rows + " rows into "
                            + table + ": " + e.getMessage(), e);
                }
                log.warn("Batch of {} rows refused by {} ({}); resending row by row", rows, table,
                        e.getMessage());
                clearBatch(e);
                resending = true;
            }
        }
        resendPending();
    }

    // Sends pending rows singly; stops at the first refused row, keeping the rest pending
    private void resendPending() {
        Iterator<CoercedRow> it = pending.iterator();
        while (it.hasNext()) {
            CoercedRow row = it.next();
            it.remove();
            try {
                bindRow(row);
                insert.executeUpdate();
            } catch (SQLException e) {
                if (!isConnectionUsable(e)) {
                    pending.clear();
                    resending = false;
                    throw new DestinationException("Failed to insert source row "
                            + row.getRowNumber() + " into " + table + ": " + e.getMessage(), e);
                }
                throw reject(row, e);
            }
        }
        resending = false;
    }

    private boolean isConnectionUsable(SQLException failure) {
        try {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            failure.addSuppressed(e);
            return false;
        }
    }

    private void clearBatch(SQLException failure) {
        try {
            insert.clearBatch();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void close() {
        try {
            if (insert != null) {
                insert.close();
            }
        } catch (SQLException e) {
            log.warn("Failed to close insert statement: {}", e.getMessage());
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    /**
     * Builds the CREATE TABLE statement.
     *
     * @param table table name
     * @param schema table schema
     * @return DDL
     */
    static String createTableSql(String table, TableSchema schema) {
        String columns = schema.getColumns().stream()
                .map(c -> quote(c.getName()) + " " + c.getType().getClickHouseType())
                .collect(Collectors.joining(", "));
        return "CREATE TABLE " + quoteTable(table) + " (" + columns
                + ") ENGINE = MergeTree() ORDER BY (" + quote(schema.getKeyColumn()) + ")";
    }

    /**
     * Builds the parameterized INSERT statement.
     *
     * @param table table name
     * @param schema table schema
     * @return SQL
     */
    static String insertSql(String table, TableSchema schema) {
        String columns = schema.getColumns().stream().map(c -> quote(c.getName()))
                .collect(Collectors.joining(", "));
        String params = schema.getColumns().stream().map(c -> "?")
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteTable(table) + " (" + columns + ") VALUES (" + params + ")";
    }

    static String quoteTable(String table) {
        int dot = table.indexOf('.');
        if (dot > 0 && dot < table.length() - 1) {
            return quote(table.substring(0, dot)) + "." + quote(table.substring(dot + 1));
        }
        return quote(table);
    }

    static String quote(String identifier) {
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }
}
