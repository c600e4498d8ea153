package io.github.yok.toch.db;

import io.github.yok.toch.config.ConnectionConfig;
import io.github.yok.toch.config.IngestOptions;
import io.github.yok.toch.exception.DestinationException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens {@link ClickHouseTableWriter}s using {@link ConnectionConfig}, with the host, user and
 * password of the run options taking precedence.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClickHouseTableWriterFactory implements TableWriterFactory {

    private final ConnectionConfig connectionConfig;

    @Override
    public TableWriter open(IngestOptions options) {
        String url = connectionConfig.jdbcUrl(options.getHost());
        Properties props = new Properties();
        props.putAll(connectionConfig.getProperties());
        props.setProperty("user",
                options.getUser() != null ? options.getUser() : connectionConfig.getUser());
        props.setProperty("password", options.getPassword() != null ? options.getPassword()
                : connectionConfig.getPassword());

        log.info("Connecting to {} as {}", url, props.getProperty("user"));
        Connection connection;
        try {
            connection = DriverManager.getConnection(url, props);
        } catch (SQLException e) {
            throw new DestinationException(
                    "Failed to connect to " + url + ": " + e.getMessage(), e);
        }
        return new ClickHouseTableWriter(connection, options.getTable(),
                connectionConfig.isDropExistingTable());
    }
}
