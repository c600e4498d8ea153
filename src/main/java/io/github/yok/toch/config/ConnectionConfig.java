package io.github.yok.toch.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code clickhouse} section in {@code application.yml}.
 *
 * <p>
 * The {@code -host}, {@code -user} and {@code -password} command-line options override the bound
 * values for a single run (see {@link IngestOptions}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "clickhouse")
@Data
public class ConnectionConfig {

    /**
     * ClickHouse server host name or address.
     */
    private String host = "127.0.0.1";

    /**
     * HTTP interface port used by the JDBC driver.
     */
    private int port = 8123;

    /**
     * Database in which the destination table is created.
     */
    private String database = "default";

    /**
     * Login user.
     */
    private String user = "default";

    /**
     * Login password.
     */
    private String password = "";

    /**
     * When {@code true}, an existing table of the same name is dropped before creation.
     */
    private boolean dropExistingTable = true;

    /**
     * Additional JDBC driver properties passed through unchanged.
     */
    private Map<String, String> properties = new LinkedHashMap<>();

    /**
     * Builds the JDBC URL for the given host.
     *
     * @param hostOverride host to connect to; {@code null} uses {@link #host}
     * @return JDBC URL, e.g. {@code jdbc:clickhouse://127.0.0.1:8123/default}
     */
    public String jdbcUrl(String hostOverride) {
        String h = hostOverride != null ? hostOverride : host;
        return "jdbc:clickhouse://" + h + ":" + port + "/" + database;
    }
}
