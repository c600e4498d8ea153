package io.github.yok.toch.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code toch} section in {@code application.yml}.
 *
 * <p>
 * Holds the defaults of the ingestion pipeline. Values given on the command line (batch size, date
 * pattern) take precedence for the run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "toch")
@Data
public class IngestConfig {

    /**
     * Rows per write batch. {@code 0} writes the whole source in a single batch.
     */
    private int batchSize = 1000;

    /**
     * Minimum fraction of non-empty values that must parse as a type for that type to be inferred.
     */
    private double acceptanceThreshold = 0.95;

    /**
     * Date pattern ({@link java.time.format.DateTimeFormatter} syntax). When unset, the built-in
     * pattern list is tried.
     */
    private String datePattern;

    /**
     * Column naming rules.
     */
    private Naming naming = new Naming();

    /**
     * Legacy XLS conversion settings.
     */
    private Converter converter = new Converter();

    /**
     * HTTP fetch settings.
     */
    private Http http = new Http();

    /**
     * Column naming rules.
     */
    @Data
    public static class Naming {

        /**
         * Column names that collide with destination keywords; compared case-insensitively and
         * suffixed with {@code 1}.
         */
        private List<String> reservedNames = new ArrayList<>(List.of("index"));

        /**
         * When {@code true}, the stored column name is also lower-cased.
         */
        private boolean lowerCaseNames = false;
    }

    /**
     * Legacy XLS conversion settings.
     */
    @Data
    public static class Converter {

        // Office suite executable
        private String command = "libreoffice";

        // Upper bound for one conversion
        private long timeoutSeconds = 300;
    }

    /**
     * HTTP fetch settings.
     */
    @Data
    public static class Http {

        private long connectTimeoutSeconds = 30;

        // 0 = no limit
        private long requestTimeoutSeconds = 0;
    }
}
