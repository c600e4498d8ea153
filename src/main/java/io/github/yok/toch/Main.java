package io.github.yok.toch;

import io.github.yok.toch.config.CommandLineParser;
import io.github.yok.toch.config.ConnectionConfig;
import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.config.IngestOptions;
import io.github.yok.toch.core.IngestResult;
import io.github.yok.toch.core.IngestRunner;
import io.github.yok.toch.db.TableWriterFactory;
import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.IngestException;
import io.github.yok.toch.source.HttpFetcher;
import io.github.yok.toch.source.SpreadsheetConverter;
import io.github.yok.toch.util.ErrorHandler;
import java.io.IOException;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line flags with {@link CommandLineParser} and runs one ingestion through
 * {@link IngestRunner}.
 * </p>
 *
 * <p>
 * Exit status:
 * </p>
 * <ul>
 * <li>{@code 0}: the data was loaded (or {@code -help} was requested).</li>
 * <li>{@code 1}: the run failed (source, conversion, schema, destination or export error).</li>
 * <li>{@code 2}: invalid command-line arguments; the usage text is printed.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link IngestConfig} ({@code toch.*}) and {@link ConnectionConfig}
 * ({@code clickhouse.*}) from {@code application.yml}. Command-line flags are not bound as
 * properties.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see CommandLineParser
 * @see IngestRunner
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({IngestConfig.class, ConnectionConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final IngestConfig ingestConfig;
    private final HttpFetcher httpFetcher;
    private final SpreadsheetConverter spreadsheetConverter;
    private final TableWriterFactory tableWriterFactory;

    // Exit status of the last run
    private int exitCode;

    /**
     * Bootstraps the application and ends the process with the run's exit status.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Runs the application and returns its exit status without ending the process.
     *
     * @param args command-line arguments
     * @return exit status
     */
    static int launch(String... args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        return SpringApplication.exit(app.run(args));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.debug("Application started. Args: {}", Arrays.toString(args));

        IngestOptions options;
        try {
            options = new CommandLineParser().parse(args);
        } catch (IngestException e) {
            fail(e);
            return;
        }
        if (options.isHelp()) {
            System.out.println(CommandLineParser.USAGE);
            exitCode = 0;
            return;
        }

        try {
            IngestResult result = new IngestRunner(ingestConfig, httpFetcher,
                    spreadsheetConverter, tableWriterFactory).run(options);
            long seconds = result.getElapsed().getSeconds();
            System.out.printf("elapsed time: %d minutes %d seconds%n", seconds / 60, seconds % 60);
            if (options.isTolerateRowErrors()) {
                System.out.printf("skipped rows: %d%n", result.getExport().getRowsSkipped());
            }
            log.info("Loaded {} rows into {}", result.getExport().getRowsWritten(),
                    result.getTable());
            exitCode = 0;
        } catch (IngestException e) {
            fail(e);
        } catch (IOException e) {
            exitCode = 1;
            ErrorHandler.errorAndExit("Failed to read the source", e);
        }
    }

    private void fail(IngestException e) {
        exitCode = e.getExitCode();
        if (e instanceof ConfigurationException) {
            System.err.println(CommandLineParser.USAGE);
        }
        ErrorHandler.errorAndExit("toch failed", e);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
