package io.github.yok.toch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.toch.config.CommandLineParser;
import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.db.TableWriter;
import io.github.yok.toch.db.TableWriterFactory;
import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.DestinationException;
import io.github.yok.toch.exception.SourceNotFoundException;
import io.github.yok.toch.schema.TableSchema;
import io.github.yok.toch.source.HttpFetcher;
import io.github.yok.toch.source.SpreadsheetConverter;
import io.github.yok.toch.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private TableWriter tableWriter;
    private TableWriterFactory factory;
    private Main main;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setup() {
        tableWriter = mock(TableWriter.class);
        factory = mock(TableWriterFactory.class);
        when(factory.open(any())).thenReturn(tableWriter);
        main = new Main(new IngestConfig(), mock(HttpFetcher.class),
                mock(SpreadsheetConverter.class), factory);

        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path csv() throws Exception {
        Path file = tempDir.resolve("people.csv");
        Files.writeString(file, "id,name\n1,alice\n2,bob\n", StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void launch_正常ケース_SpringApplicationが起動され終了コードが返されること() {
        ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
        when(context.getBeansOfType(ExitCodeGenerator.class))
                .thenReturn(Map.of("main", (ExitCodeGenerator) () -> 2));

        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(context);

                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            int exitCode = Main.launch("-s", "a.csv", "-type", "csv", "-table", "t");

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("-s"), eq("a.csv"), eq("-type"), eq("csv"), eq("-table"), eq("t"));
            verify(context).close();
            assertEquals(2, exitCode);
        }
    }

    @Test
    void run_正常ケース_ヘルプ指定_使い方が出力され終了コード0となること() {
        main.run("-help");

        assertTrue(stdout().contains(CommandLineParser.USAGE));
        assertEquals(0, main.getExitCode());
        verify(factory, never()).open(any());
    }

    @Test
    void run_正常ケース_CSVを取り込む_経過時間が出力され終了コード0となること() throws Exception {
        Path file = csv();

        main.run("-s", file.toString(), "-type", "csv", "-table", "people");

        assertEquals(0, main.getExitCode());
        assertTrue(stdout().contains("elapsed time: 0 minutes"));
        assertFalse(stdout().contains("skipped rows"));
        verify(tableWriter).createTable(any(TableSchema.class));
        verify(tableWriter).close();
    }

    @Test
    void run_正常ケース_行エラー許容_読み飛ばし件数が出力されること() throws Exception {
        Path file = csv();

        main.run("-s", file.toString(), "-type", "csv", "-table", "people", "-i", "Y");

        assertEquals(0, main.getExitCode());
        assertTrue(stdout().contains("skipped rows: 0"));
    }

    @Test
    void run_異常ケース_必須引数なし_使い方が出力され終了コード2となること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-type", "csv");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("toch failed"),
                    any(ConfigurationException.class)));
        }
        assertEquals(2, main.getExitCode());
        assertTrue(stderr().contains(CommandLineParser.USAGE));
    }

    @Test
    void run_異常ケース_ファイルが存在しない_終了コード1となること() {
        String missing = tempDir.resolve("missing.csv").toString();

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-s", missing, "-type", "csv", "-table", "people");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("toch failed"),
                    any(SourceNotFoundException.class)));
        }
        assertEquals(1, main.getExitCode());
        assertFalse(stderr().contains(CommandLineParser.USAGE));
    }

    @Test
    void run_異常ケース_接続失敗_エラーが出力され終了コード1となること() throws Exception {
        when(factory.open(any())).thenThrow(new DestinationException("Connection refused"));
        Path file = csv();

        main.run("-s", file.toString(), "-type", "csv", "-table", "people");

        assertEquals(1, main.getExitCode());
        assertTrue(stderr().contains("ERROR: toch failed: Connection refused"));
    }

    @Test
    void run_異常ケース_例外送出モード_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            IllegalStateException ex =
                    assertThrows(IllegalStateException.class, () -> main.run("-unknown", "x"));
            assertInstanceOf(ConfigurationException.class, ex.getCause());
            assertEquals(2, main.getExitCode());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
        verify(factory, never()).open(any());
        assertFalse(stderr().contains("ERROR:"));
        assertTrue(stderr().contains("Usage: toch"));
    }
}
