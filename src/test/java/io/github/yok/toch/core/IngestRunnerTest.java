package io.github.yok.toch.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.config.IngestOptions;
import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.ExportException;
import io.github.yok.toch.exception.MalformedRowException;
import io.github.yok.toch.exception.SourceNotFoundException;
import io.github.yok.toch.schema.ColumnDefinition;
import io.github.yok.toch.schema.ColumnOrigin;
import io.github.yok.toch.schema.ColumnType;
import io.github.yok.toch.schema.TableSchema;
import io.github.yok.toch.source.JdkHttpFetcher;
import io.github.yok.toch.source.SourceFormat;
import io.github.yok.toch.source.SourceSpec;
import io.github.yok.toch.source.SpreadsheetConverter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestRunnerTest {

    private static final String CSV = "id,unit price,sold on,label\n" + "1,2.5,2023-01-01,a\n"
            + "2,3,2023-01-02,b\n" + "3,4.25,2023-01-03,c\n";

    @TempDir
    Path tempDir;

    private final IngestConfig config = new IngestConfig();
    private final RecordingTableWriter writer = new RecordingTableWriter();
    private MockWebServer server;
    private IngestRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        runner = new IngestRunner(config, new JdkHttpFetcher(config),
                mock(SpreadsheetConverter.class), options -> writer);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private Path csvFile(String content) throws IOException {
        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static IngestOptions.IngestOptionsBuilder options(String identifier,
            SourceFormat format) {
        return IngestOptions.builder().table("sales")
                .source(SourceSpec.builder().identifier(identifier).format(format).build());
    }

    private static List<ColumnType> types(TableSchema schema) {
        return schema.getColumns().stream().map(ColumnDefinition::getType)
                .collect(Collectors.toList());
    }

    @Test
    void run_正常ケース_型推論_ヘッダから列名が決まり全行が書き込まれること() throws Exception {
        Path file = csvFile(CSV);

        IngestResult result =
                runner.run(options(file.toString(), SourceFormat.CSV).camelCase(true).build());

        TableSchema schema = result.getSchema();
        assertEquals(List.of("id", "unitPrice", "soldOn", "label"), schema.getColumnNames());
        assertEquals(List.of(ColumnType.INT64, ColumnType.FLOAT64, ColumnType.DATE,
                ColumnType.STRING), types(schema));
        assertEquals("id", schema.getKeyColumn());
        assertEquals(ColumnOrigin.INFERRED, schema.getColumn(0).getOrigin());
        assertEquals(schema, writer.created);

        assertEquals(3, result.getExport().getRowsWritten());
        assertEquals(List.of(1L, 2L, 3L), writer.column(0));
        assertEquals(List.of(2.5, 3.0, 4.25), writer.column(1));
        assertEquals(LocalDate.of(2023, 1, 3), writer.written.get(2).getValues().get(2));
        assertEquals("sales", result.getTable());
        assertTrue(writer.closed);
    }

    @Test
    void run_正常ケース_型指定あり_推論せずに指定型で書き込まれること() throws Exception {
        Path file = csvFile(CSV);

        IngestResult result = runner.run(options(file.toString(), SourceFormat.CSV)
                .types(List.of(ColumnType.STRING, ColumnType.STRING, ColumnType.STRING,
                        ColumnType.STRING))
                .build());

        assertEquals(List.of("id", "unit price", "sold on", "label"),
                result.getSchema().getColumnNames());
        assertEquals(ColumnOrigin.SUPPLIED, result.getSchema().getColumn(1).getOrigin());
        assertEquals(List.of("1", "2", "3"), writer.column(0));
        assertEquals(List.of("2.5", "3", "4.25"), writer.column(1));
    }

    @Test
    void run_正常ケース_列名指定あり_先頭行もデータとして扱われること() throws Exception {
        Path file = csvFile("1,x\n2,y\n3,z\n");

        IngestResult result = runner.run(options(file.toString(), SourceFormat.CSV)
                .headerNames(List.of("num", "txt")).build());

        assertEquals(List.of("num", "txt"), result.getSchema().getColumnNames());
        assertEquals(List.of(ColumnType.INT64, ColumnType.STRING), types(result.getSchema()));
        assertEquals(List.of(1L, 2L, 3L), writer.column(0));
        assertEquals(List.of("x", "y", "z"), writer.column(1));
    }

    @Test
    void run_正常ケース_予約語と重複した列名_変換されること() throws Exception {
        Path file = csvFile("index,name,name,\n1,a,b,c\n");

        IngestResult result = runner.run(options(file.toString(), SourceFormat.CSV).build());

        assertEquals(List.of("index1", "name", "name_2", "col4"),
                result.getSchema().getColumnNames());
    }

    @Test
    void run_正常ケース_HTTPソース_本文は一度だけ取得されること() throws Exception {
        server.enqueue(new MockResponse()
                .setBody(new Buffer().write(CSV.getBytes(StandardCharsets.UTF_8))));

        IngestResult result = runner.run(
                options(server.url("/sales.csv").toString(), SourceFormat.CSV).build());

        assertEquals(1, server.getRequestCount());
        assertEquals(3, result.getExport().getRowsWritten());
        assertEquals(ColumnType.DATE, result.getSchema().getColumn(2).getType());
    }

    @Test
    void run_正常ケース_タブ区切りと許容モード_不正行が読み飛ばされること() throws Exception {
        Path file = csvFile("a\tb\n1\tx\n2\n3\tz\n");

        IngestResult result = runner.run(options(file.toString(), SourceFormat.TEXT)
                .tolerateRowErrors(true).batchSize(1).build());

        assertEquals(2, result.getExport().getRowsWritten());
        assertEquals(1, result.getExport().getRowsSkipped());
        assertEquals(List.of(1L, 3L), writer.column(0));
    }

    @Test
    void run_正常ケース_設定のバッチサイズ_オプション未指定時に使われること() throws Exception {
        config.setBatchSize(2);
        Path file = csvFile(CSV);

        IngestResult result = runner.run(options(file.toString(), SourceFormat.CSV).build());

        assertEquals(2, result.getExport().getBatches());
        assertEquals(List.of(2, 1), writer.batchSizes);
    }

    @Test
    void run_異常ケース_列数の異なる行_非許容時はMalformedRowExceptionが送出されること()
            throws Exception {
        Path file = csvFile("a,b\n1,x\n2\n");

        assertThrows(MalformedRowException.class,
                () -> runner.run(options(file.toString(), SourceFormat.CSV).build()));
    }

    @Test
    void run_異常ケース_書き込み拒否_非許容時はExportExceptionが送出されること() throws Exception {
        writer.rejectIf = row -> row.getRowNumber() == 3;
        Path file = csvFile(CSV);

        assertThrows(ExportException.class,
                () -> runner.run(options(file.toString(), SourceFormat.CSV).build()));
        assertEquals(List.of(1L), writer.column(0));
        assertTrue(writer.closed);
    }

    @Test
    void run_異常ケース_ファイルが存在しない_SourceNotFoundExceptionが送出されること() {
        String missing = tempDir.resolve("missing.csv").toString();

        assertThrows(SourceNotFoundException.class,
                () -> runner.run(options(missing, SourceFormat.CSV).build()));
        assertNull(writer.created);
    }

    @Test
    void run_異常ケース_負のバッチサイズ_ConfigurationExceptionが送出されること() throws Exception {
        config.setBatchSize(-5);
        Path file = csvFile(CSV);

        assertThrows(ConfigurationException.class,
                () -> runner.run(options(file.toString(), SourceFormat.CSV).build()));
    }
}
