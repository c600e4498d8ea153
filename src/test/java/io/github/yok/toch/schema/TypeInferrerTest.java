package io.github.yok.toch.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.toch.exception.MalformedRowException;
import io.github.yok.toch.exception.SchemaMismatchException;
import io.github.yok.toch.reader.DelimitedRowReader;
import io.github.yok.toch.reader.RowReader;
import io.github.yok.toch.util.CellValueParser;
import io.github.yok.toch.util.DateParser;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeInferrerTest {

    private final CellValueParser parser = new CellValueParser(new DateParser(null));

    private static RowReader csv(String text) throws IOException {
        return new DelimitedRowReader("test",
                new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), ',', '"', 0);
    }

    private static String column(String header, int good, String goodValue, int bad) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (int i = 0; i < good; i++) {
            sb.append(goodValue).append('\n');
        }
        for (int i = 0; i < bad; i++) {
            sb.append("n/a").append('\n');
        }
        return sb.toString();
    }

    private TableSchemaBuilder infer(String text, boolean tolerate) throws IOException {
        try (RowReader reader = csv(text)) {
            TableSchemaBuilder builder = TableSchemaBuilder.withNames(reader.readHeader());
            new TypeInferrer(parser, 0.95, tolerate).infer(reader, builder);
            return builder;
        }
    }

    @Test
    void infer_正常ケース_95パーセントちょうど整数_Int64と判定されること() throws Exception {
        TableSchemaBuilder builder = infer(column("n", 19, "42", 1), false);

        assertEquals(ColumnType.INT64, builder.getType(0));
        assertEquals(ColumnOrigin.INFERRED, builder.build().getColumn(0).getOrigin());
    }

    @Test
    void infer_正常ケース_95パーセント未満の整数_Stringと判定されること() throws Exception {
        TableSchemaBuilder builder = infer(column("n", 18, "42", 2), false);

        assertEquals(ColumnType.STRING, builder.getType(0));
    }

    @Test
    void infer_正常ケース_8桁の日付形式の数値_Int64よりDateが優先されること() throws Exception {
        TableSchemaBuilder builder = infer("d\n20230101\n20221231\n19991001\n", false);

        assertEquals(ColumnType.DATE, builder.getType(0));
    }

    @Test
    void infer_正常ケース_整数と小数の混在_Float64と判定されること() throws Exception {
        TableSchemaBuilder builder = infer("x\n1\n2.5\n-3e2\n 4 \n", false);

        assertEquals(ColumnType.FLOAT64, builder.getType(0));
    }

    @Test
    void infer_正常ケース_空値は分母に含めない_型が判定されること() throws Exception {
        TableSchemaBuilder builder = infer("a,b,c\n1,,2023-01-05\n,,\n3, ,2023-02-01\n", false);

        assertEquals(ColumnType.INT64, builder.getType(0));
        assertEquals(ColumnType.STRING, builder.getType(1));
        assertEquals(ColumnType.DATE, builder.getType(2));
    }

    @Test
    void infer_正常ケース_型指定済みの列_上書きされないこと() throws Exception {
        try (RowReader reader = csv("a,b\n1,2\n3,4\n")) {
            TableSchemaBuilder builder = TableSchemaBuilder.withNames(reader.readHeader());
            builder.setType(0, ColumnType.STRING, ColumnOrigin.SUPPLIED);

            new TypeInferrer(parser, 0.95, false).infer(reader, builder);

            assertEquals(ColumnType.STRING, builder.getType(0));
            assertEquals(ColumnType.INT64, builder.getType(1));
        }
    }

    @Test
    void infer_正常ケース_不正な行を許容する_読み飛ばして件数が返されること() throws Exception {
        try (RowReader reader = csv("a,b\n1,2\n3\n5,6\n")) {
            TableSchemaBuilder builder = TableSchemaBuilder.withNames(reader.readHeader());

            InferenceStats stats = new TypeInferrer(parser, 0.95, true).infer(reader, builder);

            assertEquals(2, stats.getRowsSampled());
            assertEquals(1, stats.getRowsSkipped());
            assertEquals(ColumnType.INT64, builder.getType(0));
        }
    }

    @Test
    void infer_異常ケース_不正な行を許容しない_MalformedRowExceptionが送出されること() {
        assertThrows(MalformedRowException.class, () -> infer("a,b\n1,2\n3\n", false));
    }

    @Test
    void infer_異常ケース_指定した列名の数がデータと異なる_SchemaMismatchExceptionが送出されること()
            throws Exception {
        try (RowReader reader = csv("1,2,3\n4,5,6\n")) {
            TableSchemaBuilder builder = TableSchemaBuilder.withNames(List.of("a", "b"));

            assertThrows(SchemaMismatchException.class,
                    () -> new TypeInferrer(parser, 0.95, false).infer(reader, builder));
        }
    }

    @Test
    void コンストラクタ_異常ケース_範囲外のしきい値_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new TypeInferrer(parser, 0, false));
        assertThrows(IllegalArgumentException.class, () -> new TypeInferrer(parser, 1.5, false));
    }
}
