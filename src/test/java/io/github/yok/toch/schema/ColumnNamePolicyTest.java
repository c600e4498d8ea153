package io.github.yok.toch.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.toch.config.IngestConfig;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnNamePolicyTest {

    private static ColumnNamePolicy policy(boolean camel, boolean lowerCase) {
        IngestConfig.Naming naming = new IngestConfig.Naming();
        naming.setLowerCaseNames(lowerCase);
        return new ColumnNamePolicy(camel, naming);
    }

    @Test
    void toCamel_正常ケース_スペースとアンダースコアとドット_キャメルケースに変換されること() {
        assertEquals("loanAmount", ColumnNamePolicy.toCamel("Loan Amount"));
        assertEquals("fooBarBaz", ColumnNamePolicy.toCamel("foo_bar.baz"));
        assertEquals("abc", ColumnNamePolicy.toCamel("ABC"));
        assertEquals("trailing", ColumnNamePolicy.toCamel("trailing_"));
        assertEquals("aB", ColumnNamePolicy.toCamel("a__b"));
    }

    @Test
    void apply_正常ケース_キャメルケース有効_名前が変換されること() {
        assertEquals(List.of("loanAmount", "zipCode"),
                policy(true, false).apply(List.of("Loan Amount", "zip_code")));
    }

    @Test
    void apply_正常ケース_予約語_1が付加され大文字小文字は保持されること() {
        assertEquals(List.of("Index1", "index1", "value"),
                policy(false, false).apply(List.of("Index", "index", "value")));
    }

    @Test
    void apply_正常ケース_小文字化有効_格納名も小文字になること() {
        assertEquals(List.of("index1", "value", "mixedcase"),
                policy(false, true).apply(List.of("Index", "VALUE", "MixedCase")));
    }

    @Test
    void apply_正常ケース_小文字化無効_格納名の大文字小文字が保持されること() {
        assertEquals(List.of("VALUE", "MixedCase"),
                policy(false, false).apply(List.of("VALUE", "MixedCase")));
    }

    @Test
    void apply_正常ケース_空と重複の名前_一意な名前が付けられること() {
        assertEquals(List.of("a", "col2", "a_2", "col4", "a_3"),
                policy(false, false).apply(Arrays.asList("a", "", "a", "  ", "a")));
    }

    @Test
    void apply_正常ケース_予約語を設定で追加する_追加した語も置き換えられること() {
        IngestConfig.Naming naming = new IngestConfig.Naming();
        naming.setReservedNames(List.of("index", "Order"));

        assertEquals(List.of("order1", "index1"),
                new ColumnNamePolicy(false, naming).apply(List.of("order", "index")));
    }
}
