package io.github.yok.flexconf.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ConfigValue} and {@link ValueKind}.
 */
class ConfigValueTest {

    // ---------------------------------------------------------------------
    // of
    // ---------------------------------------------------------------------

    @Test
    void of_正常ケース_Java標準型を渡す_対応する種別に変換されること() {
        assertEquals(ValueKind.TEXT, ConfigValue.of("a").getKind());
        assertEquals(ValueKind.INTEGER, ConfigValue.of(1).getKind());
        assertEquals(ValueKind.INTEGER, ConfigValue.of(1L).getKind());
        assertEquals(ValueKind.DECIMAL, ConfigValue.of(1.5f).getKind());
        assertEquals(ValueKind.DECIMAL, ConfigValue.of(1.5d).getKind());
        assertEquals(ValueKind.BOOLEAN, ConfigValue.of(true).getKind());
        assertSame(ConfigValue.nullValue(), ConfigValue.of(null));
    }

    @Test
    void of_正常ケース_入れ子のListとMapを渡す_再帰的に変換されること() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("b", 2);
        inner.put("a", Arrays.asList("x", null));

        ConfigValue value = ConfigValue.of(Arrays.asList(1, inner));

        assertEquals(ValueKind.LIST, value.getKind());
        ConfigValue dict = value.asList().get(1);
        assertEquals(Arrays.asList("b", "a"), new ArrayList<>(dict.asDict().keySet()));
        assertTrue(dict.asDict().get("a").asList().get(1).isNull());
    }

    @Test
    void of_異常ケース_未対応の型を渡す_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> ConfigValue.of(new Object()));
        Map<Object, Object> badKeys = new LinkedHashMap<>();
        badKeys.put(1, "a");
        assertThrows(IllegalArgumentException.class, () -> ConfigValue.of(badKeys));
    }

    @Test
    void decimal_異常ケース_NaNや無限大を渡す_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> ConfigValue.decimal(Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> ConfigValue.decimal(Double.POSITIVE_INFINITY));
    }

    // ---------------------------------------------------------------------
    // accessors
    // ---------------------------------------------------------------------

    @Test
    void asLong_異常ケース_種別が異なる_IllegalStateExceptionが送出されること() {
        ConfigValue text = ConfigValue.text("8080");
        assertThrows(IllegalStateException.class, text::asLong);
    }

    @Test
    void list_正常ケース_元のリストを変更する_値は変化しないこと() {
        List<ConfigValue> items = new ArrayList<>();
        items.add(ConfigValue.integer(1));
        ConfigValue value = ConfigValue.list(items);
        items.add(ConfigValue.integer(2));

        assertEquals(1, value.asList().size());
        assertThrows(UnsupportedOperationException.class,
                () -> value.asList().add(ConfigValue.integer(3)));
    }

    @Test
    void equals_正常ケース_同じ内容の値を比較する_等価であること() {
        ConfigValue a = ConfigValue.list(ConfigValue.integer(1), ConfigValue.text("a"));
        ConfigValue b = ConfigValue.of(Arrays.asList(1L, "a"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void toJava_正常ケース_辞書を変換する_順序を保ったMapが返ること() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("z", 1L);
        raw.put("a", null);
        Object java = ConfigValue.of(raw).toJava();

        assertEquals(raw, java);
        assertEquals(Arrays.asList("z", "a"), new ArrayList<>(((Map<?, ?>) java).keySet()));
        assertNull(ConfigValue.nullValue().toJava());
    }

    // ---------------------------------------------------------------------
    // ValueKind
    // ---------------------------------------------------------------------

    @Test
    void getLabel_正常ケース_各種別のラベルを取得する_ポルトガル語のラベルが返ること() {
        assertEquals("Texto", ValueKind.TEXT.getLabel());
        assertEquals("Inteiro", ValueKind.INTEGER.getLabel());
        assertEquals("Dicionário", ValueKind.DICT.getLabel());
        assertEquals("Nulo", ValueKind.NULL.getLabel());
        assertTrue(ValueKind.LIST.isContainer());
        assertTrue(ValueKind.DECIMAL.isNumeric());
        assertEquals(7, ValueKind.all().size());
    }
}
