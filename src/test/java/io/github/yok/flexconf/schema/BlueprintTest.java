package io.github.yok.flexconf.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexconf.exception.InvalidBlueprintException;
import io.github.yok.flexconf.exception.InvalidValueFormatException;
import io.github.yok.flexconf.exception.TypeMismatchException;
import io.github.yok.flexconf.exception.ValueOutOfRangeException;
import io.github.yok.flexconf.value.ConfigValue;
import io.github.yok.flexconf.value.ValueKind;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class BlueprintTest {

    private static Blueprint port() {
        return Blueprint.builder("net", "port").kinds(ValueKind.INTEGER).defaultValue(8080)
                .minValue(1).maxValue(65535).description("Listening port").build();
    }

    // ---------------------------------------------------------------------
    // build
    // ---------------------------------------------------------------------

    @Test
    void build_正常ケース_整数オプションを宣言する_各属性が保持されること() {
        Blueprint bp = port();

        assertEquals("net", bp.getSection());
        assertEquals("port", bp.getOption());
        assertEquals(ConfigValue.integer(8080), bp.getDefaultValue());
        assertEquals(0, BigDecimal.ONE.compareTo(bp.getMinValue()));
        assertEquals("Listening port", bp.getDescription());
        assertTrue(bp.isRequired());
        assertFalse(bp.hasItemRestriction());
    }

    @Test
    void build_正常ケース_NULLを許可する_任意オプションになること() {
        Blueprint bp = Blueprint.builder(" log ", " file ").kinds(ValueKind.TEXT, ValueKind.NULL)
                .build();

        assertEquals("log", bp.getSection());
        assertEquals("file", bp.getOption());
        assertFalse(bp.isRequired());
        assertTrue(bp.getDefaultValue().isNull());
    }

    @Test
    void build_異常ケース_不正な宣言_InvalidBlueprintExceptionが送出されること() {
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder(" ", "a").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a=b").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a").build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a").kinds(ValueKind.INTEGER).build());
        assertThrows(InvalidBlueprintException.class, () -> Blueprint.builder("s", "a")
                .kinds(ValueKind.INTEGER).defaultValue("8080").build());
        assertThrows(InvalidBlueprintException.class, () -> Blueprint.builder("s", "a")
                .kinds(ValueKind.INTEGER).defaultValue(5).minValue(10).maxValue(1).build());
        assertThrows(InvalidBlueprintException.class, () -> Blueprint.builder("s", "a")
                .kinds(ValueKind.INTEGER).defaultValue(0).minValue(1).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a").pattern("bad", "(["));
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a").defaultValue(new Object()));
    }

    @Test
    void build_異常ケース_名前に改行を含む_InvalidBlueprintExceptionが送出されること() {
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a\nb").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "a\u2028b").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s\rt", "a").kinds(ValueKind.NULL).build());
        assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s\u2029t", "a").kinds(ValueKind.NULL).build());
    }

    @Test
    void build_異常ケース_既定値が書式に合わない_InvalidBlueprintExceptionが送出されること() {
        InvalidBlueprintException e = assertThrows(InvalidBlueprintException.class,
                () -> Blueprint.builder("s", "host").kinds(ValueKind.TEXT).defaultValue("x y")
                        .pattern("hostname", "[a-z.]+").build());
        assertTrue(e.getCause() instanceof InvalidValueFormatException);
    }

    // ---------------------------------------------------------------------
    // validate
    // ---------------------------------------------------------------------

    @Test
    void validate_正常ケース_受け入れ可能な値_同じ値が返ること() {
        ConfigValue value = ConfigValue.integer(443);
        assertSame(value, port().validate(value));
    }

    @Test
    void validate_異常ケース_種別が異なる_TypeMismatchExceptionが送出されること() {
        Blueprint bp = port();
        assertThrows(TypeMismatchException.class, () -> bp.validate(ConfigValue.text("443")));
        assertThrows(TypeMismatchException.class, () -> bp.validate(ConfigValue.decimal(1.0)));
        assertThrows(TypeMismatchException.class, () -> bp.validate(ConfigValue.nullValue()));
        assertThrows(TypeMismatchException.class, () -> bp.validate(null));
    }

    @Test
    void validate_異常ケース_範囲外の値_ValueOutOfRangeExceptionが送出されること() {
        Blueprint bp = port();
        assertThrows(ValueOutOfRangeException.class, () -> bp.validate(ConfigValue.integer(0)));
        assertThrows(ValueOutOfRangeException.class,
                () -> bp.validate(ConfigValue.integer(65536)));
        port().validate(ConfigValue.integer(65535));
    }

    @Test
    void validate_正常ケース_小数の範囲_境界値を含むこと() {
        Blueprint ratio = Blueprint.builder("s", "ratio").kinds(ValueKind.DECIMAL)
                .defaultValue(0.5).minValue(0.0).maxValue(1.0).build();

        ratio.validate(ConfigValue.decimal(1.0));
        assertThrows(ValueOutOfRangeException.class,
                () -> ratio.validate(ConfigValue.decimal(1.0000001)));
    }

    @Test
    void validate_異常ケース_入れ子の要素種別が不正_TypeMismatchExceptionが送出されること() {
        Blueprint bp = Blueprint.builder("s", "ids").kinds(ValueKind.LIST)
                .itemKinds(ValueKind.INTEGER, ValueKind.LIST).defaultValue(Collections.emptyList())
                .build();

        bp.validate(ConfigValue.of(Arrays.asList(1, Arrays.asList(2, 3))));
        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> bp.validate(ConfigValue.of(Arrays.asList(1, Arrays.asList(2, "x")))));
        assertTrue(e.getMessage().contains("[1][1]"));
        assertTrue(bp.hasItemRestriction());
    }

    @Test
    void validate_異常ケース_リスト内のテキストが書式に合わない_例外が送出されること() {
        Blueprint bp = Blueprint.builder("s", "hosts").kinds(ValueKind.LIST, ValueKind.TEXT)
                .defaultValue(Collections.singletonList("localhost"))
                .pattern("host", "[a-z]+").pattern("ip", "\\d+(\\.\\d+){3}").build();

        bp.validate(ConfigValue.of(Arrays.asList("db", "10.0.0.1", 5)));
        bp.validate(ConfigValue.text("web"));
        assertThrows(InvalidValueFormatException.class,
                () -> bp.validate(ConfigValue.of(Arrays.asList("db", "DB!"))));
        assertEquals(Arrays.asList("host", "ip"), Arrays.asList(
                bp.getPatterns().keySet().toArray(new String[0])));
    }
}
