package io.github.yok.flexconf.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexconf.exception.DuplicateOptionException;
import io.github.yok.flexconf.exception.TypeMismatchException;
import io.github.yok.flexconf.exception.UnknownOptionException;
import io.github.yok.flexconf.value.ConfigValue;
import io.github.yok.flexconf.value.ValueKind;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class SchemaTest {

    private static Blueprint text(String section, String option) {
        return Blueprint.builder(section, option).kinds(ValueKind.TEXT).defaultValue("").build();
    }

    @Test
    void addBlueprint_正常ケース_複数セクションを登録する_登録順が保たれること() {
        Schema schema = Schema.of(text("b", "z"), text("a", "y"), text("b", "x"));

        assertEquals(Arrays.asList("b", "a"), schema.getSections());
        assertEquals(Arrays.asList("z", "x"), schema.getBlueprints("b").stream()
                .map(Blueprint::getOption).collect(Collectors.toList()));
        assertEquals(Arrays.asList("z", "x", "y"), schema.blueprints().stream()
                .map(Blueprint::getOption).collect(Collectors.toList()));
        assertEquals(3, schema.size());
        assertTrue(schema.hasSection("a"));
        assertTrue(schema.hasOption("b", "x"));
        assertFalse(schema.hasOption("a", "x"));
        assertTrue(schema.getBlueprints("missing").isEmpty());
    }

    @Test
    void addBlueprint_異常ケース_同じキーを登録する_DuplicateOptionExceptionが送出されること() {
        Schema schema = Schema.of(text("a", "x"));
        assertThrows(DuplicateOptionException.class, () -> schema.addBlueprint(text("a", "x")));
        assertEquals(1, schema.size());
    }

    @Test
    void addBlueprint_異常ケース_凍結後に登録する_IllegalStateExceptionが送出されること() {
        Schema schema = new Schema();
        assertTrue(schema.isEmpty());
        schema.freeze();
        assertTrue(schema.isFrozen());
        assertThrows(IllegalStateException.class, () -> schema.addBlueprint(text("a", "x")));
    }

    @Test
    void validate_異常ケース_未宣言のオプション_UnknownOptionExceptionが送出されること() {
        Schema schema = Schema.of(text("a", "x"));

        assertEquals(ConfigValue.text("v"), schema.validate("a", "x", ConfigValue.text("v")));
        assertThrows(UnknownOptionException.class,
                () -> schema.validate("a", "nope", ConfigValue.text("v")));
        assertThrows(TypeMismatchException.class,
                () -> schema.validate("a", "x", ConfigValue.integer(1)));
        assertFalse(schema.findBlueprint("zz", "x").isPresent());
    }
}
