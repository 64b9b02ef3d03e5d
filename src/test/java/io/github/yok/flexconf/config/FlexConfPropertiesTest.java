package io.github.yok.flexconf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexconf.FlexConf;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FlexConfProperties}.
 */
class FlexConfPropertiesTest {

    @Test
    void getter_正常ケース_デフォルト値を取得する_既定の設定が返ること() {
        FlexConfProperties props = new FlexConfProperties();

        assertEquals("UTF-8", props.getEncoding());
        assertEquals(StandardCharsets.UTF_8, props.getCharset());
        assertEquals("ini", props.getExtension());
        assertEquals(UndeclaredOptionPolicy.WARN, props.getUndeclaredOptionPolicy());
        assertEquals("FlexConf - Version: " + FlexConf.VERSION, props.getHeader());
        assertTrue(props.getDescription().contains("="));
    }

    @Test
    void setter_正常ケース_各プロパティを設定して取得する_設定値が返ること() {
        FlexConfProperties props = new FlexConfProperties();
        props.setEncoding("ISO-8859-1");
        props.setExtension("cfg");
        props.setUndeclaredOptionPolicy(UndeclaredOptionPolicy.FAIL);
        props.setHeader("My App");
        props.setDescription("");

        assertEquals(StandardCharsets.ISO_8859_1, props.getCharset());
        assertEquals("cfg", props.getExtension());
        assertEquals(UndeclaredOptionPolicy.FAIL, props.getUndeclaredOptionPolicy());
        assertEquals("My App", props.getHeader());
        assertEquals("", props.getDescription());
    }

    @Test
    void getCharset_異常ケース_未知の文字コード_UnsupportedCharsetExceptionが送出されること() {
        FlexConfProperties props = new FlexConfProperties();
        props.setEncoding("NO-SUCH-CHARSET");
        assertThrows(UnsupportedCharsetException.class, props::getCharset);
    }
}
