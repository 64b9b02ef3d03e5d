package io.github.yok.flexconf.config;

import io.github.yok.flexconf.FlexConf;
import java.nio.charset.Charset;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings that bind the {@code flexconf} prefix in {@code application.yml} (or any other
 * property source). Each {@link io.github.yok.flexconf.core.ConfigManager} copies them on
 * construction.
 *
 * <p>
 * <strong>Example:</strong>
 * </p>
 *
 * <pre>
 * flexconf:
 *   encoding: UTF-8
 *   extension: ini
 *   undeclared-option-policy: WARN
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "flexconf")
@Data
public class FlexConfProperties {

    /**
     * Character set used to read and write configuration files.
     */
    private String encoding = "UTF-8";

    /**
     * File extension appended to the profile name, without the leading dot.
     */
    private String extension = "ini";

    /**
     * What to do with options found in a file but not declared by any blueprint.
     */
    private UndeclaredOptionPolicy undeclaredOptionPolicy = UndeclaredOptionPolicy.WARN;

    /**
     * First comment block of the generated file.
     */
    private String header = FlexConf.defaultHeader();

    /**
     * Comment block written below the header, explaining how to fill in the file.
     */
    private String description = "Preencha cada opção após o sinal '='.\n"
            + "Textos ficam entre aspas duplas; listas usam [ ] e dicionários usam { }.\n"
            + "Deixe o valor vazio para usar nulo quando o tipo permitir.";

    /**
     * Resolves {@link #encoding} to a charset.
     *
     * @return configured charset
     * @throws java.nio.charset.UnsupportedCharsetException if the encoding is unknown
     */
    public Charset getCharset() {
        return Charset.forName(encoding);
    }
}
