package io.github.yok.flexconf;

/**
 * Shared constants describing the FlexConf library itself.
 *
 * <p>
 * The tool name and version are written into the first comment line of every generated
 * configuration file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexConf {

    /**
     * Tool name written in generated file headers.
     */
    public static final String TOOL_NAME = "FlexConf";

    /**
     * Library version written in generated file headers.
     */
    public static final String VERSION = "1.0.0";

    /**
     * Utility class constructor.
     */
    private FlexConf() {}

    /**
     * Returns the default header line, e.g. {@code FlexConf - Version: 1.0.0}.
     *
     * @return default header text
     */
    public static String defaultHeader() {
        return TOOL_NAME + " - Version: " + VERSION;
    }
}
