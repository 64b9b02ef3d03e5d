package io.github.yok.flexconf.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexconf.config.FlexConfProperties;
import io.github.yok.flexconf.config.UndeclaredOptionPolicy;
import io.github.yok.flexconf.exception.ConfigDecodeException;
import io.github.yok.flexconf.exception.ConfigFileException;
import io.github.yok.flexconf.exception.ConfigFileNotFoundException;
import io.github.yok.flexconf.exception.InvalidValueException;
import io.github.yok.flexconf.exception.NotInitializedException;
import io.github.yok.flexconf.exception.TypeMismatchException;
import io.github.yok.flexconf.exception.UnknownOptionException;
import io.github.yok.flexconf.exception.ValueOutOfRangeException;
import io.github.yok.flexconf.schema.Schema;
import io.github.yok.flexconf.util.FileStore;
import io.github.yok.flexconf.value.ConfigValue;
import io.github.yok.flexconf.value.ValueKind;
import java.nio.charset.Charset;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Entry point for reading and writing one typed configuration file.
 *
 * <p>
 * <strong>Lifecycle:</strong>
 * </p>
 * <ol>
 * <li>Register every {@link io.github.yok.flexconf.schema.Blueprint} in a {@link Schema}.</li>
 * <li>Call {@link #initialize(String, Path)}. An existing {@code <profile>.<extension>} file is
 * loaded and validated; otherwise one is generated from the defaults. Either way the file is
 * written back with the current documentation, so options that were missing appear in it.</li>
 * <li>Read with {@link #getValue(String, String)} and the typed getters; change with
 * {@link #setValue(String, String, ConfigValue)}, which writes the whole file atomically.</li>
 * </ol>
 *
 * <p>
 * Every operation runs under one {@link ReentrantLock} per instance, held from validation to the
 * end of the file write. Two instances pointing at the same file are not coordinated.
 * </p>
 *
 * <p>
 * When a write fails, the new value stays in memory and the exception is propagated; the file
 * keeps its previous content.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConfigManager {

    private final ReentrantLock lock = new ReentrantLock();

    @Getter
    private final Schema schema;

    private final FileStore fileStore;

    private final String extension;

    private final UndeclaredOptionPolicy undeclaredOptionPolicy;

    private final Charset defaultCharset;

    private String header;

    private String description;

    // Assigned together once the first write succeeded
    private ConfigDocument document;
    private String profile;
    private Path directory;
    private Path path;
    private Charset charset;

    public ConfigManager(Schema schema) {
        this(schema, new FlexConfProperties());
    }

    public ConfigManager(Schema schema, FlexConfProperties properties) {
        this(schema, properties, new FileStore());
    }

    /**
     * Creates a manager.
     *
     * @param schema declared options; frozen on initialization
     * @param properties settings, copied at construction
     * @param fileStore file access
     */
    public ConfigManager(Schema schema, FlexConfProperties properties, FileStore fileStore) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        Preconditions.checkNotNull(properties, "properties must not be null");
        Preconditions.checkNotNull(fileStore, "fileStore must not be null");
        Validate.notBlank(properties.getExtension(), "extension must not be blank");
        this.schema = schema;
        this.fileStore = fileStore;
        this.extension = StringUtils.removeStart(properties.getExtension().strip(), ".");
        this.undeclaredOptionPolicy = properties.getUndeclaredOptionPolicy() == null
                ? UndeclaredOptionPolicy.WARN
                : properties.getUndeclaredOptionPolicy();
        this.defaultCharset = properties.getCharset();
        this.header = properties.getHeader();
        this.description = properties.getDescription();
    }

    /**
     * Loads or generates {@code <directory>/<profile>.<extension>} using the configured charset.
     *
     * @param profile file name without extension
     * @param directory directory of the file; created when missing
     * @throws IllegalStateException if already initialized or the schema is empty
     * @throws IllegalArgumentException if the profile is blank, contains a path separator or is
     *         not a valid file name on this platform
     * @throws ConfigDecodeException if the existing file is malformed or holds an invalid value
     * @throws ConfigFileException if the file cannot be read or written
     */
    public void initialize(String profile, Path directory) {
        initialize(profile, directory, defaultCharset);
    }

    /**
     * Loads or generates {@code <directory>/<profile>.<extension>}.
     *
     * @param profile file name without extension
     * @param directory directory of the file; created when missing
     * @param charset character set of the file
     * @throws IllegalStateException if already initialized or the schema is empty
     * @throws IllegalArgumentException if the profile is blank, contains a path separator or is
     *         not a valid file name on this platform
     * @throws ConfigDecodeException if the existing file is malformed or holds an invalid value
     * @throws UnknownOptionException if the file holds an undeclared option and the policy is
     *         {@link UndeclaredOptionPolicy#FAIL}
     * @throws ConfigFileException if the file cannot be read or written
     */
    public void initialize(String profile, Path directory, Charset charset) {
        Preconditions.checkNotNull(directory, "directory must not be null");
        Preconditions.checkNotNull(charset, "charset must not be null");
        lock.lock();
        try {
            Preconditions.checkState(document == null, "Configuration manager for '%s' is "
                    + "already initialized", this.profile);
            Preconditions.checkState(!schema.isEmpty(),
                    "Schema has no blueprints; register options before initialize");
            validateProfile(profile);

            Path dir = directory.toAbsolutePath().normalize();
            Path file = resolveFile(dir, profile);
            ConfigDocument loaded = loadOrGenerate(profile, file, charset);

            fileStore.write(file, ConfigFileRenderer.render(loaded, header, description),
                    charset);

            this.document = loaded;
            this.profile = profile;
            this.directory = dir;
            this.path = file;
            this.charset = charset;
            schema.freeze();
            log.info("[{}] Initialized (options={}, file={})", profile, loaded.size(), file);
        } finally {
            lock.unlock();
        }
    }

    private ConfigDocument loadOrGenerate(String profile, Path file, Charset charset) {
        if (fileStore.exists(file)) {
            try {
                String text = fileStore.read(file, charset);
                ConfigDocument loaded =
                        ConfigDocument.fromText(schema, text, undeclaredOptionPolicy);
                log.info("[{}] Loaded {} (healed={}, dropped={})", profile, file,
                        loaded.getHealedOptions().size(), loaded.getUndeclaredOptions().size());
                return loaded;
            } catch (ConfigFileNotFoundException e) {
                log.warn("[{}] {} disappeared while loading; generating defaults", profile,
                        file);
            }
        } else {
            log.info("[{}] {} not found; generating defaults", profile, file);
        }
        return ConfigDocument.fromDefaults(schema);
    }

    private Path resolveFile(Path dir, String profile) {
        try {
            return dir.resolve(profile + "." + extension);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException(
                    "profile is not a valid file name: " + e.getMessage(), e);
        }
    }

    private static void validateProfile(String profile) {
        Validate.notBlank(profile, "profile must not be blank");
        Validate.isTrue(!StringUtils.containsAny(profile, '/', '\\'),
                "profile must not contain path separators: %s", profile);
        Validate.isTrue(profile.indexOf('\0') < 0, "profile must not contain NUL characters");
        Validate.isTrue(!".".equals(profile) && !"..".equals(profile),
                "profile must name a file: %s", profile);
    }

    /**
     * Returns the current value of an option.
     *
     * @param section section name
     * @param option option name
     * @return current value
     * @throws NotInitializedException if {@link #initialize(String, Path)} has not succeeded
     * @throws UnknownOptionException if the option is not declared
     */
    public ConfigValue getValue(String section, String option) {
        lock.lock();
        try {
            return requireDocument().get(section, option);
        } finally {
            lock.unlock();
        }
    }

    public String getString(String section, String option) {
        return typed(section, option, ValueKind.TEXT).asText();
    }

    public long getLong(String section, String option) {
        return typed(section, option, ValueKind.INTEGER).asLong();
    }

    /**
     * Returns an integer option narrowed to {@code int}.
     *
     * @param section section name
     * @param option option name
     * @return value
     * @throws TypeMismatchException if the option does not hold an integer
     * @throws ValueOutOfRangeException if the value does not fit in an {@code int}
     */
    public int getInt(String section, String option) {
        long value = getLong(section, option);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ValueOutOfRangeException(section, option,
                    value + " does not fit in a 32-bit integer");
        }
        return (int) value;
    }

    /**
     * Returns a numeric option as {@code double}; integers are widened.
     *
     * @param section section name
     * @param option option name
     * @return value
     * @throws TypeMismatchException if the option holds neither a decimal nor an integer
     */
    public double getDouble(String section, String option) {
        ConfigValue value = getValue(section, option);
        if (value.getKind() == ValueKind.INTEGER) {
            return value.asLong();
        }
        return expect(section, option, value, ValueKind.DECIMAL).asDouble();
    }

    public boolean getBoolean(String section, String option) {
        return typed(section, option, ValueKind.BOOLEAN).asBoolean();
    }

    public List<ConfigValue> getList(String section, String option) {
        return typed(section, option, ValueKind.LIST).asList();
    }

    public Map<String, ConfigValue> getDict(String section, String option) {
        return typed(section, option, ValueKind.DICT).asDict();
    }

    private ConfigValue typed(String section, String option, ValueKind kind) {
        return expect(section, option, getValue(section, option), kind);
    }

    private static ConfigValue expect(String section, String option, ConfigValue value,
            ValueKind kind) {
        if (value.getKind() != kind) {
            throw new TypeMismatchException(section, option,
                    "stored value is " + value.getKind() + ", not " + kind);
        }
        return value;
    }

    /**
     * Validates, stores and persists a value.
     *
     * @param section section name
     * @param option option name
     * @param value new value
     * @throws NotInitializedException if {@link #initialize(String, Path)} has not succeeded
     * @throws UnknownOptionException if the option is not declared
     * @throws InvalidValueException if the value breaks the blueprint; nothing changes
     * @throws ConfigFileException if the file cannot be written; the value stays in memory
     */
    public void setValue(String section, String option, ConfigValue value) {
        lock.lock();
        try {
            ConfigDocument doc = requireDocument();
            doc.set(section, option, value);
            log.debug("[{}] {} = {}", profile, new OptionKey(section, option), value);
            persist(doc);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Converts a plain Java object with {@link ConfigValue#of(Object)}, then behaves as
     * {@link #setValue(String, String, ConfigValue)}.
     *
     * @param section section name
     * @param option option name
     * @param value {@code null}, text, number, boolean, list or map
     * @throws TypeMismatchException if the object cannot be converted or is of a rejected kind
     */
    public void setValue(String section, String option, Object value) {
        ConfigValue converted;
        try {
            converted = ConfigValue.of(value);
        } catch (IllegalArgumentException e) {
            throw new TypeMismatchException(section, option, e.getMessage());
        }
        setValue(section, option, converted);
    }

    /**
     * Writes the current state to the file again.
     *
     * @throws NotInitializedException if {@link #initialize(String, Path)} has not succeeded
     * @throws ConfigFileException if the file cannot be written
     */
    public void save() {
        lock.lock();
        try {
            persist(requireDocument());
        } finally {
            lock.unlock();
        }
    }

    private void persist(ConfigDocument doc) {
        try {
            fileStore.write(path, ConfigFileRenderer.render(doc, header, description), charset);
        } catch (ConfigFileException e) {
            log.warn("[{}] Failed to persist {}; in-memory values are kept", profile, path);
            throw e;
        }
    }

    /**
     * Replaces the first comment block written to the file. Takes effect on the next write.
     *
     * @param header header text, blank to omit
     */
    public void setHeader(String header) {
        lock.lock();
        try {
            this.header = header;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the comment block written below the header. Takes effect on the next write.
     *
     * @param description description text, blank to omit
     */
    public void setDescription(String description) {
        lock.lock();
        try {
            this.description = description;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialized() {
        lock.lock();
        try {
            return document != null;
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        lock.lock();
        try {
            requireDocument();
            return path;
        } finally {
            lock.unlock();
        }
    }

    public Path getDirectory() {
        lock.lock();
        try {
            requireDocument();
            return directory;
        } finally {
            lock.unlock();
        }
    }

    public String getProfile() {
        lock.lock();
        try {
            requireDocument();
            return profile;
        } finally {
            lock.unlock();
        }
    }

    public Charset getCharset() {
        lock.lock();
        try {
            requireDocument();
            return charset;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the options that were found in the file but not declared, in file order.
     *
     * @return immutable list, empty for a generated file
     * @throws NotInitializedException if {@link #initialize(String, Path)} has not succeeded
     */
    public List<OptionKey> getUndeclaredOptions() {
        lock.lock();
        try {
            return requireDocument().getUndeclaredOptions();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of every option in schema order.
     *
     * @return immutable map
     * @throws NotInitializedException if {@link #initialize(String, Path)} has not succeeded
     */
    public Map<OptionKey, ConfigValue> snapshot() {
        lock.lock();
        try {
            return requireDocument().asMap();
        } finally {
            lock.unlock();
        }
    }

    private ConfigDocument requireDocument() {
        if (document == null) {
            throw new NotInitializedException();
        }
        return document;
    }
}
