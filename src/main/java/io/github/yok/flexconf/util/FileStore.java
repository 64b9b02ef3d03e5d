package io.github.yok.flexconf.util;

import com.google.common.base.Preconditions;
import io.github.yok.flexconf.exception.ConfigFileException;
import io.github.yok.flexconf.exception.ConfigFileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Reads and writes whole configuration files.
 *
 * <p>
 * Writes are atomic: the content is written and flushed to a temporary file in the target
 * directory, which then replaces the target with an atomic move. A reader therefore sees either
 * the previous or the new content, never a partial file. When the file system cannot move
 * atomically, a plain replacing move is used and a warning is logged.
 * </p>
 *
 * <p>
 * Both directions use strict charset coding: unmappable or malformed characters raise a
 * {@link ConfigFileException} instead of being replaced.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileStore {

    /**
     * Reads the whole file.
     *
     * @param path file to read
     * @param charset character set of the file
     * @return file content
     * @throws ConfigFileNotFoundException if the file does not exist
     * @throws ConfigFileException if the file cannot be read or decoded
     */
    public String read(Path path, Charset charset) {
        Preconditions.checkNotNull(path, "path must not be null");
        Preconditions.checkNotNull(charset, "charset must not be null");
        if (Files.isDirectory(path)) {
            throw new ConfigFileException(path, "Configuration path is a directory: " + path);
        }
        try {
            String content = Files.readString(path, charset);
            log.debug("Read {} chars from {}", content.length(), path);
            return content;
        } catch (NoSuchFileException e) {
            throw new ConfigFileNotFoundException(path);
        } catch (CharacterCodingException e) {
            throw new ConfigFileException(path,
                    "Configuration file is not valid " + charset.name() + ": " + path, e);
        } catch (IOException e) {
            throw new ConfigFileException(path, "Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Replaces the file content atomically, creating parent directories as needed.
     *
     * @param path target file
     * @param content full new content
     * @param charset character set to encode with
     * @throws ConfigFileException if the content cannot be encoded or written; the target is then
     *         left unchanged
     */
    public void write(Path path, String content, Charset charset) {
        Preconditions.checkNotNull(path, "path must not be null");
        Preconditions.checkNotNull(content, "content must not be null");
        Preconditions.checkNotNull(charset, "charset must not be null");

        Path target = path.toAbsolutePath().normalize();
        ByteBuffer bytes = encode(target, content, charset);
        Path dir = target.getParent();
        Path tmp = null;
        try {
            FileUtils.forceMkdir(dir.toFile());
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            writeTemp(tmp, bytes);
            moveIntoPlace(tmp, target);
            log.debug("Wrote {} bytes to {}", bytes.limit(), target);
        } catch (IOException e) {
            throw new ConfigFileException(target,
                    "Failed to write configuration file: " + target, e);
        } finally {
            if (tmp != null && Files.exists(tmp)) {
                FileUtils.deleteQuietly(tmp.toFile());
            }
        }
    }

    /**
     * Determines whether a regular file exists at the path.
     *
     * @param path path to check
     * @return {@code true} if a regular file exists
     */
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Writes the encoded content to the temporary file and forces it to the storage device.
     *
     * @param tmp temporary file inside the target directory
     * @param bytes encoded content
     * @throws IOException if writing fails
     */
    protected void writeTemp(Path tmp, ByteBuffer bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = bytes.duplicate();
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; falling back to a replacing move",
                    target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static ByteBuffer encode(Path target, String content, Charset charset) {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return encoder.encode(CharBuffer.wrap(content));
        } catch (CharacterCodingException e) {
            throw new ConfigFileException(target,
                    "Content cannot be encoded as " + charset.name() + ": " + target, e);
        }
    }
}
