package io.github.yok.flexconf.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mockStatic;
import io.github.yok.flexconf.exception.ConfigFileException;
import io.github.yok.flexconf.exception.ConfigFileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedStatic;

class FileStoreTest {

    @TempDir
    Path tempDir;

    private final FileStore store = new FileStore();

    // ---------------------------------------------------------------------
    // read
    // ---------------------------------------------------------------------

    @Test
    void read_正常ケース_書き込んだファイルを読む_同じ内容が返ること() {
        Path file = tempDir.resolve("nested").resolve("dir").resolve("app.ini");

        store.write(file, "[a]\nx = \"ção\"\n", StandardCharsets.UTF_8);

        assertTrue(store.exists(file));
        assertEquals("[a]\nx = \"ção\"\n", store.read(file, StandardCharsets.UTF_8));
    }

    @Test
    void read_異常ケース_存在しないファイル_ConfigFileNotFoundExceptionが送出されること() {
        Path file = tempDir.resolve("missing.ini");
        ConfigFileNotFoundException e = assertThrows(ConfigFileNotFoundException.class,
                () -> store.read(file, StandardCharsets.UTF_8));
        assertEquals(file, e.getPath());
        assertFalse(store.exists(file));
    }

    @Test
    void read_異常ケース_ディレクトリを読む_ConfigFileExceptionが送出されること() {
        ConfigFileException e = assertThrows(ConfigFileException.class,
                () -> store.read(tempDir, StandardCharsets.UTF_8));
        assertFalse(e instanceof ConfigFileNotFoundException);
    }

    @Test
    void read_異常ケース_文字コードに合わないバイト列_ConfigFileExceptionが送出されること()
            throws Exception {
        Path file = tempDir.resolve("latin.ini");
        Files.write(file, new byte[] {'a', (byte) 0xE7, (byte) 0xE3});

        assertThrows(ConfigFileException.class, () -> store.read(file, StandardCharsets.UTF_8));
        assertEquals("açã", store.read(file, StandardCharsets.ISO_8859_1));
    }

    // ---------------------------------------------------------------------
    // write
    // ---------------------------------------------------------------------

    @Test
    void write_正常ケース_既存ファイルを置き換える_新しい内容になり一時ファイルが残らないこと()
            throws Exception {
        Path file = tempDir.resolve("app.ini");
        Files.writeString(file, "old", StandardCharsets.UTF_8);

        store.write(file, "new", StandardCharsets.UTF_8);

        assertEquals("new", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void write_異常ケース_文字コードで表せない文字_ConfigFileExceptionが送出され内容が変わらないこと()
            throws Exception {
        Path file = tempDir.resolve("app.ini");
        Files.writeString(file, "old", StandardCharsets.US_ASCII);

        assertThrows(ConfigFileException.class,
                () -> store.write(file, "ação", StandardCharsets.US_ASCII));

        assertEquals("old", Files.readString(file, StandardCharsets.US_ASCII));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void write_異常ケース_一時ファイルの書き込み途中で失敗_元の内容が保たれること() throws Exception {
        Path file = tempDir.resolve("app.ini");
        Files.writeString(file, "port = 8080\n", StandardCharsets.UTF_8);
        FileStore crashing = new FileStore() {
            @Override
            protected void writeTemp(Path tmp, ByteBuffer bytes) throws IOException {
                try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                    ByteBuffer half = bytes.duplicate();
                    half.limit(half.limit() / 2);
                    channel.write(half);
                }
                throw new IOException("simulated crash");
            }
        };

        ConfigFileException e = assertThrows(ConfigFileException.class,
                () -> crashing.write(file, "port = 9090\n", StandardCharsets.UTF_8));

        assertEquals("simulated crash", e.getCause().getMessage());
        assertEquals("port = 8080\n", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void write_異常ケース_置き換えの移動に失敗_元の内容が保たれ一時ファイルが削除されること()
            throws Exception {
        Path file = tempDir.resolve("app.ini");
        Files.writeString(file, "port = 8080\n", StandardCharsets.UTF_8);

        try (MockedStatic<Files> files = mockStatic(Files.class, CALLS_REAL_METHODS)) {
            files.when(() -> Files.move(any(Path.class), any(Path.class),
                    any(CopyOption[].class))).thenThrow(new IOException("disk full"));

            assertThrows(ConfigFileException.class,
                    () -> store.write(file, "port = 9090\n", StandardCharsets.UTF_8));
        }

        assertEquals("port = 8080\n", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void write_正常ケース_アトミック移動が未対応_通常の置き換えで書き込まれること() throws Exception {
        Path file = tempDir.resolve("app.ini");
        Files.writeString(file, "old", StandardCharsets.UTF_8);

        try (MockedStatic<Files> files = mockStatic(Files.class, CALLS_REAL_METHODS)) {
            files.when(() -> Files.move(any(Path.class), any(Path.class),
                    any(CopyOption[].class))).thenAnswer(invocation -> {
                        if (requestsAtomicMove(invocation.getArguments())) {
                            throw new AtomicMoveNotSupportedException(null, null, "test");
                        }
                        return invocation.callRealMethod();
                    });

            store.write(file, "new", StandardCharsets.UTF_8);
        }

        assertEquals("new", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(tempFiles().isEmpty());
    }

    @Test
    void write_異常ケース_対象が空でないディレクトリ_ConfigFileExceptionが送出されること()
            throws Exception {
        Path target = tempDir.resolve("app.ini");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "x", StandardCharsets.UTF_8);

        assertThrows(ConfigFileException.class,
                () -> store.write(target, "new", StandardCharsets.UTF_8));

        assertTrue(Files.isDirectory(target));
        assertTrue(tempFiles().isEmpty());
    }

    private static boolean requestsAtomicMove(Object[] arguments) {
        for (Object argument : arguments) {
            if (argument == StandardCopyOption.ATOMIC_MOVE) {
                return true;
            }
            if (argument instanceof Object[]) {
                for (Object nested : (Object[]) argument) {
                    if (nested == StandardCopyOption.ATOMIC_MOVE) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private List<Path> tempFiles() throws IOException {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.filter(p -> p.getFileName().toString().endsWith(".tmp"))
                    .collect(Collectors.toList());
        }
    }
}
