package de.bsommerfeld.reviewinsights.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileIsMissing() {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = ConfigLoader.load(file);

        assertTrue(Files.exists(file));
        assertEquals("localhost", config.getDatabase().getHost());
    }

    @Test
    void load_shouldReadWrittenDefaultsBack() {
        Path file = tempDir.resolve("config.toml");
        ConfigLoader.load(file);

        GlobalConfig reloaded = ConfigLoader.load(file);

        assertEquals(5432, reloaded.getDatabase().getPort());
        assertEquals("en", reloaded.getUser().getLanguage());
    }

    @Test
    void load_shouldReadValuesAndKeepDefaultsForAbsentKeys() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                debug-mode = true

                [database]
                host = "db.internal"
                port = 6543
                password = "pw"

                [user]
                language = "pt"
                """);

        GlobalConfig config = ConfigLoader.load(file);

        assertTrue(config.isDebugMode());
        assertEquals("db.internal", config.getDatabase().getHost());
        assertEquals(6543, config.getDatabase().getPort());
        assertEquals("pw", config.getDatabase().getPassword());
        assertEquals("postgres", config.getDatabase().getUser());
        assertEquals("produtosAmazon", config.getDatabase().getName());
        assertEquals("pt", config.getUser().getLanguage());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                theme = "dark"

                [database]
                host = "h"
                pool-size = 4
                """);

        assertEquals("h", ConfigLoader.load(file).getDatabase().getHost());
    }

    @Test
    void load_shouldFailOnBrokenToml() throws IOException {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[database\nhost = ");

        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
    }
}
