package db.parts.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PartsConfigTest {

    @TempDir
    Path tmp;

    @Test
    void bundledDefaults() {
        PartsConfig c = PartsConfig.defaults();
        assertEquals(8192, c.indexGranularity());
        assertEquals(2, c.inUseRefcount());
    }

    @Test
    void loadsFileAndKeepsDefaultsForMissingKeys() throws IOException {
        Path file = tmp.resolve("parts.json");
        Files.writeString(file, "{\"indexGranularity\": 1024}", StandardCharsets.UTF_8);
        PartsConfig c = PartsConfig.load(file.toFile());
        assertEquals(1024, c.indexGranularity());
        assertEquals(PartsConfig.DEFAULT_IN_USE_REFCOUNT, c.inUseRefcount());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        PartsConfig c = PartsConfig.load(new File(tmp.toFile(), "absent.json"));
        assertEquals(PartsConfig.DEFAULT_INDEX_GRANULARITY, c.indexGranularity());
    }

    @Test
    void malformedOrInvalidFileFallsBackToDefaults() throws IOException {
        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"indexGranularity\": ", StandardCharsets.UTF_8);
        assertEquals(PartsConfig.DEFAULT_INDEX_GRANULARITY, PartsConfig.load(broken.toFile()).indexGranularity());

        Path negative = tmp.resolve("negative.json");
        Files.writeString(negative, "{\"indexGranularity\": -5}", StandardCharsets.UTF_8);
        assertEquals(PartsConfig.DEFAULT_INDEX_GRANULARITY, PartsConfig.load(negative.toFile()).indexGranularity());
    }

    @Test
    void parseRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> PartsConfig.parse(new StringReader("{\"inUseRefcount\": -1}")));
        assertThrows(IllegalArgumentException.class, () -> new PartsConfig(0, 2));
    }
}
