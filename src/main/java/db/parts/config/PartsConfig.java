package db.parts.config;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Settings used when interpreting system.parts rows.
 * indexGranularity: rows per index mark, used to estimate row counts.
 * inUseRefcount: a part with a refcount above this is taking part in queries or merges.
 */
public class PartsConfig {
    public static final long DEFAULT_INDEX_GRANULARITY = 8192;
    public static final long DEFAULT_IN_USE_REFCOUNT = 2;

    static final String DEFAULTS_RESOURCE = "/parts-config.json";

    private static final Gson GSON = new Gson();

    private long indexGranularity = DEFAULT_INDEX_GRANULARITY;
    private long inUseRefcount = DEFAULT_IN_USE_REFCOUNT;

    public PartsConfig() {}

    public PartsConfig(long indexGranularity, long inUseRefcount) {
        this.indexGranularity = indexGranularity;
        this.inUseRefcount = inUseRefcount;
        validate();
    }

    public long indexGranularity() { return indexGranularity; }
    public long inUseRefcount() { return inUseRefcount; }

    /** Defaults bundled on the classpath, or the built-in constants when the resource is absent or broken. */
    public static PartsConfig defaults() {
        InputStream in = PartsConfig.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) return new PartsConfig();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            logError("Failed loading config resource: " + DEFAULTS_RESOURCE, e);
            return new PartsConfig();
        }
    }

    /** Load from a JSON file. A missing file yields defaults(). */
    public static PartsConfig load(File file) {
        if (file == null || !file.exists()) return defaults();
        try (FileReader reader = new FileReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            logError("Failed loading config file: " + file.getPath(), e);
            return defaults();
        }
    }

    static PartsConfig parse(Reader reader) {
        PartsConfig loaded = GSON.fromJson(reader, PartsConfig.class);
        if (loaded == null) return new PartsConfig();
        loaded.validate();
        return loaded;
    }

    private void validate() {
        if (indexGranularity <= 0) throw new IllegalArgumentException("indexGranularity must be positive: " + indexGranularity);
        if (inUseRefcount < 0) throw new IllegalArgumentException("inUseRefcount must not be negative: " + inUseRefcount);
    }

    private static void logError(String message, Exception e) {
        System.err.println("[PartsConfig] " + message);
        e.printStackTrace(System.err);
    }

    @Override
    public String toString() {
        return "PartsConfig{indexGranularity=" + indexGranularity + ", inUseRefcount=" + inUseRefcount + "}";
    }
}
