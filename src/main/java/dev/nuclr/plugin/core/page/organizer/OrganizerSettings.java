package dev.nuclr.plugin.core.page.organizer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings for the page organizer.
 *
 * <p>Built-in defaults come from {@code page-organizer.properties} on the classpath.
 * A file of the same name in the platform user config directory overrides them.
 * Out-of-range or unparsable values fall back to the defaults.
 */
@Slf4j
public final class OrganizerSettings {

    public static final String KEY_THUMBNAIL_WIDTH     = "thumbnail.width";
    public static final String KEY_THUMBNAIL_HEIGHT    = "thumbnail.height";
    public static final String KEY_BATCH_SIZE          = "thumbnail.batchSize";
    public static final String KEY_CACHE_MAX_ENTRIES   = "cache.maxEntries";
    public static final String KEY_CACHE_MAX_BYTES     = "cache.maxBytes";
    public static final String KEY_RENDER_THREADS      = "render.threads";
    public static final String KEY_RENDER_TIMEOUT      = "render.timeoutSeconds";
    public static final String KEY_EXPORT_FILE_NAME    = "export.defaultFileName";

    private static final String FILE_NAME = "page-organizer.properties";

    private static final int    DEFAULT_THUMBNAIL_WIDTH   = 140;
    private static final int    DEFAULT_THUMBNAIL_HEIGHT  = 180;
    private static final int    MAX_THUMBNAIL_SIDE        = 1024;
    private static final int    DEFAULT_BATCH_SIZE        = 5;
    private static final int    MAX_BATCH_SIZE            = 64;
    private static final int    DEFAULT_CACHE_MAX_ENTRIES = 100;
    private static final long   DEFAULT_CACHE_MAX_BYTES   = 50L * 1024 * 1024;
    private static final int    DEFAULT_RENDER_THREADS    = 5;
    private static final int    MAX_RENDER_THREADS        = 32;
    private static final long   DEFAULT_RENDER_TIMEOUT    = 0;
    private static final String DEFAULT_EXPORT_FILE_NAME  = "merged_document.pdf";

    private static volatile OrganizerSettings instance;

    private final Properties props;

    private OrganizerSettings(Properties props) {
        this.props = props;
    }

    /** Settings from classpath defaults overlaid with the user config file. Loaded once. */
    public static OrganizerSettings getInstance() {
        OrganizerSettings s = instance;
        if (s == null) {
            synchronized (OrganizerSettings.class) {
                s = instance;
                if (s == null) {
                    Properties p = new Properties();
                    loadDefaults(p);
                    loadUserOverrides(p, settingsFile());
                    s = new OrganizerSettings(p);
                    instance = s;
                }
            }
        }
        return s;
    }

    /** Settings from the given properties only; missing keys use the built-in defaults. */
    public static OrganizerSettings of(Properties props) {
        Properties copy = new Properties();
        copy.putAll(props);
        return new OrganizerSettings(copy);
    }

    // --- Getters ---

    public ThumbnailSize getThumbnailSize() {
        return new ThumbnailSize(
                intInRange(KEY_THUMBNAIL_WIDTH, DEFAULT_THUMBNAIL_WIDTH, 1, MAX_THUMBNAIL_SIDE),
                intInRange(KEY_THUMBNAIL_HEIGHT, DEFAULT_THUMBNAIL_HEIGHT, 1, MAX_THUMBNAIL_SIDE));
    }

    public int getBatchSize() {
        return intInRange(KEY_BATCH_SIZE, DEFAULT_BATCH_SIZE, 1, MAX_BATCH_SIZE);
    }

    public int getCacheMaxEntries() {
        return intInRange(KEY_CACHE_MAX_ENTRIES, DEFAULT_CACHE_MAX_ENTRIES, 1, Integer.MAX_VALUE);
    }

    public long getCacheMaxBytes() {
        long raw = parseLong(KEY_CACHE_MAX_BYTES, DEFAULT_CACHE_MAX_BYTES);
        return raw > 0 ? raw : DEFAULT_CACHE_MAX_BYTES;
    }

    /** Render pool size; never smaller than the batch size, so a whole batch renders at once. */
    public int getRenderThreads() {
        int threads = intInRange(KEY_RENDER_THREADS, DEFAULT_RENDER_THREADS, 1, MAX_RENDER_THREADS);
        int batch = getBatchSize();
        if (threads < batch) {
            log.warn("Setting {}={} is below {}={}, using {}", KEY_RENDER_THREADS, threads,
                    KEY_BATCH_SIZE, batch, batch);
            return batch;
        }
        return threads;
    }

    /** Seconds before a single thumbnail render is abandoned; 0 means never. */
    public long getRenderTimeoutSeconds() {
        long raw = parseLong(KEY_RENDER_TIMEOUT, DEFAULT_RENDER_TIMEOUT);
        return raw >= 0 ? raw : DEFAULT_RENDER_TIMEOUT;
    }

    public String getExportFileName() {
        String name = props.getProperty(KEY_EXPORT_FILE_NAME);
        return (name != null && !name.isBlank()) ? name.trim() : DEFAULT_EXPORT_FILE_NAME;
    }

    // --- Parsing ---

    private int intInRange(String key, int def, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null) return def;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                log.warn("Setting {}={} outside [{}, {}], using {}", key, value, min, max, def);
                return def;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Setting {}='{}' is not a number, using {}", key, raw, def);
            return def;
        }
    }

    private long parseLong(String key, long def) {
        String raw = props.getProperty(key);
        if (raw == null) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {}='{}' is not a number, using {}", key, raw, def);
            return def;
        }
    }

    // --- Loading ---

    private static void loadDefaults(Properties p) {
        try (InputStream in = OrganizerSettings.class.getResourceAsStream("/" + FILE_NAME)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            log.warn("Could not load built-in organizer settings: {}", e.getMessage());
        }
    }

    private static void loadUserOverrides(Properties p, Path file) {
        if (!Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            p.load(in);
            log.info("Loaded organizer settings from {}", file);
        } catch (IOException e) {
            log.warn("Could not load organizer settings from {}, using defaults: {}", file, e.getMessage());
        }
    }

    private static Path settingsFile() {
        String os = System.getProperty("os.name", "").toLowerCase();
        Path dir;
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            dir = (appData != null)
                    ? Path.of(appData, "nuclr")
                    : Path.of(System.getProperty("user.home"), "nuclr");
        } else if (os.contains("mac")) {
            dir = Path.of(System.getProperty("user.home"), "Library", "Application Support", "nuclr");
        } else {
            String xdg = System.getenv("XDG_CONFIG_HOME");
            dir = (xdg != null)
                    ? Path.of(xdg, "nuclr")
                    : Path.of(System.getProperty("user.home"), ".config", "nuclr");
        }
        return dir.resolve(FILE_NAME);
    }
}
