package io.github.linepicker.util;

import io.github.linepicker.ScoringConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link ScoringConfig} from {@code scoring.properties}. A missing file means defaults; an unreadable file is
 * logged and also means defaults.
 */
public final class ScoringSettings {
    private static final Logger logger = LogManager.getLogger(ScoringSettings.class);

    public static final String FILE_NAME = "scoring.properties";

    private ScoringSettings() {}

    public static Path getDefaultFile() {
        return LinePickerConfigPaths.getGlobalConfigDir().resolve(FILE_NAME);
    }

    public static ScoringConfig load() {
        return load(getDefaultFile());
    }

    public static ScoringConfig load(Path file) {
        var props = new Properties();
        if (!Files.exists(file)) {
            logger.debug("No scoring settings at {}, using defaults", file);
            return ScoringConfig.DEFAULT;
        }
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load scoring settings from {}: {}", file, e.getMessage());
            return ScoringConfig.DEFAULT;
        }
        var config = ScoringConfig.fromProperties(props);
        logger.debug("Loaded scoring settings from {}: {}", file, config);
        return config;
    }

    /** Writes {@code config} to {@code file}, replacing any previous contents atomically. */
    public static void save(Path file, ScoringConfig config) throws IOException {
        AtomicWrites.atomicSaveProperties(file, config.toProperties(), "linepicker scoring weights");
        logger.debug("Saved scoring settings to {}", file);
    }
}
