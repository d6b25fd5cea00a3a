package io.github.linepicker.util;

import com.google.common.annotations.VisibleForTesting;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Where linepicker keeps {@code scoring.properties}.
 *
 * <p>{@code LINEPICKER_CONFIG_DIR} wins when set. Otherwise Windows uses {@code %APPDATA%\linepicker}, macOS
 * {@code ~/Library/Application Support/linepicker}, and everything else {@code $XDG_CONFIG_HOME/linepicker} or
 * {@code ~/.config/linepicker}.
 */
public final class LinePickerConfigPaths {
    private static final Logger logger = LogManager.getLogger(LinePickerConfigPaths.class);

    static final String APP_DIR = "linepicker";
    static final String ENV_CONFIG_DIR = "LINEPICKER_CONFIG_DIR";

    private LinePickerConfigPaths() {}

    public static Path getGlobalConfigDir() {
        return resolveConfigDir(
                System::getenv, System.getProperty("os.name", ""), Path.of(System.getProperty("user.home")));
    }

    /**
     * @param env environment lookup; returns null for unset variables
     * @param osName value of the {@code os.name} system property
     * @param home the user's home directory
     */
    @VisibleForTesting
    static Path resolveConfigDir(UnaryOperator<String> env, String osName, Path home) {
        var override = nonBlank(env.apply(ENV_CONFIG_DIR));
        if (override != null) {
            try {
                return Path.of(override);
            } catch (InvalidPathException e) {
                logger.warn("Ignoring {}='{}': {}", ENV_CONFIG_DIR, override, e.getMessage());
            }
        }

        var os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            var appData = nonBlank(env.apply("APPDATA"));
            var base = appData != null ? Path.of(appData) : home.resolve("AppData").resolve("Roaming");
            return base.resolve(APP_DIR);
        }
        if (os.contains("mac")) {
            return home.resolve("Library").resolve("Application Support").resolve(APP_DIR);
        }
        var xdg = nonBlank(env.apply("XDG_CONFIG_HOME"));
        var base = xdg != null ? Path.of(xdg) : home.resolve(".config");
        return base.resolve(APP_DIR);
    }

    private static @Nullable String nonBlank(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
