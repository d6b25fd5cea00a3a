package io.github.linepicker.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/** Replaces files through a sibling temporary file so readers never see a partial write. */
public final class AtomicWrites {
    private AtomicWrites() {}

    /**
     * Writes {@code content} as UTF-8 to a temporary file next to {@code target} and moves it over {@code target}.
     * Falls back to a plain replacing move where the file system cannot move atomically. The temporary file is removed
     * if anything fails.
     */
    public static void atomicOverwrite(Path target, String content) throws IOException {
        var dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    /** Stores {@code properties} at {@code target}, creating parent directories first. */
    public static void atomicSaveProperties(Path target, Properties properties, String comment) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        var writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(target, writer.toString());
    }
}
