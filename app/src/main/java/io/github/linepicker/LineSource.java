package io.github.linepicker;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.github.linepicker.exception.NoInputException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads candidate lines from newline-delimited input.
 *
 * <p>Every newline code point separates records, so {@code "\r\n"} is two separators around an empty record. Empty
 * records are dropped; the order of the rest is kept.
 */
public final class LineSource {
    private static final Logger logger = LogManager.getLogger(LineSource.class);

    static final CharMatcher NEWLINES = CharMatcher.anyOf("\n\r\u000B\f\u0085\u2028\u2029");

    private static final Splitter LINE_SPLITTER = Splitter.on(NEWLINES).omitEmptyStrings();

    private LineSource() {}

    /**
     * Reads {@code in} to the end as UTF-8 and splits it into candidate lines. Does not close the stream.
     *
     * @throws NoInputException if the input contains no non-empty line
     */
    public static List<String> readLines(InputStream in) throws IOException {
        var text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        var lines = splitLines(text);
        if (lines.isEmpty()) {
            throw new NoInputException("No input provided. Pipe some lines into linepicker.");
        }
        logger.debug("Read {} candidate lines ({} chars)", lines.size(), text.length());
        return lines;
    }

    public static List<String> splitLines(String text) {
        return List.copyOf(LINE_SPLITTER.splitToList(text));
    }
}
