package io.github.linepicker;

import static org.junit.jupiter.api.Assertions.*;

import io.github.linepicker.exception.NoInputException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineSourceTest {

    private static ByteArrayInputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsLinesInOrder() throws IOException {
        assertEquals(List.of("one", "two", "three"), LineSource.readLines(input("one\ntwo\nthree\n")));
    }

    @Test
    void dropsEmptyLinesAndCarriageReturns() throws IOException {
        assertEquals(List.of("a", "b", "c"), LineSource.readLines(input("a\r\n\r\nb\n\n\rc")));
    }

    @Test
    void keepsWhitespaceInsideLines() throws IOException {
        assertEquals(List.of("  padded  ", "tab\there"), LineSource.readLines(input("  padded  \ntab\there\n")));
    }

    @Test
    void decodesUtf8() throws IOException {
        assertEquals(List.of("café", "😀 smile"), LineSource.readLines(input("café\n😀 smile\n")));
    }

    @Test
    void unicodeLineSeparatorsSplitRecords() {
        assertEquals(List.of("a", "b", "c"), LineSource.splitLines("a\u2028b\u0085c"));
    }

    @Test
    void emptyInputIsAnError() {
        assertThrows(NoInputException.class, () -> LineSource.readLines(input("")));
        assertThrows(NoInputException.class, () -> LineSource.readLines(input("\n\r\n\n")));
    }
}
