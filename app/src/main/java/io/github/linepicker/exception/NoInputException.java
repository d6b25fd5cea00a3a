package io.github.linepicker.exception;

import java.io.IOException;

/** Thrown when the input stream holds no non-empty lines to pick from. */
public class NoInputException extends IOException {
    public NoInputException(String message) {
        super(message);
    }
}
