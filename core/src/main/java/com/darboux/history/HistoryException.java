package com.darboux.history;

import com.darboux.exception.DarbouxException;

import java.nio.file.Path;

/**
 * Exception thrown when the function history file cannot be read or written.
 */
public class HistoryException extends DarbouxException {

    private final Path file;

    public HistoryException(String message, Path file, Throwable cause) {
        super(message + " (" + file + ")", cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String getUserMessage() {
        return "Could not access the saved functions in " + file + ".";
    }
}
