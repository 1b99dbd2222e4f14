package com.laborjustice.casechain.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class RecordLoadException extends RuntimeException {

    private final Path source;

    public RecordLoadException(String message, Path source, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public RecordLoadException(String message, Path source) {
        super(message + ": " + source);
        this.source = source;
    }
}
