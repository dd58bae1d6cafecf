package com.theoremextractor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A source file that cannot be read as text under any supported encoding.
 */
public class DocumentDecodingException extends IOException {

    private final Path source;

    public DocumentDecodingException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
