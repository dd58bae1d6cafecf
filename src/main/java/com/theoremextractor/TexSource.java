package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads LaTeX source files: strict UTF-8 first, Latin-1 when that fails.
 *
 * <p>Latin-1 maps every byte, so the only input rejected is one that is clearly not text
 * (it contains NUL bytes).
 */
public final class TexSource {

    private static final Logger log = LoggerFactory.getLogger(TexSource.class);

    private TexSource() {
    }

    public static String read(Path file) throws IOException {
        return decode(file, Files.readAllBytes(file));
    }

    static String decode(Path source, byte[] bytes) throws DocumentDecodingException {
        for (byte b : bytes) {
            if (b == 0) {
                throw new DocumentDecodingException(source, "binary content (NUL byte), not a text file");
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading as Latin-1", source);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
