package com.lbg.markets.surveillance.docsync.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict text form of document keys. Malformed UTF-8 is reported, never replaced.
 */
public final class Keys {

    private Keys() {
        // Utility class
    }

    public static String decode(byte[] key) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(key))
                .toString();
    }
}
