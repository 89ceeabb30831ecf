package com.whereq.evtfilter.reader;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;

/**
 * Byte-to-text decoding that drops undecodable sequences instead of failing.
 */
public final class LenientDecoding {

    private LenientDecoding() {
    }

    public static String decode(byte[] bytes, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // unreachable with IGNORE on both actions
            throw new IllegalStateException("Lenient decode failed for " + charset, e);
        }
    }
}
