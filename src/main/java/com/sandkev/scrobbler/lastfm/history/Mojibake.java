package com.sandkev.scrobbler.lastfm.history;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Some titles come back from Last.fm double-encoded: the UTF-8 bytes were decoded as
 * Latin-1 once too often, so "Sigur Rós" arrives as "Sigur RÃ³s".
 * <p>
 * Only text with exactly that signature is repaired: all characters fit in Latin-1, there is
 * at least one UTF-8 lead byte followed by a continuation byte, and the Latin-1 bytes are
 * valid UTF-8. Everything else is returned unchanged.
 */
public final class Mojibake {

    private static final Pattern LEAD_THEN_CONTINUATION = Pattern.compile("[\\u00C2-\\u00F4][\\u0080-\\u00BF]");

    private Mojibake() {}

    public static String repair(String s) {
        if (s == null || s.isEmpty()) return s;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0xFF) return s;
        }
        if (!LEAD_THEN_CONTINUATION.matcher(s).find()) return s;

        CharsetDecoder strictUtf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = strictUtf8.decode(ByteBuffer.wrap(s.getBytes(StandardCharsets.ISO_8859_1)));
            return decoded.toString();
        } catch (CharacterCodingException e) {
            // Latin-1 text that merely looks like UTF-8 in places, e.g. "Ã " followed by a non-continuation byte
            return s;
        }
    }
}
