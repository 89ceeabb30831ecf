package com.whereq.evtfilter.reader;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses the real encoding of a Log Parser XML document.
 *
 * <p>Order: byte-order mark, then the {@code encoding="..."} attribute in the first
 * 200 bytes, then UTF-8. Log Parser declares UCS-2 under several names; all of them
 * mean UTF-16 little-endian on Windows.</p>
 */
@Component
public class XmlEncodingDetector {

    public static final String UTF_16LE = "UTF-16LE";
    public static final String UTF_16BE = "UTF-16BE";
    public static final String UTF_8 = "UTF-8";

    static final int DECLARATION_WINDOW = 200;

    private static final Pattern ENCODING = Pattern.compile("encoding=\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    private static final Set<String> UTF_16_ALIASES = Set.of(
            "iso-10646-ucs-2", "utf-16", "utf-16le", "utf-16be", "ucs-2", "unicode");

    /**
     * @param raw document bytes
     * @return charset name to decode the document with
     */
    public String detect(byte[] raw) {
        if (raw.length >= 2) {
            int b0 = raw[0] & 0xFF;
            int b1 = raw[1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) {
                return UTF_16LE;
            }
            if (b0 == 0xFE && b1 == 0xFF) {
                return UTF_16BE;
            }
        }

        String declared = declaredEncoding(raw);
        if (declared != null) {
            if (UTF_16_ALIASES.contains(declared.toLowerCase(Locale.ROOT))) {
                return UTF_16LE;
            }
            return declared;
        }

        return UTF_8;
    }

    /**
     * Scrape the declared encoding from the head of the document, or null.
     */
    String declaredEncoding(byte[] raw) {
        int length = Math.min(raw.length, DECLARATION_WINDOW);
        String head = new String(raw, 0, length, StandardCharsets.ISO_8859_1);
        Matcher matcher = ENCODING.matcher(head);
        if (!matcher.find()) {
            return null;
        }
        String name = matcher.group(1).strip();
        return name.isEmpty() ? null : name;
    }
}
