package com.cypher.guard.sanitizer;

import com.cypher.guard.query.CypherText;

import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects Unicode and encoding tricks in raw query text.
 *
 * <p>Runs on the original, unmasked text: an attack hidden inside a string literal or a
 * comment is still an attack. Iteration is by code point so supplementary characters
 * such as mathematical alphanumerics are seen whole.</p>
 */
public final class UnicodeInspector {

    /**
     * A Unicode finding.
     *
     * @param type    the violation raised
     * @param message description including the offending code point
     */
    public record Finding(ViolationType type, String message) {
    }

    private static final Set<Integer> ZERO_WIDTH = Set.of(0x200B, 0x200C, 0x200D, 0x2060, 0xFEFF);

    private static final Set<Integer> TYPOGRAPHIC_QUOTES = Set.of(0x2018, 0x2019, 0x201C, 0x201D);

    private static final Pattern ESCAPE_SEQUENCE = Pattern.compile(
            "\\\\x[0-9a-fA-F]{2}|\\\\u[0-9a-fA-F]{4}|\\\\[0-7]{3}");

    /** Cyrillic and Greek letters that render like Latin ones, with their Latin lookalike. */
    private static final Map<Integer, Character> CONFUSABLES = Map.ofEntries(
            Map.entry(0x0430, 'a'), Map.entry(0x0435, 'e'), Map.entry(0x043E, 'o'), Map.entry(0x0440, 'p'),
            Map.entry(0x0441, 'c'), Map.entry(0x0443, 'y'), Map.entry(0x0445, 'x'), Map.entry(0x0455, 's'),
            Map.entry(0x0456, 'i'), Map.entry(0x0458, 'j'), Map.entry(0x04BB, 'h'), Map.entry(0x0501, 'd'),
            Map.entry(0x0410, 'A'), Map.entry(0x0412, 'B'), Map.entry(0x0415, 'E'), Map.entry(0x041A, 'K'),
            Map.entry(0x041C, 'M'), Map.entry(0x041D, 'H'), Map.entry(0x041E, 'O'), Map.entry(0x0420, 'P'),
            Map.entry(0x0421, 'C'), Map.entry(0x0422, 'T'), Map.entry(0x0425, 'X'), Map.entry(0x0405, 'S'),
            Map.entry(0x0406, 'I'), Map.entry(0x0408, 'J'),
            Map.entry(0x03BF, 'o'), Map.entry(0x03C1, 'p'), Map.entry(0x03B1, 'a'), Map.entry(0x03BD, 'v'),
            Map.entry(0x0391, 'A'), Map.entry(0x0392, 'B'), Map.entry(0x0395, 'E'), Map.entry(0x0396, 'Z'),
            Map.entry(0x0397, 'H'), Map.entry(0x0399, 'I'), Map.entry(0x039A, 'K'), Map.entry(0x039C, 'M'),
            Map.entry(0x039D, 'N'), Map.entry(0x039F, 'O'), Map.entry(0x03A1, 'P'), Map.entry(0x03A4, 'T'),
            Map.entry(0x03A5, 'Y'), Map.entry(0x03A7, 'X')
    );

    /** Words that, spelled entirely in lookalike letters, impersonate query syntax. */
    private static final Set<String> SPOOFABLE_WORDS = Set.of(
            "MATCH", "CREATE", "MERGE", "DELETE", "DETACH", "SET", "REMOVE", "RETURN", "WHERE", "WITH",
            "CALL", "LOAD", "CSV", "DROP", "UNWIND", "FOREACH", "OPTIONAL", "UNION", "LIMIT", "APOC", "DBMS");

    private UnicodeInspector() {
        // utility class
    }

    /**
     * Inspects query text. Returns the first finding, or empty when the text is clean.
     */
    public static Optional<Finding> inspectQuery(String text, boolean blockNonAscii) {
        Optional<Finding> finding = inspectControlCharacters(text);
        if (finding.isEmpty()) {
            finding = inspectLookalikes(text);
        }
        if (finding.isEmpty() && blockNonAscii) {
            finding = inspectNonAscii(text);
        }
        if (finding.isEmpty()) {
            finding = inspectEscapes(text);
        }
        return finding;
    }

    /**
     * Inspects a parameter value: null bytes, broken encoding, zero-width and bidi controls.
     */
    public static Optional<Finding> inspectValue(String value) {
        return inspectControlCharacters(value);
    }

    private static Optional<Finding> inspectControlCharacters(String text) {
        if (text.indexOf('\0') >= 0) {
            return finding(ViolationType.NULL_BYTE, "Blocked: query contains a null byte");
        }
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder();
        if (!encoder.canEncode(text)) {
            return finding(ViolationType.INVALID_ENCODING, "Blocked: text does not round-trip through UTF-8");
        }
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (ZERO_WIDTH.contains(cp)) {
                return finding(ViolationType.ZERO_WIDTH_CHARACTER,
                        "Blocked: zero-width character " + codePoint(cp));
            }
            if ((cp >= 0x202A && cp <= 0x202E) || (cp >= 0x2066 && cp <= 0x2069)) {
                return finding(ViolationType.BIDI_OVERRIDE,
                        "Blocked: bidirectional control character " + codePoint(cp));
            }
            i += Character.charCount(cp);
        }
        return Optional.empty();
    }

    private static Optional<Finding> inspectLookalikes(String text) {
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (isCombiningMark(cp)) {
                return finding(ViolationType.COMBINING_DIACRITIC,
                        "Blocked: combining diacritical mark " + codePoint(cp));
            }
            if (cp >= 0x1D400 && cp <= 0x1D7FF) {
                return finding(ViolationType.MATH_ALPHANUMERIC,
                        "Blocked: mathematical alphanumeric symbol " + codePoint(cp));
            }
            if ((cp >= 0xFF21 && cp <= 0xFF3A) || (cp >= 0xFF41 && cp <= 0xFF5A)) {
                return finding(ViolationType.HOMOGLYPH,
                        "Blocked: fullwidth Latin letter " + codePoint(cp) + " (homograph attack)");
            }
            i += Character.charCount(cp);
        }
        return inspectWords(text);
    }

    /**
     * Flags confusable letters that sit in query syntax, words mixing Latin with confusable
     * letters, and keywords spelled entirely in lookalikes. Prose in another script inside
     * a string literal is left alone.
     */
    private static Optional<Finding> inspectWords(String text) {
        String code = CypherText.maskLiteralsAndComments(text);
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (!Character.isLetter(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            int start = i;
            boolean latin = false;
            int confusables = 0;
            int confusableAt = -1;
            StringBuilder lookalike = new StringBuilder();
            while (i < text.length() && Character.isLetterOrDigit(text.codePointAt(i))) {
                int letter = text.codePointAt(i);
                Character mapped = CONFUSABLES.get(letter);
                if (mapped != null) {
                    confusables++;
                    if (confusableAt < 0) {
                        confusableAt = letter;
                    }
                    lookalike.append(mapped);
                } else {
                    if (letter < 0x250 && Character.UnicodeScript.of(letter) == Character.UnicodeScript.LATIN) {
                        latin = true;
                    }
                    lookalike.appendCodePoint(letter);
                }
                i += Character.charCount(letter);
            }
            if (confusables == 0) {
                continue;
            }
            boolean inCode = code.charAt(start) != ' ';
            if (latin) {
                return homoglyph(confusableAt, "mixes Latin with lookalike letters in '"
                        + text.substring(start, i) + "'");
            }
            if (inCode) {
                return homoglyph(confusableAt, "appears in query syntax");
            }
            if (SPOOFABLE_WORDS.contains(lookalike.toString().toUpperCase(Locale.ROOT))) {
                return homoglyph(confusableAt, "spells the keyword " + lookalike.toString().toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private static Optional<Finding> inspectNonAscii(String text) {
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (cp > 0x7F && !TYPOGRAPHIC_QUOTES.contains(cp)) {
                return finding(ViolationType.NON_ASCII,
                        "Blocked: non-ASCII character " + codePoint(cp) + " not allowed");
            }
            i += Character.charCount(cp);
        }
        return Optional.empty();
    }

    private static Optional<Finding> inspectEscapes(String text) {
        Matcher matcher = ESCAPE_SEQUENCE.matcher(text);
        if (matcher.find()) {
            return finding(ViolationType.ESCAPE_SEQUENCE,
                    "Blocked: escape sequence " + matcher.group() + " may hide query content");
        }
        return Optional.empty();
    }

    private static boolean isCombiningMark(int cp) {
        return (cp >= 0x0300 && cp <= 0x036F)
                || (cp >= 0x1AB0 && cp <= 0x1AFF)
                || (cp >= 0x1DC0 && cp <= 0x1DFF)
                || (cp >= 0x20D0 && cp <= 0x20FF)
                || (cp >= 0xFE20 && cp <= 0xFE2F);
    }

    private static Optional<Finding> homoglyph(int cp, String reason) {
        return finding(ViolationType.HOMOGLYPH,
                "Blocked: lookalike character " + codePoint(cp) + " " + reason + " (homograph attack)");
    }

    private static Optional<Finding> finding(ViolationType type, String message) {
        return Optional.of(new Finding(type, message));
    }

    private static String codePoint(int cp) {
        return String.format("U+%04X", cp);
    }
}
