package de.mirkosertic.transcripts.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans transcript text pulled out of markup documents.
 *
 * <p>Transcript paragraphs arrive as many small text fragments (one per word or sentence span).
 * They are stripped, joined with single spaces and freed from characters that never render:</p>
 * <ul>
 *   <li>Unicode replacement characters from failed decoding</li>
 *   <li>Control characters that aren't whitespace</li>
 *   <li>Zero-width characters and byte order marks</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +             // NULL and control chars before TAB
        "\u000B-\u000C" +             // Control chars between TAB and CR (excluding LF)
        "\u000E-\u001F" +             // Control chars after CR
        "\u200B-\u200D" +             // Zero-width space, non-joiner, joiner
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Join text fragments into one line of paragraph text.
     * Blank fragments are dropped, every other fragment is stripped and separated by a single space.
     *
     * @param fragments raw text nodes in document order
     * @return cleaned paragraph text, empty if nothing visible remains
     */
    public static String joinFragments(final List<String> fragments) {
        final StringBuilder result = new StringBuilder();
        for (final String fragment : fragments) {
            final String cleaned = clean(fragment);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(cleaned);
        }
        return result.toString();
    }

    /**
     * Remove invisible characters, collapse whitespace runs to one space and trim.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, empty string for null input
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        final String visible = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(visible).replaceAll(" ").strip();
    }
}
