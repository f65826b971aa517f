package de.mirkosertic.transcripts.reconcile;

import java.util.regex.Pattern;

/**
 * Turns podcast and episode titles into filename components.
 */
public final class FilenameSanitizer {

    static final String EMPTY_REPLACEMENT = "Untitled";

    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x08\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[_.]+|[_.]+$");

    private FilenameSanitizer() {
    }

    /**
     * Remove characters illegal in filenames, replace whitespace runs with one underscore,
     * strip leading and trailing underscores and dots, and cut to {@code maxLength}.
     *
     * @return the sanitized text, {@code Untitled} if nothing is left
     */
    public static String sanitize(final String text, final int maxLength) {
        String result = ILLEGAL_CHARS.matcher(text).replaceAll("");
        result = WHITESPACE_RUN.matcher(result).replaceAll("_");
        result = EDGE_SEPARATORS.matcher(result).replaceAll("");

        if (result.length() > maxLength) {
            int end = maxLength;
            if (Character.isHighSurrogate(result.charAt(end - 1))) {
                end--;
            }
            result = EDGE_SEPARATORS.matcher(result.substring(0, end)).replaceAll("");
        }

        return result.isEmpty() ? EMPTY_REPLACEMENT : result;
    }
}
