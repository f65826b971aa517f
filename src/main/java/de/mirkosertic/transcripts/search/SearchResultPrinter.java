package de.mirkosertic.transcripts.search;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders search results for the console.
 */
public class SearchResultPrinter {

    static final String SEPARATOR = "-".repeat(80);
    private static final String INDENT = "    ";

    private final PrintStream out;

    public SearchResultPrinter(final PrintStream out) {
        this.out = out;
    }

    public void print(final List<SearchMatch> matches, final String query, final int contextLines) {
        if (matches.isEmpty()) {
            out.println("No matches found for: \"" + query + "\"");
            return;
        }

        out.println("Found " + matches.size() + " match(es) for: \"" + query + "\"");
        out.println();

        int index = 1;
        for (final SearchMatch match : matches) {
            out.println(SEPARATOR);
            out.println("[" + index++ + "] File: " + displayPath(match.file()));
            out.println(INDENT + "Line: " + match.lineNumber());
            out.println(INDENT + "Context (±" + contextLines + " lines):");
            out.println();
            for (final String line : match.context()) {
                out.println(INDENT + line);
            }
            out.println();
        }
        out.println(SEPARATOR);
    }

    /**
     * Path relative to the working directory where possible.
     */
    static String displayPath(final Path file) {
        final Path absolute = file.toAbsolutePath().normalize();
        final Path workingDirectory = Path.of("").toAbsolutePath();
        try {
            return workingDirectory.relativize(absolute).toString();
        } catch (final IllegalArgumentException e) {
            return absolute.toString();
        }
    }
}
