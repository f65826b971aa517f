package de.mirkosertic.transcripts.search;

import java.nio.file.Path;
import java.util.List;

/**
 * A single matching line together with its surrounding lines.
 */
public record SearchMatch(
        Path file,
        /** 1-based line number of the matching line. */
        int lineNumber,
        /** Lines around the match, in file order, clamped to the file bounds. */
        List<String> context
) {
}
