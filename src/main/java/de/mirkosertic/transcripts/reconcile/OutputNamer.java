package de.mirkosertic.transcripts.reconcile;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds descriptive output filenames and keeps them from overwriting existing files.
 */
public class OutputNamer {

    private static final Logger logger = LoggerFactory.getLogger(OutputNamer.class);

    static final String EXTENSION = ".txt";

    private final int maxTitleLength;

    public OutputNamer(final int maxTitleLength) {
        if (maxTitleLength < 1) {
            throw new IllegalArgumentException("Title length must be positive: " + maxTitleLength);
        }
        this.maxTitleLength = maxTitleLength;
    }

    /**
     * Candidate filename before collision handling.
     * <ul>
     *   <li>matched: {@code <podcast>_<date>_<episode>.txt}</li>
     *   <li>unmatched inside a podcast folder: {@code Podcast_<id>_<stem>.txt}</li>
     *   <li>otherwise: {@code <stem>.txt}</li>
     * </ul>
     */
    public String candidateName(final @Nullable MatchResult match,
                                final @Nullable Long podcastId,
                                final String fallbackStem) {
        if (match != null) {
            return FilenameSanitizer.sanitize(match.podcast().title(), maxTitleLength)
                    + "_" + PublishDates.format(match.episode().publishTime())
                    + "_" + FilenameSanitizer.sanitize(match.episode().title(), maxTitleLength)
                    + EXTENSION;
        }
        if (podcastId != null) {
            return "Podcast_" + podcastId + "_" + fallbackStem + EXTENSION;
        }
        return fallbackStem + EXTENSION;
    }

    /**
     * First free path for the candidate: the candidate itself, then {@code name_1.txt},
     * {@code name_2.txt}, ... Assumes a single writer owns the directory.
     */
    public Path resolveFreePath(final Path directory, final String candidate) {
        final Path path = directory.resolve(candidate);
        if (!Files.exists(path)) {
            return path;
        }

        final int dot = candidate.lastIndexOf('.');
        final String base = dot > 0 ? candidate.substring(0, dot) : candidate;
        final String extension = dot > 0 ? candidate.substring(dot) : "";

        for (int counter = 1; ; counter++) {
            final Path next = directory.resolve(base + "_" + counter + extension);
            if (!Files.exists(next)) {
                logger.debug("{} already exists, using {}", candidate, next.getFileName());
                return next;
            }
        }
    }

    public Path name(final Path directory,
                     final @Nullable MatchResult match,
                     final @Nullable Long podcastId,
                     final String fallbackStem) {
        return resolveFreePath(directory, candidateName(match, podcastId, fallbackStem));
    }
}
