package de.mirkosertic.transcripts.transcript;

import de.mirkosertic.transcripts.reconcile.MatchResult;
import de.mirkosertic.transcripts.reconcile.PublishDates;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes transcript segments as UTF-8 text, one paragraph per block.
 */
public class TranscriptWriter {

    static final String HEADER_SEPARATOR = "=".repeat(70);

    private final boolean includeTimestamps;

    public TranscriptWriter(final boolean includeTimestamps) {
        this.includeTimestamps = includeTimestamps;
    }

    /**
     * Paragraphs separated by a blank line, prefixed with {@code [HH:MM:SS]} in timestamp mode.
     * Matched transcripts start with a podcast/episode/date header.
     */
    public String render(final List<TranscriptSegment> segments, final @Nullable MatchResult match) {
        final String body = segments.stream()
                .map(this::renderSegment)
                .collect(Collectors.joining("\n\n"));

        if (match == null) {
            return body;
        }
        return "Podcast: " + match.podcast().title() + "\n"
                + "Episode: " + match.episode().title() + "\n"
                + "Date: " + PublishDates.format(match.episode().publishTime()) + "\n"
                + HEADER_SEPARATOR + "\n\n"
                + body;
    }

    private String renderSegment(final TranscriptSegment segment) {
        if (includeTimestamps) {
            return "[" + TimestampFormatter.format(segment.timestamp()) + "] " + segment.text();
        }
        return segment.text();
    }

    /**
     * Write a new file. Never replaces an existing one.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the target appeared in the meantime
     */
    public void write(final Path target, final List<TranscriptSegment> segments, final @Nullable MatchResult match)
            throws IOException {
        Files.writeString(target, render(segments, match), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }
}
