package de.mirkosertic.transcripts.reconcile;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * One line of the mapping table: what became of a single transcript file.
 */
public record MappingRow(
        String transcriptFile,
        /** Extracted trackid, or the filename stem when extraction produced no token. */
        String trackid,
        /** Name of the written output file, empty if writing failed. */
        String outputFile,
        boolean matched,
        String podcastTitle,
        String episodeTitle,
        String pubDate,
        String author
) {

    public static MappingRow of(final Path transcript,
                                final String trackid,
                                final @Nullable Path output,
                                final @Nullable MatchResult match) {
        final String outputName = output == null ? "" : output.getFileName().toString();
        if (match == null) {
            return new MappingRow(transcript.getFileName().toString(), trackid,
                    outputName, false, "", "", "", "");
        }
        return new MappingRow(transcript.getFileName().toString(), trackid,
                outputName, true,
                match.podcast().title(),
                match.episode().title(),
                PublishDates.format(match.episode().publishTime()),
                match.podcast().author());
    }
}
