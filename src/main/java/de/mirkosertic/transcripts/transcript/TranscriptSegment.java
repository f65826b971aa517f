package de.mirkosertic.transcripts.transcript;

import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * One paragraph of a transcript, in document order.
 */
public record TranscriptSegment(
        /** Offset of the paragraph from the start of the episode, when the document declares one. */
        @Nullable Duration timestamp,
        String text
) {
}
