package de.mirkosertic.transcripts.metadata;

/**
 * A show from the podcast library. Absent authors are stored as an empty string.
 */
public record PodcastRecord(String title, String author) {
}
