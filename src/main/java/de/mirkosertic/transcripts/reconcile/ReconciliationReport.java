package de.mirkosertic.transcripts.reconcile;

import java.util.SortedSet;

/**
 * Result of comparing the transcripts on disk with the library after a batch.
 */
public record ReconciliationReport(
        /** Trackids found on disk that never matched an episode. */
        SortedSet<String> unmatchedTranscripts,
        /** Library guids that no matched trackid equals. */
        SortedSet<String> unmatchedDatabaseEntries,
        ReconciliationSummary summary
) {
}
