package de.mirkosertic.transcripts.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Totals of one batch run.
 */
public record ReconciliationSummary(
        int discoveredFiles,
        /** Files that produced a mapping row. */
        int processedFiles,
        int matched,
        int unmatched,
        int failedParses,
        int unmatchedTranscripts,
        int unmatchedDatabaseEntries,
        /** Documents without any text, skipped before naming. */
        int emptyDocuments,
        /** Documents that could not be read or parsed. */
        int unreadableDocuments,
        int writeFailures,
        int lowConfidenceTrackids,
        Map<MatchTier, Integer> matchesByTier
) {

    public int matchesFor(final MatchTier tier) {
        return matchesByTier.getOrDefault(tier, 0);
    }

    public List<String> toLines() {
        final List<String> lines = new ArrayList<>();
        lines.add("Transcript files discovered: " + discoveredFiles);
        lines.add("Transcripts written:         " + (processedFiles - writeFailures));
        lines.add("Matched:                     " + matched);
        lines.add("  exact guid:                " + matchesFor(MatchTier.EXACT));
        lines.add("  guid substring:            " + matchesFor(MatchTier.SUBSTRING));
        lines.add("  most recent episode:       " + matchesFor(MatchTier.RECENCY));
        lines.add("  podcast without episodes:  " + matchesFor(MatchTier.PLACEHOLDER));
        lines.add("Unmatched:                   " + unmatched);
        lines.add("Failed trackid parses:       " + failedParses);
        lines.add("Low-confidence trackids:     " + lowConfidenceTrackids);
        lines.add("Empty documents:             " + emptyDocuments);
        lines.add("Unreadable documents:        " + unreadableDocuments);
        lines.add("Write failures:              " + writeFailures);
        lines.add("Unmatched transcript ids:    " + unmatchedTranscripts);
        lines.add("Unmatched database entries:  " + unmatchedDatabaseEntries);
        return lines;
    }
}
