package de.mirkosertic.transcripts.reconcile;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationStateTest {

    @Test
    void shouldIgnoreEmptyTrackids() {
        final ReconciliationState state = new ReconciliationState();

        state.recordTranscriptTrackid("", Path.of("a.ttml"));

        assertThat(state.transcriptTrackids()).isEmpty();
        assertThat(state.filesFor("")).isEmpty();
    }

    @Test
    void shouldRememberEveryFileOfATrackid() {
        final ReconciliationState state = new ReconciliationState();

        state.recordTranscriptTrackid("abc", Path.of("one", "abc.ttml"));
        state.recordTranscriptTrackid("abc", Path.of("two", "abc.ttml"));

        assertThat(state.transcriptTrackids()).containsExactly("abc");
        assertThat(state.filesFor("abc")).containsExactly(Path.of("one", "abc.ttml"), Path.of("two", "abc.ttml"));
    }

    @Test
    void shouldCountMatchesPerTier() {
        final ReconciliationState state = new ReconciliationState();

        state.recordMatch("a", MatchTier.EXACT);
        state.recordMatch("b", MatchTier.EXACT);
        state.recordMatch("c", MatchTier.RECENCY);

        assertThat(state.matchedTrackids()).containsExactly("a", "b", "c");
        assertThat(state.matchesByTier()).containsEntry(MatchTier.EXACT, 2).containsEntry(MatchTier.RECENCY, 1);
    }

    @Test
    void shouldMergeWorkerStates() {
        // Given
        final ReconciliationState first = new ReconciliationState();
        first.recordDiscovered(2);
        first.recordDatabaseGuids(List.of("g1", "g2"));
        first.recordTranscriptTrackid("t1", Path.of("t1.ttml"));
        first.recordMatch("t1", MatchTier.EXACT);
        first.recordFailedParse("transcript_.ttml");

        final ReconciliationState second = new ReconciliationState();
        second.recordDiscovered(3);
        second.recordDatabaseGuids(List.of("g2", "g3"));
        second.recordTranscriptTrackid("t1", Path.of("copy", "t1.ttml"));
        second.recordTranscriptTrackid("t2", Path.of("t2.ttml"));
        second.recordMatch("t2", MatchTier.EXACT);
        second.recordEmptyDocument(Path.of("empty.ttml"));
        second.recordUnreadableDocument(Path.of("broken.ttml"));

        // When
        final ReconciliationState merged = new ReconciliationState();
        merged.mergeFrom(first);
        merged.mergeFrom(second);

        // Then
        assertThat(merged.discoveredFiles()).isEqualTo(5);
        assertThat(merged.databaseGuids()).containsExactly("g1", "g2", "g3");
        assertThat(merged.transcriptTrackids()).containsExactly("t1", "t2");
        assertThat(merged.filesFor("t1")).hasSize(2);
        assertThat(merged.matchedTrackids()).containsExactly("t1", "t2");
        assertThat(merged.matchesByTier()).containsEntry(MatchTier.EXACT, 2);
        assertThat(merged.failedParses()).containsExactly("transcript_.ttml");
        assertThat(merged.emptyDocuments()).containsExactly(Path.of("empty.ttml"));
        assertThat(merged.unreadableDocuments()).containsExactly(Path.of("broken.ttml"));
    }
}
