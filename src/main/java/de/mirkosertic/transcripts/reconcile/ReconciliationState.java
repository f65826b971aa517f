package de.mirkosertic.transcripts.reconcile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates everything the reporter needs over one batch run.
 * <p>
 * Created empty at batch start and handed to each component explicitly. All updates are
 * append-only and order-insensitive, so parallel workers can each fill their own instance
 * and combine them with {@link #mergeFrom(ReconciliationState)}. Not thread-safe.
 */
public class ReconciliationState {

    private final Set<String> transcriptTrackids = new LinkedHashSet<>();
    private final Set<String> matchedTrackids = new LinkedHashSet<>();
    private final Set<String> databaseGuids = new LinkedHashSet<>();
    private final List<String> failedParses = new ArrayList<>();
    private final Map<String, List<Path>> filesByTrackid = new LinkedHashMap<>();
    private final List<MappingRow> mappingRows = new ArrayList<>();
    private final List<Path> emptyDocuments = new ArrayList<>();
    private final List<Path> unreadableDocuments = new ArrayList<>();
    private final List<Path> writeFailures = new ArrayList<>();
    private final List<String> lowConfidenceFiles = new ArrayList<>();
    private final Map<MatchTier, Integer> matchesByTier = new EnumMap<>(MatchTier.class);
    private int discoveredFiles;

    public void recordDiscovered(final int count) {
        discoveredFiles += count;
    }

    public void recordDatabaseGuids(final Collection<String> guids) {
        databaseGuids.addAll(guids);
    }

    /**
     * Register a successfully extracted, non-empty trackid and the file it came from.
     */
    public void recordTranscriptTrackid(final String trackid, final Path file) {
        if (trackid.isEmpty()) {
            return;
        }
        transcriptTrackids.add(trackid);
        filesByTrackid.computeIfAbsent(trackid, id -> new ArrayList<>()).add(file);
    }

    public void recordMatch(final String trackid, final MatchTier tier) {
        matchedTrackids.add(trackid);
        matchesByTier.merge(tier, 1, Integer::sum);
    }

    public void recordFailedParse(final String filename) {
        failedParses.add(filename);
    }

    public void recordLowConfidence(final String filename) {
        lowConfidenceFiles.add(filename);
    }

    public void recordMapping(final MappingRow row) {
        mappingRows.add(row);
    }

    public void recordEmptyDocument(final Path file) {
        emptyDocuments.add(file);
    }

    /**
     * A document that could not be read or parsed at all, as opposed to one without text.
     */
    public void recordUnreadableDocument(final Path file) {
        unreadableDocuments.add(file);
    }

    public void recordWriteFailure(final Path file) {
        writeFailures.add(file);
    }

    public void mergeFrom(final ReconciliationState other) {
        discoveredFiles += other.discoveredFiles;
        databaseGuids.addAll(other.databaseGuids);
        transcriptTrackids.addAll(other.transcriptTrackids);
        matchedTrackids.addAll(other.matchedTrackids);
        failedParses.addAll(other.failedParses);
        other.filesByTrackid.forEach((trackid, files) ->
                filesByTrackid.computeIfAbsent(trackid, id -> new ArrayList<>()).addAll(files));
        mappingRows.addAll(other.mappingRows);
        emptyDocuments.addAll(other.emptyDocuments);
        unreadableDocuments.addAll(other.unreadableDocuments);
        writeFailures.addAll(other.writeFailures);
        lowConfidenceFiles.addAll(other.lowConfidenceFiles);
        other.matchesByTier.forEach((tier, count) -> matchesByTier.merge(tier, count, Integer::sum));
    }

    public Set<String> transcriptTrackids() {
        return Collections.unmodifiableSet(transcriptTrackids);
    }

    public Set<String> matchedTrackids() {
        return Collections.unmodifiableSet(matchedTrackids);
    }

    public Set<String> databaseGuids() {
        return Collections.unmodifiableSet(databaseGuids);
    }

    public List<String> failedParses() {
        return Collections.unmodifiableList(failedParses);
    }

    public List<Path> filesFor(final String trackid) {
        return filesByTrackid.getOrDefault(trackid, List.of());
    }

    public List<MappingRow> mappingRows() {
        return Collections.unmodifiableList(mappingRows);
    }

    public List<Path> emptyDocuments() {
        return Collections.unmodifiableList(emptyDocuments);
    }

    public List<Path> unreadableDocuments() {
        return Collections.unmodifiableList(unreadableDocuments);
    }

    public List<Path> writeFailures() {
        return Collections.unmodifiableList(writeFailures);
    }

    public List<String> lowConfidenceFiles() {
        return Collections.unmodifiableList(lowConfidenceFiles);
    }

    public Map<MatchTier, Integer> matchesByTier() {
        return Collections.unmodifiableMap(matchesByTier);
    }

    public int discoveredFiles() {
        return discoveredFiles;
    }
}
