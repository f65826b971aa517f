package de.mirkosertic.transcripts.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Extracts the trackid from a transcript filename by walking an ordered list of rules.
 * The first rule whose predicate accepts the stem decides the result.
 */
public class TrackidResolver {

    private static final Logger logger = LoggerFactory.getLogger(TrackidResolver.class);

    private static final String NO_RULE = "none";

    private final List<TrackidRule> rules;

    public TrackidResolver(final List<TrackidRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The standard decision list: generator prefix, whole stem, short stem.
     */
    public static TrackidResolver withDefaultRules(final String prefix, final int confidentLength) {
        return new TrackidResolver(List.of(
                TrackidRule.generatorPrefix(prefix),
                TrackidRule.wholeStem(confidentLength),
                TrackidRule.shortStem()));
    }

    /**
     * Pure extraction, no bookkeeping.
     *
     * @param stem filename without its extension
     */
    public TrackidExtractionResult extract(final String stem) {
        for (final TrackidRule rule : rules) {
            if (rule.appliesTo().test(stem)) {
                return rule.extractor().apply(stem);
            }
        }
        return TrackidExtractionResult.failed(NO_RULE);
    }

    /**
     * Extract the trackid of a transcript file and record failures and low-confidence
     * tokens in the batch state.
     */
    public TrackidExtractionResult resolve(final Path file, final ReconciliationState state) {
        final String filename = file.getFileName().toString();
        final TrackidExtractionResult result = extract(stemOf(filename));

        if (!result.succeeded()) {
            logger.warn("Could not extract a trackid from {} (rule {})", filename, result.rule());
            state.recordFailedParse(filename);
        } else if (result.lowConfidence()) {
            logger.debug("Accepting short trackid '{}' from {} with low confidence", result.token(), filename);
            state.recordLowConfidence(filename);
        } else {
            logger.debug("Trackid '{}' from {} via rule {}", result.token(), filename, result.rule());
        }
        return result;
    }

    /**
     * Filename without its last extension. Names whose only dot is the leading one are kept whole.
     */
    public static String stemOf(final String filename) {
        final int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
