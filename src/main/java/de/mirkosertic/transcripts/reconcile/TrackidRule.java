package de.mirkosertic.transcripts.reconcile;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the trackid decision list: if {@code appliesTo} accepts the filename stem,
 * {@code extractor} decides the result and no later rule is consulted.
 */
public record TrackidRule(
        String name,
        Predicate<String> appliesTo,
        Function<String, TrackidExtractionResult> extractor
) {

    /**
     * Stems starting with a generator prefix carry the trackid after the prefix.
     * An empty remainder is a failed extraction.
     */
    public static TrackidRule generatorPrefix(final String prefix) {
        final String name = "prefix:" + prefix;
        return new TrackidRule(
                name,
                stem -> stem.startsWith(prefix),
                stem -> {
                    final String remainder = stem.substring(prefix.length());
                    return remainder.isEmpty()
                            ? TrackidExtractionResult.failed(name)
                            : TrackidExtractionResult.success(remainder, name);
                });
    }

    /**
     * Long enough stems are taken as the trackid verbatim.
     */
    public static TrackidRule wholeStem(final int minLength) {
        final String name = "stem";
        return new TrackidRule(
                name,
                stem -> stem.length() >= minLength,
                stem -> TrackidExtractionResult.success(stem, name));
    }

    /**
     * Short stems are still accepted, since the filename is often the only signal, but flagged.
     */
    public static TrackidRule shortStem() {
        final String name = "short-stem";
        return new TrackidRule(
                name,
                stem -> !stem.isEmpty(),
                stem -> TrackidExtractionResult.lowConfidence(stem, name));
    }
}
