package io.graphlite.core.diff;

/**
 * Knobs that bound the size of stored change summaries.
 *
 * @param stringTruncateThreshold strings longer than this (chars) are stored as a hash stub
 * @param objectTruncateThreshold containers whose serialized size exceeds this (bytes) are
 *                                compared as a single leaf and stored as a hash stub
 * @param maxChangeSummaryBytes   when the serialized details exceed this, only paths are kept
 * @param floatTolerance          numeric values closer than this compare equal (0 = exact)
 */
public record DiffOptions(
        int stringTruncateThreshold,
        int objectTruncateThreshold,
        int maxChangeSummaryBytes,
        double floatTolerance
) {
    public DiffOptions {
        if (stringTruncateThreshold <= 0) throw new IllegalArgumentException("stringTruncateThreshold must be > 0");
        if (objectTruncateThreshold <= 0) throw new IllegalArgumentException("objectTruncateThreshold must be > 0");
        if (maxChangeSummaryBytes <= 0) throw new IllegalArgumentException("maxChangeSummaryBytes must be > 0");
        if (floatTolerance < 0) throw new IllegalArgumentException("floatTolerance must be >= 0");
    }

    public static DiffOptions defaults() {
        return new DiffOptions(256, 2048, 16 * 1024, 0.0);
    }

    public DiffOptions withStringTruncateThreshold(int v) {
        return new DiffOptions(v, objectTruncateThreshold, maxChangeSummaryBytes, floatTolerance);
    }

    public DiffOptions withObjectTruncateThreshold(int v) {
        return new DiffOptions(stringTruncateThreshold, v, maxChangeSummaryBytes, floatTolerance);
    }

    public DiffOptions withMaxChangeSummaryBytes(int v) {
        return new DiffOptions(stringTruncateThreshold, objectTruncateThreshold, v, floatTolerance);
    }

    public DiffOptions withFloatTolerance(double v) {
        return new DiffOptions(stringTruncateThreshold, objectTruncateThreshold, maxChangeSummaryBytes, v);
    }
}
