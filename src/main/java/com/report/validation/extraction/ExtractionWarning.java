package com.report.validation.extraction;

import java.util.Objects;

/**
 * Non-fatal extraction problem. Reduces coverage and is reported on the final result.
 */
public record ExtractionWarning(Kind kind, String region, String message) {

    public enum Kind {
        UNKNOWN_REGION,
        MALFORMED_REGION,
        MALFORMED_NODE
    }

    public ExtractionWarning {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static ExtractionWarning unknownRegion(String region) {
        return new ExtractionWarning(Kind.UNKNOWN_REGION, region, "Region is not known for this report kind");
    }

    public static ExtractionWarning malformedRegion(String region, String message) {
        return new ExtractionWarning(Kind.MALFORMED_REGION, region, message);
    }

    public static ExtractionWarning malformedNode(String region, String message) {
        return new ExtractionWarning(Kind.MALFORMED_NODE, region, message);
    }
}
