package com.report.validation.extraction;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Strategy that turns one top-level region of a report into node drafts.
 * Implementations never throw on bad input; they skip the offending part and add a warning.
 */
public interface RegionExtractor {

    /**
     * The top-level field this extractor handles.
     */
    String region();

    /**
     * Extracts node drafts from the region's content.
     *
     * @param regionContent the value of the region field, never null
     * @param warnings      sink for non-fatal problems
     */
    List<NodeDraft> extract(JsonNode regionContent, List<ExtractionWarning> warnings);
}
