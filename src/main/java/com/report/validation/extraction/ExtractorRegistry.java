package com.report.validation.extraction;

import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.ReportKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a report kind to the region extractors applied to it.
 * Kinds without their own registration use the {@link ReportKind#DEFAULT} set.
 */
public class ExtractorRegistry {

    private final Map<ReportKind, List<RegionExtractor>> extractors = new EnumMap<>(ReportKind.class);

    /**
     * Registry with the built-in regions: scores, insights, recommendations,
     * executive summary and contextual factors for every kind, plus leadership
     * competencies for executive reports and team dynamics for organizational ones.
     */
    public static ExtractorRegistry defaults() {
        ExtractorRegistry registry = new ExtractorRegistry();
        for (ReportKind kind : ReportKind.values()) {
            registry.register(kind, new ScoresRegionExtractor());
            registry.register(kind, new ArrayRegionExtractor("insights", "insight_", NodeType.INSIGHT));
            registry.register(kind, new ArrayRegionExtractor("recommendations", "recommendation_", NodeType.RECOMMENDATION));
            registry.register(kind, new SingleNodeRegionExtractor("executiveSummary", "executive_summary", NodeType.SUMMARY));
            registry.register(kind, new SingleNodeRegionExtractor("contextualFactors", "context_factors", NodeType.CONTEXT));
        }
        registry.register(ReportKind.EXECUTIVE,
                new ScoredMapRegionExtractor("leadershipCompetencies", "executive_", "competency"));
        registry.register(ReportKind.ORGANIZATIONAL,
                new ArrayRegionExtractor("teamDynamics", "team_dynamics_", NodeType.INSIGHT));
        return registry;
    }

    /**
     * Adds an extractor for a kind. A later registration for the same region replaces the earlier one.
     */
    public ExtractorRegistry register(ReportKind kind, RegionExtractor extractor) {
        List<RegionExtractor> list = extractors.computeIfAbsent(kind, k -> new ArrayList<>());
        list.removeIf(existing -> existing.region().equals(extractor.region()));
        list.add(extractor);
        return this;
    }

    public List<RegionExtractor> extractorsFor(ReportKind kind) {
        List<RegionExtractor> list = extractors.get(kind);
        if (list == null || list.isEmpty()) {
            list = extractors.getOrDefault(ReportKind.DEFAULT, List.of());
        }
        return List.copyOf(list);
    }
}
