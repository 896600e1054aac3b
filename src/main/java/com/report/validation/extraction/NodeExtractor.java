package com.report.validation.extraction;

import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import com.report.validation.core.model.Report;
import com.report.validation.core.model.ReportKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decomposes a report into typed, addressable nodes.
 *
 * <p>Extraction never fails: unknown or malformed regions are skipped and recorded as
 * {@link ExtractionWarning}s.</p>
 */
public class NodeExtractor {
    private static final Logger log = LoggerFactory.getLogger(NodeExtractor.class);

    private static final Set<String> IGNORED_FIELDS = Set.of("metadata", "reportId", "assessmentType", "generatedAt");

    private final ExtractorRegistry registry;
    private final NodeMetadataAnnotator annotator;

    public NodeExtractor() {
        this(ExtractorRegistry.defaults());
    }

    public NodeExtractor(ExtractorRegistry registry) {
        this.registry = registry;
        this.annotator = new NodeMetadataAnnotator();
    }

    public ExtractionResult extract(Report report) {
        return extract(report.getContent(), report.getKind());
    }

    public ExtractionResult extract(JsonNode content, ReportKind kind) {
        List<ExtractionWarning> warnings = new ArrayList<>();
        if (content == null || !content.isObject()) {
            warnings.add(ExtractionWarning.malformedRegion("$", "Report content must be a JSON object"));
            log.warn("Report content is not an object, no nodes extracted");
            return new ExtractionResult(List.of(), warnings, new ExtractionMetadata(kind, List.of(), Map.of()));
        }

        List<RegionExtractor> extractors = registry.extractorsFor(kind);
        Map<String, RegionExtractor> byRegion = new HashMap<>();
        extractors.forEach(e -> byRegion.put(e.region(), e));

        List<NodeDraft> drafts = new ArrayList<>();
        List<String> regionsVisited = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        Iterator<String> fieldNames = content.fieldNames();
        while (fieldNames.hasNext()) {
            String field = fieldNames.next();
            RegionExtractor extractor = byRegion.get(field);
            if (extractor == null) {
                if (!IGNORED_FIELDS.contains(field)) {
                    warnings.add(ExtractionWarning.unknownRegion(field));
                }
                continue;
            }
            JsonNode regionContent = content.get(field);
            if (regionContent == null || regionContent.isNull()) {
                warnings.add(ExtractionWarning.malformedRegion(field, "Region is null"));
                continue;
            }
            regionsVisited.add(field);
            for (NodeDraft draft : extractor.extract(regionContent, warnings)) {
                if (seenIds.add(draft.id())) {
                    drafts.add(draft);
                } else {
                    warnings.add(ExtractionWarning.malformedNode(field, "Duplicate node id '" + draft.id() + "'"));
                }
            }
        }

        List<Node> nodes = annotator.annotate(drafts);
        Map<NodeType, Integer> nodesByType = new EnumMap<>(NodeType.class);
        nodes.forEach(n -> nodesByType.merge(n.type(), 1, Integer::sum));

        if (!warnings.isEmpty()) {
            log.warn("Extraction produced {} warning(s) for kind={}: {}", warnings.size(), kind, warnings);
        }
        log.debug("Extracted {} nodes from regions {} (kind={})", nodes.size(), regionsVisited, kind);
        return new ExtractionResult(nodes, warnings, new ExtractionMetadata(kind, regionsVisited, nodesByType));
    }
}
