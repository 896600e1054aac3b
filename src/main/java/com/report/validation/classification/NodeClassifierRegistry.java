package com.report.validation.classification;

import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import static com.report.validation.classification.ValidationCheck.*;

/**
 * Type-to-profile registry. Classification is a pure lookup; adding a node type means
 * registering one classifier, existing profiles stay untouched.
 */
public class NodeClassifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(NodeClassifierRegistry.class);

    private final Map<NodeType, NodeClassifier> classifiers = new EnumMap<>(NodeType.class);

    /**
     * Registry with the built-in profiles. Scoring nodes are critical, insights and
     * recommendations high, summaries and context medium.
     */
    public static NodeClassifierRegistry defaults() {
        NodeClassifierRegistry registry = new NodeClassifierRegistry();
        registry.register(NodeType.SCORING, node -> NodeProfile.of(NodeType.SCORING, Criticality.CRITICAL,
                DATA_ACCURACY, STATISTICAL_VALIDITY, SCORE_INTERPRETATION, BIAS_DETECTION, READABILITY,
                CROSS_REFERENCE_ALIGNMENT, PROFESSIONAL_TONE));
        registry.register(NodeType.INSIGHT, node -> NodeProfile.of(NodeType.INSIGHT, Criticality.HIGH,
                EVIDENCE_SUPPORT, SCORE_INTERPRETATION, BIAS_DETECTION, BALANCED_PERSPECTIVE, LOGICAL_COHERENCE,
                TERMINOLOGY_CONSISTENCY, CROSS_REFERENCE_ALIGNMENT, PROFESSIONAL_TONE));
        registry.register(NodeType.RECOMMENDATION, node -> NodeProfile.of(NodeType.RECOMMENDATION, Criticality.HIGH,
                EVIDENCE_SUPPORT, BIAS_DETECTION, ACTIONABILITY, FEASIBILITY, LOGICAL_COHERENCE,
                CROSS_REFERENCE_ALIGNMENT, RELEVANCE, PROFESSIONAL_TONE));
        registry.register(NodeType.SUMMARY, node -> NodeProfile.of(NodeType.SUMMARY, Criticality.MEDIUM,
                EVIDENCE_SUPPORT, BALANCED_PERSPECTIVE, COMPLETENESS, READABILITY,
                TERMINOLOGY_CONSISTENCY, CROSS_REFERENCE_ALIGNMENT, PROFESSIONAL_TONE));
        registry.register(NodeType.CONTEXT, node -> NodeProfile.of(NodeType.CONTEXT, Criticality.MEDIUM,
                DATA_ACCURACY, BIAS_DETECTION, READABILITY, RELEVANCE, PROFESSIONAL_TONE));
        return registry;
    }

    public NodeClassifierRegistry register(NodeType type, NodeClassifier classifier) {
        classifiers.put(Objects.requireNonNull(type), Objects.requireNonNull(classifier));
        return this;
    }

    /**
     * Returns the node's profile. Types without a registered classifier get a
     * low-criticality profile with the baseline checks.
     */
    public NodeProfile classify(Node node) {
        NodeClassifier classifier = classifiers.get(node.type());
        if (classifier == null) {
            log.debug("No classifier registered for type {}, using baseline profile", node.type());
            return NodeProfile.of(node.type(), Criticality.LOW,
                    DATA_ACCURACY, BIAS_DETECTION, READABILITY, PROFESSIONAL_TONE);
        }
        return classifier.profile(node);
    }
}
