package com.report.validation.classification;

import com.report.validation.core.model.Node;

/**
 * Strategy that assigns a validation profile to nodes of one type.
 */
@FunctionalInterface
public interface NodeClassifier {

    NodeProfile profile(Node node);
}
