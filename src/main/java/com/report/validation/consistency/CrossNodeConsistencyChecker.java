package com.report.validation.consistency;

import com.fasterxml.jackson.databind.JsonNode;
import com.report.validation.core.model.Node;
import com.report.validation.core.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic cross-node checks: terminology agreement, quoted score values
 * against their scoring nodes, and narrative voice.
 *
 * <p>A check over changed nodes covers, at {@link ConsistencyDepth#SHALLOW}, the changed
 * nodes with their direct dependencies and dependents, and at {@link ConsistencyDepth#DEEP}
 * every node. In-scope nodes are compared against every node of the report and each finding
 * that involves an in-scope node is kept. Inconsistencies of the previous report that lie
 * entirely outside the checked scope are carried forward, so the score always describes the
 * whole report.</p>
 */
public class CrossNodeConsistencyChecker {
    private static final Logger log = LoggerFactory.getLogger(CrossNodeConsistencyChecker.class);

    static final int PENALTY_PER_INCONSISTENCY = 10;
    private static final double VALUE_TOLERANCE = 0.5;
    private static final Set<NodeType> NARRATIVE_TYPES =
            EnumSet.of(NodeType.INSIGHT, NodeType.RECOMMENDATION, NodeType.SUMMARY);
    private static final List<String> SCORED_NAME_FIELDS = List.of("trait", "pillar", "competency", "dimension");

    private static final Pattern SECOND_PERSON = Pattern.compile("\\b(you|your|yours|yourself)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern THIRD_PERSON = Pattern.compile(
            "\\b(the (candidate|individual|employee|participant|leader)|he|she|his|her)\\b",
            Pattern.CASE_INSENSITIVE);

    private final Map<String, List<Pattern>> terminology;

    public CrossNodeConsistencyChecker() {
        this(defaultTerminology());
    }

    /**
     * @param terminology canonical concept name to the patterns of its accepted variants
     */
    public CrossNodeConsistencyChecker(Map<String, List<Pattern>> terminology) {
        this.terminology = new LinkedHashMap<>(Objects.requireNonNull(terminology, "terminology is required"));
    }

    public static Map<String, List<Pattern>> defaultTerminology() {
        Map<String, List<Pattern>> groups = new LinkedHashMap<>();
        groups.put("extraversion", List.of(word("extraversion"), word("extroversion")));
        groups.put("neuroticism", List.of(word("neuroticism"), word("emotional instability")));
        groups.put("development area", List.of(word("development areas?"), word("growth areas?"),
                word("improvement areas?")));
        return groups;
    }

    /**
     * Checks every node of the report.
     */
    public ConsistencyReport checkAll(List<Node> nodes) {
        Set<String> all = nodes.stream().map(Node::id).collect(Collectors.toCollection(LinkedHashSet::new));
        return evaluate(nodes, all, List.of(), Set.of());
    }

    /**
     * Re-checks the part of the report affected by {@code changedNodeIds}.
     *
     * @param nodes          current nodes of the report
     * @param previous       report of the previous iteration, or null
     * @param changedNodeIds ids of new or modified nodes
     * @param depth          scope of the re-check
     */
    public ConsistencyReport recheck(List<Node> nodes, ConsistencyReport previous,
                                     Set<String> changedNodeIds, ConsistencyDepth depth) {
        if (previous == null || depth == ConsistencyDepth.DEEP) {
            return checkAll(nodes);
        }
        Set<String> scope = scope(nodes, changedNodeIds);
        Set<String> present = nodes.stream().map(Node::id).collect(Collectors.toSet());
        List<Inconsistency> carried = previous.inconsistencies().stream()
                .filter(i -> present.containsAll(i.nodeIds()))
                .filter(i -> i.nodeIds().stream().noneMatch(scope::contains))
                .toList();
        Set<String> rechecked = previous.inconsistencies().stream()
                .filter(i -> i.nodeIds().stream().anyMatch(scope::contains))
                .map(Inconsistency::key)
                .collect(Collectors.toSet());
        return evaluate(nodes, scope, carried, rechecked);
    }

    /**
     * Changed nodes plus the nodes they depend on and the nodes that depend on them.
     */
    public static Set<String> scope(Collection<Node> nodes, Set<String> changedNodeIds) {
        Set<String> scope = new TreeSet<>();
        for (Node node : nodes) {
            if (changedNodeIds.contains(node.id())) {
                scope.add(node.id());
                scope.addAll(node.metadata().dependencies());
            } else if (node.metadata().dependencies().stream().anyMatch(changedNodeIds::contains)) {
                scope.add(node.id());
            }
        }
        Set<String> present = nodes.stream().map(Node::id).collect(Collectors.toSet());
        scope.retainAll(present);
        return scope;
    }

    private ConsistencyReport evaluate(List<Node> nodes, Set<String> scope, List<Inconsistency> carried,
                                       Set<String> recheckedKeys) {
        Map<String, Inconsistency> found = new LinkedHashMap<>();
        carried.forEach(i -> found.put(i.key(), i));
        // in-scope nodes are compared against the whole report
        List<Inconsistency> detected = new ArrayList<>(checkTerminology(nodes));
        detected.addAll(checkDataValues(nodes));
        detected.addAll(checkVoice(nodes));
        detected.stream()
                .filter(i -> i.nodeIds().stream().anyMatch(scope::contains) || recheckedKeys.contains(i.key()))
                .forEach(i -> found.put(i.key(), i));

        int score = Math.max(0, 100 - PENALTY_PER_INCONSISTENCY * found.size());
        if (!found.isEmpty()) {
            log.debug("Consistency check over {} node(s): {} inconsistencies ({} carried), score={}",
                    scope.size(), found.size(), carried.size(), score);
        }
        return new ConsistencyReport(score, new ArrayList<>(found.values()), scope);
    }

    List<Inconsistency> checkTerminology(List<Node> nodes) {
        List<Inconsistency> result = new ArrayList<>();
        for (Map.Entry<String, List<Pattern>> group : terminology.entrySet()) {
            Map<String, Set<String>> nodesByVariant = new LinkedHashMap<>();
            for (Node node : nodes) {
                String text = node.text();
                for (Pattern variant : group.getValue()) {
                    Matcher matcher = variant.matcher(text);
                    if (matcher.find()) {
                        nodesByVariant.computeIfAbsent(matcher.group().toLowerCase(Locale.ROOT).replaceAll("s$", ""),
                                k -> new TreeSet<>()).add(node.id());
                    }
                }
            }
            if (nodesByVariant.size() > 1) {
                Set<String> involved = nodesByVariant.values().stream()
                        .flatMap(Set::stream)
                        .collect(Collectors.toCollection(TreeSet::new));
                result.add(new Inconsistency(InconsistencyKind.TERMINOLOGY, involved,
                        "'" + group.getKey() + "' is referred to as " + String.join(", ", new TreeSet<>(nodesByVariant.keySet())),
                        "terminology:" + group.getKey()));
            }
        }
        return result;
    }

    List<Inconsistency> checkDataValues(List<Node> nodes) {
        List<Inconsistency> result = new ArrayList<>();
        for (Node scoring : nodes) {
            if (scoring.type() != NodeType.SCORING || !scoring.content().path("score").isNumber()) {
                continue;
            }
            String name = scoredName(scoring);
            double score = scoring.content().path("score").asDouble();
            JsonNode percentile = scoring.content().path("percentile");
            Pattern quoted = Pattern.compile("\\b" + Pattern.quote(name)
                    + "\\b(?:\\s+(?:score|scored|level|rating))?\\s*(?:of|:|=|at|is|was)?\\s*"
                    + "(\\d{1,3}(?:\\.\\d+)?)(?!\\d|\\s*%|\\s*(?:st|nd|rd|th)\\b)", Pattern.CASE_INSENSITIVE);
            for (Node other : nodes) {
                if (other == scoring || other.type() == NodeType.SCORING) {
                    continue;
                }
                Matcher matcher = quoted.matcher(other.text());
                while (matcher.find()) {
                    double value = Double.parseDouble(matcher.group(1));
                    boolean matchesScore = Math.abs(value - score) <= VALUE_TOLERANCE;
                    boolean matchesPercentile = percentile.isNumber()
                            && Math.abs(value - percentile.asDouble()) <= VALUE_TOLERANCE;
                    if (!matchesScore && !matchesPercentile) {
                        result.add(new Inconsistency(InconsistencyKind.DATA_VALUE, Set.of(scoring.id(), other.id()),
                                other.id() + " states " + name + " as " + matcher.group(1)
                                        + " but " + scoring.id() + " reports " + formatNumber(score),
                                "data_value:" + scoring.id() + ":" + other.id()));
                        break;
                    }
                }
            }
        }
        return result;
    }

    List<Inconsistency> checkVoice(List<Node> nodes) {
        Set<String> secondPerson = new TreeSet<>();
        Set<String> thirdPerson = new TreeSet<>();
        for (Node node : nodes) {
            if (!NARRATIVE_TYPES.contains(node.type())) {
                continue;
            }
            String text = node.text();
            if (SECOND_PERSON.matcher(text).find()) {
                secondPerson.add(node.id());
            } else if (THIRD_PERSON.matcher(text).find()) {
                thirdPerson.add(node.id());
            }
        }
        if (secondPerson.isEmpty() || thirdPerson.isEmpty()) {
            return List.of();
        }
        Set<String> minority = secondPerson.size() <= thirdPerson.size() ? secondPerson : thirdPerson;
        String minorityVoice = minority == secondPerson ? "second person" : "third person";
        return List.of(new Inconsistency(InconsistencyKind.STYLE, minority,
                minority.size() + " narrative node(s) use the " + minorityVoice + " unlike the rest of the report",
                "style:voice"));
    }

    static String scoredName(Node scoring) {
        for (String field : SCORED_NAME_FIELDS) {
            JsonNode value = scoring.content().path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText().replace('_', ' ');
            }
        }
        String id = scoring.id();
        int separator = id.indexOf('_');
        return (separator >= 0 ? id.substring(separator + 1) : id).replace('_', ' ');
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    private static Pattern word(String regex) {
        return Pattern.compile("\\b" + regex + "\\b", Pattern.CASE_INSENSITIVE);
    }
}
