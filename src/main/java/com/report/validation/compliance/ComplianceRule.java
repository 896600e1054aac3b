package com.report.validation.compliance;

import com.report.validation.core.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A forbidden-content rule: a case-insensitive pattern that must not match a node's text.
 * Rules can be scoped to specific node types.
 */
public class ComplianceRule {
    private final String name;
    private final ComplianceGroup group;
    private final Pattern pattern;
    private final String description;
    private final String remediation;
    private final Set<NodeType> applicableTypes;
    private final int priority;

    private ComplianceRule(Builder builder) {
        this.name = builder.name;
        this.group = builder.group;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.description = builder.description;
        this.remediation = builder.remediation;
        this.applicableTypes = builder.applicableTypes != null ? Set.copyOf(builder.applicableTypes) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public ComplianceGroup getGroup() {
        return group;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getDescription() {
        return description;
    }

    public String getRemediation() {
        return remediation;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * If no types are specified, the rule applies to all node types.
     */
    public boolean appliesTo(NodeType type) {
        return applicableTypes.isEmpty() || applicableTypes.contains(type);
    }

    /**
     * Returns every matched fragment of the text, empty when the rule is satisfied.
     */
    public List<String> findViolations(String text) {
        List<String> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComplianceRule that = (ComplianceRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ComplianceRule{" +
                "name='" + name + '\'' +
                ", group=" + group +
                ", pattern=" + pattern.pattern() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private ComplianceGroup group;
        private String pattern;
        private String description;
        private String remediation;
        private Set<NodeType> applicableTypes;
        private int priority = 5;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder group(ComplianceGroup group) {
            this.group = group;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder remediation(String remediation) {
            this.remediation = remediation;
            return this;
        }

        public Builder applicableTypes(NodeType... types) {
            this.applicableTypes = Set.of(types);
            return this;
        }

        public Builder priority(int priority) {
            if (priority < 1 || priority > 10) {
                throw new IllegalArgumentException("priority must be between 1 and 10");
            }
            this.priority = priority;
            return this;
        }

        public ComplianceRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(group, "group is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(description, "description is required");
            Objects.requireNonNull(remediation, "remediation is required");
            return new ComplianceRule(this);
        }
    }
}
