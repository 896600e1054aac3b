package com.report.validation.compliance;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in forbidden-content rules for assessment reports.
 */
public final class DefaultComplianceRules {

    private DefaultComplianceRules() {
        // Utility class
    }

    public static ComplianceRuleEngine createDefaultEngine() {
        List<ComplianceRule> rules = new ArrayList<>();
        rules.addAll(getEthicsRules());
        rules.addAll(getPrivacyRules());
        rules.addAll(getProfessionalismRules());
        rules.addAll(getLegalityRules());
        return new ComplianceRuleEngine(rules);
    }

    public static List<ComplianceRule> getEthicsRules() {
        return List.of(
                ComplianceRule.builder()
                        .name("ethics-demographic-generalization")
                        .group(ComplianceGroup.ETHICS)
                        .pattern("\\b(as (a|an) (woman|man|female|male|older|younger|immigrant|foreigner))\\b")
                        .description("Judgment framed through a demographic attribute")
                        .remediation("Describe observed behaviour and results without reference to personal attributes")
                        .priority(8)
                        .build(),
                ComplianceRule.builder()
                        .name("ethics-harmful-stereotype")
                        .group(ComplianceGroup.ETHICS)
                        .pattern("\\b(typical (for|of) (women|men|his|her|their) (age|gender|culture|generation))\\b")
                        .description("Harmful stereotype in assessment language")
                        .remediation("Remove the generalization and cite individual assessment evidence instead")
                        .priority(8)
                        .build()
        );
    }

    public static List<ComplianceRule> getPrivacyRules() {
        return List.of(
                ComplianceRule.builder()
                        .name("privacy-email-address")
                        .group(ComplianceGroup.PRIVACY)
                        .pattern("\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b")
                        .description("Report exposes an e-mail address")
                        .remediation("Remove contact details from the report body")
                        .priority(7)
                        .build(),
                ComplianceRule.builder()
                        .name("privacy-phone-number")
                        .group(ComplianceGroup.PRIVACY)
                        .pattern("(?<!\\d)(\\+?\\d{1,3}[ .-])?\\(?\\d{3}\\)?[ .-]\\d{3}[ .-]\\d{4}(?!\\d)")
                        .description("Report exposes a phone number")
                        .remediation("Remove contact details from the report body")
                        .priority(7)
                        .build(),
                ComplianceRule.builder()
                        .name("privacy-health-disclosure")
                        .group(ComplianceGroup.PRIVACY)
                        .pattern("\\b(diagnosed with|medical condition|mental illness|pregnan(t|cy))\\b")
                        .description("Report discloses sensitive health information")
                        .remediation("Remove health-related statements; they are outside the scope of the assessment")
                        .priority(8)
                        .build()
        );
    }

    public static List<ComplianceRule> getProfessionalismRules() {
        return List.of(
                ComplianceRule.builder()
                        .name("professionalism-casual-tone")
                        .group(ComplianceGroup.PROFESSIONALISM)
                        .pattern("\\b(lol|gonna|wanna|kinda|super awesome|totally crushed it)\\b")
                        .description("Casual tone inappropriate for a professional report")
                        .remediation("Rephrase in neutral, professional language")
                        .priority(4)
                        .build(),
                ComplianceRule.builder()
                        .name("professionalism-derogatory-term")
                        .group(ComplianceGroup.PROFESSIONALISM)
                        .pattern("\\b(lazy|stupid|incompetent|hopeless|useless)\\b")
                        .description("Derogatory characterization of the subject")
                        .remediation("Replace the label with a description of the observed development area")
                        .priority(6)
                        .build()
        );
    }

    public static List<ComplianceRule> getLegalityRules() {
        return List.of(
                ComplianceRule.builder()
                        .name("legality-protected-characteristic-decision")
                        .group(ComplianceGroup.LEGALITY)
                        .pattern("\\b(should not be (hired|promoted)|unsuitable for (promotion|hiring)) because of (age|gender|race|religion|disability|pregnancy)\\b")
                        .description("Employment recommendation based on a protected characteristic")
                        .remediation("Remove the statement; employment decisions must not reference protected characteristics")
                        .priority(10)
                        .build(),
                ComplianceRule.builder()
                        .name("legality-guaranteed-outcome")
                        .group(ComplianceGroup.LEGALITY)
                        .pattern("\\b(guarantee[sd]? (success|promotion|results)|clinically proven)\\b")
                        .description("Unsupported claim presented as guaranteed or proven")
                        .remediation("Qualify the statement and tie it to assessment evidence")
                        .priority(9)
                        .build()
        );
    }
}
