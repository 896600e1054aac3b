package com.report.validation.feedback;

/**
 * Estimated remediation effort, with the hours used for plan totals.
 */
public enum EffortLevel {
    LOW(1),
    MEDIUM(3),
    HIGH(8);

    private final int hours;

    EffortLevel(int hours) {
        this.hours = hours;
    }

    public int hours() {
        return hours;
    }

    /**
     * Buckets a total number of hours: under 2 is low, under 8 medium, otherwise high.
     */
    public static EffortLevel ofTotalHours(int totalHours) {
        if (totalHours < 2) {
            return LOW;
        }
        return totalHours < 8 ? MEDIUM : HIGH;
    }
}
