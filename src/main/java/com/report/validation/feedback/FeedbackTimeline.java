package com.report.validation.feedback;

import java.util.List;

/**
 * Feedback partitioned by urgency: immediate (critical or priority 9+), short term
 * (high severity or priority 6-8) and long term (everything else).
 */
public record FeedbackTimeline(List<Feedback> immediate, List<Feedback> shortTerm, List<Feedback> longTerm) {

    public FeedbackTimeline {
        immediate = immediate != null ? List.copyOf(immediate) : List.of();
        shortTerm = shortTerm != null ? List.copyOf(shortTerm) : List.of();
        longTerm = longTerm != null ? List.copyOf(longTerm) : List.of();
    }
}
