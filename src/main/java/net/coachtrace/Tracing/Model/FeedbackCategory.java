package net.coachtrace.Tracing.Model;

import java.util.Locale;

/**
 * Categories for LLM-as-judge and human feedback scores.
 */
public enum FeedbackCategory {
    QUALITY,
    RELEVANCE,
    ACCURACY,
    HELPFULNESS,
    SAFETY,
    COHERENCE,
    EVOLUTION,
    ADAPTIVE,
    PERFORMANCE,
    ENGAGEMENT,
    CUSTOM;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
