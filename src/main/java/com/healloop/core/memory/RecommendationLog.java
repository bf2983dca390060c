package com.healloop.core.memory;

import java.util.List;

/**
 * Bounded list of proactive {@link Recommendation}s.
 */
public class RecommendationLog {

    private final BoundedHistory<Recommendation> recommendations;

    public RecommendationLog(int capacity) {
        this.recommendations = new BoundedHistory<>(capacity);
    }

    public void add(Recommendation recommendation) {
        recommendations.append(recommendation);
    }

    public List<Recommendation> all() {
        return recommendations.snapshot();
    }
}
