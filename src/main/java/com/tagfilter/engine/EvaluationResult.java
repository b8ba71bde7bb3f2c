package com.tagfilter.engine;

import java.util.List;
import java.util.Optional;

/**
 * Result of evaluating all filters against one element.
 *
 * @param elementId      Id of the evaluated element
 * @param matchedFilters Names of the matching filters, in configuration order
 */
public record EvaluationResult(long elementId, List<String> matchedFilters) {

    public EvaluationResult {
        matchedFilters = List.copyOf(matchedFilters);
    }

    /**
     * Check if any filter matched.
     */
    public boolean isMatched() {
        return !matchedFilters.isEmpty();
    }

    /**
     * Get the first matching filter.
     */
    public Optional<String> firstMatch() {
        return matchedFilters.stream().findFirst();
    }
}
