package com.tagfilter.config;

import java.util.List;
import java.util.Optional;

/**
 * Root configuration: a named, ordered list of filters.
 *
 * @param name    Configuration name
 * @param version Configuration version
 * @param filters Filters in evaluation order
 */
public record TagFilterConfig(
        String name,
        String version,
        List<FilterConfig> filters
) {
    public TagFilterConfig {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    /**
     * Get filter by name.
     */
    public Optional<FilterConfig> getFilter(String filterName) {
        return filters.stream()
                .filter(f -> f.name().equals(filterName))
                .findFirst();
    }
}
