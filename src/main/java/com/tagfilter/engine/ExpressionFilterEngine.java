package com.tagfilter.engine;

import com.tagfilter.config.FilterConfig;
import com.tagfilter.config.TagFilterConfig;
import com.tagfilter.element.Element;
import com.tagfilter.exception.ConfigurationException;
import com.tagfilter.filter.ElementFilterExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FilterEngine for parsed filter expressions.
 * Each configured filter is normalized once, at construction; evaluation only reads the
 * resulting trees.
 */
public class ExpressionFilterEngine implements FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(ExpressionFilterEngine.class);

    private final Map<String, ElementFilterExpression> filters;

    public ExpressionFilterEngine(TagFilterConfig config) {
        this.filters = buildFilters(config);

        log.info("ExpressionFilterEngine initialized with {} filters", filters.size());
    }

    private Map<String, ElementFilterExpression> buildFilters(TagFilterConfig config) {
        Map<String, ElementFilterExpression> result = new LinkedHashMap<>();

        for (FilterConfig filterConfig : config.filters()) {
            ElementFilterExpression normalized = filterConfig.filter().normalized(filterConfig.normalization());
            if (result.putIfAbsent(filterConfig.name(), normalized) != null) {
                throw new ConfigurationException("Duplicate filter name '" + filterConfig.name() + "'");
            }
            log.debug("Built filter '{}' ({}): {}", filterConfig.name(), filterConfig.normalization(), normalized);
        }

        return result;
    }

    @Override
    public EvaluationResult evaluate(Element element) {
        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, ElementFilterExpression> entry : filters.entrySet()) {
            if (entry.getValue().matches(element)) {
                matched.add(entry.getKey());
            }
        }

        log.debug("Element {} {} matched filters {}", element.getType(), element.getId(), matched);
        return new EvaluationResult(element.getId(), matched);
    }

    @Override
    public boolean matches(String filterName, Element element) {
        ElementFilterExpression filter = filters.get(filterName);
        if (filter == null) {
            throw new ConfigurationException("Unknown filter '" + filterName + "'");
        }
        return filter.matches(element);
    }

    @Override
    public List<String> getFilterNames() {
        return List.copyOf(filters.keySet());
    }
}
