package com.tagfilter.engine;

import com.tagfilter.element.Element;

import java.util.List;

/**
 * Evaluates configured filters against map elements.
 * Implementations are thread-safe once constructed.
 */
public interface FilterEngine {

    /**
     * Evaluate all filters against an element.
     *
     * @param element Element to test
     * @return Names of the matching filters, in configuration order
     */
    EvaluationResult evaluate(Element element);

    /**
     * Evaluate a single filter against an element.
     *
     * @param filterName Name of a configured filter
     * @param element    Element to test
     * @return true if the filter matches
     * @throws com.tagfilter.exception.ConfigurationException if no filter has that name
     */
    boolean matches(String filterName, Element element);

    /**
     * Get the names of all configured filters, in configuration order.
     */
    List<String> getFilterNames();
}
