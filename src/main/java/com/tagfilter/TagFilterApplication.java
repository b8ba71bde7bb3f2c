package com.tagfilter;

import com.tagfilter.element.Element;
import com.tagfilter.element.ElementFactory;
import com.tagfilter.engine.EvaluationResult;
import com.tagfilter.engine.FilterEngine;
import com.tagfilter.spring.EnableTagFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating tag filter usage.
 */
@SpringBootApplication
@EnableTagFilter
public class TagFilterApplication {

    private static final Logger log = LoggerFactory.getLogger(TagFilterApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TagFilterApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(FilterEngine filterEngine) {
        return args -> {
            log.info("=== Tag Filter Demo Started ===");
            log.info("Configured filters: {}", filterEngine.getFilterNames());

            List<String> samples = List.of(
                    """
                    {"type": "way", "id": 1, "tags": {"highway": "residential", "name": "Elm Street"}}
                    """,
                    """
                    {"type": "way", "id": 2, "tags": {"highway": "primary", "maxspeed": 70, "ref": "B 42"}}
                    """,
                    """
                    {"type": "node", "id": 3, "tags": {"amenity": "bench", "backrest": "yes"}}
                    """,
                    """
                    {"type": "node", "id": 4, "tags": {"amenity": "post_box"}}
                    """
            );

            for (String json : samples) {
                Element element = ElementFactory.fromJson(json);
                EvaluationResult result = filterEngine.evaluate(element);
                log.info("{} {} {} -> {}", element.getType(), element.getId(), element.getTags(),
                        result.isMatched() ? result.matchedFilters() : "no match");
            }

            log.info("=== Tag Filter Demo Finished ===");
        };
    }
}
