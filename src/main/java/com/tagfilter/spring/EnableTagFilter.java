package com.tagfilter.spring;

import com.tagfilter.adapter.spring.TagFilterAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable tag filters in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTagFilter
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TagFilterAutoConfiguration.class)
public @interface EnableTagFilter {
}
