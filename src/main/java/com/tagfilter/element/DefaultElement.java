package com.tagfilter.element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default implementation of Element.
 * Immutable after construction.
 */
public final class DefaultElement implements Element {

    private final ElementType type;
    private final long id;
    private final Map<String, String> tags;

    private DefaultElement(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Element type is required");
        this.id = builder.id;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    }

    @Override
    public ElementType getType() {
        return type;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "Element{" +
                "type=" + type +
                ", id=" + id +
                ", tags=" + tags +
                '}';
    }

    /**
     * Builder for DefaultElement.
     */
    public static class Builder implements Element.Builder {
        private ElementType type;
        private long id;
        private final Map<String, String> tags = new LinkedHashMap<>();

        @Override
        public Builder type(ElementType type) {
            this.type = type;
            return this;
        }

        @Override
        public Builder id(long id) {
            this.id = id;
            return this;
        }

        @Override
        public Builder tag(String key, String value) {
            if (key != null && value != null) {
                this.tags.put(key, value);
            }
            return this;
        }

        @Override
        public Builder tags(Map<String, String> tags) {
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        @Override
        public DefaultElement build() {
            return new DefaultElement(this);
        }
    }
}
