package com.winevt.resources.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Describes an attribute container type: its name, its attribute schema and how
 * containers are converted to and from attribute maps.
 *
 * <p>Attribute values in maps are normalized per {@link AttributeType}:
 * {@code STRING} as {@link String}, {@code INTEGER} as {@link Long},
 * {@code STRING_LIST} as {@code List<String>} and {@code IDENTIFIER} as
 * {@link ContainerIdentifier}. Any value may be {@code null}.</p>
 *
 * @param <T> the container class
 */
public final class ContainerType<T extends AttributeContainer> {

    private final String name;
    private final Map<String, AttributeType> schema;
    private final Function<Map<String, Object>, T> reader;
    private final Function<T, Map<String, Object>> writer;

    private ContainerType(Builder<T> builder) {
        this.name = builder.name;
        this.schema = Collections.unmodifiableMap(new LinkedHashMap<>(builder.schema));
        this.reader = builder.reader;
        this.writer = builder.writer;
    }

    public String getName() {
        return name;
    }

    public Map<String, AttributeType> getSchema() {
        return schema;
    }

    /**
     * Creates a container from an attribute map. Values are normalized first.
     */
    public T fromAttributes(Map<String, Object> attributes) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeType> entry : schema.entrySet()) {
            normalized.put(entry.getKey(), normalize(entry.getValue(), attributes.get(entry.getKey())));
        }
        return reader.apply(normalized);
    }

    /**
     * Returns the attribute map of a container, keyed by schema attribute name.
     */
    public Map<String, Object> toAttributes(T container) {
        Map<String, Object> raw = writer.apply(container);
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, AttributeType> entry : schema.entrySet()) {
            normalized.put(entry.getKey(), normalize(entry.getValue(), raw.get(entry.getKey())));
        }
        return normalized;
    }

    static Object normalize(AttributeType type, Object value) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case STRING -> value.toString();
            case INTEGER -> {
                if (value instanceof Number number) {
                    yield number.longValue();
                }
                yield Long.parseLong(value.toString());
            }
            case STRING_LIST -> {
                if (value instanceof List<?> list) {
                    yield list.stream().map(String::valueOf).toList();
                }
                if (value instanceof Iterable<?> iterable) {
                    List<String> values = new ArrayList<>();
                    iterable.forEach(item -> values.add(String.valueOf(item)));
                    yield List.copyOf(values);
                }
                throw new IllegalArgumentException("Expected a list value, got: " + value.getClass().getName());
            }
            case IDENTIFIER -> {
                if (value instanceof ContainerIdentifier) {
                    yield value;
                }
                yield ContainerIdentifier.parse(value.toString());
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((ContainerType<?>) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "ContainerType{" + name + '}';
    }

    public static <T extends AttributeContainer> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public static class Builder<T extends AttributeContainer> {
        private final String name;
        private final Map<String, AttributeType> schema = new LinkedHashMap<>();
        private Function<Map<String, Object>, T> reader;
        private Function<T, Map<String, Object>> writer;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Container type name must not be blank");
            }
            this.name = name;
        }

        public Builder<T> attribute(String attributeName, AttributeType type) {
            schema.put(Objects.requireNonNull(attributeName), Objects.requireNonNull(type));
            return this;
        }

        public Builder<T> reader(Function<Map<String, Object>, T> reader) {
            this.reader = reader;
            return this;
        }

        public Builder<T> writer(Function<T, Map<String, Object>> writer) {
            this.writer = writer;
            return this;
        }

        public ContainerType<T> build() {
            if (schema.isEmpty()) {
                throw new IllegalStateException("Container type " + name + " has no attributes");
            }
            Objects.requireNonNull(reader, "reader must be set");
            Objects.requireNonNull(writer, "writer must be set");
            return new ContainerType<>(this);
        }
    }
}
