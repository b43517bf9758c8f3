package com.winevt.resources.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Conjunction of attribute equality conditions used to select attribute containers.
 * An empty filter matches every container.
 *
 * <pre>
 * ContainerFilter filter = ContainerFilter.where("language_identifier", 0x0409)
 *         .and("message_identifier", 0x1L);
 * </pre>
 */
public final class ContainerFilter {

    private static final ContainerFilter ALL = new ContainerFilter(List.of());

    private final List<Condition> conditions;

    private ContainerFilter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static ContainerFilter all() {
        return ALL;
    }

    public static ContainerFilter where(String attributeName, Object value) {
        return ALL.and(attributeName, value);
    }

    /**
     * Returns a new filter with an additional equality condition.
     */
    public ContainerFilter and(String attributeName, Object value) {
        if (attributeName == null || attributeName.isBlank()) {
            throw new IllegalArgumentException("Attribute name must not be blank");
        }
        Objects.requireNonNull(value, "Filter value must not be null for " + attributeName);
        List<Condition> extended = new ArrayList<>(conditions);
        extended.add(new Condition(attributeName, value));
        return new ContainerFilter(extended);
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Evaluates the filter against normalized container attributes.
     */
    public boolean matches(Map<String, Object> attributes) {
        for (Condition condition : conditions) {
            if (!valueEquals(attributes.get(condition.attributeName()), condition.value())) {
                return false;
            }
        }
        return true;
    }

    static boolean valueEquals(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number b) {
            return a.longValue() == b.longValue();
        }
        if (actual instanceof Number || expected instanceof Number) {
            return false;
        }
        return actual.toString().equals(expected.toString());
    }

    @Override
    public String toString() {
        if (conditions.isEmpty()) {
            return "<all>";
        }
        return conditions.stream()
                .map(Condition::toString)
                .collect(Collectors.joining(" and "));
    }

    /**
     * A single {@code attribute == value} condition.
     */
    public record Condition(String attributeName, Object value) {

        /**
         * Returns the value as bound to a SQL parameter.
         */
        public Object sqlValue() {
            if (value instanceof Number number) {
                return number.longValue();
            }
            return value.toString();
        }

        @Override
        public String toString() {
            if (value instanceof Number) {
                return attributeName + " == " + value;
            }
            return attributeName + " == \"" + value + "\"";
        }
    }
}
