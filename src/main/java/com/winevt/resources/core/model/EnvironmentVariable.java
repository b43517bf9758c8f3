package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;

import java.util.Objects;

/**
 * Environment variable recorded for the analyzed system, such as {@code SystemRoot}.
 */
public class EnvironmentVariable extends AbstractAttributeContainer {

    private final String name;
    private final String value;

    public EnvironmentVariable(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnvironmentVariable that = (EnvironmentVariable) o;
        return Objects.equals(name, that.name) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return "EnvironmentVariable{" + name + "=" + value + '}';
    }
}
