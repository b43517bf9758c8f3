package com.winevt.resources.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory attribute container store. Stands in for the case storage when containers
 * are produced by parsers in the same process. Not thread-safe.
 */
public class InMemoryAttributeContainerStore implements AttributeContainerStore {

    private final Map<String, List<AttributeContainer>> containers = new HashMap<>();

    /**
     * Adds a container and assigns it the next identifier of its type.
     *
     * @return the assigned identifier
     */
    public <T extends AttributeContainer> ContainerIdentifier addAttributeContainer(
            ContainerType<T> type, T container) {
        List<AttributeContainer> stored = containers.computeIfAbsent(type.getName(), k -> new ArrayList<>());
        ContainerIdentifier identifier = new ContainerIdentifier(type.getName(), stored.size() + 1L);
        container.setIdentifier(identifier);
        stored.add(container);
        return identifier;
    }

    @Override
    public boolean hasAttributeContainers(ContainerType<?> type) {
        List<AttributeContainer> stored = containers.get(type.getName());
        return stored != null && !stored.isEmpty();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends AttributeContainer> List<T> getAttributeContainers(
            ContainerType<T> type, ContainerFilter filter) {
        List<T> result = new ArrayList<>();
        for (AttributeContainer container : containers.getOrDefault(type.getName(), List.of())) {
            T typed = (T) container;
            if (filter.isEmpty() || filter.matches(type.toAttributes(typed))) {
                result.add(typed);
            }
        }
        return result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends AttributeContainer> Optional<T> getAttributeContainerByIdentifier(
            ContainerType<T> type, ContainerIdentifier identifier) {
        if (!type.getName().equals(identifier.name())) {
            return Optional.empty();
        }
        List<AttributeContainer> stored = containers.getOrDefault(type.getName(), List.of());
        long index = identifier.sequenceNumber() - 1;
        if (index < 0 || index >= stored.size()) {
            return Optional.empty();
        }
        return Optional.of((T) stored.get((int) index));
    }

    /**
     * Returns the number of stored containers of a type.
     */
    public int getNumberOfAttributeContainers(ContainerType<?> type) {
        return containers.getOrDefault(type.getName(), List.of()).size();
    }
}
