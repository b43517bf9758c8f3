package com.winevt.resources.store;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a store of typed attribute containers.
 * Implemented by the forensic case storage and by file-based resource stores.
 */
public interface AttributeContainerStore {

    /**
     * Determines whether the store holds at least one container of the given type.
     *
     * @param type the container type
     * @return true if containers of the type are present
     */
    boolean hasAttributeContainers(ContainerType<?> type);

    /**
     * Retrieves the containers of a type that match a filter, in store order.
     *
     * @param type   the container type
     * @param filter the filter, {@link ContainerFilter#all()} for every container
     * @return matching containers with their identifiers set
     */
    <T extends AttributeContainer> List<T> getAttributeContainers(ContainerType<T> type, ContainerFilter filter);

    /**
     * Retrieves all containers of a type, in store order.
     */
    default <T extends AttributeContainer> List<T> getAttributeContainers(ContainerType<T> type) {
        return getAttributeContainers(type, ContainerFilter.all());
    }

    /**
     * Retrieves a container by its identifier.
     *
     * @param type       the container type
     * @param identifier the identifier
     * @return the container, or empty if not stored
     */
    <T extends AttributeContainer> Optional<T> getAttributeContainerByIdentifier(
            ContainerType<T> type, ContainerIdentifier identifier);
}
