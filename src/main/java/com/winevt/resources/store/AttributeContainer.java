package com.winevt.resources.store;

/**
 * A typed record held by an {@link AttributeContainerStore}.
 * The identifier is assigned by the store when the container is added or read.
 */
public interface AttributeContainer {

    ContainerIdentifier getIdentifier();

    void setIdentifier(ContainerIdentifier identifier);
}
