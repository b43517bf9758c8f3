package com.winevt.resources.store;

/**
 * Base class holding the store-assigned identifier of a container.
 */
public abstract class AbstractAttributeContainer implements AttributeContainer {

    private ContainerIdentifier identifier;

    @Override
    public ContainerIdentifier getIdentifier() {
        return identifier;
    }

    @Override
    public void setIdentifier(ContainerIdentifier identifier) {
        this.identifier = identifier;
    }
}
