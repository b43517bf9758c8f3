package com.winevt.resources.core.model;

import java.util.Locale;

/**
 * Kind of string being resolved.
 */
public enum ResolutionKind {
    /** Event message string, subject to WEVT_TEMPLATE mapping. */
    MESSAGE,
    /** Parameter string, such as those referenced by {@code %%1833}. */
    PARAMETER;

    /**
     * Lower-case name used in metric tags and log context.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
