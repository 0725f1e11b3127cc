package org.stianloader.picodep;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown if a view or resource is requested from a loader which does not own it.
 * Callers composing several loaders should treat this as "ask the next loader".
 */
public class ResourceNotFoundException extends PicodepException {

    private static final long serialVersionUID = 7863372104538125940L;

    @NotNull
    private final String resourceName;

    public ResourceNotFoundException(@NotNull String resourceName) {
        super(resourceName);
        this.resourceName = resourceName;
    }

    @NotNull
    @Contract(pure = true)
    public String getResourceName() {
        return this.resourceName;
    }
}
