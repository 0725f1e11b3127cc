package org.stianloader.picodep.view;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The data registered for a view within a {@link ViewDatabase}.
 *
 * @param name The name of the view
 * @param mappingData The dependency mapping data of the view, empty if the view has no data of its own
 * @param dependencies The views this view depends on, in order of precedence
 * @param origin Where the data came from, for debugging
 */
public record ViewData(@NotNull String name, @NotNull Map<String, Object> mappingData, @NotNull List<String> dependencies, @Nullable String origin) {
}
