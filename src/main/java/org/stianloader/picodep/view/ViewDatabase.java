package org.stianloader.picodep.view;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Storage for the data of loaded views, filled by {@link ViewLoader ViewLoaders}.
 * Merging the data of a view with the data of its dependencies is the task of the database,
 * not of the loaders.
 */
public interface ViewDatabase {

    @Contract(pure = true)
    boolean isLoaded(@NotNull String viewName);

    /**
     * Registers the data of a view and marks it as loaded.
     *
     * @param viewName The name of the view
     * @param mappingData The mapping data of the view, null if no data is available for it
     * @param dependencies The names of the views the view depends on
     * @param origin Where the data came from, for debugging
     */
    void setViewData(@NotNull String viewName, @Nullable Map<String, Object> mappingData, @NotNull List<String> dependencies, @Nullable String origin);

    /**
     * Obtains the data registered for a view.
     *
     * @param viewName The name of the view
     * @return The data of the view, or null if the view was not loaded
     */
    @Nullable
    ViewData getViewData(@NotNull String viewName);
}
