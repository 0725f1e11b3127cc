package org.stianloader.picodep.view;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.ResourceNotFoundException;

/**
 * A view loader exposes dependency mapping data as named views that can be loaded into a {@link ViewDatabase}.
 * Views may depend on other views; the database uses these dependencies to implement precedence.
 *
 * <p>Loaders may additionally map concrete resources (for example packages) to views and declare
 * the dependency keys used by a resource. Loaders that do not know a resource report it as
 * {@link LookupResult#notFound(String) not found} so that callers composing several loaders can ask
 * the next one.
 */
public interface ViewLoader {

    /**
     * Loads a view into the database. Does nothing if the database already has the view loaded.
     *
     * @param viewName The name of the view
     * @param database The database to load the view into
     * @throws ResourceNotFoundException If this loader does not provide the view
     * @throws InvalidDataException If the data of the view is malformed
     */
    void loadView(@NotNull String viewName, @NotNull ViewDatabase database) throws ResourceNotFoundException, InvalidDataException;

    /**
     * Obtains the names of all views that {@link #loadView(String, ViewDatabase)} can load.
     *
     * @return The loadable views
     */
    @NotNull
    List<String> getLoadableViews();

    /**
     * Obtains the names of all concrete resources this loader knows of.
     *
     * @return The loadable resources
     */
    @NotNull
    List<String> getLoadableResources();

    /**
     * Obtains the views a view depends on.
     *
     * @param viewName The name of the view
     * @return The dependencies of the view
     */
    @NotNull
    List<String> getViewDependencies(@NotNull String viewName);

    /**
     * Obtains the dependency keys a resource declares.
     *
     * @param resourceName The name of the resource
     * @return The dependency keys, or not found if the loader does not know the resource
     */
    @NotNull
    LookupResult<List<String>> getRosdeps(@NotNull String resourceName);

    /**
     * Obtains the name of the view a resource belongs to.
     *
     * @param resourceName The name of the resource
     * @return The name of the view, or not found if the loader does not know the resource
     */
    @NotNull
    LookupResult<String> getViewKey(@NotNull String resourceName);
}
