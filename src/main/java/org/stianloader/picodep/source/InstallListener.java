package org.stianloader.picodep.source;

import org.jetbrains.annotations.NotNull;

/**
 * Observes the state transitions of installations.
 */
@FunctionalInterface
public interface InstallListener {

    void onStateChange(@NotNull SourceInstall install, @NotNull InstallState state);
}
