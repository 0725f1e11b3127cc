package org.stianloader.picodep.source;

/**
 * The states a {@link SourceInstall} passes through while being installed by the {@link SourceInstallPipeline}.
 * {@link #ALREADY_INSTALLED}, {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum InstallState {
    NOT_STARTED,
    PRESENCE_CHECKED,
    ALREADY_INSTALLED,
    FETCHING,
    VERIFYING,
    EXTRACTING,
    EXECUTING,
    CLEANUP,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == ALREADY_INSTALLED || this == DONE || this == FAILED;
    }
}
