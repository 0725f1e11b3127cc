package org.stianloader.picodep;

import java.util.Locale;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The format of the mapping data a {@link DataSource} points to.
 */
public enum DataSourceType {

    /**
     * A YAML mapping document that can be used as-is.
     */
    YAML("yaml"),

    /**
     * A git-buildpackage distribution file that needs to be converted to a mapping document first.
     */
    GBPDISTRO("gbpdistro");

    @NotNull
    private final String name;

    DataSourceType(@NotNull String name) {
        this.name = name;
    }

    /**
     * Obtains the name of the type as used within sources list files.
     *
     * @return The name of the type
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public static DataSourceType fromName(@NotNull String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (DataSourceType type : DataSourceType.values()) {
            if (type.name.equals(lower)) {
                return type;
            }
        }
        throw new IllegalArgumentException("type must be one of [yaml,gbpdistro], but was \"" + name + "\"");
    }
}
