package org.stianloader.picodep.view;

import java.util.NoSuchElementException;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.ResourceNotFoundException;

/**
 * The result of looking up a resource, which is either a value or the information that the
 * resource is not known.
 *
 * @param <V> The type of the value
 */
public final class LookupResult<V> {

    @NotNull
    private final String name;
    @Nullable
    private final V value;

    private LookupResult(@NotNull String name, @Nullable V value) {
        this.name = Objects.requireNonNull(name, "name may not be null");
        this.value = value;
    }

    @NotNull
    public static <V> LookupResult<V> found(@NotNull String name, @NotNull V value) {
        return new LookupResult<>(name, Objects.requireNonNull(value, "value may not be null"));
    }

    @NotNull
    public static <V> LookupResult<V> notFound(@NotNull String name) {
        return new LookupResult<>(name, null);
    }

    /**
     * Obtains the name of the resource that was looked up.
     *
     * @return The name of the resource
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @Contract(pure = true)
    public boolean isFound() {
        return this.value != null;
    }

    @NotNull
    @Contract(pure = true)
    public V getValue() {
        V v = this.value;
        if (v == null) {
            throw new NoSuchElementException("Resource \"" + this.name + "\" was not found");
        }
        return v;
    }

    @NotNull
    public V orElseThrow() throws ResourceNotFoundException {
        V v = this.value;
        if (v == null) {
            throw new ResourceNotFoundException(this.name);
        }
        return v;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof LookupResult) {
            LookupResult<?> other = (LookupResult<?>) obj;
            return other.name.equals(this.name) && Objects.equals(other.value, this.value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.value);
    }

    @Override
    public String toString() {
        return this.value == null ? "LookupResult[" + this.name + ": not found]" : "LookupResult[" + this.name + ": " + this.value + "]";
    }
}
