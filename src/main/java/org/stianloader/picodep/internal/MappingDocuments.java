package org.stianloader.picodep.internal;

import java.io.IOException;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads and writes the YAML mapping documents used for source data, cache entries and rdmanifests.
 */
public final class MappingDocuments {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private MappingDocuments() {
    }

    /**
     * Parses a YAML document into plain java objects (maps, lists, strings, numbers and booleans).
     *
     * @param data The raw document
     * @return The top level value of the document
     * @throws IOException If the document is empty or not valid YAML
     */
    @Nullable
    public static Object parse(byte @NotNull[] data) throws IOException {
        return YAML_MAPPER.readValue(data, Object.class);
    }

    /**
     * Casts a parsed document to a mapping, if it is one.
     *
     * @param document The document as returned by {@link #parse(byte[])}
     * @return The mapping, or null if the document is not a mapping
     */
    @Nullable
    @SuppressWarnings("unchecked")
    @Contract(pure = true)
    public static Map<String, Object> asMapping(@Nullable Object document) {
        if (document instanceof Map) {
            return (Map<String, Object>) document;
        }
        return null;
    }

    /**
     * Serializes a mapping as a YAML document. Equal mappings with equal iteration order
     * always produce the same bytes.
     *
     * @param mapping The mapping to serialize
     * @return The serialized document
     * @throws IOException If the mapping contains values which cannot be serialized
     */
    public static byte @NotNull[] write(@NotNull Map<String, Object> mapping) throws IOException {
        return YAML_MAPPER.writeValueAsBytes(mapping);
    }
}
