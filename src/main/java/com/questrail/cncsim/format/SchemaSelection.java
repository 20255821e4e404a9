package com.questrail.cncsim.format;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which wire schemas a simulation emits.
 */
public enum SchemaSelection
{
    HIERARCHICAL(EnumSet.of(WireSchema.HIERARCHICAL)),
    COMPACT(EnumSet.of(WireSchema.COMPACT)),
    BOTH(EnumSet.allOf(WireSchema.class));

    private final Set<WireSchema> schemas;

    SchemaSelection(Set<WireSchema> schemas) {
        this.schemas = schemas;
    }

    public Set<WireSchema> schemas() {
        return EnumSet.copyOf(schemas);
    }

    public boolean includes(WireSchema schema) {
        return schemas.contains(schema);
    }

    /**
     * Parses a configuration word: the enum name, or {@code uns}, {@code umh}
     * or {@code both}, case-insensitively.
     *
     * @throws IllegalArgumentException for any other word
     */
    public static SchemaSelection parse(String text) {
        String word = text.trim().toLowerCase(Locale.ROOT);
        switch (word) {
            case "uns":
            case "hierarchical":
                return HIERARCHICAL;
            case "umh":
            case "umh-core":
            case "compact":
                return COMPACT;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("Unknown output format: " + text);
        }
    }
}
