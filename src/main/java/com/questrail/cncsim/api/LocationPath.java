package com.questrail.cncsim.api;

import java.util.List;
import java.util.Objects;

/**
 * LocationPath
 * -----------------------------------------------------------------------------
 * Four-level location hierarchy of a machine: enterprise, site, area and work
 * cell, in that order.
 *
 * <p>Every segment must be non-blank. Wire schemas join these segments with
 * their own separator, so segments are stored verbatim and never pre-joined.</p>
 */
public record LocationPath(String enterprise, String site, String area, String workCell)
{
    public LocationPath {
        requireSegment(enterprise, "enterprise");
        requireSegment(site, "site");
        requireSegment(area, "area");
        requireSegment(workCell, "workCell");
    }

    /**
     * Segments in hierarchy order.
     */
    public List<String> segments() {
        return List.of(enterprise, site, area, workCell);
    }

    /**
     * Segments joined by {@code separator}.
     */
    public String join(String separator) {
        return String.join(separator, segments());
    }

    private static void requireSegment(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
