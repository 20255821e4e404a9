package com.questrail.cncsim.api;

import java.util.Arrays;

/**
 * Travel limits of the linear axes in millimetres, in X, Y, Z order.
 *
 * <p>Parsed from the conventional {@code "762x406x508"} notation used on
 * machine data sheets.</p>
 */
public final class WorkEnvelope
{
    /** Travel assumed for an axis the envelope does not list. */
    public static final double DEFAULT_TRAVEL_MM = 100.0;

    private final double[] dimensions;

    private WorkEnvelope(double[] dimensions) {
        this.dimensions = dimensions;
    }

    public static WorkEnvelope of(double... dimensions) {
        if (dimensions.length == 0) {
            throw new IllegalArgumentException("at least one dimension required");
        }
        for (double d : dimensions) {
            if (!(d > 0) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("dimensions must be positive and finite: " + Arrays.toString(dimensions));
            }
        }
        return new WorkEnvelope(dimensions.clone());
    }

    /**
     * Parses {@code "AxBxC"} notation.
     *
     * @throws IllegalArgumentException if any part is not a positive number
     */
    public static WorkEnvelope parse(String notation) {
        String[] parts = notation.trim().toLowerCase().split("x");
        double[] dims = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                dims[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed work envelope: " + notation, e);
            }
        }
        return of(dims);
    }

    /**
     * Travel of the axis at {@code index} (0 = X), or {@link #DEFAULT_TRAVEL_MM}
     * when the envelope does not cover that axis.
     */
    public double travel(int index) {
        return index >= 0 && index < dimensions.length ? dimensions[index] : DEFAULT_TRAVEL_MM;
    }

    public int dimensionCount() {
        return dimensions.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WorkEnvelope other && Arrays.equals(dimensions, other.dimensions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dimensions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < dimensions.length; i++) {
            if (i > 0) {
                sb.append('x');
            }
            double d = dimensions[i];
            sb.append(d == Math.rint(d) ? Long.toString((long) d) : Double.toString(d));
        }
        return sb.toString();
    }
}
