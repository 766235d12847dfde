package io.dynamis.optics.api;

/**
 * CIE XYZ tristimulus value. Immutable; safe to hand between threads.
 */
public record Tristimulus(double x, double y, double z) {

    public static final Tristimulus ZERO = new Tristimulus(0.0, 0.0, 0.0);

    public Tristimulus plus(Tristimulus other) {
        return new Tristimulus(x + other.x, y + other.y, z + other.z);
    }

    public Tristimulus times(double factor) {
        return new Tristimulus(x * factor, y * factor, z * factor);
    }
}
