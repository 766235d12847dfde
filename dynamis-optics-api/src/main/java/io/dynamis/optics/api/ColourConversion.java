package io.dynamis.optics.api;

/**
 * Spectrum to tristimulus to display colour conversion.
 *
 * Tristimulus values of disjoint channels must be additive: the XYZ of a full-band
 * spectrum equals the sum of the XYZ of its sub-bands. The accumulator relies on this
 * when it sums channel contributions into one cell.
 */
public interface ColourConversion {

    /**
     * Resamples the colour matching curves onto {@code channel}'s grid.
     * Called once per channel per pass by the coordinating thread.
     */
    SpectralResponse resample(SpectralChannel channel);

    /**
     * Converts an XYZ value to a display colour.
     *
     * ALLOCATION CONTRACT: writes into caller-supplied {@code outRgb}; must not allocate.
     *
     * @param x      CIE X
     * @param y      CIE Y
     * @param z      CIE Z
     * @param outRgb pre-allocated double[3]; overwritten with display R, G, B in [0..1]
     */
    void toDisplay(double x, double y, double z, double[] outRgb);
}
