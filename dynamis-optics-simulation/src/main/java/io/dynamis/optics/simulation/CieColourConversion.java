package io.dynamis.optics.simulation;

import io.dynamis.optics.api.ColourConversion;
import io.dynamis.optics.api.SampledSpectrum;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralResponse;
import io.dynamis.optics.api.Tristimulus;

/**
 * CIE 1931 2-degree observer: spectrum to XYZ, XYZ to gamma-encoded sRGB (D65).
 *
 * COLOUR MATCHING FUNCTIONS:
 *   Analytic multi-lobe piecewise Gaussian fit (Wyman, Sloan, Shirley 2013):
 *     g(l; mu, s1, s2) = exp(-0.5 * ((l - mu) / s)^2), s = s1 below mu, s2 above
 *   Accurate to within a few percent of the tabulated CIE data across the visible band.
 *
 * RESAMPLING:
 *   Each channel bin gets the mean of each curve over the bin (midpoint rule with
 *   SUB_STEPS evaluations per bin), so integrals of disjoint channels add up to the
 *   integral of their union.
 *
 * NORMALISATION:
 *   XYZ = sum(spectrum[i] * curve[i] * delta) / Y_NORM, where Y_NORM is the integral of
 *   y-bar over [360 nm, 830 nm]. One constant for every channel, so additivity holds.
 *
 * THREAD SAFETY: immutable. Responses are immutable and shared by all workers.
 */
public final class CieColourConversion implements ColourConversion {

    /** Curve evaluations per bin when resampling. */
    public static final int SUB_STEPS = 16;

    private static final double Y_NORM = integrateY(360.0, 830.0, 4700);

    // -- ColourConversion -----------------------------------------------------

    @Override
    public SpectralResponse resample(SpectralChannel channel) {
        int bins = channel.spectralSamples();
        double delta = channel.width() / bins;
        double[] xBar = new double[bins];
        double[] yBar = new double[bins];
        double[] zBar = new double[bins];
        double step = delta / SUB_STEPS;
        for (int i = 0; i < bins; i++) {
            double binStart = channel.minWavelength() + i * delta;
            double sx = 0.0;
            double sy = 0.0;
            double sz = 0.0;
            for (int k = 0; k < SUB_STEPS; k++) {
                double l = binStart + (k + 0.5) * step;
                sx += xBar(l);
                sy += yBar(l);
                sz += zBar(l);
            }
            double weight = delta / (SUB_STEPS * Y_NORM);
            xBar[i] = sx * weight;
            yBar[i] = sy * weight;
            zBar[i] = sz * weight;
        }
        return new CieResponse(channel, xBar, yBar, zBar);
    }

    @Override
    public void toDisplay(double x, double y, double z, double[] outRgb) {
        double r = 3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
        double g = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
        double b = 0.0556434 * x - 0.2040259 * y + 1.0572252 * z;
        outRgb[0] = encode(r);
        outRgb[1] = encode(g);
        outRgb[2] = encode(b);
    }

    // -- Colour matching functions -------------------------------------------

    /** CIE 1931 x-bar at wavelength {@code l} nanometres. */
    public static double xBar(double l) {
        return 1.056 * lobe(l, 599.8, 37.9, 31.0)
             + 0.362 * lobe(l, 442.0, 16.0, 26.7)
             - 0.065 * lobe(l, 501.1, 20.4, 26.2);
    }

    /** CIE 1931 y-bar (photopic luminosity) at wavelength {@code l} nanometres. */
    public static double yBar(double l) {
        return 0.821 * lobe(l, 568.8, 46.9, 40.5)
             + 0.286 * lobe(l, 530.9, 16.3, 31.1);
    }

    /** CIE 1931 z-bar at wavelength {@code l} nanometres. */
    public static double zBar(double l) {
        return 1.217 * lobe(l, 437.0, 11.8, 36.0)
             + 0.681 * lobe(l, 459.0, 26.0, 13.8);
    }

    private static double lobe(double l, double mu, double sigmaBelow, double sigmaAbove) {
        double t = (l - mu) / (l < mu ? sigmaBelow : sigmaAbove);
        return Math.exp(-0.5 * t * t);
    }

    private static double integrateY(double from, double to, int steps) {
        double step = (to - from) / steps;
        double sum = 0.0;
        for (int i = 0; i < steps; i++) {
            sum += yBar(from + (i + 0.5) * step);
        }
        return sum * step;
    }

    private static double encode(double linear) {
        double c = Math.max(0.0, Math.min(1.0, linear));
        if (c <= 0.0031308) {
            return 12.92 * c;
        }
        return 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    // -- Resampled response ---------------------------------------------------

    private static final class CieResponse implements SpectralResponse {

        private final SpectralChannel channel;
        private final double[] xBar;
        private final double[] yBar;
        private final double[] zBar;

        CieResponse(SpectralChannel channel, double[] xBar, double[] yBar, double[] zBar) {
            this.channel = channel;
            this.xBar = xBar;
            this.yBar = yBar;
            this.zBar = zBar;
        }

        @Override
        public SpectralChannel channel() { return channel; }

        @Override
        public Tristimulus toTristimulus(SampledSpectrum spectrum) {
            if (spectrum.bins() != xBar.length
                    || spectrum.minWavelength() != channel.minWavelength()
                    || spectrum.maxWavelength() != channel.maxWavelength()) {
                throw new IllegalArgumentException(
                    "spectrum grid [" + spectrum.minWavelength() + ", " + spectrum.maxWavelength()
                    + "] x " + spectrum.bins() + " does not match channel " + channel);
            }
            double x = 0.0;
            double y = 0.0;
            double z = 0.0;
            for (int i = 0; i < xBar.length; i++) {
                double s = spectrum.get(i);
                x += s * xBar[i];
                y += s * yBar[i];
                z += s * zBar[i];
            }
            return new Tristimulus(x, y, z);
        }
    }
}
