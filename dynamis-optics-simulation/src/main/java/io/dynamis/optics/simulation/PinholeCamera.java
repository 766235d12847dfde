package io.dynamis.optics.simulation;

import io.dynamis.optics.api.ColourConversion;
import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.core.Camera;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ideal pinhole camera looking along +Z from its eye position.
 *
 * Field of view is measured in degrees across the larger image dimension.
 * Pixel geometry is rebuilt at the start of every observe(), so fov, eye position,
 * pixel samples and sub-sampling may change between passes.
 */
public final class PinholeCamera extends Camera {

    private static final Logger LOG = LoggerFactory.getLogger(PinholeCamera.class);

    /** Default field of view in degrees. */
    public static final double DEFAULT_FOV_DEGREES = 45.0;

    private double fov = DEFAULT_FOV_DEGREES;
    private boolean subSample = false;
    private double eyeX = 0.0;
    private double eyeY = 0.0;
    private double eyeZ = 0.0;

    /**
     * @param fov see {@link #setFov(double)}
     * @see Camera#Camera(int, int, double, int, int, int, int, boolean, ColourConversion)
     */
    public PinholeCamera(int width, int height, double fov, double sensitivity,
                         int spectralSamples, int spectralChannels, int pixelSamples,
                         int workerCount, boolean progressive,
                         ColourConversion colour) {
        super(width, height, sensitivity, spectralSamples, spectralChannels, pixelSamples,
              workerCount, progressive, colour);
        setFov(fov);
    }

    /** Constructs with default configuration and the CIE 1931 colour conversion. */
    public PinholeCamera() {
        super(new CieColourConversion());
    }

    @Override
    protected PixelSampler rebuildPixels() {
        PinholeGeometry geometry = PinholeGeometry.compute(width(), height(), fov);
        LOG.debug("Pinhole geometry: {}x{} at {} degrees, pixel pitch {}",
            width(), height(), fov, geometry.delta());
        return new PinholePixelSampler(geometry, eyeX, eyeY, eyeZ, pixelSamples(), subSample);
    }

    // -- Configuration --------------------------------------------------------

    public double fov() { return fov; }

    /**
     * @param fov field of view in degrees; must be > 0 and < 180
     * @throws InvalidConfigurationException otherwise
     */
    public void setFov(double fov) {
        if (!(fov > 0.0)) {
            throw new InvalidConfigurationException(
                "Field of view angle can not be less than or equal to 0 degrees; got " + fov);
        }
        if (!(fov < 180.0)) {
            throw new InvalidConfigurationException(
                "Field of view angle must be less than 180 degrees; got " + fov);
        }
        this.fov = fov;
    }

    public boolean isSubSample() { return subSample; }

    /** When true, primary rays are jittered uniformly across each pixel. */
    public void setSubSample(boolean subSample) { this.subSample = subSample; }

    /** Places the pinhole. The camera always looks along +Z. */
    public void setEye(double x, double y, double z) {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new InvalidConfigurationException(
                "eye position must be finite; got (" + x + ", " + y + ", " + z + ")");
        }
        this.eyeX = x;
        this.eyeY = y;
        this.eyeZ = z;
    }

    public double eyeX() { return eyeX; }

    public double eyeY() { return eyeY; }

    public double eyeZ() { return eyeZ; }
}
