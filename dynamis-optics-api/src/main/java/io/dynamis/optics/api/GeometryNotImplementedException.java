package io.dynamis.optics.api;

/**
 * Thrown by observe() when a camera variant has not supplied its per-pixel geometry.
 */
public final class GeometryNotImplementedException extends UnsupportedOperationException {

    public GeometryNotImplementedException(String cameraType) {
        super("Pixel geometry rebuild has not been implemented for camera type " + cameraType);
    }
}
