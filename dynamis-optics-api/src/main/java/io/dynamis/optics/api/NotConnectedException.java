package io.dynamis.optics.api;

/**
 * Thrown by observe() when the observer is not attached to a scene root.
 * Raised before any sampling or buffer mutation takes place.
 */
public final class NotConnectedException extends IllegalStateException {

    public NotConnectedException(String message) {
        super(message);
    }
}
