package com.contentgrid.oidc.security.jwt.issuer;

/**
 * Callback invoked by a {@link KeyRing} after a new key is generated, but before the ring itself changes.
 * <p>
 * Throwing from {@link #onRotation(KeyRotation)} aborts the rotation: the ring keeps its previous keys and the
 * exception propagates to whoever triggered the rotation.
 */
@FunctionalInterface
public interface RotationListener {

    RotationListener NONE = rotation -> { };

    void onRotation(KeyRotation rotation);
}
