package org.micromanager.simsched.api;

/**
 * A device switched by a digital line (light sources, camera triggers).
 * Switching is treated as instantaneous.
 */
public interface Triggerable extends Resource {

}
