package org.micromanager.simsched.api;

import org.micromanager.simsched.main.Time;

/**
 * Camera-like device. A trigger starts an exposure, after which the device is
 * busy for the exposure time plus the time it needs between exposures
 * (readout, rearming).
 *
 * Values may depend on a previously set exposure, so they should be read at
 * planning time, not cached across runs.
 */
public interface Exposable extends Triggerable {

   public Time getExposureTime() throws UnavailableTimingException;

   public Time getTimeBetweenExposures() throws UnavailableTimingException;

   /**
    * How long a reset/arm toggle takes before the device can take real images
    */
   public Time getResetTime() throws UnavailableTimingException;

}
