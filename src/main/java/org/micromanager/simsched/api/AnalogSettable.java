package org.micromanager.simsched.api;

import org.micromanager.simsched.main.Time;

/**
 * A device driven by an analog setpoint or a sequence index, e.g. a spatial
 * light modulator or a polarization rotor.
 */
public interface AnalogSettable extends Resource {

   public Time getSettlingTime() throws UnavailableTimingException;

}
