package org.micromanager.simsched.devices;

import java.util.Map;
import org.micromanager.simsched.api.AnalogSettable;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.Time;

/**
 * Pattern generator (SLM, polarization rotor) that steps through a preloaded
 * sequence, one index per action. Configured with an optional
 * {@code settlingtime} in ms, 10 by default.
 */
public class ConfiguredModulator extends ConfiguredDevice implements AnalogSettable {

   private static final Time DEFAULT_SETTLING_TIME = Time.ofMillis(10);

   public ConfiguredModulator(String name, Map<String, String> settings) {
      super(name, settings);
   }

   @Override
   public Time getSettlingTime() throws UnavailableTimingException {
      return getTime("settlingtime", DEFAULT_SETTLING_TIME);
   }

   /**
    * SLM diffraction angle, if configured
    */
   public Double getDiffractionAngle() throws UnavailableTimingException {
      return hasSetting("diffraction-angle") ? getDouble("diffraction-angle") : null;
   }
}
