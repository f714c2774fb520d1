package org.micromanager.simsched.devices;

import java.util.Map;
import org.micromanager.simsched.api.Triggerable;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.Time;

/**
 * Light source switched by a trigger line. Its exposure time is only kept for
 * metadata; switching itself takes no time.
 */
public class ConfiguredLight extends ConfiguredDevice implements Triggerable {

   private static final Time DEFAULT_EXPOSURE = Time.ofMillis(100);

   public ConfiguredLight(String name, Map<String, String> settings) {
      super(name, settings);
   }

   public Time getExposureTime() throws UnavailableTimingException {
      return getTime("exposure", DEFAULT_EXPOSURE);
   }

   public String getWavelength() {
      return settings_.get("wavelength");
   }
}
