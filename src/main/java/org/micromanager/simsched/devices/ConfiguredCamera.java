package org.micromanager.simsched.devices;

import java.util.Map;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.Time;

/**
 * Camera with exposure and readout timing from its configuration:
 * <pre>
 *   exposure: 50
 *   time-between-exposures: 10
 *   reset-time: 60     (optional, defaults to exposure + time-between-exposures)
 * </pre>
 * All values in ms. The exposure can be changed before planning, which is
 * why the planner queries it fresh.
 */
public class ConfiguredCamera extends ConfiguredDevice implements Exposable {

   public static final String EXPOSURE = "exposure";
   public static final String TIME_BETWEEN_EXPOSURES = "time-between-exposures";
   public static final String RESET_TIME = "reset-time";

   private volatile Time exposureOverride_ = null;

   public ConfiguredCamera(String name, Map<String, String> settings) {
      super(name, settings);
   }

   public void setExposureTime(Time exposure) {
      exposureOverride_ = exposure;
   }

   @Override
   public Time getExposureTime() throws UnavailableTimingException {
      Time override = exposureOverride_;
      return override != null ? override : getTime(EXPOSURE);
   }

   @Override
   public Time getTimeBetweenExposures() throws UnavailableTimingException {
      return getTime(TIME_BETWEEN_EXPOSURES);
   }

   @Override
   public Time getResetTime() throws UnavailableTimingException {
      if (hasSetting(RESET_TIME)) {
         return getTime(RESET_TIME);
      }
      return getExposureTime().plus(getTimeBetweenExposures());
   }
}
