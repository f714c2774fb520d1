package org.micromanager.simsched.internal;

import org.micromanager.simsched.api.AnalogSettable;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.api.Resource;
import org.micromanager.simsched.api.ResourceTimingOracle;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.ActionPayload;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timing oracle that asks each device's own descriptor. Nothing is cached:
 * camera timings in particular can change whenever an exposure is set.
 */
public class DescriptorTimingOracle implements ResourceTimingOracle {

   private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorTimingOracle.class);

   @Override
   public MotionTime motionTime(Positionable resource, double from, double to)
         throws ConfigurationException {
      try {
         return require(resource, "movement time", resource.getMovementTime(from, to));
      } catch (UnavailableTimingException e) {
         throw unavailable(resource, "movement time", e);
      }
   }

   @Override
   public Time exposureTime(Exposable camera) throws ConfigurationException {
      try {
         return require(camera, "exposure time", camera.getExposureTime());
      } catch (UnavailableTimingException e) {
         throw unavailable(camera, "exposure time", e);
      }
   }

   @Override
   public Time interExposureGap(Exposable camera) throws ConfigurationException {
      try {
         return require(camera, "time between exposures", camera.getTimeBetweenExposures());
      } catch (UnavailableTimingException e) {
         throw unavailable(camera, "time between exposures", e);
      }
   }

   @Override
   public Time resetTime(Exposable camera) throws ConfigurationException {
      try {
         return require(camera, "reset time", camera.getResetTime());
      } catch (UnavailableTimingException e) {
         throw unavailable(camera, "reset time", e);
      }
   }

   @Override
   public Time settleTime(Resource resource) throws ConfigurationException {
      try {
         if (resource instanceof Positionable) {
            return require(resource, "settling time",
                  ((Positionable) resource).getSettlingTime());
         } else if (resource instanceof AnalogSettable) {
            return require(resource, "settling time",
                  ((AnalogSettable) resource).getSettlingTime());
         }
      } catch (UnavailableTimingException e) {
         throw unavailable(resource, "settling time", e);
      }
      return Time.ZERO;
   }

   /**
    * Cameras are busy for exposure plus readout after a trigger, stages and
    * analog devices for their settling time, everything else not at all.
    */
   @Override
   public Time busyDuration(Resource resource, ActionPayload payload)
         throws ConfigurationException {
      if (resource instanceof Exposable) {
         if (payload.isDigitalHigh()) {
            Exposable camera = (Exposable) resource;
            return exposureTime(camera).plus(interExposureGap(camera));
         }
         return Time.ZERO;
      }
      if (resource instanceof Positionable && !payload.isMove()) {
         return Time.ZERO;
      }
      return settleTime(resource);
   }

   private static <T> T require(Resource resource, String what, T value)
         throws ConfigurationException {
      if (value == null) {
         LOGGER.error("{} returned no {}", resource.getName(), what);
         throw new ConfigurationException(resource.getName() + " did not report a " + what);
      }
      return value;
   }

   private static ConfigurationException unavailable(Resource resource, String what,
                                                     UnavailableTimingException e) {
      LOGGER.error("Can't get {} of {}: {}", what, resource.getName(), e.getMessage());
      return new ConfigurationException("Missing " + what + " for " + resource.getName()
            + ": " + e.getMessage(), e);
   }
}
