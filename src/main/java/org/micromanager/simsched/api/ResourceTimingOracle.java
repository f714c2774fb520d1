package org.micromanager.simsched.api;

import org.micromanager.simsched.main.ActionPayload;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;

/**
 * Answers "how long will this take" for every kind of resource. All answers
 * are non-negative and deterministic for a given configuration; anything a
 * device can not answer is reported as a {@link ConfigurationException}.
 */
public interface ResourceTimingOracle {

   public MotionTime motionTime(Positionable resource, double from, double to)
         throws ConfigurationException;

   public Time exposureTime(Exposable camera) throws ConfigurationException;

   public Time interExposureGap(Exposable camera) throws ConfigurationException;

   public Time resetTime(Exposable camera) throws ConfigurationException;

   public Time settleTime(Resource resource) throws ConfigurationException;

   /**
    * How long a resource stays busy after being sent the given action.
    */
   public Time busyDuration(Resource resource, ActionPayload payload)
         throws ConfigurationException;

}
