package org.micromanager.simsched.api;

import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;

/**
 * A stage axis or other actuator that can be moved to a position.
 */
public interface Positionable extends Resource {

   /**
    * Estimate how long a move takes, and how long the axis then needs to
    * settle. Must not talk to hardware.
    *
    * @param start position in microns
    * @param end position in microns
    */
   public MotionTime getMovementTime(double start, double end)
         throws UnavailableTimingException;

   public Time getSettlingTime() throws UnavailableTimingException;

}
