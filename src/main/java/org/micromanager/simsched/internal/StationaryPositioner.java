package org.micromanager.simsched.internal;

import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;

/**
 * Stands in for the Z stage of a plan that has none. Moves take no time, so
 * the stage entries it receives only mark the structure of the table.
 */
public final class StationaryPositioner implements Positionable {

   public static final String NAME = "Stationary Z";
   public static final StationaryPositioner INSTANCE = new StationaryPositioner();

   private StationaryPositioner() {
   }

   @Override
   public String getName() {
      return NAME;
   }

   @Override
   public MotionTime getMovementTime(double start, double end) {
      return MotionTime.NONE;
   }

   @Override
   public Time getSettlingTime() {
      return Time.ZERO;
   }
}
