package org.micromanager.simsched.devices;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;

/**
 * Single stage axis. Movement time is estimated from configuration, since the
 * devices don't report it:
 * <pre>
 *   units-per-micron: 40   (required, steps per micron)
 *   velocity: 1000         (um/s, default 1000)
 *   settlingtime: 10       (ms, default 10)
 * </pre>
 * If the device reports its own velocity, that is used instead of the
 * configured one.
 */
public class ConfiguredStageAxis extends ConfiguredDevice implements Positionable {

   public static final double DEFAULT_VELOCITY_UM_PER_S = 1000;
   private static final Time DEFAULT_SETTLING_TIME = Time.ofMillis(10);
   private static final BigDecimal MS_PER_S = BigDecimal.valueOf(1000);

   private final double unitsPerMicron_;
   private volatile Double reportedVelocity_ = null;

   public ConfiguredStageAxis(String name, Map<String, String> settings)
         throws ConfigurationException {
      super(name, settings);
      try {
         unitsPerMicron_ = getDouble("units-per-micron");
      } catch (UnavailableTimingException e) {
         throw new ConfigurationException(e.getMessage(), e);
      }
      if (unitsPerMicron_ <= 0.0) {
         throw new ConfigurationException("'units-per-micron' of " + name
               + " must be a positive value");
      }
   }

   public double getUnitsPerMicron() {
      return unitsPerMicron_;
   }

   /**
    * Velocity reported by the device in um/s, or null to use the configured one
    */
   public void setReportedVelocity(Double velocity) {
      reportedVelocity_ = velocity;
   }

   public double getVelocity() throws UnavailableTimingException {
      Double reported = reportedVelocity_;
      double velocity = reported != null ? reported : getDouble("velocity", DEFAULT_VELOCITY_UM_PER_S);
      if (!(velocity > 0) || Double.isInfinite(velocity)) {
         throw new UnavailableTimingException("velocity of " + getName() + " must be positive, got "
               + velocity);
      }
      return velocity;
   }

   @Override
   public MotionTime getMovementTime(double start, double end) throws UnavailableTimingException {
      double d = Math.abs(end - start);
      if (Double.isNaN(d) || Double.isInfinite(d)) {
         throw new UnavailableTimingException("Can't move " + getName() + " from " + start
               + " to " + end);
      }
      BigDecimal ms = BigDecimal.valueOf(d).multiply(MS_PER_S)
            .divide(BigDecimal.valueOf(getVelocity()), Time.SCALE, RoundingMode.HALF_EVEN);
      try {
         return new MotionTime(Time.ofMillis(ms), getSettlingTime());
      } catch (ArithmeticException e) {
         throw new UnavailableTimingException("Move of " + getName() + " from " + start + " to "
               + end + " takes too long: " + ms + " ms", e);
      }
   }

   @Override
   public Time getSettlingTime() throws UnavailableTimingException {
      return getTime("settlingtime", DEFAULT_SETTLING_TIME);
   }
}
