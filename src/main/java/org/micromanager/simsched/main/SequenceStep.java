package org.micromanager.simsched.main;

/**
 * One pattern of a structured illumination sequence.
 */
public final class SequenceStep {

   private final double angle_;
   private final double phase_;
   private final double wavelength_;

   public SequenceStep(double angle, double phase, double wavelength) {
      angle_ = angle;
      phase_ = phase;
      wavelength_ = wavelength;
   }

   /** degrees */
   public double getAngle() {
      return angle_;
   }

   /** degrees */
   public double getPhase() {
      return phase_;
   }

   /** meters */
   public double getWavelength() {
      return wavelength_;
   }

   @Override
   public boolean equals(Object o) {
      if (!(o instanceof SequenceStep)) {
         return false;
      }
      SequenceStep s = (SequenceStep) o;
      return Double.compare(angle_, s.angle_) == 0 && Double.compare(phase_, s.phase_) == 0
            && Double.compare(wavelength_, s.wavelength_) == 0;
   }

   @Override
   public int hashCode() {
      return (31 * Double.hashCode(angle_) + Double.hashCode(phase_)) * 31
            + Double.hashCode(wavelength_);
   }

   @Override
   public String toString() {
      return "(" + angle_ + ", " + phase_ + ", " + wavelength_ + ")";
   }
}
