package org.micromanager.simsched.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.SequenceStep;

/**
 * Utility functions for building structured illumination pattern sequences
 */
public class SimSequences {

   public static final double DEFAULT_WAVELENGTH = 488e-9;
   private static final double ANGLE_RANGE = 180;
   private static final double PHASE_RANGE = 360;

   /**
    * Every combination of angle and phase, angle major. Angles divide 180
    * degrees and phases 360 degrees evenly, starting at 0.
    */
   public static List<SequenceStep> create(int numAngles, int numPhases, double wavelength)
         throws ConfigurationException {
      if (numAngles < 1 || numPhases < 1) {
         throw new ConfigurationException("Need at least one angle and one phase, got "
               + numAngles + " angles and " + numPhases + " phases");
      }
      List<SequenceStep> sequence = new ArrayList<SequenceStep>(numAngles * numPhases);
      for (int i = 0; i < numAngles; i++) {
         for (int j = 0; j < numPhases; j++) {
            sequence.add(new SequenceStep(i * ANGLE_RANGE / numAngles,
                  j * PHASE_RANGE / numPhases, wavelength));
         }
      }
      return sequence;
   }

   public static List<SequenceStep> create(int numAngles, int numPhases)
         throws ConfigurationException {
      return create(numAngles, numPhases, DEFAULT_WAVELENGTH);
   }

   /**
    * Add the SLM diffraction angle to existing experiment metadata
    */
   public static String describe(String metadata, double diffractionAngle) {
      String entry = String.format(Locale.ROOT, "SLM diff_angle %.3f", diffractionAngle);
      if (metadata == null || metadata.isEmpty()) {
         return entry;
      }
      return metadata + "; " + entry;
   }
}
