package org.micromanager.simsched.main;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.api.Triggerable;

/**
 * Description of one structured illumination acquisition: the pattern
 * sequence to visit at every Z slice, the Z stack geometry and the devices
 * taking part. Built once, consumed by a single planning run.
 *
 * @see org.micromanager.simsched.internal.SequencePlanner
 */
public class ExperimentPlan {

   public static final Time DEFAULT_TRIGGER_DELAY = Time.ofMillis(5);
   // Volumes at most this tall are treated as 2D
   public static final double DEFAULT_FLAT_VOLUME_THRESHOLD = 1e-6;

   private final List<SequenceStep> sequence_;
   private final double zStart_;
   private final double zHeight_;
   private final double sliceHeight_;
   private final int numReps_;
   private final List<Exposable> cameras_;
   private final List<Triggerable> lights_;
   private final Positionable zPositioner_;
   private final List<String> patternGroups_;
   private final Set<String> readyCameras_;
   private final Time triggerDelay_;
   private final double flatVolumeThreshold_;
   private final String metadata_;

   private ExperimentPlan(Builder b) {
      sequence_ = Collections.unmodifiableList(new ArrayList<SequenceStep>(b.sequence_));
      zStart_ = b.zStart_;
      zHeight_ = b.zHeight_;
      sliceHeight_ = b.sliceHeight_;
      numReps_ = b.numReps_;
      cameras_ = Collections.unmodifiableList(new ArrayList<Exposable>(b.cameras_));
      lights_ = Collections.unmodifiableList(new ArrayList<Triggerable>(b.lights_));
      zPositioner_ = b.zPositioner_;
      patternGroups_ = Collections.unmodifiableList(new ArrayList<String>(b.patternGroups_));
      readyCameras_ = Collections.unmodifiableSet(new LinkedHashSet<String>(b.readyCameras_));
      triggerDelay_ = b.triggerDelay_;
      flatVolumeThreshold_ = b.flatVolumeThreshold_;
      metadata_ = b.metadata_;
   }

   public static Builder builder() {
      return new Builder();
   }

   /**
    * Check everything the planner relies on.
    */
   public void validate() throws ConfigurationException {
      if (sequence_.isEmpty()) {
         throw new ConfigurationException("Pattern sequence is empty");
      }
      if (cameras_.isEmpty()) {
         throw new ConfigurationException("At least one camera is required");
      }
      if (numReps_ < 1) {
         throw new ConfigurationException("Number of repetitions must be at least 1, got " + numReps_);
      }
      if (Double.isNaN(zStart_) || Double.isInfinite(zStart_)) {
         throw new ConfigurationException("Z start must be finite");
      }
      // used for the Z targets even when the plan is flat
      if (Double.isNaN(sliceHeight_) || Double.isInfinite(sliceHeight_)) {
         throw new ConfigurationException("Slice height must be finite, got " + sliceHeight_);
      }
      if (triggerDelay_ == null) {
         throw new ConfigurationException("Missing trigger delay");
      }
      getNumZSlices();
   }

   /**
    * Number of Z slices to image: the volume divided into slices of the
    * configured height, at least one. A volume taller than the flat volume
    * threshold gets one extra slice so that its top is captured. A zero
    * height plan, or a flat one without a slice height, has one slice.
    */
   public int getNumZSlices() throws ConfigurationException {
      if (Double.isNaN(zHeight_) || Double.isInfinite(zHeight_) || zHeight_ < 0) {
         throw new ConfigurationException("Z height must be a non-negative number, got " + zHeight_);
      }
      boolean flat = zHeight_ <= flatVolumeThreshold_;
      if (flat && (zHeight_ == 0 || !(sliceHeight_ > 0))) {
         return 1;
      }
      if (!(sliceHeight_ > 0) || Double.isInfinite(sliceHeight_)) {
         throw new ConfigurationException("Slice height must be positive for a Z stack, got "
               + sliceHeight_);
      }
      // decimal division so that e.g. 1.0 / 0.1 is exactly 10
      BigDecimal slices = BigDecimal.valueOf(zHeight_)
            .divide(BigDecimal.valueOf(sliceHeight_), 0, RoundingMode.CEILING);
      try {
         int numSlices = Math.max(1, slices.intValueExact());
         return flat ? numSlices : Math.addExact(numSlices, 1);
      } catch (ArithmeticException e) {
         throw new ConfigurationException("Too many Z slices: " + slices, e);
      }
   }

   /**
    * Z position of a slice, in microns
    */
   public double getZTarget(int zIndex) {
      return zStart_ + sliceHeight_ * zIndex;
   }

   public List<SequenceStep> getSequence() {
      return sequence_;
   }

   public double getZStart() {
      return zStart_;
   }

   public double getZHeight() {
      return zHeight_;
   }

   public double getSliceHeight() {
      return sliceHeight_;
   }

   public int getNumReps() {
      return numReps_;
   }

   public List<Exposable> getCameras() {
      return cameras_;
   }

   public List<Triggerable> getLights() {
      return lights_;
   }

   /**
    * @return the Z stage, or null if the plan does not move one
    */
   public Positionable getZPositioner() {
      return zPositioner_;
   }

   /**
    * Names of the executor groups whose analog clients get a sequence index
    * at every step, e.g. "slm" and "rotor".
    */
   public List<String> getPatternGroups() {
      return patternGroups_;
   }

   public boolean isCameraReady(Exposable camera) {
      return readyCameras_.contains(camera.getName());
   }

   /**
    * Pause after each exposure so pattern generators can latch before the
    * next trigger.
    */
   public Time getTriggerDelay() {
      return triggerDelay_;
   }

   public double getFlatVolumeThreshold() {
      return flatVolumeThreshold_;
   }

   public String getMetadata() {
      return metadata_;
   }

   public static class Builder {

      private List<SequenceStep> sequence_ = new ArrayList<SequenceStep>();
      private double zStart_ = 0;
      private double zHeight_ = 0;
      private double sliceHeight_ = 0;
      private int numReps_ = 1;
      private List<Exposable> cameras_ = new ArrayList<Exposable>();
      private List<Triggerable> lights_ = new ArrayList<Triggerable>();
      private Positionable zPositioner_ = null;
      private List<String> patternGroups_ = new ArrayList<String>();
      private Set<String> readyCameras_ = new LinkedHashSet<String>();
      private Time triggerDelay_ = DEFAULT_TRIGGER_DELAY;
      private double flatVolumeThreshold_ = DEFAULT_FLAT_VOLUME_THRESHOLD;
      private String metadata_ = "";

      private Builder() {
      }

      public Builder sequence(List<SequenceStep> sequence) {
         sequence_ = new ArrayList<SequenceStep>(sequence);
         return this;
      }

      public Builder zStack(double zStart, double zHeight, double sliceHeight) {
         zStart_ = zStart;
         zHeight_ = zHeight;
         sliceHeight_ = sliceHeight;
         return this;
      }

      public Builder numReps(int numReps) {
         numReps_ = numReps;
         return this;
      }

      public Builder camera(Exposable camera) {
         cameras_.add(camera);
         return this;
      }

      public Builder light(Triggerable light) {
         lights_.add(light);
         return this;
      }

      public Builder zPositioner(Positionable zPositioner) {
         zPositioner_ = zPositioner;
         return this;
      }

      public Builder patternGroup(String group) {
         patternGroups_.add(group);
         return this;
      }

      /**
       * Mark a camera as already armed, so it will not be reset before the
       * first exposure.
       */
      public Builder readyCamera(String cameraName) {
         readyCameras_.add(cameraName);
         return this;
      }

      public Builder triggerDelay(Time triggerDelay) {
         triggerDelay_ = triggerDelay;
         return this;
      }

      public Builder flatVolumeThreshold(double threshold) {
         flatVolumeThreshold_ = threshold;
         return this;
      }

      public Builder metadata(String metadata) {
         metadata_ = metadata == null ? "" : metadata;
         return this;
      }

      public ExperimentPlan build() {
         return new ExperimentPlan(this);
      }
   }
}
