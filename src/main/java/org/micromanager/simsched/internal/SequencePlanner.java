///////////////////////////////////////////////////////////////////////////////
// LICENSE:      This file is distributed under the BSD license.
//               License text is included with the source distribution.
//
//               This file is distributed in the hope that it will be useful,
//               but WITHOUT ANY WARRANTY; without even the implied warranty
//               of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
//
//               IN NO EVENT SHALL THE COPYRIGHT OWNER OR
//               CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT,
//               INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES.
//
package org.micromanager.simsched.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.micromanager.simsched.api.AnalogSettable;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.PatternGeneratorRegistry;
import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.api.ResourceTimingOracle;
import org.micromanager.simsched.api.Triggerable;
import org.micromanager.simsched.main.ActionPayload;
import org.micromanager.simsched.main.ActionTable;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.ExperimentPlan;
import org.micromanager.simsched.main.MotionTime;
import org.micromanager.simsched.main.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link ExperimentPlan} into an {@link ActionTable}. For every Z
 * slice the stage is moved and allowed to settle, then every step of the
 * pattern sequence is shown on the pattern generators and exposed on all
 * cameras at once. Finally the stage returns to the start of the stack.
 *
 * Planning only uses the timing estimates of the devices; no hardware is
 * touched. A planner produces exactly one table.
 */
public class SequencePlanner {

   private static final Logger LOGGER = LoggerFactory.getLogger(SequencePlanner.class);

   private final ResourceTimingOracle oracle_;
   private final PatternGeneratorRegistry patternGenerators_;
   private final LinkedHashMap<String, Integer> cameraToImageCount_ =
         new LinkedHashMap<String, Integer>();
   private final LinkedHashMap<String, List<Integer>> cameraToIgnoredImageIndices_ =
         new LinkedHashMap<String, List<Integer>>();
   private boolean used_ = false;
   private boolean debugMode_ = false;

   public SequencePlanner(ResourceTimingOracle oracle, PatternGeneratorRegistry patternGenerators) {
      if (oracle == null || patternGenerators == null) {
         throw new IllegalArgumentException("Timing oracle and pattern generator registry are required");
      }
      oracle_ = oracle;
      patternGenerators_ = patternGenerators;
   }

   public void setDebugMode(boolean debug) {
      debugMode_ = debug;
   }

   public boolean isDebugMode() {
      return debugMode_;
   }

   /**
    * Build the action table for a plan.
    *
    * @return a sealed table, in which entries are appended in time order
    * @throws ConfigurationException if the plan is invalid or any device can't
    * report a timing it needs. Nothing is returned in that case.
    * @throws IllegalStateException if this planner has already been used
    */
   public ActionTable generate(ExperimentPlan plan) throws ConfigurationException {
      if (used_) {
         throw new IllegalStateException("SequencePlanner instances generate a single table");
      }
      used_ = true;
      plan.validate();
      try {
         return buildTable(plan);
      } catch (ArithmeticException e) {
         // Time overflow from timings too large to schedule
         LOGGER.error("Schedule does not fit in the time range: {}", e.getMessage());
         throw new ConfigurationException("Device timings are too large to schedule: "
               + e.getMessage(), e);
      }
   }

   private ActionTable buildTable(ExperimentPlan plan) throws ConfigurationException {
      ActionTable table = new ActionTable(oracle_);
      List<Exposable> cameras = plan.getCameras();
      for (Exposable camera : cameras) {
         cameraToImageCount_.put(camera.getName(), 0);
         cameraToIgnoredImageIndices_.put(camera.getName(), new ArrayList<Integer>());
      }
      Time curTime = Time.ZERO;

      Set<Exposable> camsToReset = new LinkedHashSet<Exposable>();
      for (Exposable camera : cameras) {
         if (!plan.isCameraReady(camera)) {
            camsToReset.add(camera);
         }
      }
      if (!camsToReset.isEmpty()) {
         curTime = resetCameras(curTime, camsToReset, table);
      }

      Positionable zPositioner = plan.getZPositioner();
      if (zPositioner == null) {
         zPositioner = StationaryPositioner.INSTANCE;
      }
      // Attachment can change between runs, so look the clients up now
      List<AnalogSettable> analogClients = new ArrayList<AnalogSettable>();
      for (String group : plan.getPatternGroups()) {
         analogClients.addAll(patternGenerators_.getAnalogClients(group));
      }

      int numZSlices = plan.getNumZSlices();
      int numSteps = plan.getSequence().size();
      LOGGER.info("Planning {} Z slices x {} steps on {} cameras, {} pattern generator clients",
            numZSlices, numSteps, cameras.size(), analogClients.size());

      Double prevAltitude = null;
      for (int zIndex = 0; zIndex < numZSlices; zIndex++) {
         // Move to the next position, then wait for the stage to stabilize.
         // The move is scheduled when it starts.
         double zTarget = plan.getZTarget(zIndex);
         MotionTime motion = MotionTime.NONE;
         if (prevAltitude != null) {
            motion = oracle_.motionTime(zPositioner, prevAltitude, zTarget);
         }
         table.append(curTime, zPositioner, ActionPayload.moveAbsolute(zTarget));
         curTime = curTime.plus(motion.getMoveTime()).plus(motion.getSettleTime());
         prevAltitude = zTarget;
         if (debugMode_) {
            LOGGER.debug("Z slice {} at {}, stage settled at {}", zIndex, zTarget, curTime);
         }

         for (int i = 0; i < numSteps; i++) {
            for (AnalogSettable client : analogClients) {
               table.append(curTime, client, ActionPayload.custom(i));
            }
            curTime = expose(curTime, cameras, plan.getLights(), table);
            // Wait a few ms for any pattern generator triggers
            curTime = curTime.plus(plan.getTriggerDelay());
            if (debugMode_) {
               LOGGER.debug("Step {} of slice {} done at {}", i, zIndex, curTime);
            }
         }

         // Hold the Z position during the exposures
         table.append(curTime, zPositioner, ActionPayload.moveAbsolute(zTarget));
      }

      // Move back to the start so we're ready for the next rep
      MotionTime returnMotion = oracle_.motionTime(zPositioner, prevAltitude, plan.getZStart());
      curTime = curTime.plus(returnMotion.getMoveTime());
      table.append(curTime, zPositioner, ActionPayload.moveAbsolute(plan.getZStart()));

      // Hold flat for the settling time, and for any time the cameras still
      // need before they can expose again. Only matters when another rep
      // follows immediately.
      Time cameraReadyTime = Time.ZERO;
      if (plan.getNumReps() > 1) {
         for (Exposable camera : cameras) {
            cameraReadyTime = Time.max(cameraReadyTime, table.earliestAvailable(camera));
         }
      }
      Time holdTime = Time.max(curTime.plus(returnMotion.getSettleTime()), cameraReadyTime);
      table.append(holdTime, zPositioner, ActionPayload.moveAbsolute(plan.getZStart()));

      table.seal();
      LOGGER.info("Generated {} actions, repetition takes {}", table.size(),
            table.getRepetitionDuration());
      return table;
   }

   /**
    * Toggle each camera once so it is armed for the first real exposure. The
    * images produced by the toggle are recorded as ignored.
    *
    * @return time at which all reset cameras are ready
    */
   Time resetCameras(Time curTime, Set<Exposable> cameras, ActionTable table)
         throws ConfigurationException {
      Time readyTime = curTime;
      for (Exposable camera : cameras) {
         table.append(curTime, camera, ActionPayload.setDigital(true));
         List<Integer> ignored = cameraToIgnoredImageIndices_.get(camera.getName());
         if (ignored == null) {
            ignored = new ArrayList<Integer>();
            cameraToIgnoredImageIndices_.put(camera.getName(), ignored);
         }
         ignored.add(incrementImageCount(camera));
         readyTime = Time.max(readyTime, curTime.plus(oracle_.resetTime(camera)));
         readyTime = Time.max(readyTime, table.earliestAvailable(camera));
      }
      LOGGER.debug("Reset {} cameras, ready at {}", cameras.size(), readyTime);
      return readyTime;
   }

   /**
    * Expose all cameras at once, with every light on.
    *
    * Triggers are sent at curTime even if a camera is still busy, but the
    * returned end time covers the real busy period so that later actions wait
    * for it.
    *
    * @return time at which the exposure is over on all cameras
    */
   Time expose(Time curTime, List<Exposable> cameras, List<Triggerable> lights,
               ActionTable table) throws ConfigurationException {
      Time maxAcqTime = Time.ZERO;
      Time lastReady = Time.ZERO;

      for (Exposable camera : cameras) {
         Time exposure = oracle_.exposureTime(camera);
         // has to be read after the exposure is set, not at initialization
         Time waiting = oracle_.interExposureGap(camera);
         maxAcqTime = Time.max(maxAcqTime, exposure.plus(waiting));
         lastReady = Time.max(lastReady, table.earliestAvailable(camera));
      }

      for (Triggerable light : lights) {
         table.append(curTime, light, ActionPayload.setDigital(true));
      }
      for (Exposable camera : cameras) {
         table.append(curTime, camera, ActionPayload.setDigital(true));
         incrementImageCount(camera);
      }

      return Time.max(lastReady, curTime.plus(maxAcqTime));
   }

   private int incrementImageCount(Exposable camera) {
      Integer count = cameraToImageCount_.get(camera.getName());
      int index = count == null ? 0 : count;
      cameraToImageCount_.put(camera.getName(), index + 1);
      return index;
   }

   /**
    * Images each camera will produce, including ignored ones
    */
   public Map<String, Integer> getCameraImageCounts() {
      return Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(cameraToImageCount_));
   }

   /**
    * Indices of images that come from camera resets and should be discarded
    */
   public List<Integer> getIgnoredImageIndices(String cameraName) {
      List<Integer> ignored = cameraToIgnoredImageIndices_.get(cameraName);
      if (ignored == null) {
         return Collections.emptyList();
      }
      return Collections.unmodifiableList(new ArrayList<Integer>(ignored));
   }
}
