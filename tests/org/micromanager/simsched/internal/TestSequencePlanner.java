package org.micromanager.simsched.internal;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import mmcorej.org.json.JSONObject;
import org.junit.Assert;
import org.junit.Test;
import org.micromanager.simsched.FakeDevices;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.Resource;
import org.micromanager.simsched.main.ActionEntry;
import org.micromanager.simsched.main.ActionPayload;
import org.micromanager.simsched.main.ActionTable;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.ExperimentPlan;
import org.micromanager.simsched.main.Time;
import org.micromanager.simsched.util.SimSequences;

public class TestSequencePlanner {

   private final DeviceRegistry registry_ = new DeviceRegistry();
   private final FakeDevices.Camera camera_ = new FakeDevices.Camera("Camera", 50, 10);
   private final FakeDevices.Light light_ = new FakeDevices.Light("488nm");

   private ActionTable generate(ExperimentPlan plan) throws ConfigurationException {
      return new SequencePlanner(new DescriptorTimingOracle(), registry_).generate(plan);
   }

   private static List<ActionEntry> entriesMatching(ActionTable table, Resource target,
                                                    ActionPayload.Kind kind) {
      List<ActionEntry> list = new ArrayList<ActionEntry>();
      for (ActionEntry e : table.entriesFor(target)) {
         if (e.getPayload().getKind() == kind) {
            list.add(e);
         }
      }
      return list;
   }

   private ExperimentPlan.Builder flatPlan(int numAngles, int numPhases)
         throws ConfigurationException {
      return ExperimentPlan.builder()
            .sequence(SimSequences.create(numAngles, numPhases))
            .camera(camera_)
            .light(light_)
            .readyCamera(camera_.getName());
   }

   @Test
   public void testTwoStepsOneCamera() throws Exception {
      ActionTable table = generate(flatPlan(2, 1).build());

      List<ActionEntry> cameraTriggers = table.entriesFor(camera_);
      List<ActionEntry> lightTriggers = table.entriesFor(light_);
      Assert.assertEquals(2, cameraTriggers.size());
      Assert.assertEquals(2, lightTriggers.size());
      Assert.assertEquals(Time.ZERO, cameraTriggers.get(0).getTime());
      Assert.assertEquals(Time.ZERO, lightTriggers.get(0).getTime());
      // 50 exposure + 10 readout + 5 trigger delay
      Assert.assertEquals(Time.ofMillis(65), cameraTriggers.get(1).getTime());
      Assert.assertEquals(Time.ofMillis(65), lightTriggers.get(1).getTime());
      Assert.assertEquals(ActionPayload.setDigital(true), cameraTriggers.get(1).getPayload());

      ActionEntry finalHold = table.entries().get(table.size() - 1);
      Assert.assertFalse(finalHold.getTime().isBefore(Time.ofMillis(125)));
      Assert.assertEquals(Time.ofMillis(130), finalHold.getTime());
      Assert.assertEquals(ActionPayload.moveAbsolute(0), finalHold.getPayload());
      Assert.assertTrue(table.isSealed());
   }

   @Test
   public void testStageMoveScheduledWhenItStarts() throws Exception {
      FakeDevices.Stage stage = new FakeDevices.Stage("Z", 20, 5);
      ActionTable table = generate(flatPlan(1, 1)
            .zStack(0, 10, 10)
            .zPositioner(stage)
            .build());

      List<ActionEntry> entries = table.entries();
      int moveIndex = entries.indexOf(new ActionEntry(findMoveTo(table, stage, 10).getTime(),
            stage, ActionPayload.moveAbsolute(10)));
      Time moveStart = entries.get(moveIndex).getTime();
      // the slice before ended with a hold at the same time
      Assert.assertEquals(ActionPayload.moveAbsolute(0), entries.get(moveIndex - 1).getPayload());
      Assert.assertEquals(moveStart, entries.get(moveIndex - 1).getTime());

      ActionEntry next = entries.get(moveIndex + 1);
      Assert.assertEquals(moveStart.plus(Time.ofMillis(25)), next.getTime());
      for (ActionEntry e : entries.subList(moveIndex + 1, entries.size())) {
         Assert.assertFalse(e.getTime().isBefore(moveStart.plus(Time.ofMillis(25))));
      }
   }

   private static ActionEntry findMoveTo(ActionTable table, Resource stage, double z) {
      for (ActionEntry e : table.entriesFor(stage)) {
         if (e.getPayload().getKind() == ActionPayload.Kind.MOVE_ABSOLUTE
               && e.getPayload().getValue() == z) {
            return e;
         }
      }
      throw new AssertionError("no move to " + z);
   }

   @Test
   public void testReturnMoveAndFinalHold() throws Exception {
      FakeDevices.Stage stage = new FakeDevices.Stage("Z", 20, 5);
      ActionTable table = generate(flatPlan(1, 1)
            .zStack(2, 1, 1)
            .zPositioner(stage)
            .build());
      List<ActionEntry> moves = table.entriesFor(stage);
      // 2 slices x (move + hold) + return + final hold
      Assert.assertEquals(6, moves.size());
      ActionEntry lastHold = moves.get(3);
      ActionEntry returnMove = moves.get(4);
      ActionEntry finalHold = moves.get(5);
      Assert.assertEquals(ActionPayload.moveAbsolute(3), lastHold.getPayload());
      Assert.assertEquals(ActionPayload.moveAbsolute(2), returnMove.getPayload());
      Assert.assertEquals(lastHold.getTime().plus(Time.ofMillis(20)), returnMove.getTime());
      Assert.assertEquals(returnMove.getTime().plus(Time.ofMillis(5)), finalHold.getTime());
      Assert.assertEquals(finalHold.getTime(), table.getRepetitionDuration());
   }

   @Test
   public void testZSliceCounts() throws Exception {
      FakeDevices.Stage stage = new FakeDevices.Stage("Z", 1, 1);
      ActionTable flat = generate(flatPlan(1, 1).zStack(0, 0, 1).zPositioner(stage).build());
      // one slice: move, hold, return, final hold
      Assert.assertEquals(4, entriesMatching(flat, stage, ActionPayload.Kind.MOVE_ABSOLUTE).size());
      Assert.assertEquals(1, flat.entriesFor(camera_).size());

      ActionTable volume = generate(flatPlan(1, 1).zStack(0, 2, 1).zPositioner(stage).build());
      // 2 slices plus one for the top of the volume
      Assert.assertEquals(3 * 2 + 2,
            entriesMatching(volume, stage, ActionPayload.Kind.MOVE_ABSOLUTE).size());
      Assert.assertEquals(3, volume.entriesFor(camera_).size());
   }

   @Test
   public void testPerResourceTimesNeverDecrease() throws Exception {
      FakeDevices.Camera slow = new FakeDevices.Camera("Slow camera", 120, 30);
      FakeDevices.Modulator slm = new FakeDevices.Modulator("slm");
      registry_.attachAnalogClient("slm", slm);
      ActionTable table = generate(ExperimentPlan.builder()
            .sequence(SimSequences.create(3, 5))
            .camera(camera_)
            .camera(slow)
            .light(light_)
            .zPositioner(new FakeDevices.Stage("Z", 7, 3))
            .zStack(0, 1.5, 0.5)
            .patternGroup("slm")
            .build());

      Map<String, Time> lastTimes = new HashMap<String, Time>();
      for (ActionEntry e : table) {
         Time previous = lastTimes.get(e.getTarget().getName());
         if (previous != null) {
            Assert.assertFalse(e + " before " + previous, e.getTime().isBefore(previous));
         }
         lastTimes.put(e.getTarget().getName(), e.getTime());
      }
      // triggers and moves are appended in time order overall
      Time previous = Time.ZERO;
      for (ActionEntry e : table) {
         Assert.assertFalse(e.getTime().isBefore(previous));
         previous = e.getTime();
      }
      Assert.assertEquals(table.entries(), table.sortedEntries());
   }

   @Test
   public void testCamerasAreNeverDoubleBooked() throws Exception {
      FakeDevices.Camera fast = new FakeDevices.Camera("Fast camera", 5, 1);
      FakeDevices.Camera slow = new FakeDevices.Camera("Slow camera", 80, 33);
      ActionTable table = generate(ExperimentPlan.builder()
            .sequence(SimSequences.create(3, 3))
            .camera(fast)
            .camera(slow)
            .zPositioner(new FakeDevices.Stage("Z", 4, 2))
            .zStack(0, 3, 1)
            .numReps(3)
            .build());

      for (FakeDevices.Camera camera : new FakeDevices.Camera[]{fast, slow}) {
         Time busy = camera.exposure_.plus(camera.gap_);
         List<ActionEntry> triggers = table.entriesFor(camera);
         // one reset plus 4 slices of 9 steps
         Assert.assertEquals(1 + 4 * 9, triggers.size());
         for (int i = 1; i < triggers.size(); i++) {
            Assert.assertFalse(triggers.get(i).getTime()
                  .isBefore(triggers.get(i - 1).getTime().plus(busy)));
         }
      }
   }

   @Test
   public void testPlanningIsRepeatable() throws Exception {
      FakeDevices.Modulator slm = new FakeDevices.Modulator("slm");
      FakeDevices.Modulator rotor = new FakeDevices.Modulator("rotor");
      registry_.attachAnalogClient("slm", slm);
      registry_.attachAnalogClient("rotor", rotor);
      ExperimentPlan plan = ExperimentPlan.builder()
            .sequence(SimSequences.create(3, 5))
            .camera(camera_)
            .light(light_)
            .zPositioner(new FakeDevices.Stage("Z", 3, 1))
            .zStack(-0.3, 0.9, 0.3)
            .patternGroup("slm")
            .patternGroup("rotor")
            .triggerDelay(Time.parse("0.1"))
            .numReps(2)
            .build();

      ActionTable first = generate(plan);
      ActionTable second = generate(plan);
      Assert.assertEquals(first.entries(), second.entries());
      Assert.assertEquals(first.dump(), second.dump());
      Assert.assertEquals(first.toJSON().toString(), second.toJSON().toString());
   }

   @Test
   public void testPatternGeneratorsGetStepIndex() throws Exception {
      FakeDevices.Modulator slm = new FakeDevices.Modulator("slm");
      FakeDevices.Modulator rotor = new FakeDevices.Modulator("rotor");
      registry_.attachAnalogClient("slm", slm);
      registry_.attachAnalogClient("rotor", rotor);
      ActionTable table = generate(flatPlan(2, 3).patternGroup("slm").patternGroup("rotor").build());

      List<ActionEntry> slmEntries = table.entriesFor(slm);
      List<ActionEntry> cameraTriggers = table.entriesFor(camera_);
      Assert.assertEquals(6, slmEntries.size());
      Assert.assertEquals(6, table.entriesFor(rotor).size());
      for (int i = 0; i < 6; i++) {
         Assert.assertEquals(ActionPayload.custom(i), slmEntries.get(i).getPayload());
         // pattern is set when the exposure starts
         Assert.assertEquals(cameraTriggers.get(i).getTime(), slmEntries.get(i).getTime());
      }
   }

   @Test
   public void testUnusedGroupsAndLateAttachment() throws Exception {
      FakeDevices.Modulator slm = new FakeDevices.Modulator("slm");
      ExperimentPlan plan = flatPlan(1, 2).patternGroup("slm").build();

      ActionTable before = generate(plan);
      Assert.assertTrue(before.entriesFor(slm).isEmpty());

      registry_.attachAnalogClient("slm", slm);
      ActionTable after = generate(plan);
      Assert.assertEquals(2, after.entriesFor(slm).size());
      // "rotor" is not in the plan, so its clients are left alone
      FakeDevices.Modulator rotor = new FakeDevices.Modulator("rotor");
      registry_.attachAnalogClient("rotor", rotor);
      Assert.assertTrue(generate(plan).entriesFor(rotor).isEmpty());
   }

   @Test
   public void testResetCameras() throws Exception {
      camera_.reset_ = Time.ofMillis(100);
      SequencePlanner planner = new SequencePlanner(new DescriptorTimingOracle(), registry_);
      ActionTable table = planner.generate(ExperimentPlan.builder()
            .sequence(SimSequences.create(1, 2))
            .camera(camera_)
            .light(light_)
            .build());

      List<ActionEntry> triggers = table.entriesFor(camera_);
      Assert.assertEquals(3, triggers.size());
      Assert.assertEquals(Time.ZERO, triggers.get(0).getTime());
      Assert.assertEquals(Time.ofMillis(100), triggers.get(1).getTime());
      // lights are not switched on for the reset
      Assert.assertEquals(Time.ofMillis(100), table.entriesFor(light_).get(0).getTime());
      Assert.assertEquals(Integer.valueOf(3), planner.getCameraImageCounts().get("Camera"));
      Assert.assertEquals(1, planner.getIgnoredImageIndices("Camera").size());
      Assert.assertEquals(Integer.valueOf(0), planner.getIgnoredImageIndices("Camera").get(0));
   }

   @Test
   public void testShortResetWaitsForCamera() throws Exception {
      camera_.reset_ = Time.ofMillis(1);
      ActionTable table = generate(ExperimentPlan.builder()
            .sequence(SimSequences.create(1, 1))
            .camera(camera_)
            .build());
      List<ActionEntry> triggers = table.entriesFor(camera_);
      Assert.assertEquals(Time.ofMillis(60), triggers.get(1).getTime());
   }

   @Test
   public void testRepeatedPlanWaitsForCameras() throws Exception {
      FakeDevices.Camera slow = new FakeDevices.Camera("Slow camera", 500, 100);
      ExperimentPlan.Builder builder = ExperimentPlan.builder()
            .sequence(SimSequences.create(1, 1))
            .camera(slow)
            .readyCamera(slow.getName())
            .zPositioner(new FakeDevices.Stage("Z", 1, 1));

      ActionTable single = generate(builder.numReps(1).build());
      ActionTable repeated = generate(builder.numReps(2).build());
      // single rep: cursor after exposure and trigger delay, plus return move and settle
      Assert.assertEquals(Time.ofMillis(607), single.getRepetitionDuration());
      Assert.assertEquals(Time.ofMillis(607), repeated.getRepetitionDuration());

      slow.gap_ = Time.ofMillis(100);
      FakeDevices.Camera other = new FakeDevices.Camera("Other camera", 10, 0);
      ActionTable twoCameras = generate(ExperimentPlan.builder()
            .sequence(SimSequences.create(1, 1))
            .camera(other)
            .camera(slow)
            .readyCamera(other.getName())
            .readyCamera(slow.getName())
            .triggerDelay(Time.ZERO)
            .numReps(2)
            .build());
      Time ready = Time.ZERO;
      for (Exposable camera : new Exposable[]{other, slow}) {
         ready = Time.max(ready, twoCameras.earliestAvailable(camera));
      }
      Assert.assertFalse(twoCameras.getRepetitionDuration().isBefore(ready));
   }

   @Test
   public void testMissingTimingAbortsPlanning() throws Exception {
      camera_.gap_ = null;
      SequencePlanner planner = new SequencePlanner(new DescriptorTimingOracle(), registry_);
      try {
         planner.generate(flatPlan(1, 1).build());
         Assert.fail("planning must fail without a readout time");
      } catch (ConfigurationException e) {
         Assert.assertTrue(e.getMessage().contains("Camera"));
      }
   }

   @Test(expected = IllegalStateException.class)
   public void testPlannerIsSingleUse() throws Exception {
      SequencePlanner planner = new SequencePlanner(new DescriptorTimingOracle(), registry_);
      ExperimentPlan plan = flatPlan(1, 1).build();
      planner.generate(plan);
      planner.generate(plan);
   }

   @Test
   public void testInvalidPlanIsRejectedBeforePlanning() throws Exception {
      SequencePlanner planner = new SequencePlanner(new DescriptorTimingOracle(), registry_);
      try {
         planner.generate(flatPlan(1, 1).zStack(0, 5, 0).build());
         Assert.fail();
      } catch (ConfigurationException e) {
         Assert.assertTrue(planner.getCameraImageCounts().isEmpty());
      }
   }

   @Test
   public void testNoStageUsesStationaryPlaceholder() throws Exception {
      ActionTable table = generate(flatPlan(1, 1).build());
      int stationary = 0;
      for (ActionEntry e : table) {
         if (e.getTarget().getName().equals(StationaryPositioner.NAME)) {
            stationary++;
         }
      }
      Assert.assertEquals(4, stationary);
   }

   @Test
   public void testPlannedTablesReadBack() throws Exception {
      registry_.register(camera_);
      registry_.register(light_);
      ActionTable flat = generate(flatPlan(2, 1).build());
      ActionTable flatCopy = ActionTable.fromJSON(new JSONObject(flat.toJSON().toString()),
            registry_);
      Assert.assertEquals(flat.sortedEntries(), flatCopy.sortedEntries());
      Assert.assertEquals(flat.dump(), flatCopy.dump());
      Assert.assertSame(StationaryPositioner.INSTANCE,
            flatCopy.sortedEntries().get(0).getTarget());

      FakeDevices.Stage stage = new FakeDevices.Stage("Z", 20, 5);
      registry_.register(stage);
      ActionTable volume = generate(flatPlan(1, 2).zStack(0, 10, 5).zPositioner(stage).build());
      ActionTable volumeCopy = ActionTable.fromJSON(volume.toJSON(), registry_);
      Assert.assertEquals(volume.dump(), volumeCopy.dump());
      Assert.assertEquals(volume.getRepetitionDuration(), volumeCopy.getRepetitionDuration());
   }

   @Test
   public void testTimingOverflowIsAConfigurationError() throws Exception {
      camera_.exposure_ = Time.parse("9000000000000");
      camera_.gap_ = Time.ZERO;
      try {
         generate(flatPlan(2, 1).build());
         Assert.fail("planning must fail when the schedule overflows");
      } catch (ConfigurationException e) {
         Assert.assertTrue(e.getCause() instanceof ArithmeticException);
      }
   }

   @Test(expected = ConfigurationException.class)
   public void testNonFiniteSliceHeightOnFlatPlan() throws Exception {
      generate(flatPlan(1, 1).zStack(0, 0, Double.NaN).build());
   }
}
