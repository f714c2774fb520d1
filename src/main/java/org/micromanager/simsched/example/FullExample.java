package org.micromanager.simsched.example;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.micromanager.simsched.internal.DescriptorTimingOracle;
import org.micromanager.simsched.internal.SequencePlanner;
import org.micromanager.simsched.main.ActionTable;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.util.PlanConfiguration;

/**
 * This class demonstrates how to plan a structured illumination acquisition
 */
public class FullExample {

   public static final String EXAMPLE_CONFIG = "cryosim.json";

   public static ActionTable run() throws ConfigurationException, IOException {
      // Devices and the experiment are described in a JSON configuration.
      // Reading it gives a registry holding this run's devices, and the plan.
      PlanConfiguration config = PlanConfiguration.fromJSON(readExampleConfig());

      // Timings are read from the device descriptors as the plan is built.
      // The registry also tells the planner which modulators are attached to
      // the "slm" and "rotor" groups the plan drives.
      SequencePlanner planner = new SequencePlanner(new DescriptorTimingOracle(),
            config.getRegistry());

      // Planning either returns a complete, sealed table or throws. The table
      // can then be handed to an executor, which replays it against hardware
      return planner.generate(config.getPlan());
   }

   static String readExampleConfig() throws IOException {
      try (InputStream in = FullExample.class.getResourceAsStream(EXAMPLE_CONFIG)) {
         if (in == null) {
            throw new IOException("Missing example configuration " + EXAMPLE_CONFIG);
         }
         return new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
   }

   public static void main(String[] args) throws Exception {
      ActionTable table = run();
      System.out.print(table.dump());
   }
}
