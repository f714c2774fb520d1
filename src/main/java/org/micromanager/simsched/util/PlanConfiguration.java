package org.micromanager.simsched.util;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import mmcorej.org.json.JSONArray;
import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;
import org.micromanager.simsched.api.AnalogSettable;
import org.micromanager.simsched.api.Exposable;
import org.micromanager.simsched.api.Positionable;
import org.micromanager.simsched.api.Triggerable;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.devices.ConfiguredCamera;
import org.micromanager.simsched.devices.ConfiguredLight;
import org.micromanager.simsched.devices.ConfiguredModulator;
import org.micromanager.simsched.devices.ConfiguredStageAxis;
import org.micromanager.simsched.internal.DeviceRegistry;
import org.micromanager.simsched.main.ConfigurationException;
import org.micromanager.simsched.main.ExperimentPlan;
import org.micromanager.simsched.main.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the devices and experiment of a single run from JSON:
 * <pre>
 * {
 *   "devices": [
 *     {"name": "Camera", "type": "camera", "settings": {"exposure": 50, "time-between-exposures": 10}},
 *     {"name": "slm", "type": "modulator", "group": "slm", "settings": {"settlingtime": 10}},
 *     ...
 *   ],
 *   "experiment": {
 *     "numAngles": 3, "numPhases": 5, "zStart": 0, "zHeight": 2, "sliceHeight": 0.5,
 *     "cameras": ["Camera"], "lights": ["488nm"], "zPositioner": "Z",
 *     "patternGroups": ["slm", "rotor"]
 *   }
 * }
 * </pre>
 */
public class PlanConfiguration {

   private static final Logger LOGGER = LoggerFactory.getLogger(PlanConfiguration.class);

   public static final String CAMERA = "camera";
   public static final String LIGHT = "light";
   public static final String STAGE = "stage";
   public static final String MODULATOR = "modulator";

   private final DeviceRegistry registry_;
   private final ExperimentPlan plan_;

   private PlanConfiguration(DeviceRegistry registry, ExperimentPlan plan) {
      registry_ = registry;
      plan_ = plan;
   }

   public DeviceRegistry getRegistry() {
      return registry_;
   }

   public ExperimentPlan getPlan() {
      return plan_;
   }

   public static PlanConfiguration fromJSON(String text) throws ConfigurationException {
      try {
         return fromJSON(new JSONObject(text));
      } catch (JSONException ex) {
         throw new ConfigurationException("Experiment configuration is not valid JSON: "
               + ex.getMessage(), ex);
      }
   }

   public static PlanConfiguration fromJSON(JSONObject json) throws ConfigurationException {
      try {
         DeviceRegistry registry = new DeviceRegistry();
         JSONArray devices = json.getJSONArray("devices");
         for (int i = 0; i < devices.length(); i++) {
            readDevice(devices.getJSONObject(i), registry);
         }
         ExperimentPlan plan = readExperiment(json.getJSONObject("experiment"), registry);
         LOGGER.info("Read {} devices, {} step sequence", registry.getResources().size(),
               plan.getSequence().size());
         return new PlanConfiguration(registry, plan);
      } catch (JSONException ex) {
         throw new ConfigurationException("Malformed experiment configuration: "
               + ex.getMessage(), ex);
      }
   }

   private static void readDevice(JSONObject device, DeviceRegistry registry)
         throws JSONException, ConfigurationException {
      String name = device.getString("name");
      String type = device.getString("type");
      Map<String, String> settings = new LinkedHashMap<String, String>();
      JSONObject settingsJSON = device.optJSONObject("settings");
      if (settingsJSON != null) {
         Iterator<String> keys = settingsJSON.keys();
         while (keys.hasNext()) {
            String key = keys.next();
            settings.put(key, settingsJSON.get(key).toString());
         }
      }
      if (registry.contains(name)) {
         throw new ConfigurationException("Device " + name + " is defined more than once");
      }
      if (CAMERA.equals(type)) {
         registry.register(new ConfiguredCamera(name, settings));
      } else if (LIGHT.equals(type)) {
         registry.register(new ConfiguredLight(name, settings));
      } else if (STAGE.equals(type)) {
         registry.register(new ConfiguredStageAxis(name, settings));
      } else if (MODULATOR.equals(type)) {
         ConfiguredModulator modulator = new ConfiguredModulator(name, settings);
         registry.register(modulator);
         if (device.has("group")) {
            registry.attachAnalogClient(device.getString("group"), modulator);
         }
      } else {
         throw new ConfigurationException("Unknown type '" + type + "' for device " + name);
      }
   }

   private static ExperimentPlan readExperiment(JSONObject exp, DeviceRegistry registry)
         throws JSONException, ConfigurationException {
      ExperimentPlan.Builder builder = ExperimentPlan.builder()
            .sequence(SimSequences.create(exp.getInt("numAngles"), exp.getInt("numPhases"),
                  exp.optDouble("wavelength", SimSequences.DEFAULT_WAVELENGTH)))
            .zStack(exp.optDouble("zStart", 0), exp.optDouble("zHeight", 0),
                  exp.optDouble("sliceHeight", 0))
            .numReps(exp.optInt("numReps", 1));
      if (exp.has("flatVolumeThreshold")) {
         builder.flatVolumeThreshold(exp.getDouble("flatVolumeThreshold"));
      }
      if (exp.has("triggerDelay")) {
         try {
            builder.triggerDelay(Time.parse(exp.get("triggerDelay").toString()));
         } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ConfigurationException("Invalid trigger delay: " + e.getMessage(), e);
         }
      }
      JSONArray cameras = exp.getJSONArray("cameras");
      for (int i = 0; i < cameras.length(); i++) {
         builder.camera(registry.getResource(cameras.getString(i), Exposable.class));
      }
      JSONArray lights = exp.optJSONArray("lights");
      for (int i = 0; lights != null && i < lights.length(); i++) {
         builder.light(registry.getResource(lights.getString(i), Triggerable.class));
      }
      if (exp.has("zPositioner")) {
         builder.zPositioner(registry.getResource(exp.getString("zPositioner"),
               Positionable.class));
      }
      String metadata = exp.optString("metadata", "");
      JSONArray groups = exp.optJSONArray("patternGroups");
      for (int i = 0; groups != null && i < groups.length(); i++) {
         String group = groups.getString(i);
         builder.patternGroup(group);
         for (AnalogSettable client : registry.getAnalogClients(group)) {
            if (client instanceof ConfiguredModulator) {
               metadata = describeModulator((ConfiguredModulator) client, metadata);
            }
         }
      }
      JSONArray ready = exp.optJSONArray("readyCameras");
      for (int i = 0; ready != null && i < ready.length(); i++) {
         builder.readyCamera(ready.getString(i));
      }
      return builder.metadata(metadata).build();
   }

   private static String describeModulator(ConfiguredModulator modulator, String metadata)
         throws ConfigurationException {
      try {
         Double angle = modulator.getDiffractionAngle();
         return angle == null ? metadata : SimSequences.describe(metadata, angle);
      } catch (UnavailableTimingException e) {
         throw new ConfigurationException(e.getMessage(), e);
      }
   }
}
