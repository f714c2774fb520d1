package org.micromanager.simsched.devices;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.micromanager.simsched.api.Resource;
import org.micromanager.simsched.api.UnavailableTimingException;
import org.micromanager.simsched.main.Time;

/**
 * Base for devices whose timing comes from a settings map, as written in the
 * device configuration. Keys are compared case insensitively.
 */
public abstract class ConfiguredDevice implements Resource {

   private final String name_;
   protected final Map<String, String> settings_;

   protected ConfiguredDevice(String name, Map<String, String> settings) {
      if (name == null || name.isEmpty()) {
         throw new IllegalArgumentException("Devices need a name");
      }
      name_ = name;
      LinkedHashMap<String, String> lower = new LinkedHashMap<String, String>();
      if (settings != null) {
         for (Map.Entry<String, String> e : settings.entrySet()) {
            lower.put(e.getKey().toLowerCase(), e.getValue());
         }
      }
      settings_ = Collections.unmodifiableMap(lower);
   }

   @Override
   public String getName() {
      return name_;
   }

   public Map<String, String> getSettings() {
      return settings_;
   }

   public boolean hasSetting(String key) {
      return settings_.containsKey(key.toLowerCase());
   }

   protected double getDouble(String key) throws UnavailableTimingException {
      String value = settings_.get(key.toLowerCase());
      if (value == null) {
         throw new UnavailableTimingException("missing '" + key + "' value for device " + name_);
      }
      try {
         double d = Double.parseDouble(value.trim());
         if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new UnavailableTimingException("'" + key + "' of " + name_ + " is not finite");
         }
         return d;
      } catch (NumberFormatException e) {
         throw new UnavailableTimingException("'" + key + "' of " + name_
               + " is not a number: " + value, e);
      }
   }

   protected double getDouble(String key, double defaultValue) throws UnavailableTimingException {
      return hasSetting(key) ? getDouble(key) : defaultValue;
   }

   /**
    * Millisecond setting as a Time. Negative values are rejected.
    */
   protected Time getTime(String key) throws UnavailableTimingException {
      String value = settings_.get(key.toLowerCase());
      if (value == null) {
         throw new UnavailableTimingException("missing '" + key + "' value for device " + name_);
      }
      BigDecimal ms;
      try {
         ms = new BigDecimal(value.trim());
      } catch (NumberFormatException e) {
         throw new UnavailableTimingException("'" + key + "' of " + name_
               + " is not a number: " + value, e);
      }
      if (ms.signum() < 0) {
         throw new UnavailableTimingException("'" + key + "' of " + name_ + " is negative: " + value);
      }
      try {
         return Time.ofMillis(ms);
      } catch (ArithmeticException e) {
         throw new UnavailableTimingException("'" + key + "' of " + name_ + " is too large: "
               + value, e);
      }
   }

   protected Time getTime(String key, Time defaultValue) throws UnavailableTimingException {
      return hasSetting(key) ? getTime(key) : defaultValue;
   }

   @Override
   public String toString() {
      return getClass().getSimpleName() + " " + name_;
   }
}
