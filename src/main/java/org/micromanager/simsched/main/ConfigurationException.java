package org.micromanager.simsched.main;

/**
 * A planning run can not proceed because a timing parameter or part of the
 * experiment description is missing or invalid. Retrying with the same input
 * gives the same result, so callers should report it rather than retry.
 */
public class ConfigurationException extends Exception {

   public ConfigurationException(String message) {
      super(message);
   }

   public ConfigurationException(String message, Throwable cause) {
      super(message, cause);
   }
}
