package org.micromanager.simsched.api;

/**
 * A device descriptor could not answer a timing query, e.g. because the
 * parameter is not configured or is not a valid number.
 */
public class UnavailableTimingException extends Exception {

   public UnavailableTimingException(String message) {
      super(message);
   }

   public UnavailableTimingException(String message, Throwable cause) {
      super(message, cause);
   }
}
