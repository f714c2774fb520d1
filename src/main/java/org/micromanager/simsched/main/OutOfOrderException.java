package org.micromanager.simsched.main;

/**
 * Thrown when an entry would be scheduled against a resource earlier than the
 * last entry already scheduled for that resource. This can only come from a bug
 * in whatever is building the table, so it is unchecked and not meant to be
 * recovered from.
 */
public class OutOfOrderException extends IllegalStateException {

   public OutOfOrderException(String message) {
      super(message);
   }
}
