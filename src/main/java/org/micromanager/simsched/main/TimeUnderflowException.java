package org.micromanager.simsched.main;

/**
 * A {@link Time} computation would have produced a negative value.
 */
public class TimeUnderflowException extends ArithmeticException {

   public TimeUnderflowException(String message) {
      super(message);
   }
}
