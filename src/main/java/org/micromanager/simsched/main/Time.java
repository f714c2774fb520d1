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
package org.micromanager.simsched.main;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Milliseconds since the start of an experiment, stored as a fixed point
 * integer with a resolution of 10^-6 ms. All schedule arithmetic goes through
 * this class so that long chains of additions do not drift and a given plan
 * always produces the same table.
 *
 * Instances are immutable and never negative.
 */
public final class Time implements Comparable<Time> {

   public static final int SCALE = 6;
   private static final long UNITS_PER_MS = 1_000_000L;

   public static final Time ZERO = new Time(0);

   // ms * 10^6
   private final long units_;

   private Time(long units) {
      if (units < 0) {
         throw new TimeUnderflowException("Time can not be negative: " + units + "e-6 ms");
      }
      units_ = units;
   }

   public static Time ofMillis(long ms) {
      return new Time(Math.multiplyExact(ms, UNITS_PER_MS));
   }

   /**
    * Convert a configured or computed millisecond value. The value is rounded
    * (half even) to the resolution of this class, going through its shortest
    * decimal representation so that e.g. 0.1 becomes exactly 0.1 ms.
    */
   public static Time ofMillis(double ms) {
      if (Double.isNaN(ms) || Double.isInfinite(ms)) {
         throw new IllegalArgumentException("Not a finite time: " + ms);
      }
      return ofMillis(BigDecimal.valueOf(ms));
   }

   public static Time ofMillis(BigDecimal ms) {
      BigDecimal scaled = ms.setScale(SCALE, RoundingMode.HALF_EVEN).movePointRight(SCALE);
      return new Time(scaled.longValueExact());
   }

   /**
    * Parse the decimal string form produced by {@link #toDecimalString()}.
    */
   public static Time parse(String decimalMs) {
      try {
         return ofMillis(new BigDecimal(decimalMs.trim()));
      } catch (NumberFormatException e) {
         throw new IllegalArgumentException("Not a decimal time: " + decimalMs, e);
      }
   }

   public Time plus(Time other) {
      return new Time(Math.addExact(units_, other.units_));
   }

   /**
    * @throws TimeUnderflowException if other is later than this
    */
   public Time minus(Time other) {
      if (other.units_ > units_) {
         throw new TimeUnderflowException(toDecimalString() + " - " + other.toDecimalString()
               + " would be negative");
      }
      return new Time(units_ - other.units_);
   }

   public Time times(long factor) {
      return new Time(Math.multiplyExact(units_, factor));
   }

   public static Time max(Time a, Time b) {
      return a.units_ >= b.units_ ? a : b;
   }

   public static Time min(Time a, Time b) {
      return a.units_ <= b.units_ ? a : b;
   }

   public boolean isBefore(Time other) {
      return units_ < other.units_;
   }

   public boolean isAfter(Time other) {
      return units_ > other.units_;
   }

   public boolean isZero() {
      return units_ == 0;
   }

   /**
    * Whole milliseconds, truncated.
    */
   public long toMillis() {
      return units_ / UNITS_PER_MS;
   }

   public BigDecimal toBigDecimal() {
      return BigDecimal.valueOf(units_, SCALE);
   }

   /**
    * Plain decimal milliseconds without trailing zeros, e.g. "65" or "0.25".
    */
   public String toDecimalString() {
      if (units_ == 0) {
         return "0";
      }
      return toBigDecimal().stripTrailingZeros().toPlainString();
   }

   @Override
   public int compareTo(Time o) {
      return Long.compare(units_, o.units_);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Time)) {
         return false;
      }
      return units_ == ((Time) o).units_;
   }

   @Override
   public int hashCode() {
      return Long.hashCode(units_);
   }

   @Override
   public String toString() {
      return toDecimalString() + " ms";
   }
}
