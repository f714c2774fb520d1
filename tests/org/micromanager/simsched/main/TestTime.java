package org.micromanager.simsched.main;

import java.math.BigDecimal;
import org.junit.Assert;
import org.junit.Test;

public class TestTime {

   @Test
   public void testNoDriftOverManyAdditions() {
      Time step = Time.ofMillis(0.1);
      Time t = Time.ZERO;
      for (int i = 0; i < 10000; i++) {
         t = t.plus(step);
      }
      Assert.assertEquals(Time.ofMillis(1000), t);
      Assert.assertEquals("1000", t.toDecimalString());
   }

   @Test
   public void testSubMillisecondResolution() {
      Time t = Time.parse("0.000001");
      Assert.assertTrue(t.isAfter(Time.ZERO));
      Assert.assertEquals("0.000001", t.toDecimalString());
      Assert.assertEquals(0, t.toMillis());
   }

   @Test(expected = TimeUnderflowException.class)
   public void testMinusUnderflow() {
      Time.ofMillis(5).minus(Time.ofMillis(6));
   }

   @Test
   public void testMinus() {
      Assert.assertEquals(Time.parse("2.5"), Time.ofMillis(5).minus(Time.parse("2.5")));
      Assert.assertEquals(Time.ZERO, Time.ofMillis(5).minus(Time.ofMillis(5)));
   }

   @Test(expected = TimeUnderflowException.class)
   public void testNegativeNotAllowed() {
      Time.ofMillis(-1L);
   }

   @Test
   public void testMaxAndOrdering() {
      Time a = Time.ofMillis(65);
      Time b = Time.parse("65.000001");
      Assert.assertSame(b, Time.max(a, b));
      Assert.assertSame(a, Time.min(a, b));
      Assert.assertTrue(a.compareTo(b) < 0);
      Assert.assertTrue(a.isBefore(b));
   }

   @Test
   public void testDecimalConversions() {
      Assert.assertEquals("65", Time.ofMillis(65).toDecimalString());
      Assert.assertEquals("0.25", Time.ofMillis(0.25).toDecimalString());
      Assert.assertEquals("0", Time.ZERO.toDecimalString());
      Assert.assertEquals(new BigDecimal("12.500000"), Time.parse("12.5").toBigDecimal());
      Assert.assertEquals(Time.ofMillis(12), Time.parse(" 12.0 "));
      Assert.assertEquals(Time.ofMillis(30), Time.ofMillis(10).times(3));
   }

   @Test
   public void testRoundsToResolution() {
      Assert.assertEquals(Time.parse("0.000002"), Time.ofMillis(new BigDecimal("0.0000015")));
      Assert.assertEquals(Time.parse("0.000002"), Time.ofMillis(new BigDecimal("0.0000025")));
   }

   @Test(expected = IllegalArgumentException.class)
   public void testParseGarbage() {
      Time.parse("soon");
   }
}
