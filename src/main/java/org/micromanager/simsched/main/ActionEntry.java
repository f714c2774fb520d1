package org.micromanager.simsched.main;

import org.micromanager.simsched.api.Resource;

/**
 * One scheduled command: at time, do payload to target. Immutable.
 */
public final class ActionEntry {

   private final Time time_;
   private final Resource target_;
   private final ActionPayload payload_;

   public ActionEntry(Time time, Resource target, ActionPayload payload) {
      if (time == null || target == null || payload == null) {
         throw new IllegalArgumentException("Time, target and payload are all required");
      }
      time_ = time;
      target_ = target;
      payload_ = payload;
   }

   public Time getTime() {
      return time_;
   }

   public Resource getTarget() {
      return target_;
   }

   public ActionPayload getPayload() {
      return payload_;
   }

   @Override
   public boolean equals(Object o) {
      if (!(o instanceof ActionEntry)) {
         return false;
      }
      ActionEntry e = (ActionEntry) o;
      return time_.equals(e.time_) && target_.getName().equals(e.target_.getName())
            && payload_.equals(e.payload_);
   }

   @Override
   public int hashCode() {
      return (31 * time_.hashCode() + target_.getName().hashCode()) * 31 + payload_.hashCode();
   }

   @Override
   public String toString() {
      return time_.toDecimalString() + "\t" + target_.getName() + "\t" + payload_;
   }
}
