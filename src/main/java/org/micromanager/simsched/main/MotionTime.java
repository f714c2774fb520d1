package org.micromanager.simsched.main;

/**
 * Estimated duration of a move, and the time the moved axis needs afterwards
 * before its position can be trusted.
 */
public final class MotionTime {

   public static final MotionTime NONE = new MotionTime(Time.ZERO, Time.ZERO);

   private final Time moveTime_;
   private final Time settleTime_;

   public MotionTime(Time moveTime, Time settleTime) {
      if (moveTime == null || settleTime == null) {
         throw new IllegalArgumentException("Move and settle times are both required");
      }
      moveTime_ = moveTime;
      settleTime_ = settleTime;
   }

   public Time getMoveTime() {
      return moveTime_;
   }

   public Time getSettleTime() {
      return settleTime_;
   }

   public Time getTotal() {
      return moveTime_.plus(settleTime_);
   }

   @Override
   public boolean equals(Object o) {
      if (!(o instanceof MotionTime)) {
         return false;
      }
      MotionTime other = (MotionTime) o;
      return moveTime_.equals(other.moveTime_) && settleTime_.equals(other.settleTime_);
   }

   @Override
   public int hashCode() {
      return 31 * moveTime_.hashCode() + settleTime_.hashCode();
   }

   @Override
   public String toString() {
      return "move " + moveTime_ + ", settle " + settleTime_;
   }
}
