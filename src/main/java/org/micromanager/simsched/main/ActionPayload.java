package org.micromanager.simsched.main;

import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;

/**
 * What to do to a resource at a scheduled time. One of a fixed set of kinds,
 * each carrying a single value.
 */
public final class ActionPayload {

   public enum Kind {
      SET_DIGITAL("SetDigital"),
      SET_ANALOG("SetAnalog"),
      MOVE_ABSOLUTE("MoveAbsolute"),
      MOVE_RELATIVE("MoveRelative"),
      CUSTOM("Custom");

      private final String label_;

      Kind(String label) {
         label_ = label;
      }

      public String getLabel() {
         return label_;
      }

      public static Kind fromLabel(String label) {
         for (Kind k : values()) {
            if (k.label_.equals(label)) {
               return k;
            }
         }
         throw new IllegalArgumentException("Unknown action kind: " + label);
      }
   }

   private final Kind kind_;
   private final boolean state_;
   private final double value_;
   private final int index_;

   private ActionPayload(Kind kind, boolean state, double value, int index) {
      kind_ = kind;
      state_ = state;
      value_ = value;
      index_ = index;
   }

   public static ActionPayload setDigital(boolean state) {
      return new ActionPayload(Kind.SET_DIGITAL, state, 0, 0);
   }

   public static ActionPayload setAnalog(double value) {
      return new ActionPayload(Kind.SET_ANALOG, false, checkFinite(value), 0);
   }

   public static ActionPayload moveAbsolute(double position) {
      return new ActionPayload(Kind.MOVE_ABSOLUTE, false, checkFinite(position), 0);
   }

   public static ActionPayload moveRelative(double delta) {
      return new ActionPayload(Kind.MOVE_RELATIVE, false, checkFinite(delta), 0);
   }

   /**
    * Device specific action identified by an index, e.g. the step of a
    * pattern sequence a modulator should display.
    */
   public static ActionPayload custom(int index) {
      return new ActionPayload(Kind.CUSTOM, false, 0, index);
   }

   private static double checkFinite(double v) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
         throw new IllegalArgumentException("Action value must be finite: " + v);
      }
      return v;
   }

   public Kind getKind() {
      return kind_;
   }

   public boolean isDigitalHigh() {
      return kind_ == Kind.SET_DIGITAL && state_;
   }

   public boolean isMove() {
      return kind_ == Kind.MOVE_ABSOLUTE || kind_ == Kind.MOVE_RELATIVE;
   }

   public boolean getDigitalState() {
      requireKind(Kind.SET_DIGITAL);
      return state_;
   }

   /**
    * Analog setpoint, absolute position or relative delta
    */
   public double getValue() {
      if (kind_ == Kind.SET_DIGITAL || kind_ == Kind.CUSTOM) {
         throw new IllegalStateException(kind_.getLabel() + " has no numeric value");
      }
      return value_;
   }

   public int getIndex() {
      requireKind(Kind.CUSTOM);
      return index_;
   }

   private void requireKind(Kind k) {
      if (kind_ != k) {
         throw new IllegalStateException("Payload is " + kind_.getLabel() + ", not " + k.getLabel());
      }
   }

   public JSONObject toJSON() {
      try {
         JSONObject json = new JSONObject();
         json.put("kind", kind_.getLabel());
         switch (kind_) {
            case SET_DIGITAL:
               json.put("state", state_);
               break;
            case CUSTOM:
               json.put("index", index_);
               break;
            default:
               json.put("value", value_);
         }
         return json;
      } catch (JSONException ex) {
         throw new RuntimeException(ex);
      }
   }

   /**
    * @throws IllegalArgumentException for an unknown kind or a non finite value
    */
   public static ActionPayload fromJSON(JSONObject json) throws JSONException {
      Kind kind = Kind.fromLabel(json.getString("kind"));
      switch (kind) {
         case SET_DIGITAL:
            return setDigital(json.getBoolean("state"));
         case SET_ANALOG:
            return setAnalog(json.getDouble("value"));
         case MOVE_ABSOLUTE:
            return moveAbsolute(json.getDouble("value"));
         case MOVE_RELATIVE:
            return moveRelative(json.getDouble("value"));
         default:
            return custom(json.getInt("index"));
      }
   }

   @Override
   public boolean equals(Object o) {
      if (!(o instanceof ActionPayload)) {
         return false;
      }
      ActionPayload p = (ActionPayload) o;
      return kind_ == p.kind_ && state_ == p.state_
            && Double.compare(value_, p.value_) == 0 && index_ == p.index_;
   }

   @Override
   public int hashCode() {
      int h = kind_.hashCode();
      h = 31 * h + Boolean.hashCode(state_);
      h = 31 * h + Double.hashCode(value_);
      return 31 * h + index_;
   }

   @Override
   public String toString() {
      switch (kind_) {
         case SET_DIGITAL:
            return kind_.getLabel() + "(" + state_ + ")";
         case CUSTOM:
            return kind_.getLabel() + "(" + index_ + ")";
         default:
            return kind_.getLabel() + "(" + value_ + ")";
      }
   }
}
