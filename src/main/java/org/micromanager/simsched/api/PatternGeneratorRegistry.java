package org.micromanager.simsched.api;

import java.util.List;

/**
 * Source of the analog clients attached to each pattern generating executor
 * group. Attachment can change between experiments, so planners ask again on
 * every run.
 */
public interface PatternGeneratorRegistry {

   /**
    * @param group executor group name, e.g. "slm" or "rotor"
    * @return attached clients in attachment order, empty if the group is
    * unknown or has none
    */
   public List<AnalogSettable> getAnalogClients(String group);

}
