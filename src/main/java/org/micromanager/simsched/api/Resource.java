package org.micromanager.simsched.api;

/**
 * Any device that can be the target of an entry in an action table. The name
 * is the only identity a resource has as far as scheduling is concerned, and
 * must be unique within a {@link org.micromanager.simsched.internal.DeviceRegistry}.
 */
public interface Resource {

   public String getName();

}
