package org.micromanager.simsched.internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import org.micromanager.simsched.api.AnalogSettable;
import org.micromanager.simsched.api.PatternGeneratorRegistry;
import org.micromanager.simsched.api.Resource;
import org.micromanager.simsched.main.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The devices available to one experiment, by name, plus the analog clients
 * attached to each pattern generating executor group. One registry is created
 * per experiment and passed to whatever needs it.
 */
public class DeviceRegistry implements PatternGeneratorRegistry {

   private static final Logger LOGGER = LoggerFactory.getLogger(DeviceRegistry.class);

   private final LinkedHashMap<String, Resource> resources_ = new LinkedHashMap<String, Resource>();
   private final LinkedHashMap<String, List<AnalogSettable>> analogClients_ =
         new LinkedHashMap<String, List<AnalogSettable>>();

   public synchronized void register(Resource resource) {
      if (resource == null || resource.getName() == null || resource.getName().isEmpty()) {
         throw new IllegalArgumentException("Resources need a name");
      }
      if (resources_.containsKey(resource.getName())) {
         throw new IllegalArgumentException("A device named " + resource.getName()
               + " is already registered");
      }
      resources_.put(resource.getName(), resource);
   }

   public synchronized Resource getResource(String name) throws ConfigurationException {
      Resource r = resources_.get(name);
      if (r == null) {
         throw new ConfigurationException("No device named " + name);
      }
      return r;
   }

   /**
    * Look up a device that must have a given capability
    */
   public <T extends Resource> T getResource(String name, Class<T> capability)
         throws ConfigurationException {
      Resource r = getResource(name);
      if (!capability.isInstance(r)) {
         throw new ConfigurationException("Device " + name + " is not "
               + capability.getSimpleName());
      }
      return capability.cast(r);
   }

   public synchronized boolean contains(String name) {
      return resources_.containsKey(name);
   }

   public synchronized Collection<Resource> getResources() {
      return Collections.unmodifiableCollection(new ArrayList<Resource>(resources_.values()));
   }

   /**
    * Attach an analog client to an executor group. Registers the client too if
    * it is not known yet.
    */
   public synchronized void attachAnalogClient(String group, AnalogSettable client) {
      if (!resources_.containsKey(client.getName())) {
         register(client);
      }
      List<AnalogSettable> clients = analogClients_.get(group);
      if (clients == null) {
         clients = new ArrayList<AnalogSettable>();
         analogClients_.put(group, clients);
      }
      if (!clients.contains(client)) {
         clients.add(client);
         LOGGER.debug("Attached {} to executor group {}", client.getName(), group);
      }
   }

   public synchronized boolean detachAnalogClient(String group, AnalogSettable client) {
      List<AnalogSettable> clients = analogClients_.get(group);
      return clients != null && clients.remove(client);
   }

   @Override
   public synchronized List<AnalogSettable> getAnalogClients(String group) {
      List<AnalogSettable> clients = analogClients_.get(group);
      if (clients == null) {
         return Collections.emptyList();
      }
      return Collections.unmodifiableList(new ArrayList<AnalogSettable>(clients));
   }
}
