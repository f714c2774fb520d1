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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import mmcorej.org.json.JSONArray;
import mmcorej.org.json.JSONException;
import mmcorej.org.json.JSONObject;
import org.micromanager.simsched.api.Resource;
import org.micromanager.simsched.api.ResourceTimingOracle;
import org.micromanager.simsched.internal.DeviceRegistry;
import org.micromanager.simsched.internal.StationaryPositioner;

/**
 * Append only ledger of timed hardware commands. Entries for any one resource
 * are always in the order they will be executed; entries for different
 * resources may interleave.
 *
 * A table is built by a single planner, then sealed and handed to whatever
 * executes it. After {@link #seal()} it can no longer change and may be read
 * from any thread.
 */
public class ActionTable implements Iterable<ActionEntry> {

   private final ResourceTimingOracle oracle_;
   private final ArrayList<ActionEntry> entries_ = new ArrayList<ActionEntry>();
   // resource name -> most recent entry for it
   private final HashMap<String, ActionEntry> lastEntries_ = new HashMap<String, ActionEntry>();
   private volatile boolean sealed_ = false;
   private List<ActionEntry> sortedEntries_ = null;

   /**
    * @param oracle used to work out how long a resource stays busy after each
    *               of its entries. May be null for tables that are only read
    *               back, in which case readiness queries are unavailable.
    */
   public ActionTable(ResourceTimingOracle oracle) {
      oracle_ = oracle;
   }

   /**
    * Schedule an action.
    *
    * @throws OutOfOrderException if an entry for the same target already
    * exists at a later time
    * @throws IllegalStateException if the table has been sealed
    */
   public ActionEntry append(Time timestamp, Resource target, ActionPayload payload) {
      if (sealed_) {
         throw new IllegalStateException("Action table has been handed off and can't be modified");
      }
      ActionEntry entry = new ActionEntry(timestamp, target, payload);
      ActionEntry last = lastEntries_.get(target.getName());
      if (last != null && timestamp.isBefore(last.getTime())) {
         throw new OutOfOrderException("Can't schedule " + payload + " on " + target.getName()
               + " at " + timestamp + ", it already has " + last.getPayload() + " at "
               + last.getTime());
      }
      entries_.add(entry);
      lastEntries_.put(target.getName(), entry);
      return entry;
   }

   /**
    * Earliest time a new command may be sent to target: the time of its most
    * recent entry plus however long that entry keeps it busy. Zero if nothing
    * has been scheduled for it yet.
    */
   public Time earliestAvailable(Resource target) throws ConfigurationException {
      ActionEntry last = lastEntries_.get(target.getName());
      if (last == null) {
         return Time.ZERO;
      }
      if (oracle_ == null) {
         throw new IllegalStateException("No timing oracle available for readiness queries");
      }
      return last.getTime().plus(oracle_.busyDuration(target, last.getPayload()));
   }

   public ActionEntry getLastEntry(Resource target) {
      return lastEntries_.get(target.getName());
   }

   /**
    * Entries in the order they were appended
    */
   public List<ActionEntry> entries() {
      return Collections.unmodifiableList(entries_);
   }

   @Override
   public Iterator<ActionEntry> iterator() {
      return entries().iterator();
   }

   public List<ActionEntry> entriesFor(Resource target) {
      ArrayList<ActionEntry> list = new ArrayList<ActionEntry>();
      for (ActionEntry e : entries_) {
         if (e.getTarget().getName().equals(target.getName())) {
            list.add(e);
         }
      }
      return list;
   }

   /**
    * Entries in execution order: sorted by time, entries with equal times
    * kept in the order they were appended.
    */
   public List<ActionEntry> sortedEntries() {
      if (sealed_ && sortedEntries_ != null) {
         return sortedEntries_;
      }
      ArrayList<ActionEntry> sorted = new ArrayList<ActionEntry>(entries_);
      // List.sort is stable
      sorted.sort(Comparator.comparing(ActionEntry::getTime));
      List<ActionEntry> result = Collections.unmodifiableList(sorted);
      if (sealed_) {
         sortedEntries_ = result;
      }
      return result;
   }

   /**
    * Freeze the table before handing it to an executor.
    */
   public void seal() {
      if (!sealed_) {
         sortedEntries_ = null;
         sealed_ = true;
         sortedEntries();
      }
   }

   public boolean isSealed() {
      return sealed_;
   }

   public int size() {
      return entries_.size();
   }

   public boolean isEmpty() {
      return entries_.isEmpty();
   }

   public Time getFirstTime() {
      if (entries_.isEmpty()) {
         return Time.ZERO;
      }
      return sortedEntries().get(0).getTime();
   }

   public Time getLastTime() {
      Time last = Time.ZERO;
      for (ActionEntry e : entries_) {
         last = Time.max(last, e.getTime());
      }
      return last;
   }

   /**
    * Time after which a repetition of this table may begin
    */
   public Time getRepetitionDuration() {
      return getLastTime();
   }

   /**
    * Tab separated "time resource payload" lines in execution order. Stable
    * across runs, for fixtures and for comparison with other implementations.
    */
   public String dump() {
      StringBuilder builder = new StringBuilder();
      for (ActionEntry e : sortedEntries()) {
         builder.append(e.toString()).append('\n');
      }
      return builder.toString();
   }

   public JSONObject toJSON() {
      try {
         JSONArray array = new JSONArray();
         for (ActionEntry e : sortedEntries()) {
            JSONObject json = new JSONObject();
            json.put("time", e.getTime().toDecimalString());
            json.put("resource", e.getTarget().getName());
            json.put("action", e.getPayload().toJSON());
            array.put(json);
         }
         JSONObject table = new JSONObject();
         table.put("entries", array);
         return table;
      } catch (JSONException ex) {
         throw new RuntimeException(ex);
      }
   }

   /**
    * Read back a table written by {@link #toJSON()}. The result is sealed and
    * has no timing oracle. Entries for the stand-in Z stage of plans without
    * one resolve to {@link StationaryPositioner#INSTANCE} unless the registry
    * has a device of that name.
    */
   public static ActionTable fromJSON(JSONObject json, DeviceRegistry registry)
         throws ConfigurationException {
      ActionTable table = new ActionTable(null);
      try {
         JSONArray array = json.getJSONArray("entries");
         for (int i = 0; i < array.length(); i++) {
            JSONObject entry = array.getJSONObject(i);
            table.append(Time.parse(entry.getString("time")),
                  resolve(entry.getString("resource"), registry),
                  ActionPayload.fromJSON(entry.getJSONObject("action")));
         }
      } catch (JSONException | IllegalArgumentException | ArithmeticException
            | OutOfOrderException ex) {
         throw new ConfigurationException("Malformed action table: " + ex.getMessage(), ex);
      }
      table.seal();
      return table;
   }

   private static Resource resolve(String name, DeviceRegistry registry)
         throws ConfigurationException {
      if (StationaryPositioner.NAME.equals(name) && !registry.contains(name)) {
         return StationaryPositioner.INSTANCE;
      }
      return registry.getResource(name);
   }

   @Override
   public String toString() {
      return "ActionTable with " + entries_.size() + " entries ending at " + getLastTime();
   }
}
