/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package roster.source;

import java.util.Arrays;
import java.util.Collection;

/**
 * Record naming and the gap scan. A record name is the decimal form of an id
 * in [{@value #MIN_ID}, {@value #MAX_ID}], without sign or leading zeros.
 */
public final class InstanceIds {
  public static final int MIN_ID = 1;
  public static final int MAX_ID = 65535;

  private static final int MAX_NAME_LENGTH = Integer.toString(MAX_ID).length();

  private InstanceIds() {
  }

  public static String toRecordName(int id) {
    if (id < MIN_ID || id > MAX_ID) {
      throw new IllegalArgumentException("Instance id " + id + " is outside [" + MIN_ID + ", " + MAX_ID + "].");
    }
    return Integer.toString(id);
  }

  /**
   * Parses a record name.
   * 
   * @return the id, or -1 when the name is not one this library writes
   */
  public static int parseRecordName(String name) {
    if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
      return -1;
    }
    char first = name.charAt(0);
    if (first < '1' || first > '9') {
      return -1;
    }
    int value = 0;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      value = value * 10 + (c - '0');
    }
    return value <= MAX_ID ? value : -1;
  }

  /**
   * Finds the smallest id not claimed by any of the given record names.
   * Names are ordered numerically here; the order they were listed in does
   * not matter.
   * 
   * @param recordNames
   *          every record currently in the namespace
   * @return the smallest free id
   * @throws NamespaceCorruptedException
   *           if any name is not a record name
   * @throws InstanceIdSpaceFullException
   *           if every id up to {@value #MAX_ID} is claimed
   */
  public static int findSmallestFreeId(Collection<String> recordNames) throws NamespaceCorruptedException, InstanceIdSpaceFullException {
    int[] ids = new int[recordNames.size()];
    int counter = 0;
    for (String name : recordNames) {
      int id = parseRecordName(name);
      if (id == -1) {
        throw new NamespaceCorruptedException("Encountered unrelated record \"" + name + "\" in the instance id namespace.", name);
      }
      ids[counter] = id;
      counter++;
    }
    Arrays.sort(ids);

    int lastSeen = 0;
    boolean foundGap = false;
    for (int i = 0; i < ids.length && !foundGap; i++) {
      if (ids[i] > lastSeen + 1) {
        foundGap = true;
      } else {
        lastSeen = ids[i];
      }
    }
    if (!foundGap && lastSeen == MAX_ID) {
      throw new InstanceIdSpaceFullException("Id space is full.  All " + MAX_ID + " instance id slots are taken.");
    }
    return lastSeen + 1;
  }
}
