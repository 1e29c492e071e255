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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class TestInstanceIds {

  @Test
  public void testEmptyNamespaceYieldsOne() throws Exception {
    assertEquals(1, InstanceIds.findSmallestFreeId(Collections.<String> emptyList()));
  }

  @Test
  public void testSmallestGapWins() throws Exception {
    assertEquals(3, InstanceIds.findSmallestFreeId(Arrays.asList("1", "2", "4")));
    assertEquals(1, InstanceIds.findSmallestFreeId(Arrays.asList("2", "3")));
    assertEquals(2, InstanceIds.findSmallestFreeId(Arrays.asList("1", "3", "5", "6")));
  }

  @Test
  public void testDenseRangeYieldsNextId() throws Exception {
    assertEquals(4, InstanceIds.findSmallestFreeId(Arrays.asList("1", "2", "3")));
  }

  @Test
  public void testListingOrderDoesNotMatter() throws Exception {
    // lexicographic listing puts "10" before "2"
    List<String> names = new ArrayList<String>();
    for (int i = 1; i <= 10; i++) {
      names.add(Integer.toString(i));
    }
    Collections.sort(names);
    assertEquals("10", names.get(1));
    assertEquals(11, InstanceIds.findSmallestFreeId(names));

    assertEquals(3, InstanceIds.findSmallestFreeId(Arrays.asList("4", "10", "2", "1")));
    Collections.reverse(names);
    assertEquals(11, InstanceIds.findSmallestFreeId(names));
  }

  @Test
  public void testForeignNamesAreRejected() throws Exception {
    String[] foreign = { "abc", "0", "007", "+5", "-1", "65536", "99999999999", "", " 1", "1.0", "backup/1" };
    for (String name : foreign) {
      try {
        InstanceIds.findSmallestFreeId(Arrays.asList("1", name));
        fail("Expected \"" + name + "\" to be rejected");
      } catch (NamespaceCorruptedException e) {
        assertEquals(name, e.getRecordName());
      }
    }
  }

  @Test
  public void testForeignNameAfterGapIsStillRejected() throws Exception {
    try {
      InstanceIds.findSmallestFreeId(Arrays.asList("2", "7", "zzz"));
      fail("Expected the namespace to be reported as corrupted");
    } catch (NamespaceCorruptedException e) {
      assertEquals("zzz", e.getRecordName());
    }
  }

  @Test
  public void testTopOfRange() throws Exception {
    List<String> names = new ArrayList<String>();
    for (int i = 1; i < InstanceIds.MAX_ID; i++) {
      names.add(Integer.toString(i));
    }
    assertEquals(InstanceIds.MAX_ID, InstanceIds.findSmallestFreeId(names));

    names.add(Integer.toString(InstanceIds.MAX_ID));
    try {
      InstanceIds.findSmallestFreeId(names);
      fail("Expected the id space to be full");
    } catch (InstanceIdSpaceFullException e) {
      // expected
    }

    names.remove("40000");
    assertEquals(40000, InstanceIds.findSmallestFreeId(names));
  }

  @Test
  public void testOnlyMaximumClaimed() throws Exception {
    assertEquals(1, InstanceIds.findSmallestFreeId(Arrays.asList("65535")));
  }

  @Test
  public void testRecordNames() {
    assertEquals("1", InstanceIds.toRecordName(1));
    assertEquals("65535", InstanceIds.toRecordName(65535));
    assertEquals(1, InstanceIds.parseRecordName("1"));
    assertEquals(65535, InstanceIds.parseRecordName("65535"));
    assertEquals(-1, InstanceIds.parseRecordName("0"));
    assertEquals(-1, InstanceIds.parseRecordName(null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRecordNameOfZero() {
    InstanceIds.toRecordName(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRecordNameAboveRange() {
    InstanceIds.toRecordName(65536);
  }
}
