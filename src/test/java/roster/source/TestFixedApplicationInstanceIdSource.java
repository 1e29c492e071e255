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

import org.junit.Test;

import roster.lifecycle.ManualShutdownNotifier;

public class TestFixedApplicationInstanceIdSource {

  @Test
  public void testFixedIdLifecycle() throws Exception {
    ManualShutdownNotifier notifier = new ManualShutdownNotifier();
    FixedApplicationInstanceIdSource source = new FixedApplicationInstanceIdSource(42, notifier, null);

    assertEquals(42, source.getApplicationInstanceId());
    assertEquals(42, source.getApplicationInstanceId());
    assertEquals(InstanceIdState.ACQUIRED, source.getState());

    notifier.shutdown();
    assertEquals(InstanceIdState.RELEASED, source.getState());
    try {
      source.getApplicationInstanceId();
      fail("Expected the released id not to be handed out again");
    } catch (InstanceIdReleasedException e) {
      // expected
    }
  }

  @Test
  public void testRangeIsChecked() {
    int[] invalid = { 0, -1, 65536 };
    for (int id : invalid) {
      try {
        new FixedApplicationInstanceIdSource(id, null, null);
        fail("Expected " + id + " to be rejected");
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    new FixedApplicationInstanceIdSource(65535, null, null).close();
  }

  @Test
  public void testRejectedIdLeavesNoRegistration() {
    ManualShutdownNotifier notifier = new ManualShutdownNotifier();
    try {
      new FixedApplicationInstanceIdSource(0, notifier, null);
      fail("Expected 0 to be rejected");
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertEquals(0, notifier.getRegistrationCount());
  }
}
