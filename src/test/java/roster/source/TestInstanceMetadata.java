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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.Test;

public class TestInstanceMetadata {

  @Test
  public void testRecordContent() {
    InstanceMetadata metadata = new InstanceMetadata("billing", "web-07");
    String content = new String(metadata.toRecordContent(Instant.parse("2026-01-02T03:04:05.678Z")), StandardCharsets.UTF_8);
    assertEquals("ApplicationName=billing\nServerName=web-07\nCreationDateTime=2026-01-02T03:04:05.678Z", content);
  }

  @Test
  public void testCreationTimeParsesBack() {
    Instant createdAt = Instant.parse("2026-10-18T23:59:59.999Z");
    String content = new String(new InstanceMetadata("a", "b").toRecordContent(createdAt), StandardCharsets.UTF_8);
    String[] lines = content.split("\n");
    assertEquals(3, lines.length);
    assertTrue(lines[2].startsWith(InstanceMetadata.CREATION_DATE_TIME_KEY + "="));
    assertEquals(createdAt, Instant.parse(lines[2].substring(lines[2].indexOf('=') + 1)));
  }

  @Test
  public void testMissingNames() {
    InstanceMetadata metadata = new InstanceMetadata(null, null);
    assertEquals(InstanceMetadata.UNKNOWN, metadata.getApplicationName());
    assertEquals(InstanceMetadata.UNKNOWN, metadata.getServerName());
  }

  @Test
  public void testLocalHost() {
    InstanceMetadata metadata = InstanceMetadata.forLocalHost("svc");
    assertEquals("svc", metadata.getApplicationName());
    assertNotNull(metadata.getServerName());
  }
}
