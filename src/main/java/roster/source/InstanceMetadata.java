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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic description of this instance, written as the content of its
 * record. Never read back.
 */
public class InstanceMetadata {
  private static final Logger LOG = LoggerFactory.getLogger(InstanceMetadata.class);

  public static final String UNKNOWN = "unknown";
  public static final String APPLICATION_NAME_KEY = "ApplicationName";
  public static final String SERVER_NAME_KEY = "ServerName";
  public static final String CREATION_DATE_TIME_KEY = "CreationDateTime";

  private final String applicationName;
  private final String serverName;

  public InstanceMetadata(String applicationName, String serverName) {
    this.applicationName = applicationName == null ? UNKNOWN : applicationName;
    this.serverName = serverName == null ? UNKNOWN : serverName;
  }

  /**
   * Describes an instance of the given application running on this host.
   */
  public static InstanceMetadata forLocalHost(String applicationName) {
    return new InstanceMetadata(applicationName, localHostName());
  }

  static String localHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      LOG.warn("Could not resolve the local host name, recording it as \"" + UNKNOWN + "\".", e);
      return UNKNOWN;
    }
  }

  public String getApplicationName() {
    return applicationName;
  }

  public String getServerName() {
    return serverName;
  }

  /**
   * Renders the record content: one {@code Key=Value} line per field, the
   * creation time as an ISO-8601 UTC instant.
   */
  public byte[] toRecordContent(Instant createdAt) {
    String text = APPLICATION_NAME_KEY + "=" + this.applicationName + "\n" + SERVER_NAME_KEY + "=" + this.serverName + "\n" + CREATION_DATE_TIME_KEY + "="
        + DateTimeFormatter.ISO_INSTANT.format(createdAt);
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return this.applicationName + "@" + this.serverName;
  }
}
