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

/**
 * The namespace holds a record whose name is not a canonical instance id.
 */
public class NamespaceCorruptedException extends InstanceIdAllocationException {
  /**
   * generated
   */
  private static final long serialVersionUID = 3598871370217751329L;

  private final String recordName;

  public NamespaceCorruptedException(String message, String recordName) {
    super(message);
    this.recordName = recordName;
  }

  public String getRecordName() {
    return recordName;
  }
}
