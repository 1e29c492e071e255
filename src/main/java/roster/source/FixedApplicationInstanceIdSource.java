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

import roster.lifecycle.FailureHandler;
import roster.lifecycle.ShutdownNotifier;

/**
 * Hands out a configured id without coordinating with anyone. Only suitable
 * when a single instance runs, or ids are assigned by deployment.
 */
public class FixedApplicationInstanceIdSource extends ApplicationInstanceIdSource {
  private final int fixedId;

  public FixedApplicationInstanceIdSource(int fixedId, ShutdownNotifier shutdownNotifier, FailureHandler failureHandler) {
    super(checkRange(fixedId, shutdownNotifier), failureHandler);
    this.fixedId = fixedId;
  }

  private static ShutdownNotifier checkRange(int fixedId, ShutdownNotifier shutdownNotifier) {
    if (fixedId < InstanceIds.MIN_ID || fixedId > InstanceIds.MAX_ID) {
      throw new IllegalArgumentException("Fixed instance id " + fixedId + " is outside [" + InstanceIds.MIN_ID + ", " + InstanceIds.MAX_ID + "].");
    }
    return shutdownNotifier;
  }

  @Override
  protected int acquireCore() {
    return this.fixedId;
  }

  @Override
  protected void releaseCore(int id) {
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + this.fixedId + "]";
  }
}
