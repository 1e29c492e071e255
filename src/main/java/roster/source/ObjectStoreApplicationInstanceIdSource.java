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

import java.io.IOException;
import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import roster.lifecycle.FailureHandler;
import roster.lifecycle.ShutdownNotifier;
import roster.store.CreateResult;
import roster.store.ObjectStoreRepo;

/**
 * Claims the smallest free instance id by creating a record named after it in
 * a namespace shared by every instance of the application.
 * 
 * The only coordination between processes is the store's create-if-absent: if
 * another instance creates the same record first, the namespace is listed
 * again and the next smallest free id is tried. On shutdown the record is
 * deleted. A record left behind by an unclean shutdown keeps its id claimed
 * until removed by hand; the gap scan always prefers the lowest free id, so
 * such leaks do not push the claimed ids towards the ceiling.
 */
public class ObjectStoreApplicationInstanceIdSource extends ApplicationInstanceIdSource {
  private static final Logger LOG = LoggerFactory.getLogger(ObjectStoreApplicationInstanceIdSource.class);

  private final ObjectStoreRepo repo;
  private final InstanceMetadata metadata;
  private final Clock clock;

  public ObjectStoreApplicationInstanceIdSource(ObjectStoreRepo repo, InstanceMetadata metadata, ShutdownNotifier shutdownNotifier,
      FailureHandler failureHandler) {
    this(repo, metadata, Clock.systemUTC(), shutdownNotifier, failureHandler);
  }

  public ObjectStoreApplicationInstanceIdSource(ObjectStoreRepo repo, InstanceMetadata metadata, Clock clock, ShutdownNotifier shutdownNotifier,
      FailureHandler failureHandler) {
    super(checkArguments(repo, clock, shutdownNotifier), failureHandler);
    this.repo = repo;
    this.metadata = metadata == null ? new InstanceMetadata(null, null) : metadata;
    this.clock = clock;
  }

  /**
   * Runs before the superclass registers for shutdown, so a rejected source
   * never leaves a registration behind.
   */
  private static ShutdownNotifier checkArguments(ObjectStoreRepo repo, Clock clock, ShutdownNotifier shutdownNotifier) {
    if (repo == null) {
      throw new IllegalArgumentException("repo must not be null");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock must not be null");
    }
    return shutdownNotifier;
  }

  public ObjectStoreRepo getRepo() {
    return this.repo;
  }

  @Override
  protected int acquireCore() throws InstanceIdAllocationException {
    byte[] content = this.metadata.toRecordContent(this.clock.instant());

    try {
      this.repo.ensureNamespace();
    } catch (IOException e) {
      throw new StoreBackendException("Could not ensure that the instance id namespace exists.", e);
    }

    int attempts = 0;
    while (true) {
      attempts++;
      List<String> recordNames;
      try {
        recordNames = this.repo.listRecordNames();
      } catch (IOException e) {
        throw new StoreBackendException("Could not list the instance id namespace.", e);
      }

      int candidate = InstanceIds.findSmallestFreeId(recordNames);

      CreateResult result;
      try {
        result = this.repo.createRecord(InstanceIds.toRecordName(candidate), content, false);
      } catch (IOException e) {
        throw new StoreBackendException("Could not create the record for instance id " + candidate + ".", e);
      }

      if (result == CreateResult.CREATED) {
        LOG.debug("Claimed instance id {} after {} attempt(s)", candidate, attempts);
        return candidate;
      }
      LOG.debug("Instance id {} was claimed concurrently by another instance, looking again", candidate);
    }
  }

  @Override
  protected void releaseCore(int id) throws IOException {
    this.repo.deleteRecord(InstanceIds.toRecordName(id), true);
  }

  /**
   * Releases the id, if held, then closes the underlying store.
   */
  @Override
  public void close() {
    super.close();
    try {
      this.repo.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the instance id store " + this.repo + ".", e);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + this.metadata + "]";
  }
}
