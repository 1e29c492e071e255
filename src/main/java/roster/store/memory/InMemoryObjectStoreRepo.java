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
package roster.store.memory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import roster.store.CreateResult;
import roster.store.ObjectStoreRepo;

/**
 * A process-local store. Records are listed in lexicographic name order, the
 * way most object stores list them. Every operation is counted so callers can
 * observe how many round trips were made.
 */
public class InMemoryObjectStoreRepo implements ObjectStoreRepo {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryObjectStoreRepo.class);

  private final Object lock = new Object();
  private final TreeMap<String, byte[]> records = new TreeMap<String, byte[]>();
  private final Map<String, List<String>> derived = new HashMap<String, List<String>>();
  private boolean namespaceExists = false;

  private final AtomicInteger ensureCount = new AtomicInteger();
  private final AtomicInteger listCount = new AtomicInteger();
  private final AtomicInteger createCount = new AtomicInteger();
  private final AtomicInteger deleteCount = new AtomicInteger();

  @Override
  public void ensureNamespace() throws IOException {
    this.ensureCount.incrementAndGet();
    synchronized (this.lock) {
      if (!this.namespaceExists) {
        LOG.debug("Creating namespace");
        this.namespaceExists = true;
      }
    }
  }

  @Override
  public List<String> listRecordNames() throws IOException {
    this.listCount.incrementAndGet();
    synchronized (this.lock) {
      checkNamespace();
      return new ArrayList<String>(this.records.keySet());
    }
  }

  @Override
  public CreateResult createRecord(String name, byte[] content, boolean overwrite) throws IOException {
    this.createCount.incrementAndGet();
    synchronized (this.lock) {
      checkNamespace();
      if (!overwrite && this.records.containsKey(name)) {
        return CreateResult.ALREADY_EXISTS;
      }
      this.records.put(name, Arrays.copyOf(content, content.length));
      return CreateResult.CREATED;
    }
  }

  @Override
  public void deleteRecord(String name, boolean includeDerived) throws IOException {
    this.deleteCount.incrementAndGet();
    synchronized (this.lock) {
      checkNamespace();
      List<String> artifacts = this.derived.get(name);
      if (artifacts != null && !artifacts.isEmpty() && !includeDerived) {
        throw new IOException("Record \"" + name + "\" has " + artifacts.size() + " derived artifacts and they were not included in the delete.");
      }
      this.derived.remove(name);
      if (this.records.remove(name) == null) {
        LOG.debug("Record \"{}\" was already absent", name);
      }
    }
  }

  /**
   * Attaches a derived artifact (a snapshot, say) to an existing record.
   */
  public void addDerivedArtifact(String recordName, String artifactName) throws IOException {
    synchronized (this.lock) {
      checkNamespace();
      if (!this.records.containsKey(recordName)) {
        throw new IOException("No record \"" + recordName + "\" to derive from.");
      }
      List<String> artifacts = this.derived.get(recordName);
      if (artifacts == null) {
        artifacts = new ArrayList<String>();
        this.derived.put(recordName, artifacts);
      }
      artifacts.add(artifactName);
    }
  }

  public byte[] getRecordContent(String name) {
    synchronized (this.lock) {
      byte[] content = this.records.get(name);
      return content == null ? null : Arrays.copyOf(content, content.length);
    }
  }

  public boolean hasNamespace() {
    synchronized (this.lock) {
      return this.namespaceExists;
    }
  }

  public int getEnsureCount() {
    return this.ensureCount.get();
  }

  public int getListCount() {
    return this.listCount.get();
  }

  public int getCreateCount() {
    return this.createCount.get();
  }

  public int getDeleteCount() {
    return this.deleteCount.get();
  }

  @Override
  public void close() {
  }

  private void checkNamespace() throws IOException {
    if (!this.namespaceExists) {
      throw new IOException("Namespace does not exist.");
    }
  }
}
